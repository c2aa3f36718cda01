package build.acta.sdk.common.config;

import build.acta.sdk.common.exception.MissingCredentialException;
import build.acta.sdk.domain.ActaNetwork;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ApiKeyResolverTest {

    @Test
    void explicitKey_winsOverEnvironment() {
        var resolver = ApiKeyResolver.defaultResolver(" explicit ", Map.of("ACTA_API_KEY", "env")::get);

        assertThat(resolver.resolve(ActaNetwork.TESTNET)).isEqualTo("explicit");
    }

    @Test
    void networkSpecificVariable_winsOverFallback() {
        var env = Map.of(
                "ACTA_API_KEY_MAINNET", "main",
                "ACTA_API_KEY_TESTNET", "test",
                "ACTA_API_KEY", "shared");
        var resolver = ApiKeyResolver.defaultResolver(null, env::get);

        assertThat(resolver.resolve(ActaNetwork.MAINNET)).isEqualTo("main");
        assertThat(resolver.resolve(ActaNetwork.TESTNET)).isEqualTo("test");
    }

    @Test
    void blankCandidates_areSkipped() {
        var env = Map.of("ACTA_API_KEY_TESTNET", "   ", "ACTA_API_KEY", "shared");
        var resolver = ApiKeyResolver.defaultResolver("", env::get);

        assertThat(resolver.resolve(ActaNetwork.TESTNET)).isEqualTo("shared");
    }

    @Test
    void noKey_throwsNamingTheVariables() {
        var resolver = ApiKeyResolver.defaultResolver(null, name -> null);

        assertThatThrownBy(() -> resolver.resolve(ActaNetwork.MAINNET))
                .isInstanceOf(MissingCredentialException.class)
                .hasMessageContaining("ACTA_API_KEY_MAINNET")
                .hasMessageContaining("ACTA_API_KEY");
    }
}
