package build.acta.sdk.autoconfigure;

import build.acta.sdk.domain.ActaNetwork;
import build.acta.sdk.domain.SubmissionMode;
import build.acta.sdk.service.ActaApiClient;
import build.acta.sdk.service.CredentialService;
import build.acta.sdk.service.TransactionOrchestrator;
import build.acta.sdk.service.VaultReadService;
import build.acta.sdk.service.VaultService;
import build.acta.sdk.service.ledger.LedgerGateway;
import build.acta.sdk.service.ledger.LedgerStatusPoller;
import build.acta.sdk.service.ledger.SorobanRpcLedgerGateway;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class ActaAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ActaAutoConfiguration.class));

    @Test
    void withoutBaseUrl_nothingIsRegistered() {
        contextRunner.run(context -> assertThat(context).doesNotHaveBean(ActaApiClient.class));
    }

    @Test
    void withBaseUrlAndKey_allBeansAreRegistered() {
        contextRunner
                .withPropertyValues("acta.base-url=" + ActaNetwork.MAINNET_BASE_URL, "acta.api-key=secret")
                .run(context -> {
                    assertThat(context).hasSingleBean(ActaApiClient.class);
                    assertThat(context).hasSingleBean(TransactionOrchestrator.class);
                    assertThat(context).hasSingleBean(VaultService.class);
                    assertThat(context).hasSingleBean(CredentialService.class);
                    assertThat(context).hasSingleBean(VaultReadService.class);
                    assertThat(context).hasSingleBean(ActaApiHealthIndicator.class);
                    assertThat(context.getBean(ActaApiClient.class).getNetwork()).isEqualTo(ActaNetwork.MAINNET);
                    assertThat(context.getBean(VaultService.class).getSubmissionMode()).isEqualTo(SubmissionMode.BACKEND);
                    assertThat(((SorobanRpcLedgerGateway) context.getBean(LedgerGateway.class)).getRpcUrl())
                            .isEqualTo(ActaNetwork.MAINNET.getDefaultRpcUrl());
                    var polling = context.getBean(LedgerStatusPoller.class).getSettings();
                    assertThat(polling.interval()).isEqualTo(Duration.ofMillis(1200));
                    assertThat(polling.maxAttempts()).isEqualTo(40);
                });
    }

    @Test
    void apiKey_isResolvedFromNetworkSpecificVariable() {
        contextRunner
                .withPropertyValues("acta.base-url=" + ActaNetwork.TESTNET_BASE_URL, "ACTA_API_KEY_TESTNET=from-env")
                .run(context -> assertThat(context).hasSingleBean(ActaApiClient.class));
    }

    @Test
    void ledgerSettings_areBound() {
        contextRunner
                .withPropertyValues(
                        "acta.base-url=" + ActaNetwork.TESTNET_BASE_URL,
                        "acta.api-key=secret",
                        "acta.submission-mode=ledger",
                        "acta.ledger.rpc-url=https://rpc.example.org",
                        "acta.ledger.poll-interval=250ms",
                        "acta.ledger.max-poll-attempts=5")
                .run(context -> {
                    assertThat(context.getBean(CredentialService.class).getSubmissionMode()).isEqualTo(SubmissionMode.LEDGER);
                    assertThat(((SorobanRpcLedgerGateway) context.getBean(LedgerGateway.class)).getRpcUrl())
                            .isEqualTo("https://rpc.example.org");
                    var polling = context.getBean(LedgerStatusPoller.class).getSettings();
                    assertThat(polling.interval()).isEqualTo(Duration.ofMillis(250));
                    assertThat(polling.maxAttempts()).isEqualTo(5);
                });
    }

    @Test
    void invalidPollAttempts_failStartup() {
        contextRunner
                .withPropertyValues(
                        "acta.base-url=" + ActaNetwork.TESTNET_BASE_URL,
                        "acta.api-key=secret",
                        "acta.ledger.max-poll-attempts=0")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void userDefinedLedgerGateway_isKept() {
        var custom = mock(LedgerGateway.class);
        contextRunner
                .withPropertyValues("acta.base-url=" + ActaNetwork.TESTNET_BASE_URL, "acta.api-key=secret")
                .withBean(LedgerGateway.class, () -> custom)
                .run(context -> {
                    assertThat(context.getBean(LedgerGateway.class)).isSameAs(custom);
                    assertThat(context.getBean(LedgerStatusPoller.class).getLedgerGateway()).isSameAs(custom);
                });
    }
}
