/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.common.config;

import build.acta.sdk.common.exception.MissingCredentialException;
import build.acta.sdk.domain.ActaNetwork;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Resolves the API key from an ordered list of sources. The first non-blank value wins.
 */
@Slf4j
public class ApiKeyResolver {

    private final List<ApiKeySource> sources;

    public ApiKeyResolver(List<ApiKeySource> sources) {
        this.sources = List.copyOf(sources);
    }

    /**
     * Default order: explicit key, network specific environment variable, network agnostic environment variable.
     *
     * @param explicitApiKey key passed by the caller, may be null
     * @param environment    environment lookup, usually {@code System::getenv}
     */
    public static ApiKeyResolver defaultResolver(String explicitApiKey, UnaryOperator<String> environment) {
        return new ApiKeyResolver(List.of(
                ApiKeySource.explicit(explicitApiKey),
                ApiKeySource.networkSpecific(environment),
                ApiKeySource.fallback(environment)));
    }

    /**
     * @return the trimmed API key
     * @throws MissingCredentialException if no source yields a non-blank value
     */
    public String resolve(ActaNetwork network) {
        for (int i = 0; i < sources.size(); i++) {
            Optional<String> candidate = sources.get(i).resolve(network).filter(StringUtils::isNotBlank);
            if (candidate.isPresent()) {
                log.debug("Resolved ACTA API key for {} from source #{}", network, i + 1);
                return candidate.get().trim();
            }
        }
        throw new MissingCredentialException(String.format(
                "API key is required for %s. Provide it explicitly or set %s (recommended) or %s (fallback for both networks).",
                network, ApiKeySource.variableFor(network), ApiKeySource.API_KEY_VARIABLE));
    }
}
