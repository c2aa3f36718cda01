/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.service;

import build.acta.sdk.common.exception.ConfigurationMissingException;
import jakarta.annotation.Nullable;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;

/**
 * Picks the contract an intent is executed against: the explicit id if given, else the one announced by the API.
 */
@RequiredArgsConstructor
public class ContractIdResolver {

    private final ActaApiClient apiClient;

    public String resolve(@Nullable String explicitContractId) {
        if (StringUtils.isNotBlank(explicitContractId)) {
            return explicitContractId.trim();
        }
        var contractId = apiClient.getConfig().actaContractId();
        if (StringUtils.isBlank(contractId)) {
            throw new ConfigurationMissingException(
                    "No contract id given and %s does not announce one".formatted(apiClient.getBaseUrl()));
        }
        return contractId;
    }
}
