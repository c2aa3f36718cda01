/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.autoconfigure;

import build.acta.sdk.common.config.LedgerPollingSettings;
import build.acta.sdk.domain.SubmissionMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Settings of the ACTA SDK.
 *
 * @param baseUrl        ACTA API base url, the network is derived from it
 * @param apiKey         API key, falls back to ACTA_API_KEY_MAINNET / ACTA_API_KEY_TESTNET and ACTA_API_KEY
 * @param submissionMode where signed transactions are submitted to
 */
@Validated
@ConfigurationProperties(prefix = "acta")
public record ActaProperties(
        @NotBlank String baseUrl,
        @Size(min = 1) // null means resolve from the environment, empty is a mistake
        String apiKey,
        @NotNull @DefaultValue("BACKEND") SubmissionMode submissionMode,
        @Valid @NotNull @DefaultValue LedgerProperties ledger) {

    /**
     * @param rpcUrl          Soroban RPC node, defaults to the public node of the network
     * @param pollInterval    wait between two status queries
     * @param maxPollAttempts status queries before a transaction is reported as unresolved
     */
    public record LedgerProperties(
            String rpcUrl,
            @NotNull @DefaultValue("1200ms") Duration pollInterval,
            @Min(1) @DefaultValue("40") int maxPollAttempts) {

        public LedgerPollingSettings toPollingSettings() {
            return new LedgerPollingSettings(pollInterval, maxPollAttempts);
        }
    }
}
