/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk;

import build.acta.sdk.common.config.LedgerPollingSettings;
import build.acta.sdk.domain.SubmissionMode;
import build.acta.sdk.service.ActaApiClient;
import build.acta.sdk.service.CredentialService;
import build.acta.sdk.service.TransactionOrchestrator;
import build.acta.sdk.service.VaultReadService;
import build.acta.sdk.service.VaultService;
import build.acta.sdk.service.ledger.LedgerStatusPoller;
import build.acta.sdk.service.ledger.Sleeper;
import build.acta.sdk.service.ledger.SorobanRpcLedgerGateway;
import jakarta.annotation.Nullable;
import lombok.Builder;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.util.function.UnaryOperator;

/**
 * Entry point for applications without a Spring context. Wires client, orchestrator and façades for one network.
 *
 * <pre>{@code
 * var sdk = ActaSdk.builder().baseUrl(ActaNetwork.TESTNET_BASE_URL).apiKey(key).build();
 * sdk.getVaults().createVault(owner, owner, null, wallet::sign);
 * }</pre>
 */
@Getter
public final class ActaSdk {

    private final ActaApiClient apiClient;
    private final TransactionOrchestrator orchestrator;
    private final VaultService vaults;
    private final CredentialService credentials;
    private final VaultReadService reads;

    private ActaSdk(ActaApiClient apiClient, TransactionOrchestrator orchestrator, SubmissionMode submissionMode, Clock clock) {
        this.apiClient = apiClient;
        this.orchestrator = orchestrator;
        this.vaults = new VaultService(apiClient, orchestrator, submissionMode);
        this.credentials = new CredentialService(apiClient, orchestrator, submissionMode, clock);
        this.reads = new VaultReadService(apiClient);
    }

    /**
     * @param baseUrl           mandatory ACTA API base url
     * @param submissionMode    defaults to {@link SubmissionMode#BACKEND}
     * @param ledgerRpcUrl      Soroban RPC url for {@link SubmissionMode#LEDGER}, defaults to the public node of the network
     * @param pollingSettings   defaults to {@link LedgerPollingSettings#defaults()}
     */
    @Builder
    private static ActaSdk create(String baseUrl,
                                  @Nullable String apiKey,
                                  @Nullable UnaryOperator<String> environment,
                                  @Nullable RestClient.Builder restClientBuilder,
                                  @Nullable SubmissionMode submissionMode,
                                  @Nullable String ledgerRpcUrl,
                                  @Nullable LedgerPollingSettings pollingSettings,
                                  @Nullable Sleeper sleeper,
                                  @Nullable Clock clock) {
        var builder = restClientBuilder != null ? restClientBuilder : RestClient.builder();
        var apiClient = ActaApiClient.builder()
                .baseUrl(baseUrl)
                .apiKey(apiKey)
                .environment(environment)
                .restClientBuilder(builder)
                .build();
        var rpcUrl = StringUtils.defaultIfBlank(ledgerRpcUrl, apiClient.getNetwork().getDefaultRpcUrl());
        var poller = new LedgerStatusPoller(
                new SorobanRpcLedgerGateway(builder, rpcUrl),
                pollingSettings != null ? pollingSettings : LedgerPollingSettings.defaults(),
                sleeper != null ? sleeper : Sleeper.THREAD_SLEEPER);
        return new ActaSdk(apiClient,
                new TransactionOrchestrator(apiClient, poller),
                submissionMode != null ? submissionMode : SubmissionMode.BACKEND,
                clock != null ? clock : Clock.systemUTC());
    }
}
