/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.service;

import build.acta.sdk.domain.AuthorizeIssuerIntent;
import build.acta.sdk.domain.CreateVaultIntent;
import build.acta.sdk.domain.RevokeIssuerIntent;
import build.acta.sdk.domain.RevokeVaultIntent;
import build.acta.sdk.domain.SubmissionMode;
import build.acta.sdk.domain.SubmissionOutcome;
import jakarta.annotation.Nullable;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import static build.acta.sdk.service.Arguments.requireText;

/**
 * Vault lifecycle operations. Every operation is a transaction signed by the vault owner.
 */
@Slf4j
public class VaultService {

    private final ActaApiClient apiClient;
    private final ContractIdResolver contractIdResolver;
    private final TransactionOrchestrator orchestrator;
    @Getter
    private final SubmissionMode submissionMode;

    public VaultService(ActaApiClient apiClient, TransactionOrchestrator orchestrator, SubmissionMode submissionMode) {
        this.apiClient = apiClient;
        this.contractIdResolver = new ContractIdResolver(apiClient);
        this.orchestrator = orchestrator;
        this.submissionMode = submissionMode;
    }

    /**
     * Creates the vault of {@code owner}.
     *
     * @param ownerDid DID of the owner, a bare wallet address is turned into a {@code did:pkh} identifier
     */
    public SubmissionOutcome createVault(String owner, String ownerDid, @Nullable String contractId, TransactionSigner signer) {
        requireText(owner, "owner");
        var didUri = IdentifierNormalizer.normalizeDid(ownerDid, apiClient.getNetwork());
        var intent = new CreateVaultIntent(owner, didUri, contractIdResolver.resolve(contractId));
        log.debug("Creating vault for {} with {}", owner, didUri);
        return orchestrator.execute(intent, signer, submissionMode);
    }

    /**
     * Allows {@code issuer} to store credentials in the vault of {@code owner}.
     */
    public SubmissionOutcome authorizeIssuer(String owner, String issuer, @Nullable String contractId, TransactionSigner signer) {
        var intent = new AuthorizeIssuerIntent(requireText(owner, "owner"), requireText(issuer, "issuer"),
                contractIdResolver.resolve(contractId));
        return orchestrator.execute(intent, signer, submissionMode);
    }

    public SubmissionOutcome revokeIssuer(String owner, String issuer, @Nullable String contractId, TransactionSigner signer) {
        var intent = new RevokeIssuerIntent(requireText(owner, "owner"), requireText(issuer, "issuer"),
                contractIdResolver.resolve(contractId));
        return orchestrator.execute(intent, signer, submissionMode);
    }

    /**
     * Revokes the whole vault. No credential can be stored in it afterwards.
     */
    public SubmissionOutcome revokeVault(String owner, @Nullable String contractId, TransactionSigner signer) {
        var intent = new RevokeVaultIntent(requireText(owner, "owner"), contractIdResolver.resolve(contractId));
        return orchestrator.execute(intent, signer, submissionMode);
    }
}
