/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.service;

import build.acta.sdk.common.exception.InvalidInputException;
import build.acta.sdk.common.exception.SubmitFailedException;
import build.acta.sdk.domain.IssueCredentialCommand;
import build.acta.sdk.domain.IssueCredentialIntent;
import build.acta.sdk.domain.RevokeCredentialIntent;
import build.acta.sdk.domain.SubmissionMode;
import build.acta.sdk.domain.SubmissionOutcome;
import jakarta.annotation.Nullable;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static build.acta.sdk.service.Arguments.requireText;

/**
 * Issuance and revocation of credentials.
 * <p>
 * Holder and issuer identifiers are normalized to DIDs of the client's network and the credential document
 * is completed with the required {@code @context} entries before the transaction is prepared.
 * </p>
 */
@Slf4j
public class CredentialService {

    private final ActaApiClient apiClient;
    private final ContractIdResolver contractIdResolver;
    private final TransactionOrchestrator orchestrator;
    @Getter
    private final SubmissionMode submissionMode;
    private final Clock clock;

    public CredentialService(ActaApiClient apiClient, TransactionOrchestrator orchestrator, SubmissionMode submissionMode, Clock clock) {
        this.apiClient = apiClient;
        this.contractIdResolver = new ContractIdResolver(apiClient);
        this.orchestrator = orchestrator;
        this.submissionMode = submissionMode;
        this.clock = clock;
    }

    public CredentialService(ActaApiClient apiClient, TransactionOrchestrator orchestrator, SubmissionMode submissionMode) {
        this(apiClient, orchestrator, submissionMode, Clock.systemUTC());
    }

    public SubmissionOutcome issueCredential(IssueCredentialCommand command, TransactionSigner signer) {
        if (command.vcData() == null) {
            throw new InvalidInputException("vcData must not be empty");
        }
        var network = apiClient.getNetwork();
        var intent = IssueCredentialIntent.builder()
                .owner(requireText(command.owner(), "owner"))
                .vcId(requireText(command.vcId(), "vcId"))
                .vcData(IdentifierNormalizer.ensureContext(command.vcData()))
                .issuer(requireText(command.issuer(), "issuer"))
                .holder(IdentifierNormalizer.normalizeDid(command.holder(), network))
                .issuerDid(StringUtils.isNotBlank(command.issuerDid())
                        ? IdentifierNormalizer.normalizeDid(command.issuerDid(), network)
                        : null)
                .contractId(contractIdResolver.resolve(command.contractId()))
                .build();
        log.debug("Issuing credential {} to {}", intent.vcId(), intent.holder());
        return orchestrator.execute(intent, signer, submissionMode);
    }

    /**
     * Revokes a credential with a transaction signed by the vault owner.
     *
     * @param date ISO-8601 revocation time, defaults to now
     */
    public SubmissionOutcome revokeCredential(String owner, String vcId, @Nullable String date,
                                              @Nullable String contractId, TransactionSigner signer) {
        var revocationDate = StringUtils.isNotBlank(date)
                ? date
                : Instant.now(clock).truncatedTo(ChronoUnit.MILLIS).toString();
        var intent = new RevokeCredentialIntent(requireText(owner, "owner"), requireText(vcId, "vcId"),
                revocationDate, contractIdResolver.resolve(contractId));
        return orchestrator.execute(intent, signer, submissionMode);
    }

    /**
     * Revokes a credential through the issuance contract, signed by the server's admin account.
     *
     * @return id of the revocation transaction
     */
    public String revokeCredentialServerSigned(String vcId, @Nullable String date) {
        var response = apiClient.revokeCredentialServerSigned(requireText(vcId, "vcId"), date);
        if (response == null || StringUtils.isBlank(response.transactionId())) {
            throw new SubmitFailedException(
                    "Backend did not return a transaction id for the revocation of " + vcId);
        }
        log.info("Revoked credential {} with server signed transaction {}", vcId, response.transactionId());
        return response.transactionId();
    }
}
