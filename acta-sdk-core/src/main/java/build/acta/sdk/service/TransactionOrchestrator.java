/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.service;

import build.acta.sdk.api.SignedTransactionRequestDto;
import build.acta.sdk.api.TransactionResponseDto;
import build.acta.sdk.common.exception.ActaApiException;
import build.acta.sdk.common.exception.ConfigurationMissingException;
import build.acta.sdk.common.exception.LedgerQueryException;
import build.acta.sdk.common.exception.PrepareFailedException;
import build.acta.sdk.common.exception.SigningFailedException;
import build.acta.sdk.common.exception.SubmitFailedException;
import build.acta.sdk.common.exception.TransactionFailedException;
import build.acta.sdk.domain.OrchestrationState;
import build.acta.sdk.domain.SignedEnvelope;
import build.acta.sdk.domain.SubmissionMode;
import build.acta.sdk.domain.SubmissionOutcome;
import build.acta.sdk.domain.TransactionIntent;
import build.acta.sdk.domain.TxEndpoint;
import build.acta.sdk.domain.UnsignedEnvelope;
import build.acta.sdk.service.ledger.LedgerStatusPoller;
import build.acta.sdk.service.ledger.LedgerSubmission;
import jakarta.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.web.client.RestClientException;

import java.util.Objects;

/**
 * Turns a {@link TransactionIntent} into a ledger transaction: prepare, sign, submit and, when submitting
 * directly to the ledger, wait for confirmation.
 * <p>
 * The backend prepares the unsigned envelope. Signing is done by the caller's {@link TransactionSigner} with
 * the network passphrase returned by the backend. Submission goes either back to the backend or straight to
 * a ledger node, see {@link SubmissionMode}. Nothing is retried apart from the status queries of the poller.
 * </p>
 */
@Slf4j
public class TransactionOrchestrator {

    private final ActaApiClient apiClient;
    @Nullable
    private final LedgerStatusPoller ledgerStatusPoller;

    /**
     * @param ledgerStatusPoller required for {@link SubmissionMode#LEDGER}, may be null if only the backend submits
     */
    public TransactionOrchestrator(ActaApiClient apiClient, @Nullable LedgerStatusPoller ledgerStatusPoller) {
        this.apiClient = apiClient;
        this.ledgerStatusPoller = ledgerStatusPoller;
    }

    public TransactionOrchestrator(ActaApiClient apiClient) {
        this(apiClient, null);
    }

    /**
     * Runs one intent to completion.
     *
     * @return {@code ACCEPTED} once the transaction is submitted (backend) or confirmed (ledger),
     * {@code PENDING} if the ledger gave no final answer in time
     * @throws PrepareFailedException      if the backend did not prepare the transaction
     * @throws SigningFailedException      if the signer failed
     * @throws SubmitFailedException       if the signed transaction could not be submitted
     * @throws TransactionFailedException  if the ledger rejected the transaction
     */
    public SubmissionOutcome execute(TransactionIntent intent, TransactionSigner signer, SubmissionMode mode) {
        var run = new Run(intent.endpoint());
        log.info("Starting {} in {} submission mode", intent.endpoint(), mode);
        try {
            run.transitionTo(OrchestrationState.PREPARING);
            var unsignedEnvelope = prepare(intent);

            run.transitionTo(OrchestrationState.AWAITING_SIGNATURE);
            var signedEnvelope = sign(unsignedEnvelope, signer);

            run.transitionTo(OrchestrationState.SUBMITTING);
            var outcome = switch (mode) {
                case BACKEND -> submitToBackend(intent.endpoint(), signedEnvelope, run);
                case LEDGER -> submitToLedger(signedEnvelope, run);
            };
            log.info("Finished {} with {} ({})", intent.endpoint(), outcome.status(), outcome.transactionId());
            return outcome;
        } catch (RuntimeException e) {
            run.fail(e);
            throw e;
        }
    }

    private UnsignedEnvelope prepare(TransactionIntent intent) {
        TransactionResponseDto response;
        try {
            response = apiClient.transact(intent.endpoint(), intent.toPrepareRequest());
        } catch (ActaApiException | RestClientException e) {
            throw new PrepareFailedException("Preparing %s failed: %s".formatted(intent.endpoint(), e.getMessage()), e);
        }
        if (response == null || !response.isPrepareResponse()) {
            throw new PrepareFailedException(
                    "Backend did not return an unsigned transaction and network passphrase for %s".formatted(intent.endpoint()));
        }
        return new UnsignedEnvelope(response.envelope(), response.networkPassphrase());
    }

    private SignedEnvelope sign(UnsignedEnvelope unsignedEnvelope, TransactionSigner signer) {
        String signed;
        try {
            signed = signer.signTransaction(unsignedEnvelope.envelope(), unsignedEnvelope.networkPassphrase());
        } catch (SigningFailedException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SigningFailedException("Signing the transaction failed: " + e.getMessage(), e);
        }
        if (StringUtils.isBlank(signed)) {
            throw new SigningFailedException("Signer returned an empty transaction");
        }
        return new SignedEnvelope(signed);
    }

    private SubmissionOutcome submitToBackend(TxEndpoint endpoint, SignedEnvelope signedEnvelope, Run run) {
        TransactionResponseDto response;
        try {
            response = apiClient.transact(endpoint, new SignedTransactionRequestDto(signedEnvelope.envelope()));
        } catch (ActaApiException | RestClientException e) {
            throw new SubmitFailedException("Submitting %s failed: %s".formatted(endpoint, e.getMessage()), e);
        }
        if (response == null || !response.isSubmitResponse()) {
            throw new SubmitFailedException("Backend did not return a transaction id for %s".formatted(endpoint));
        }
        run.transitionTo(OrchestrationState.CONFIRMED);
        return SubmissionOutcome.accepted(response.transactionId());
    }

    private SubmissionOutcome submitToLedger(SignedEnvelope signedEnvelope, Run run) {
        if (ledgerStatusPoller == null) {
            throw new ConfigurationMissingException("Direct ledger submission requires a ledger gateway");
        }
        var gateway = ledgerStatusPoller.getLedgerGateway();
        LedgerSubmission submission;
        try {
            submission = gateway.sendTransaction(signedEnvelope);
        } catch (LedgerQueryException e) {
            throw new SubmitFailedException("Sending the transaction to the ledger failed: " + e.getMessage(), e);
        }
        if (submission.status().isFatalSubmission()) {
            var outcome = SubmissionOutcome.error(submission.hash(),
                    "Ledger refused the transaction: " + Objects.toString(submission.errorResultXdr(), "no details"));
            throw new TransactionFailedException(outcome.reason(), outcome);
        }
        if (StringUtils.isBlank(submission.hash())) {
            throw new SubmitFailedException("Ledger did not return a transaction hash");
        }

        run.transitionTo(OrchestrationState.POLLING);
        var outcome = ledgerStatusPoller.poll(submission.hash());
        switch (outcome.status()) {
            case ACCEPTED -> run.transitionTo(OrchestrationState.CONFIRMED);
            case PENDING -> run.transitionTo(OrchestrationState.UNRESOLVED);
            case REJECTED, ERROR -> throw new TransactionFailedException(outcome.reason(), outcome);
        }
        return outcome;
    }

    /**
     * State of a single {@link #execute} call.
     */
    private static final class Run {
        private final TxEndpoint endpoint;
        private OrchestrationState state = OrchestrationState.IDLE;

        private Run(TxEndpoint endpoint) {
            this.endpoint = endpoint;
        }

        private void transitionTo(OrchestrationState target) {
            if (!state.canTransitionTo(target)) {
                throw new IllegalStateException("Illegal transition from %s to %s".formatted(state, target));
            }
            log.debug("{}: {} -> {}", endpoint, state, target);
            state = target;
        }

        private void fail(RuntimeException cause) {
            if (state.canTransitionTo(OrchestrationState.FAILED)) {
                log.info("{} failed while {}: {}", endpoint, state, cause.getMessage());
                state = OrchestrationState.FAILED;
            }
        }
    }
}
