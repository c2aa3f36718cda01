/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.service.ledger;

import build.acta.sdk.common.config.LedgerPollingSettings;
import build.acta.sdk.common.exception.LedgerQueryException;
import build.acta.sdk.domain.LedgerTransactionStatus;
import build.acta.sdk.domain.SubmissionOutcome;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Polls the ledger for the status of a submitted transaction until it is terminal or the attempts are used up.
 * <p>
 * Errors of a single query are not reported, the next attempt simply asks again.
 * An exhausted budget or an interrupted wait yields a {@link SubmissionOutcome.Status#PENDING} outcome.
 * </p>
 */
@Slf4j
public class LedgerStatusPoller {

    @Getter
    private final LedgerGateway ledgerGateway;
    @Getter
    private final LedgerPollingSettings settings;
    private final Sleeper sleeper;

    public LedgerStatusPoller(LedgerGateway ledgerGateway, LedgerPollingSettings settings, Sleeper sleeper) {
        this.ledgerGateway = ledgerGateway;
        this.settings = settings;
        this.sleeper = sleeper;
    }

    public LedgerStatusPoller(LedgerGateway ledgerGateway, LedgerPollingSettings settings) {
        this(ledgerGateway, settings, Sleeper.THREAD_SLEEPER);
    }

    public SubmissionOutcome poll(String transactionHash) {
        for (int attempt = 1; attempt <= settings.maxAttempts(); attempt++) {
            var status = queryStatus(transactionHash, attempt);
            switch (status.decision()) {
                case CONFIRMED -> {
                    log.debug("Transaction {} confirmed after {} attempt(s)", transactionHash, attempt);
                    return SubmissionOutcome.accepted(transactionHash);
                }
                case FAILED -> {
                    return SubmissionOutcome.rejected(transactionHash, "Transaction %s failed on the ledger".formatted(transactionHash));
                }
                case CONTINUE -> log.debug("Transaction {} is {} (attempt {}/{})", transactionHash, status, attempt, settings.maxAttempts());
            }
            if (attempt < settings.maxAttempts()) {
                try {
                    sleeper.sleep(settings.interval());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted while waiting for transaction {}, its status is unresolved", transactionHash);
                    return SubmissionOutcome.pending(transactionHash);
                }
            }
        }
        log.warn("Transaction {} not confirmed after {} attempts, its status is unresolved", transactionHash, settings.maxAttempts());
        return SubmissionOutcome.pending(transactionHash);
    }

    private LedgerTransactionStatus queryStatus(String transactionHash, int attempt) {
        try {
            return ledgerGateway.getTransactionStatus(transactionHash);
        } catch (LedgerQueryException e) {
            log.debug("Status query {} for transaction {} failed: {}", attempt, transactionHash, e.getMessage());
            return LedgerTransactionStatus.UNKNOWN;
        }
    }
}
