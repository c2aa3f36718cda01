/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.domain;

import jakarta.annotation.Nullable;

/**
 * Caller visible result of a transaction run.
 * <p>
 * {@link Status#PENDING} means the ledger did not report a terminal status within the polling budget.
 * The transaction may still succeed, callers have to look it up again by its id.
 * </p>
 */
public record SubmissionOutcome(Status status, @Nullable String transactionId, @Nullable String reason) {

    public enum Status {
        ACCEPTED,
        PENDING,
        REJECTED,
        ERROR;

        public boolean isTerminalState() {
            return this != PENDING;
        }
    }

    public static SubmissionOutcome accepted(String transactionId) {
        return new SubmissionOutcome(Status.ACCEPTED, transactionId, null);
    }

    public static SubmissionOutcome pending(String transactionId) {
        return new SubmissionOutcome(Status.PENDING, transactionId, null);
    }

    public static SubmissionOutcome rejected(String transactionId, String reason) {
        return new SubmissionOutcome(Status.REJECTED, transactionId, reason);
    }

    public static SubmissionOutcome error(@Nullable String transactionId, String reason) {
        return new SubmissionOutcome(Status.ERROR, transactionId, reason);
    }

    public boolean isAccepted() {
        return status == Status.ACCEPTED;
    }

    public boolean isUnresolved() {
        return status == Status.PENDING;
    }
}
