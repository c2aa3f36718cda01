/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.domain;

import java.util.Arrays;

/**
 * Status values reported by the ledger for a submitted transaction, both by the send call and by later lookups.
 */
public enum LedgerTransactionStatus {
    SUCCESS,
    FAILED,
    PENDING,
    DUPLICATE,
    TRY_AGAIN_LATER,
    NOT_FOUND,
    ERROR,
    UNKNOWN;

    /**
     * Maps a raw status string. Unrecognized or missing values become {@link #UNKNOWN}.
     */
    public static LedgerTransactionStatus fromValue(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        return Arrays.stream(values())
                .filter(status -> status.name().equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElse(UNKNOWN);
    }

    /**
     * Classification used while polling a transaction by its hash.
     * Everything that is not SUCCESS or FAILED is treated as not yet terminal.
     */
    public PollDecision decision() {
        return switch (this) {
            case SUCCESS -> PollDecision.CONFIRMED;
            case FAILED -> PollDecision.FAILED;
            case PENDING, DUPLICATE, TRY_AGAIN_LATER, NOT_FOUND, ERROR, UNKNOWN -> PollDecision.CONTINUE;
        };
    }

    /**
     * Whether the immediate answer of a send call is fatal, in which case the transaction is never polled.
     */
    public boolean isFatalSubmission() {
        return this == ERROR;
    }
}
