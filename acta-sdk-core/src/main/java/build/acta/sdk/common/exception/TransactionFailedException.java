/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.common.exception;

import build.acta.sdk.domain.SubmissionOutcome;
import lombok.Getter;

import java.io.Serial;

/**
 * Terminal rejection of a transaction by the ledger.
 */
@Getter
public class TransactionFailedException extends ActaSdkException {
    @Serial
    private static final long serialVersionUID = 1L;

    private final transient SubmissionOutcome outcome;

    public TransactionFailedException(String message, SubmissionOutcome outcome) {
        super(message);
        this.outcome = outcome;
    }
}
