/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.service.ledger;

import build.acta.sdk.domain.LedgerTransactionStatus;
import jakarta.annotation.Nullable;

/**
 * Immediate answer of the ledger to a submitted transaction.
 *
 * @param errorResultXdr encoded error details, only present for {@link LedgerTransactionStatus#ERROR}
 */
public record LedgerSubmission(LedgerTransactionStatus status, @Nullable String hash, @Nullable String errorResultXdr) {
}
