/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.common.exception;

/**
 * Exception indicating that the ledger RPC node could not be queried or answered with an error
 */
public class LedgerQueryException extends ActaSdkException {

    public LedgerQueryException(String message) {
        super(message);
    }

    public LedgerQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
