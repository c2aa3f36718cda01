/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.domain;

/**
 * Where a signed envelope is sent and how its outcome is observed.
 */
public enum SubmissionMode {
    /**
     * The ACTA API submits the envelope and answers with the transaction id.
     */
    BACKEND,
    /**
     * The envelope is sent straight to a ledger RPC node which is polled until a terminal status.
     */
    LEDGER
}
