/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.api;

public enum TransactionResponseKind {
    PREPARED,
    SUBMITTED,
    UNKNOWN
}
