/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.api.ledger;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Result of the {@code sendTransaction} RPC method.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SendTransactionResultDto(
        String status,
        String hash,
        String errorResultXdr,
        Long latestLedger) {
}
