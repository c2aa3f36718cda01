/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.api.ledger;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Result of the {@code getTransaction} RPC method. Only the fields needed for confirmation are mapped.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GetTransactionResultDto(
        String status,
        Long ledger,
        String resultXdr) {
}
