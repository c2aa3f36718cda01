/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.api;

/**
 * Body of a request to an endpoint serving both transaction modes.
 * Prepare requests carry the structured intent fields, submit requests only the signed envelope.
 * Which branch runs is decided by the server from the fields present.
 */
public interface TransactionRequestDto {
}
