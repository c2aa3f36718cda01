/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.domain;

/**
 * Unsigned transaction as prepared by the backend.
 *
 * @param envelope          base64 transaction XDR
 * @param networkPassphrase passphrase of the network the transaction has to be signed for
 */
public record UnsignedEnvelope(String envelope, String networkPassphrase) {
}
