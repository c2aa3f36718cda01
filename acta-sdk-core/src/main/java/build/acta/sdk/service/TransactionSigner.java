/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.service;

/**
 * Signing capability supplied by the calling application, typically backed by a wallet.
 */
@FunctionalInterface
public interface TransactionSigner {

    /**
     * @param unsignedEnvelope  base64 transaction XDR as prepared by the backend
     * @param networkPassphrase passphrase of the network the transaction belongs to
     * @return the signed envelope as base64 XDR
     * @throws build.acta.sdk.common.exception.SigningFailedException or any other runtime exception if signing is not possible
     */
    String signTransaction(String unsignedEnvelope, String networkPassphrase);
}
