/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.domain;

import jakarta.annotation.Nullable;
import lombok.Builder;

/**
 * Caller input for issuing a credential.
 *
 * @param owner      wallet address of the vault owner
 * @param vcId       id of the credential inside the vault
 * @param vcData     credential document, a JSON string or a {@link java.util.Map}; {@code @context} is completed automatically
 * @param issuer     wallet address of the issuer, also the source account of the transaction
 * @param holder     wallet address or DID of the holder
 * @param issuerDid  wallet address or DID of the issuer
 * @param contractId contract to issue against, the network default is used if absent
 */
@Builder
public record IssueCredentialCommand(
        String owner,
        String vcId,
        Object vcData,
        String issuer,
        String holder,
        @Nullable String issuerDid,
        @Nullable String contractId) {
}
