/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.domain;

import build.acta.sdk.api.TransactionRequestDto;
import build.acta.sdk.api.VcIssueRequestDto;
import jakarta.annotation.Nullable;
import lombok.Builder;

/**
 * Issues a credential into the owner's vault. The issuer account signs the transaction.
 *
 * @param vcData    credential JSON, already carrying the required {@code @context}
 * @param holder    DID of the holder
 * @param issuerDid DID of the issuer, optional
 */
@Builder
public record IssueCredentialIntent(
        String owner,
        String vcId,
        String vcData,
        String issuer,
        String holder,
        @Nullable String issuerDid,
        String contractId) implements TransactionIntent {

    @Override
    public TxEndpoint endpoint() {
        return TxEndpoint.VC_ISSUE;
    }

    @Override
    public TransactionRequestDto toPrepareRequest() {
        return VcIssueRequestDto.builder()
                .owner(owner)
                .vcId(vcId)
                .vcData(vcData)
                .issuer(issuer)
                .holder(holder)
                .issuerDid(issuerDid)
                .sourcePublicKey(issuer)
                .contractId(contractId)
                .build();
    }
}
