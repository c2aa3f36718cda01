/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.domain;

import build.acta.sdk.api.TransactionRequestDto;
import build.acta.sdk.api.VcRevokeRequestDto;

/**
 * @param owner account signing the revocation
 * @param date  ISO-8601 revocation timestamp
 */
public record RevokeCredentialIntent(String owner, String vcId, String date, String contractId) implements TransactionIntent {

    @Override
    public TxEndpoint endpoint() {
        return TxEndpoint.VC_REVOKE;
    }

    @Override
    public TransactionRequestDto toPrepareRequest() {
        return VcRevokeRequestDto.builder()
                .vcId(vcId)
                .date(date)
                .sourcePublicKey(owner)
                .contractId(contractId)
                .build();
    }
}
