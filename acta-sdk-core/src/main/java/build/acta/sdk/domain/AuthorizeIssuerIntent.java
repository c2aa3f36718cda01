/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.domain;

import build.acta.sdk.api.TransactionRequestDto;
import build.acta.sdk.api.VaultIssuerRequestDto;

public record AuthorizeIssuerIntent(String owner, String issuer, String contractId) implements TransactionIntent {

    @Override
    public TxEndpoint endpoint() {
        return TxEndpoint.VAULT_AUTHORIZE_ISSUER;
    }

    @Override
    public TransactionRequestDto toPrepareRequest() {
        return VaultIssuerRequestDto.builder()
                .owner(owner)
                .issuer(issuer)
                .sourcePublicKey(owner)
                .contractId(contractId)
                .build();
    }
}
