/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.domain;

import build.acta.sdk.api.TransactionRequestDto;
import build.acta.sdk.api.VaultRevokeRequestDto;

public record RevokeVaultIntent(String owner, String contractId) implements TransactionIntent {

    @Override
    public TxEndpoint endpoint() {
        return TxEndpoint.VAULT_REVOKE_VAULT;
    }

    @Override
    public TransactionRequestDto toPrepareRequest() {
        return VaultRevokeRequestDto.builder()
                .owner(owner)
                .sourcePublicKey(owner)
                .contractId(contractId)
                .build();
    }
}
