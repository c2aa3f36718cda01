/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.domain;

import build.acta.sdk.api.TransactionRequestDto;
import build.acta.sdk.api.VaultCreateRequestDto;

public record CreateVaultIntent(String owner, String ownerDid, String contractId) implements TransactionIntent {

    @Override
    public TxEndpoint endpoint() {
        return TxEndpoint.VAULT_CREATE;
    }

    @Override
    public TransactionRequestDto toPrepareRequest() {
        return VaultCreateRequestDto.builder()
                .owner(owner)
                .didUri(ownerDid)
                .sourcePublicKey(owner)
                .contractId(contractId)
                .build();
    }
}
