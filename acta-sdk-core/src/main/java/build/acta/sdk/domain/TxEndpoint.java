/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Backend endpoints serving both the prepare and the submit shape of a transaction request.
 */
@Getter
@RequiredArgsConstructor
public enum TxEndpoint {
    VAULT_CREATE("/contracts/vault/create", "vault creation"),
    VAULT_AUTHORIZE_ISSUER("/contracts/vault/authorize-issuer", "authorize issuer"),
    VAULT_REVOKE_ISSUER("/contracts/vault/revoke-issuer", "revoke issuer"),
    VAULT_REVOKE_VAULT("/contracts/vault/revoke-vault", "revoke vault"),
    VC_ISSUE("/contracts/vc/issue", "issue credential"),
    VC_REVOKE("/contracts/vc/revoke", "revoke credential");

    private final String path;
    private final String displayName;

    @Override
    public String toString() {
        return getDisplayName();
    }
}
