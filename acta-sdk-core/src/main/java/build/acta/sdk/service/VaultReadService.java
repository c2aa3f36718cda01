/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.service;

import build.acta.sdk.api.VaultVerifyResponseDto;
import build.acta.sdk.api.VerifyStatusResponseDto;
import jakarta.annotation.Nullable;
import lombok.RequiredArgsConstructor;

import java.util.List;
import java.util.Optional;

import static build.acta.sdk.service.Arguments.requireText;

/**
 * Read-only access to vault contents. Reads are not transactions and need no signer.
 * Without a contract id the server picks the network default.
 */
@RequiredArgsConstructor
public class VaultReadService {

    private final ActaApiClient apiClient;

    public List<String> listVcIds(String owner, @Nullable String contractId) {
        var response = apiClient.vaultListVcIds(requireText(owner, "owner"), contractId);
        return response != null ? response.ids() : List.of();
    }

    public Optional<Object> getVc(String owner, String vcId, @Nullable String contractId) {
        var response = apiClient.vaultGetVc(requireText(owner, "owner"), requireText(vcId, "vcId"), contractId);
        return response != null ? response.credential() : Optional.empty();
    }

    public VaultVerifyResponseDto verifyVc(String owner, String vcId, @Nullable String contractId) {
        return apiClient.vaultVerify(requireText(owner, "owner"), requireText(vcId, "vcId"), contractId);
    }

    public VerifyStatusResponseDto verifyStatus(String vcId) {
        return apiClient.verifyStatus(requireText(vcId, "vcId"));
    }
}
