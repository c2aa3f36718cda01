/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;

/**
 * Prepare request for authorizing or revoking an issuer on a vault.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(name = "VaultIssuerRequest")
public record VaultIssuerRequestDto(
        @Schema(description = "Wallet address owning the vault")
        String owner,
        @Schema(description = "Wallet address of the issuer")
        String issuer,
        String sourcePublicKey,
        String contractId) implements TransactionRequestDto {
}
