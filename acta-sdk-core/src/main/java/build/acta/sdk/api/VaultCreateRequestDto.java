/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;

@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(name = "VaultCreateRequest")
public record VaultCreateRequestDto(
        @Schema(description = "Wallet address owning the vault")
        String owner,
        @Schema(description = "DID of the vault owner", example = "did:pkh:stellar:testnet:GABC")
        String didUri,
        @Schema(description = "Account signing the transaction")
        String sourcePublicKey,
        String contractId) implements TransactionRequestDto {
}
