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
@Schema(name = "VcIssueRequest")
public record VcIssueRequestDto(
        @Schema(description = "Wallet address owning the vault the credential is stored in")
        String owner,
        @Schema(description = "Unique identifier of the credential")
        String vcId,
        @Schema(description = "Credential data as JSON string, including the @context array")
        String vcData,
        @Schema(description = "Wallet address of the issuer")
        String issuer,
        @Schema(description = "DID of the holder", example = "did:pkh:stellar:testnet:GABC")
        String holder,
        @Schema(description = "DID of the issuer")
        String issuerDid,
        String sourcePublicKey,
        String contractId) implements TransactionRequestDto {
}
