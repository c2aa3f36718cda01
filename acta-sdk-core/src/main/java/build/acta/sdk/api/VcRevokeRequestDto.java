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
@Schema(name = "VcRevokeRequest")
public record VcRevokeRequestDto(
        String vcId,
        @Schema(description = "Revocation date as ISO-8601 timestamp")
        String date,
        String sourcePublicKey,
        String contractId) implements TransactionRequestDto {
}
