/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "SignedTransactionRequest")
public record SignedTransactionRequestDto(
        @JsonProperty("signedXdr")
        @Schema(description = "Signed transaction envelope as base64 XDR")
        String signedEnvelope) implements TransactionRequestDto {
}
