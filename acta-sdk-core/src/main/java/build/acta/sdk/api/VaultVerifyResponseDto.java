/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.swagger.v3.oas.annotations.media.Schema;

@JsonIgnoreProperties(ignoreUnknown = true)
@Schema(name = "VaultVerifyResponse")
public record VaultVerifyResponseDto(
        @Schema(allowableValues = {"valid", "revoked"})
        String status,
        @Schema(description = "Timestamp of the last status change")
        String since) {

    @JsonIgnore
    public boolean isValid() {
        return "valid".equalsIgnoreCase(status);
    }

    @JsonIgnore
    public boolean isRevoked() {
        return "revoked".equalsIgnoreCase(status);
    }
}
