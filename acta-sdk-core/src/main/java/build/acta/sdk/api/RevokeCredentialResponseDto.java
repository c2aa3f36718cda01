/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RevokeCredentialResponseDto(
        @JsonProperty("vc_id")
        String vcId,
        @JsonProperty("tx_id")
        String transactionId) {
}
