/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;

@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
@Schema(name = "ConfigResponse")
public record ConfigResponseDto(
        @Schema(description = "Soroban RPC url of the network served by the API")
        String rpcUrl,
        String networkPassphrase,
        @Schema(description = "Default ACTA contract id of the network")
        String actaContractId) {
}
