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
 * Body of the direct vault read endpoints (verify, list and get).
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(name = "VaultQueryRequest")
public record VaultQueryRequestDto(
        String owner,
        String vcId,
        String contractId) {
}
