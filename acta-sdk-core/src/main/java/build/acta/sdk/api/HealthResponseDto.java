/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;

import java.util.Map;

@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
@Schema(name = "HealthResponse")
public record HealthResponseDto(
        String status,
        String timestamp,
        String service,
        Object port,
        Map<String, Object> env) {
}
