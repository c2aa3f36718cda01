/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Optional;

@JsonIgnoreProperties(ignoreUnknown = true)
@Schema(name = "VaultGetVcResponse")
public record VaultGetVcResponseDto(
        Object vc,
        @Deprecated
        @Schema(description = "Older servers answer with this field instead of vc", deprecated = true)
        Object result) {

    @JsonIgnore
    public Optional<Object> credential() {
        return Optional.ofNullable(vc != null ? vc : result);
    }
}
