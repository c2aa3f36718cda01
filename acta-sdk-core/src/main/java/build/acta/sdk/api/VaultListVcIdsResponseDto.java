/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
@Schema(name = "VaultListVcIdsResponse")
public record VaultListVcIdsResponseDto(
        @JsonProperty("vc_ids")
        List<String> vcIds,
        @Deprecated
        @Schema(description = "Older servers answer with this field instead of vc_ids", deprecated = true)
        List<String> result) {

    /**
     * @return credential ids, read from {@code vc_ids} and falling back to the deprecated {@code result}
     */
    @JsonIgnore
    public List<String> ids() {
        if (vcIds != null) {
            return vcIds;
        }
        return result != null ? result : List.of();
    }
}
