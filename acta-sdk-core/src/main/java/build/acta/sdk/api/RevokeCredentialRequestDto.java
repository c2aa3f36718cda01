/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.api;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RevokeCredentialRequestDto(String vcId, String date) {
}
