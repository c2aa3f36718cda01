/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.api.ledger;

import java.util.Map;

/**
 * JSON-RPC 2.0 request as understood by Soroban RPC nodes.
 */
public record JsonRpcRequestDto(
        String jsonrpc,
        long id,
        String method,
        Map<String, Object> params) {

    public static JsonRpcRequestDto of(long id, String method, Map<String, Object> params) {
        return new JsonRpcRequestDto("2.0", id, method, params);
    }
}
