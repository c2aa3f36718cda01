/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.common.exception;

import lombok.Getter;
import org.springframework.http.HttpStatusCode;

@Getter
public class ActaApiException extends ActaSdkException {

    private final transient HttpStatusCode statusCode;
    private final String responseBody;

    public ActaApiException(HttpStatusCode statusCode, String message, String responseBody) {
        super(message);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public boolean isAuthenticationFailure() {
        return statusCode.value() == 401 || statusCode.value() == 403;
    }
}
