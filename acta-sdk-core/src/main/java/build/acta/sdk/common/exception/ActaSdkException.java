/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.common.exception;

/**
 * Base class of all failures raised by the ACTA SDK.
 */
public class ActaSdkException extends RuntimeException {

    public ActaSdkException(String message) {
        super(message);
    }

    public ActaSdkException(String message, Throwable cause) {
        super(message, cause);
    }
}
