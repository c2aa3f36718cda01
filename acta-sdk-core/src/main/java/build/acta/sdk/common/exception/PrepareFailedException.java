/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.common.exception;

/**
 * Exception indicating that the backend did not return an unsigned envelope together with its network
 */
public class PrepareFailedException extends ActaSdkException {

    public PrepareFailedException(String message) {
        super(message);
    }

    public PrepareFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
