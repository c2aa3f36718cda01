/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.common.exception;

/**
 * Exception indicating that a signed envelope was submitted but no transaction id came back
 */
public class SubmitFailedException extends ActaSdkException {

    public SubmitFailedException(String message) {
        super(message);
    }

    public SubmitFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
