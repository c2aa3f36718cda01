/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.common.exception;

/**
 * Errors being used when caller supplied data is structurally unusable, e.g. a blank wallet address.
 */
public class InvalidInputException extends ActaSdkException {

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
