/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.common.exception;

/**
 * Exception indicating that no API key could be resolved when a client was constructed
 */
public class MissingCredentialException extends ActaSdkException {

    public MissingCredentialException(String message) {
        super(message);
    }

    public MissingCredentialException(String message, Throwable cause) {
        super(message, cause);
    }
}
