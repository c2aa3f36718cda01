/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.common.exception;

/**
 * Exception indicating that no contract id could be resolved for an operation
 */
public class ConfigurationMissingException extends ActaSdkException {

    public ConfigurationMissingException(String message) {
        super(message);
    }

    public ConfigurationMissingException(String message, Throwable cause) {
        super(message, cause);
    }
}
