/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.service;

import build.acta.sdk.common.exception.InvalidInputException;
import org.apache.commons.lang3.StringUtils;

final class Arguments {

    private Arguments() {
    }

    static String requireText(String value, String name) {
        if (StringUtils.isBlank(value)) {
            throw new InvalidInputException(name + " must not be empty");
        }
        return value;
    }
}
