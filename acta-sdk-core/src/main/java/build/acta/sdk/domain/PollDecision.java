/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.domain;

public enum PollDecision {
    CONFIRMED,
    FAILED,
    CONTINUE
}
