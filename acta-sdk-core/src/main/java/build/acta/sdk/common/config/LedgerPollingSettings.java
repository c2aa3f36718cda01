/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.common.config;

import java.time.Duration;

/**
 * Cadence of the transaction status poll loop.
 *
 * @param interval    wait between two status queries
 * @param maxAttempts number of status queries before the outcome is reported as unresolved
 */
public record LedgerPollingSettings(Duration interval, int maxAttempts) {

    public static final Duration DEFAULT_INTERVAL = Duration.ofMillis(1200);
    public static final int DEFAULT_MAX_ATTEMPTS = 40;

    public LedgerPollingSettings {
        if (interval == null || interval.isNegative()) {
            throw new IllegalArgumentException("Poll interval must not be negative");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("At least one poll attempt is required");
        }
    }

    public static LedgerPollingSettings defaults() {
        return new LedgerPollingSettings(DEFAULT_INTERVAL, DEFAULT_MAX_ATTEMPTS);
    }
}
