/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.service.ledger;

import java.time.Duration;

/**
 * Blocking wait between two status queries. Replaced in tests to observe the waits without waiting.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD_SLEEPER = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
