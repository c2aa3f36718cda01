/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.autoconfigure;

import build.acta.sdk.common.exception.ActaApiException;
import build.acta.sdk.service.ActaApiClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.web.client.RestClientException;

import java.util.Set;

/**
 * Reports the ACTA API as UP when its health endpoint answers with a healthy status.
 * <p>
 * A rejected API key is reported as DOWN with the HTTP status, so that a misconfigured key shows up in the
 * actuator health instead of only at the first transaction.
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class ActaApiHealthIndicator implements HealthIndicator {

    private static final Set<String> HEALTHY_STATUSES = Set.of("ok", "up", "healthy");

    private final ActaApiClient actaApiClient;

    @Override
    public Health health() {
        var builder = Health.unknown()
                .withDetail("baseUrl", actaApiClient.getBaseUrl())
                .withDetail("network", actaApiClient.getNetwork().getValue());
        try {
            var response = actaApiClient.getHealth();
            var status = response != null ? response.status() : null;
            if (status != null && HEALTHY_STATUSES.contains(status.toLowerCase())) {
                builder.up();
            } else {
                builder.down();
            }
            builder.withDetail("status", String.valueOf(status));
        } catch (ActaApiException e) {
            log.debug("ACTA API health check failed with status {}", e.getStatusCode());
            builder.down().withDetail("statusCode", e.getStatusCode().value());
        } catch (RestClientException e) {
            log.debug("ACTA API health check failed: {}", e.getMessage());
            builder.down().withDetail("error", "unreachable: " + e.getMessage());
        }
        return builder.build();
    }
}
