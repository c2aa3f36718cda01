/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.domain;

import lombok.Getter;

import java.util.EnumSet;
import java.util.Set;

@Getter
public enum OrchestrationState {
    IDLE("Idle"),
    PREPARING("Preparing"),
    AWAITING_SIGNATURE("Awaiting signature"),
    SUBMITTING("Submitting"),
    POLLING("Polling"),
    CONFIRMED("Confirmed"),
    FAILED("Failed"),
    // polling budget exhausted without a terminal ledger status
    UNRESOLVED("Unresolved");

    private final String displayName;

    OrchestrationState(String displayName) {
        this.displayName = displayName;
    }

    @Override
    public String toString() {
        return this.getDisplayName();
    }

    public boolean isTerminalState() {
        return this == CONFIRMED || this == FAILED || this == UNRESOLVED;
    }

    /**
     * @return states reachable from this state in one step
     */
    public Set<OrchestrationState> getSuccessors() {
        return switch (this) {
            case IDLE -> EnumSet.of(PREPARING);
            case PREPARING -> EnumSet.of(AWAITING_SIGNATURE, FAILED);
            case AWAITING_SIGNATURE -> EnumSet.of(SUBMITTING, FAILED);
            case SUBMITTING -> EnumSet.of(POLLING, CONFIRMED, FAILED);
            case POLLING -> EnumSet.of(CONFIRMED, FAILED, UNRESOLVED);
            case CONFIRMED, FAILED, UNRESOLVED -> EnumSet.noneOf(OrchestrationState.class);
        };
    }

    public boolean canTransitionTo(OrchestrationState target) {
        return getSuccessors().contains(target);
    }
}
