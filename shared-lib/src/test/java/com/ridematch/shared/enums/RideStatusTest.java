package com.ridematch.shared.enums;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class RideStatusTest {

    private static final Map<RideStatus, Set<RideStatus>> ALLOWED = Map.of(
            RideStatus.REQUESTED,       EnumSet.of(RideStatus.MATCHED, RideStatus.CANCELLED),
            RideStatus.MATCHED,         EnumSet.of(RideStatus.DRIVER_ARRIVING, RideStatus.CANCELLED),
            RideStatus.DRIVER_ARRIVING, EnumSet.of(RideStatus.IN_PROGRESS, RideStatus.CANCELLED),
            RideStatus.IN_PROGRESS,     EnumSet.of(RideStatus.COMPLETED),
            RideStatus.COMPLETED,       EnumSet.noneOf(RideStatus.class),
            RideStatus.CANCELLED,       EnumSet.noneOf(RideStatus.class));

    @Test
    @DisplayName("Every (from, to) pair outside the table is rejected, every pair inside is allowed")
    void transitionTableIsExhaustive() {
        for (RideStatus from : RideStatus.values()) {
            for (RideStatus to : RideStatus.values()) {
                boolean expected = ALLOWED.get(from).contains(to);
                assertThat(from.canTransitionTo(to))
                        .as("%s -> %s", from, to)
                        .isEqualTo(expected);
            }
        }
    }

    @Test
    @DisplayName("Only COMPLETED and CANCELLED are terminal")
    void terminalStates() {
        assertThat(EnumSet.allOf(RideStatus.class).stream().filter(RideStatus::isTerminal))
                .containsExactlyInAnyOrder(RideStatus.COMPLETED, RideStatus.CANCELLED);
    }

    @Test
    @DisplayName("Cancellable before pickup, not once IN_PROGRESS")
    void cancellableStates() {
        assertThat(RideStatus.REQUESTED.isCancellable()).isTrue();
        assertThat(RideStatus.MATCHED.isCancellable()).isTrue();
        assertThat(RideStatus.DRIVER_ARRIVING.isCancellable()).isTrue();
        assertThat(RideStatus.IN_PROGRESS.isCancellable()).isFalse();
        assertThat(RideStatus.COMPLETED.isCancellable()).isFalse();
    }

    @Test
    @DisplayName("A trip starts from MATCHED or DRIVER_ARRIVING only")
    void startableStates() {
        assertThat(EnumSet.allOf(RideStatus.class).stream().filter(RideStatus::canStart))
                .containsExactlyInAnyOrder(RideStatus.MATCHED, RideStatus.DRIVER_ARRIVING);
    }
}
