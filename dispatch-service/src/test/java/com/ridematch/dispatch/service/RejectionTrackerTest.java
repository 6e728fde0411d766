package com.ridematch.dispatch.service;

import com.ridematch.dispatch.entity.Ride;
import com.ridematch.dispatch.result.RejectOutcome;
import com.ridematch.dispatch.support.DispatchTestFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static com.ridematch.dispatch.support.DispatchTestFixture.CITY_LNG;
import static com.ridematch.dispatch.support.DispatchTestFixture.latNorthOfCenter;
import static org.assertj.core.api.Assertions.assertThat;

class RejectionTrackerTest {

    private DispatchTestFixture fx;
    private Ride ride;

    @BeforeEach
    void setUp() {
        fx = new DispatchTestFixture();
        fx.onlineDriver("d1", latNorthOfCenter(1), CITY_LNG);
        fx.onlineDriver("d2", latNorthOfCenter(2), CITY_LNG);
        fx.onlineDriver("d3", latNorthOfCenter(3), CITY_LNG);
        fx.onlineDriver("far", latNorthOfCenter(9), CITY_LNG);
        ride = fx.requestRide("rider-1");
    }

    @Test
    @DisplayName("A decline is recorded; the ride stays open for the other notified drivers")
    void reject_recorded() {
        RejectOutcome outcome = fx.rejectionTracker.reject(ride.getId(), "d1");

        assertThat(outcome).isInstanceOf(RejectOutcome.Recorded.class);
        RejectOutcome.Recorded recorded = (RejectOutcome.Recorded) outcome;
        assertThat(recorded.rejectionCount()).isEqualTo(1);
        assertThat(recorded.remainingDrivers()).containsExactlyInAnyOrder("d2", "d3");
        assertThat(fx.broadcastCoordinator.pendingNotifications("d1")).isEmpty();
        assertThat(fx.broadcastCoordinator.pendingNotifications("d2")).hasSize(1);
        assertThat(fx.orchestrator.getBroadcast(ride.getId()).orElseThrow().isActive()).isTrue();
    }

    @Test
    @DisplayName("Every notified driver declining leaves the ride REQUESTED with nobody remaining")
    void reject_allDecline() {
        fx.rejectionTracker.reject(ride.getId(), "d1");
        fx.rejectionTracker.reject(ride.getId(), "d2");
        RejectOutcome.Recorded last = (RejectOutcome.Recorded) fx.rejectionTracker.reject(ride.getId(), "d3");

        assertThat(last.rejectionCount()).isEqualTo(3);
        assertThat(last.remainingDrivers()).isEmpty();
        assertThat(fx.counter("dispatch.rejections")).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Declining twice is idempotent")
    void reject_twice() {
        fx.rejectionTracker.reject(ride.getId(), "d1");
        RejectOutcome.Recorded again = (RejectOutcome.Recorded) fx.rejectionTracker.reject(ride.getId(), "d1");

        assertThat(again.rejectionCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("A driver who was never notified → NOT_NOTIFIED")
    void reject_notNotified() {
        assertThat(fx.rejectionTracker.reject(ride.getId(), "far")).isInstanceOf(RejectOutcome.NotNotified.class);
    }

    @Test
    @DisplayName("Unknown ride → NOT_FOUND")
    void reject_unknownRide() {
        assertThat(fx.rejectionTracker.reject(UUID.randomUUID(), "d1")).isInstanceOf(RejectOutcome.NotFound.class);
    }

    @Test
    @DisplayName("Matched ride → ALREADY_RESOLVED")
    void reject_matchedRide() {
        fx.arbitrator.accept(ride.getId(), "d2", "rider-1");

        assertThat(fx.rejectionTracker.reject(ride.getId(), "d1")).isInstanceOf(RejectOutcome.AlreadyResolved.class);
    }
}
