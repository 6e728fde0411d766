package com.ridematch.dispatch.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Custom Micrometer metrics for the dispatch engine.
 *
 * Metrics exposed at /actuator/prometheus:
 *
 *   dispatch_ride_requests_total{status="created|rejected"}
 *   dispatch_broadcasts_total / dispatch_drivers_notified_total
 *   dispatch_notifications_total{result="delivered|failed"}
 *   dispatch_accept_outcomes_total{outcome="won|already_matched|busy|..."}
 *   dispatch_lock_contention_total
 *   dispatch_arbitration_seconds{quantile="0.5|0.95|0.99"}   time spent holding the ride lock
 *   dispatch_rejections_total, dispatch_radius_expansions_total
 *   dispatch_driver_cancellations_total, dispatch_driver_suspensions_total{action="suspended|released"}
 *   dispatch_ride_transitions_total{status=...}
 */
@Component
public class DispatchMetrics {

    private final MeterRegistry registry;

    private final Counter rideCreatedCounter;
    private final Counter rideRejectedCounter;
    private final Counter broadcastCounter;
    private final Counter driversNotifiedCounter;
    private final Counter notificationDeliveredCounter;
    private final Counter notificationFailedCounter;
    private final Counter lockContentionCounter;
    private final Counter rejectionCounter;
    private final Counter expansionCounter;
    private final Counter driverCancellationCounter;
    private final Counter suspensionCounter;
    private final Counter suspensionReleasedCounter;
    private final Timer   arbitrationTimer;

    public DispatchMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.rideCreatedCounter = Counter.builder("dispatch.ride.requests")
                .tag("status", "created")
                .description("Ride requests persisted and broadcast")
                .register(registry);

        this.rideRejectedCounter = Counter.builder("dispatch.ride.requests")
                .tag("status", "rejected")
                .description("Ride requests refused (kill switch, outside service area)")
                .register(registry);

        this.broadcastCounter = Counter.builder("dispatch.broadcasts")
                .description("Broadcast rounds started")
                .register(registry);

        this.driversNotifiedCounter = Counter.builder("dispatch.drivers.notified")
                .description("Drivers notified across broadcasts and expansions")
                .register(registry);

        this.notificationDeliveredCounter = Counter.builder("dispatch.notifications")
                .tag("result", "delivered")
                .register(registry);

        this.notificationFailedCounter = Counter.builder("dispatch.notifications")
                .tag("result", "failed")
                .description("Pushes the sink did not confirm; never retried")
                .register(registry);

        this.lockContentionCounter = Counter.builder("dispatch.lock.contention")
                .description("Accept attempts that found the ride lock held")
                .register(registry);

        this.rejectionCounter = Counter.builder("dispatch.rejections")
                .register(registry);

        this.expansionCounter = Counter.builder("dispatch.radius.expansions")
                .register(registry);

        this.driverCancellationCounter = Counter.builder("dispatch.driver.cancellations")
                .register(registry);

        this.suspensionCounter = Counter.builder("dispatch.driver.suspensions")
                .tag("action", "suspended")
                .register(registry);

        this.suspensionReleasedCounter = Counter.builder("dispatch.driver.suspensions")
                .tag("action", "released")
                .register(registry);

        this.arbitrationTimer = Timer.builder("dispatch.arbitration")
                .description("Time spent inside the per-ride arbitration lock")
                .publishPercentiles(0.5, 0.95, 0.99)
                .minimumExpectedValue(Duration.ofMillis(1))
                .maximumExpectedValue(Duration.ofSeconds(10))
                .register(registry);
    }

    public void recordRideCreated()                 { rideCreatedCounter.increment(); }
    public void recordRideRejected()                { rideRejectedCounter.increment(); }
    public void recordNotificationDelivered()       { notificationDeliveredCounter.increment(); }
    public void recordNotificationFailed()          { notificationFailedCounter.increment(); }
    public void recordLockContention()              { lockContentionCounter.increment(); }
    public void recordRejection()                   { rejectionCounter.increment(); }
    public void recordSuspensionReleased()          { suspensionReleasedCounter.increment(); }
    public Timer getArbitrationTimer()              { return arbitrationTimer; }

    public void recordBroadcast(int driversNotified) {
        broadcastCounter.increment();
        driversNotifiedCounter.increment(driversNotified);
    }

    public void recordExpansion(int newlyNotified) {
        expansionCounter.increment();
        driversNotifiedCounter.increment(newlyNotified);
    }

    public void recordDriverCancellation(boolean suspended) {
        driverCancellationCounter.increment();
        if (suspended) {
            suspensionCounter.increment();
        }
    }

    public void recordAcceptOutcome(String outcome) {
        registry.counter("dispatch.accept.outcomes", "outcome", outcome).increment();
    }

    public void recordTransition(String status) {
        registry.counter("dispatch.ride.transitions", "status", status).increment();
    }
}
