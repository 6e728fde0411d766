package com.ridematch.dispatch.service;

import com.ridematch.dispatch.config.DispatchProperties;
import com.ridematch.dispatch.entity.Ride;
import com.ridematch.dispatch.model.BroadcastRecord;
import com.ridematch.dispatch.result.ExpandOutcome;
import com.ridematch.dispatch.store.BroadcastStore;
import com.ridematch.dispatch.store.RideStore;
import com.ridematch.shared.enums.RideStatus;
import com.ridematch.shared.featureflag.FeatureFlagService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Periodically widens broadcasts nobody has accepted within the area's
 * matching timeout, one increment per pass, up to the configured maximum.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RadiusExpansionScheduler {

    private final RideStore rideStore;
    private final BroadcastStore broadcastStore;
    private final RadiusExpansionService expansionService;
    private final ServiceArea serviceArea;
    private final FeatureFlagService featureFlagService;
    private final DispatchProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${dispatch.expansion.interval-ms:120000}")
    public void expandStaleBroadcasts() {
        expandDue();
    }

    /**
     * @return number of rides whose radius was expanded in this pass
     */
    public int expandDue() {
        if (!properties.getExpansion().isEnabled()
                || !featureFlagService.isEnabled(FeatureFlagService.AUTO_RADIUS_EXPANSION, true)) {
            log.debug("Automatic radius expansion disabled");
            return 0;
        }

        int expanded = 0;
        for (Ride ride : rideStore.findByStatus(RideStatus.REQUESTED)) {
            try {
                if (expandIfDue(ride)) {
                    expanded++;
                }
            } catch (RuntimeException e) {
                log.error("Radius expansion failed for ride {}: {}", ride.getId(), e.getMessage(), e);
            }
        }
        if (expanded > 0) {
            log.info("Expanded {} stale broadcasts", expanded);
        }
        return expanded;
    }

    private boolean expandIfDue(Ride ride) {
        Optional<BroadcastRecord> active = broadcastStore.find(ride.getId()).filter(BroadcastRecord::isActive);
        if (active.isEmpty()) {
            return false;
        }
        BroadcastRecord record = active.get();

        Instant since = record.getLastExpandedAt() != null ? record.getLastExpandedAt() : record.getCreatedAt();
        Duration timeout = serviceArea.matchingTimeout(record.isExtendedArea());
        if (since != null && Duration.between(since, clock.instant()).compareTo(timeout) < 0) {
            return false;
        }

        double maxRadiusKm = properties.getExpansion().getMaxRadiusKm();
        if (record.getRadiusKm() >= maxRadiusKm) {
            log.info("Ride {} still unmatched at maximum radius {}km", ride.getId(), maxRadiusKm);
            return false;
        }

        double increment = Math.min(serviceArea.radiusIncrementKm(record.isExtendedArea()),
                maxRadiusKm - record.getRadiusKm());
        ExpandOutcome outcome = expansionService.expand(ride.getId(), record.getRadiusKm(), increment);
        return outcome.succeeded();
    }
}
