package com.ridematch.dispatch.service;

import com.ridematch.dispatch.config.DispatchProperties;
import com.ridematch.dispatch.entity.DriverProfile;
import com.ridematch.dispatch.metrics.DispatchMetrics;
import com.ridematch.dispatch.store.DriverProfileStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Lifts suspensions that have run their full duration. Released drivers start
 * with a clean cancellation count but must go online again themselves.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SuspensionReleaseJob {

    private final DriverProfileStore profileStore;
    private final DispatchProperties properties;
    private final DispatchMetrics metrics;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${dispatch.suspension.release-check-ms:3600000}")
    public void releaseSuspensions() {
        int released = releaseExpiredSuspensions();
        if (released > 0) {
            log.info("Released {} driver suspensions", released);
        }
    }

    public int releaseExpiredSuspensions() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(properties.getCancellation().getSuspensionDuration());
        List<DriverProfile> expired = profileStore.findSuspendedAtOrBefore(cutoff);

        for (DriverProfile profile : expired) {
            profile.setSuspended(false);
            profile.setSuspendedAt(null);
            profile.setCancellationCount(0);
            profile.setLastCancellationResetAt(now);
            profileStore.save(profile);
            metrics.recordSuspensionReleased();
            log.info("Suspension of driver {} lifted", profile.getDriverId());
        }
        return expired.size();
    }
}
