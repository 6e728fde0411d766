package com.ridematch.dispatch.repository;

import com.ridematch.dispatch.entity.DriverProfile;
import com.ridematch.dispatch.entity.Ride;
import com.ridematch.shared.enums.RideStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class RideRepositoryTest {

    @Autowired
    private RideRepository rideRepository;

    @Autowired
    private DriverProfileRepository profileRepository;

    private Ride requested() {
        return rideRepository.saveAndFlush(Ride.builder()
                .riderId("rider-1")
                .status(RideStatus.REQUESTED)
                .pickupLat(22.7196)
                .pickupLng(75.8577)
                .destinationLat(22.7646)
                .destinationLng(75.8577)
                .estimatedFare(new BigDecimal("90.00"))
                .requestedAt(Instant.parse("2024-03-01T08:00:00Z"))
                .build());
    }

    @Test
    @DisplayName("Only the first compare-and-set from REQUESTED commits a match")
    void compareAndSetMatched_firstWins() {
        Ride ride = requested();
        Instant matchedAt = Instant.parse("2024-03-01T08:00:05Z");

        int first = rideRepository.compareAndSetMatched(ride.getId(), RideStatus.REQUESTED, RideStatus.MATCHED,
                "d1", matchedAt);
        int second = rideRepository.compareAndSetMatched(ride.getId(), RideStatus.REQUESTED, RideStatus.MATCHED,
                "d2", matchedAt);

        assertThat(first).isEqualTo(1);
        assertThat(second).isZero();
        Ride reloaded = rideRepository.findById(ride.getId()).orElseThrow();
        assertThat(reloaded.getStatus()).isEqualTo(RideStatus.MATCHED);
        assertThat(reloaded.getDriverId()).isEqualTo("d1");
        assertThat(reloaded.getMatchedAt()).isEqualTo(matchedAt);
        assertThat(reloaded.getVersion()).isEqualTo(ride.getVersion() + 1);
    }

    @Test
    @DisplayName("findByStatus lists only open rides")
    void findByStatus() {
        Ride open = requested();
        Ride other = requested();
        rideRepository.compareAndSetMatched(other.getId(), RideStatus.REQUESTED, RideStatus.MATCHED, "d1",
                Instant.parse("2024-03-01T08:00:05Z"));

        assertThat(rideRepository.findByStatus(RideStatus.REQUESTED))
                .extracting(Ride::getId)
                .containsExactly(open.getId());
    }

    @Test
    @DisplayName("Suspensions at or before the cutoff are due for release")
    void findSuspendedAtOrBefore() {
        Instant now = Instant.parse("2024-03-02T08:00:00Z");
        profileRepository.save(DriverProfile.builder().driverId("old").suspended(true)
                .suspendedAt(now.minus(25, ChronoUnit.HOURS)).build());
        profileRepository.save(DriverProfile.builder().driverId("fresh").suspended(true)
                .suspendedAt(now.minus(2, ChronoUnit.HOURS)).build());
        profileRepository.save(DriverProfile.builder().driverId("active").build());
        profileRepository.flush();

        assertThat(profileRepository.findSuspendedAtOrBefore(now.minus(24, ChronoUnit.HOURS)))
                .extracting(DriverProfile::getDriverId)
                .containsExactly("old");
    }
}
