package com.ridematch.dispatch.store;

import com.ridematch.dispatch.entity.Ride;
import com.ridematch.dispatch.repository.RideRepository;
import com.ridematch.shared.enums.RideStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Component
@RequiredArgsConstructor
public class JpaRideStore implements RideStore {

    private final RideRepository rideRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<Ride> findById(UUID rideId) {
        return rideRepository.findById(rideId);
    }

    @Override
    @Transactional
    public Ride save(Ride ride) {
        return rideRepository.saveAndFlush(ride);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Ride> findByStatus(RideStatus status) {
        return rideRepository.findByStatus(status);
    }

    @Override
    @Transactional
    public boolean assignDriver(UUID rideId, String driverId, Instant matchedAt) {
        return rideRepository.compareAndSetMatched(
                rideId, RideStatus.REQUESTED, RideStatus.MATCHED, driverId, matchedAt) == 1;
    }
}
