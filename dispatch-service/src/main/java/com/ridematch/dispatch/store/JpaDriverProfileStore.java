package com.ridematch.dispatch.store;

import com.ridematch.dispatch.entity.DriverProfile;
import com.ridematch.dispatch.repository.DriverProfileRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
@RequiredArgsConstructor
public class JpaDriverProfileStore implements DriverProfileStore {

    private final DriverProfileRepository repository;

    @Override
    @Transactional(readOnly = true)
    public Optional<DriverProfile> findById(String driverId) {
        return repository.findById(driverId);
    }

    @Override
    @Transactional(readOnly = true)
    public Map<String, DriverProfile> findAllById(Collection<String> driverIds) {
        if (driverIds.isEmpty()) {
            return Map.of();
        }
        return repository.findAllById(driverIds).stream()
                .collect(Collectors.toMap(DriverProfile::getDriverId, Function.identity()));
    }

    @Override
    @Transactional
    public DriverProfile save(DriverProfile profile) {
        return repository.saveAndFlush(profile);
    }

    @Override
    @Transactional(readOnly = true)
    public List<DriverProfile> findSuspendedAtOrBefore(Instant cutoff) {
        return repository.findSuspendedAtOrBefore(cutoff);
    }
}
