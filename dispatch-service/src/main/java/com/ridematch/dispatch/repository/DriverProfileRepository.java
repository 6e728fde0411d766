package com.ridematch.dispatch.repository;

import com.ridematch.dispatch.entity.DriverProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface DriverProfileRepository extends JpaRepository<DriverProfile, String> {

    @Query("SELECT p FROM DriverProfile p WHERE p.suspended = true AND p.suspendedAt <= :cutoff")
    List<DriverProfile> findSuspendedAtOrBefore(@Param("cutoff") Instant cutoff);
}
