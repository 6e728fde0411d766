package com.ridematch.dispatch.repository;

import com.ridematch.dispatch.entity.Ride;
import com.ridematch.shared.enums.RideStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface RideRepository extends JpaRepository<Ride, UUID> {

    List<Ride> findByStatus(RideStatus status);

    /**
     * Conditional commit of a match. Returns 0 when the ride has left
     * {@code expected} in the meantime.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Ride r SET r.status = :target, r.driverId = :driverId, r.matchedAt = :matchedAt, "
            + "r.version = r.version + 1 "
            + "WHERE r.id = :id AND r.status = :expected")
    int compareAndSetMatched(@Param("id") UUID id,
                             @Param("expected") RideStatus expected,
                             @Param("target") RideStatus target,
                             @Param("driverId") String driverId,
                             @Param("matchedAt") Instant matchedAt);
}
