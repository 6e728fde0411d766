package com.ridematch.dispatch.entity;

import com.ridematch.dispatch.model.GeoPoint;
import com.ridematch.shared.enums.RideStatus;
import com.ridematch.shared.enums.RideType;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Historical ride record. Never deleted.
 *
 * {@code driverId} is set exactly while the ride is MATCHED, DRIVER_ARRIVING,
 * IN_PROGRESS or COMPLETED, and kept on a ride cancelled after matching.
 */
@Entity
@Table(name = "rides",
        indexes = {
                @Index(name = "idx_ride_rider", columnList = "rider_id"),
                @Index(name = "idx_ride_driver", columnList = "driver_id"),
                @Index(name = "idx_ride_status", columnList = "status")
        })
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class Ride {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    /**
     * Optimistic lock version. Lifecycle writes go through save() and fail on a
     * stale copy; the matching commit bumps it from its conditional UPDATE.
     */
    @Version
    @Column(nullable = false)
    private Long version;

    @Column(name = "rider_id", nullable = false)
    private String riderId;

    @Column(name = "driver_id")
    private String driverId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RideStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "ride_type", nullable = false, length = 10)
    @Builder.Default
    private RideType rideType = RideType.RIDE;

    @Column(name = "pickup_lat", nullable = false)
    private double pickupLat;

    @Column(name = "pickup_lng", nullable = false)
    private double pickupLng;

    @Column(name = "destination_lat", nullable = false)
    private double destinationLat;

    @Column(name = "destination_lng", nullable = false)
    private double destinationLng;

    @Column(name = "extended_area", nullable = false)
    private boolean extendedArea;

    @Column(name = "estimated_fare", nullable = false, precision = 10, scale = 2)
    private BigDecimal estimatedFare;

    @Column(name = "final_fare", precision = 10, scale = 2)
    private BigDecimal finalFare;

    @Embedded
    private FareBreakdown fareBreakdown;

    @Column(name = "requested_at", nullable = false)
    private Instant requestedAt;

    @Column(name = "matched_at")
    private Instant matchedAt;

    @Column(name = "pickup_time")
    private Instant pickupTime;

    @Column(name = "start_time")
    private Instant startTime;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "cancellation_timestamp")
    private Instant cancellationTimestamp;

    @Enumerated(EnumType.STRING)
    @Column(name = "cancelled_by", length = 10)
    private CancellationParty cancelledBy;

    @Column(name = "cancellation_reason")
    private String cancellationReason;

    @Column(name = "cancellation_fee", precision = 10, scale = 2)
    private BigDecimal cancellationFee;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    public GeoPoint pickupPoint() {
        return new GeoPoint(pickupLat, pickupLng);
    }

    public GeoPoint destinationPoint() {
        return new GeoPoint(destinationLat, destinationLng);
    }

    public double surgeMultiplier() {
        if (fareBreakdown == null || fareBreakdown.getSurgeMultiplier() == null) {
            return 1.0;
        }
        return fareBreakdown.getSurgeMultiplier();
    }
}
