package com.ridematch.dispatch.entity;

import com.ridematch.shared.enums.DriverStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

/**
 * Durable driver data the dispatch engine reads for eligibility and match
 * enrichment, plus the cancellation counter it owns.
 */
@Entity
@Table(name = "driver_profiles",
        indexes = @Index(name = "idx_driver_suspended", columnList = "suspended"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "driverId")
public class DriverProfile {

    @Id
    @Column(name = "driver_id", length = 64)
    private String driverId;

    @Version
    private Long version;

    @Column(name = "full_name")
    private String fullName;

    private String phone;

    @Column(name = "vehicle_registration")
    private String vehicleRegistration;

    @Column(name = "vehicle_make")
    private String vehicleMake;

    @Column(name = "vehicle_model")
    private String vehicleModel;

    @Column(name = "vehicle_color")
    private String vehicleColor;

    @Builder.Default
    private double rating = 5.0;

    @Column(name = "total_rides")
    private int totalRides;

    @Column(name = "accept_extended_area", nullable = false)
    @Builder.Default
    private boolean acceptExtendedArea = true;

    @Column(name = "accept_parcel_delivery", nullable = false)
    @Builder.Default
    private boolean acceptParcelDelivery = true;

    /** Reporting copy of the registry status; matching never reads it. */
    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private DriverStatus status;

    @Column(name = "cancellation_count", nullable = false)
    private int cancellationCount;

    @Column(name = "last_cancellation_reset_at")
    private Instant lastCancellationResetAt;

    @Column(nullable = false)
    private boolean suspended;

    @Column(name = "suspended_at")
    private Instant suspendedAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;
}
