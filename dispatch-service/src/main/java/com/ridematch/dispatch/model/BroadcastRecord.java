package com.ridematch.dispatch.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One ride's broadcast state. {@code notifiedDriverIds} only ever grows while
 * the record lives; storing a new record for the ride replaces it.
 * {@code excludedDriverIds} are drivers who cancelled the ride; they are never
 * offered it again and cannot accept it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BroadcastRecord {

    private UUID rideId;
    private double pickupLat;
    private double pickupLng;
    private double destinationLat;
    private double destinationLng;
    private BigDecimal estimatedFare;
    private double radiusKm;
    private boolean extendedArea;

    @Builder.Default
    private List<String> notifiedDriverIds = new ArrayList<>();

    @Builder.Default
    private List<String> excludedDriverIds = new ArrayList<>();

    private BroadcastStatus status;
    private int broadcastCount;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant createdAt;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant lastExpandedAt;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant cancelledAt;

    @JsonIgnore
    public boolean isActive() {
        return status == BroadcastStatus.ACTIVE;
    }

    public boolean excludes(String driverId) {
        return excludedDriverIds != null && excludedDriverIds.contains(driverId);
    }

    public GeoPoint pickupPoint() {
        return new GeoPoint(pickupLat, pickupLng);
    }
}
