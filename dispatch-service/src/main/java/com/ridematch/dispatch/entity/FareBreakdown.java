package com.ridematch.dispatch.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FareBreakdown {

    @Column(name = "base_fare", precision = 10, scale = 2)
    private BigDecimal baseFare;

    @Column(name = "distance_charge", precision = 10, scale = 2)
    private BigDecimal distanceCharge;

    /** Effective per-km rate across both distance tiers. */
    @Column(name = "per_km_rate", precision = 10, scale = 2)
    private BigDecimal perKmRate;

    @Column(name = "estimated_distance_km")
    private Double estimatedDistanceKm;

    @Column(name = "surge_multiplier")
    private Double surgeMultiplier;

    @Column(name = "actual_distance_km")
    private Double actualDistanceKm;

    @Column(name = "actual_fare", precision = 10, scale = 2)
    private BigDecimal actualFare;
}
