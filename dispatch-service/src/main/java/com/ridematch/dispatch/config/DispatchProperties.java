package com.ridematch.dispatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Tunables bound from the {@code dispatch.*} tree in application.yml.
 */
@Data
@ConfigurationProperties(prefix = "dispatch")
public class DispatchProperties {

    /** Lifetime of a broadcast record, its rejections and the per-driver notifications. */
    private Duration broadcastTtl = Duration.ofMinutes(10);

    /** Availability records expire when a driver stops refreshing them. */
    private Duration availabilityTtl = Duration.ofHours(24);

    /** Lease of the per-ride arbitration lock. */
    private Duration lockLease = Duration.ofSeconds(10);

    private double averageSpeedKmh = 30.0;

    /** Radius used when a driver cancellation re-opens a ride. */
    private double rebroadcastRadiusKm = 5.0;

    private Area area = new Area();
    private Cancellation cancellation = new Cancellation();
    private Expansion expansion = new Expansion();

    @Data
    public static class Area {
        private double centerLat = 22.7196;
        private double centerLng = 75.8577;
        private double serviceRadiusKm = 20.0;

        // city limits bounding box
        private double cityMinLat = 22.6;
        private double cityMaxLat = 22.8;
        private double cityMinLng = 75.7;
        private double cityMaxLng = 75.9;

        private double cityInitialRadiusKm = 5.0;
        private double extendedInitialRadiusKm = 8.0;
        private double cityRadiusIncrementKm = 2.0;
        private double extendedRadiusIncrementKm = 3.0;
        private Duration cityMatchingTimeout = Duration.ofSeconds(120);
        private Duration extendedMatchingTimeout = Duration.ofSeconds(180);
    }

    @Data
    public static class Cancellation {
        private int suspensionThreshold = 3;
        private Duration countingWindow = Duration.ofHours(24);
        private Duration suspensionDuration = Duration.ofHours(24);
        private BigDecimal riderFee = new BigDecimal("20.00");
        private String defaultDriverReason = "Driver cancelled";
    }

    @Data
    public static class Expansion {
        private boolean enabled = true;
        private double maxRadiusKm = 15.0;
    }
}
