package com.ridematch.shared.util;

/**
 * Central registry of all Kafka topic names.
 */
public final class KafkaTopics {

    private KafkaTopics() {}

    public static final String RIDE_REQUESTED         = "ride.requested";
    public static final String RIDE_MATCHED           = "ride.matched";
    public static final String RIDE_DRIVER_ARRIVING   = "ride.driver_arriving";
    public static final String RIDE_IN_PROGRESS       = "ride.in_progress";
    public static final String RIDE_COMPLETED         = "ride.completed";
    public static final String RIDE_CANCELLED         = "ride.cancelled";
    public static final String RIDE_DRIVER_CANCELLED  = "ride.driver_cancelled";
    public static final String DRIVER_RIDE_OFFERED    = "driver.ride.offered";
    public static final String DRIVER_SUSPENDED       = "driver.suspended";
}
