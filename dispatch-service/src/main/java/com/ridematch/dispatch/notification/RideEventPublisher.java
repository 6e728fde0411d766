package com.ridematch.dispatch.notification;

import com.ridematch.dispatch.entity.DriverProfile;
import com.ridematch.dispatch.entity.Ride;
import com.ridematch.shared.enums.RideStatus;
import com.ridematch.shared.events.DriverSuspendedEvent;
import com.ridematch.shared.events.RideRequestedEvent;
import com.ridematch.shared.events.RideStatusChangedEvent;
import com.ridematch.shared.util.KafkaTopics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Publishes ride lifecycle events for downstream consumers (rider app
 * gateway, billing, analytics). Sends are asynchronous; a failed send is
 * logged and does not undo the state change that produced it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RideEventPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final Clock clock;

    public void publishRideRequested(Ride ride) {
        RideRequestedEvent event = RideRequestedEvent.builder()
                .rideId(ride.getId().toString())
                .riderId(ride.getRiderId())
                .rideType(ride.getRideType())
                .pickupLat(ride.getPickupLat())
                .pickupLng(ride.getPickupLng())
                .destinationLat(ride.getDestinationLat())
                .destinationLng(ride.getDestinationLng())
                .estimatedFare(ride.getEstimatedFare())
                .extendedArea(ride.isExtendedArea())
                .requestedAt(ride.getRequestedAt())
                .build();
        send(KafkaTopics.RIDE_REQUESTED, ride.getId().toString(), event);
    }

    public void publishStatusChange(Ride ride, RideStatus previous, String reason, String topic) {
        RideStatusChangedEvent event = RideStatusChangedEvent.builder()
                .rideId(ride.getId().toString())
                .riderId(ride.getRiderId())
                .driverId(ride.getDriverId())
                .previousStatus(previous)
                .status(ride.getStatus())
                .reason(reason)
                .fare(ride.getFinalFare() != null ? ride.getFinalFare() : ride.getCancellationFee())
                .changedAt(Instant.now(clock))
                .build();
        send(topic, ride.getId().toString(), event);
    }

    public void publishDriverSuspended(DriverProfile profile, Instant expiresAt, String reason) {
        DriverSuspendedEvent event = DriverSuspendedEvent.builder()
                .driverId(profile.getDriverId())
                .cancellationCount(profile.getCancellationCount())
                .reason(reason)
                .suspendedAt(profile.getSuspendedAt())
                .expiresAt(expiresAt)
                .build();
        send(KafkaTopics.DRIVER_SUSPENDED, profile.getDriverId(), event);
    }

    private void send(String topic, String key, Object event) {
        try {
            kafkaTemplate.send(topic, key, event).whenComplete((result, ex) -> {
                if (ex != null) {
                    log.error("Failed to publish {} for key {}", topic, key, ex);
                }
            });
        } catch (KafkaException e) {
            log.error("Kafka unavailable, {} for key {} not published", topic, key, e);
        }
    }
}
