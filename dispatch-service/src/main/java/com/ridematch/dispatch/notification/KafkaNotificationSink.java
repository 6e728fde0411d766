package com.ridematch.dispatch.notification;

import com.ridematch.shared.util.KafkaTopics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Hands pushes to the push gateway through the driver.ride.offered topic.
 * Runs on the notification executor, so waiting for the broker ack is fine.
 */
@Slf4j
@Component
public class KafkaNotificationSink implements NotificationSink {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final long ackTimeoutMs;

    public KafkaNotificationSink(KafkaTemplate<String, Object> kafkaTemplate,
                                 @Value("${dispatch.notification.ack-timeout-ms:2000}") long ackTimeoutMs) {
        this.kafkaTemplate = kafkaTemplate;
        this.ackTimeoutMs = ackTimeoutMs;
    }

    @Override
    public boolean push(String userId, Object payload) {
        try {
            kafkaTemplate.send(KafkaTopics.DRIVER_RIDE_OFFERED, userId, payload)
                    .get(ackTimeoutMs, TimeUnit.MILLISECONDS);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while pushing to user {}", userId);
            return false;
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Push to user {} not confirmed: {}", userId, e.getMessage());
            return false;
        }
    }
}
