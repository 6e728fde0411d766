package com.ridematch.dispatch.notification;

/**
 * Best-effort real-time channel to a user's device. No ordering guarantee.
 */
public interface NotificationSink {

    /**
     * @return true if the channel confirmed the hand-off
     */
    boolean push(String userId, Object payload);
}
