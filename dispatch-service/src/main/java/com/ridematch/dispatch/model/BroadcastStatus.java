package com.ridematch.dispatch.model;

public enum BroadcastStatus {
    ACTIVE,
    CANCELLED
}
