package com.ridematch.shared.enums;

public enum DriverStatus {
    AVAILABLE,
    BUSY,
    UNAVAILABLE
}
