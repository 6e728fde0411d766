package com.ridematch.shared.enums;

public enum RideType {
    RIDE,
    PARCEL
}
