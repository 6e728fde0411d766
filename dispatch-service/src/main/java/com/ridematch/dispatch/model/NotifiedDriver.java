package com.ridematch.dispatch.model;

public record NotifiedDriver(String driverId, double distanceKm) {
}
