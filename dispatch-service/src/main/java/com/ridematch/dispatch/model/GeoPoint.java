package com.ridematch.dispatch.model;

import com.ridematch.shared.util.GeoUtil;

public record GeoPoint(double lat, double lng) {

    public double distanceKmTo(GeoPoint other) {
        return GeoUtil.distanceKm(lat, lng, other.lat, other.lng);
    }

    public boolean isValid() {
        return GeoUtil.isValidCoordinate(lat, lng);
    }
}
