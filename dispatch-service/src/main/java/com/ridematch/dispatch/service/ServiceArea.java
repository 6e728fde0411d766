package com.ridematch.dispatch.service;

import com.ridematch.dispatch.config.DispatchProperties;
import com.ridematch.dispatch.model.GeoPoint;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * City versus extended-area rules. The extended area is the ring inside the
 * service radius but outside the city limits box; rides there start with a
 * wider radius, expand faster and wait longer between expansions.
 */
@Component
public class ServiceArea {

    private final DispatchProperties.Area area;
    private final GeoPoint center;

    public ServiceArea(DispatchProperties properties) {
        this.area = properties.getArea();
        this.center = new GeoPoint(area.getCenterLat(), area.getCenterLng());
    }

    public boolean isWithinServiceArea(GeoPoint point) {
        return center.distanceKmTo(point) <= area.getServiceRadiusKm();
    }

    public boolean isWithinCityLimits(GeoPoint point) {
        return point.lat() >= area.getCityMinLat() && point.lat() <= area.getCityMaxLat()
                && point.lng() >= area.getCityMinLng() && point.lng() <= area.getCityMaxLng();
    }

    public boolean isExtendedArea(GeoPoint point) {
        return isWithinServiceArea(point) && !isWithinCityLimits(point);
    }

    public double initialRadiusKm(boolean extendedArea) {
        return extendedArea ? area.getExtendedInitialRadiusKm() : area.getCityInitialRadiusKm();
    }

    public double radiusIncrementKm(boolean extendedArea) {
        return extendedArea ? area.getExtendedRadiusIncrementKm() : area.getCityRadiusIncrementKm();
    }

    public Duration matchingTimeout(boolean extendedArea) {
        return extendedArea ? area.getExtendedMatchingTimeout() : area.getCityMatchingTimeout();
    }
}
