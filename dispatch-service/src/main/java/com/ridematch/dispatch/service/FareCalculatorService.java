package com.ridematch.dispatch.service;

import com.ridematch.dispatch.model.FareQuote;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Tiered distance fare with surge and fare protection.
 *
 * Formula:
 *   d ≤ 25 km:  fare = (30 + d * 12) * surge
 *   d > 25 km:  fare = (30 + 25 * 12 + (d - 25) * 10) * surge
 *
 * Fare protection: when the fare for the distance actually driven differs from
 * the estimate by more than 20%, the rider pays the estimate.
 */
@Slf4j
@Service
public class FareCalculatorService {

    private static final BigDecimal BASE_FARE              = new BigDecimal("30.00");
    private static final BigDecimal PER_KM_RATE            = new BigDecimal("12.00");
    private static final BigDecimal LONG_DISTANCE_KM_RATE  = new BigDecimal("10.00");
    private static final BigDecimal TIER_THRESHOLD_KM      = new BigDecimal("25");
    private static final BigDecimal PROTECTION_TOLERANCE   = new BigDecimal("0.20");

    public FareQuote quote(double distanceKm, double surgeMultiplier) {
        if (distanceKm < 0) {
            throw new IllegalArgumentException("distance must not be negative: " + distanceKm);
        }
        BigDecimal distance = BigDecimal.valueOf(distanceKm);

        BigDecimal distanceCharge;
        if (distance.compareTo(TIER_THRESHOLD_KM) <= 0) {
            distanceCharge = distance.multiply(PER_KM_RATE);
        } else {
            distanceCharge = TIER_THRESHOLD_KM.multiply(PER_KM_RATE)
                    .add(distance.subtract(TIER_THRESHOLD_KM).multiply(LONG_DISTANCE_KM_RATE));
        }
        distanceCharge = distanceCharge.setScale(2, RoundingMode.HALF_UP);

        BigDecimal perKm = distanceKm > 0
                ? distanceCharge.divide(distance, 2, RoundingMode.HALF_UP)
                : PER_KM_RATE;

        BigDecimal total = BASE_FARE.add(distanceCharge)
                .multiply(BigDecimal.valueOf(surgeMultiplier))
                .setScale(2, RoundingMode.HALF_UP);

        log.debug("Fare quote: dist={}km surge={} -> {}", distanceKm, surgeMultiplier, total);
        return new FareQuote(BASE_FARE, distanceCharge, perKm, distanceKm, surgeMultiplier, total);
    }

    public BigDecimal calculate(double distanceKm, double surgeMultiplier) {
        return quote(distanceKm, surgeMultiplier).total();
    }

    /**
     * Amount actually charged at completion.
     */
    public BigDecimal finalFare(BigDecimal estimatedFare, BigDecimal actualFare) {
        if (estimatedFare == null || estimatedFare.signum() <= 0) {
            return actualFare;
        }
        BigDecimal deviation = actualFare.subtract(estimatedFare).abs()
                .divide(estimatedFare, 4, RoundingMode.HALF_UP);
        if (deviation.compareTo(PROTECTION_TOLERANCE) > 0) {
            log.info("Fare protection applied: actual={} estimate={} deviation={}", actualFare, estimatedFare, deviation);
            return estimatedFare;
        }
        return actualFare;
    }
}
