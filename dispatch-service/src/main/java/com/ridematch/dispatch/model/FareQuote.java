package com.ridematch.dispatch.model;

import java.math.BigDecimal;

public record FareQuote(BigDecimal baseFare,
                        BigDecimal distanceCharge,
                        BigDecimal perKmRate,
                        double distanceKm,
                        double surgeMultiplier,
                        BigDecimal total) {
}
