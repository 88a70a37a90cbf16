package com.shecares.delivery.service;

import java.math.BigDecimal;

/** Inputs for a delivery fee estimate. Distance and weight are optional. */
public record FeeQuote(BigDecimal distanceKm, BigDecimal weightKg, boolean remote) {}
