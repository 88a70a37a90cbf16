package com.shecares.delivery.service;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * 배송비 계산 (나이라 단위).
 *
 * <p>기본요금 + 거리(km당) + 무게(kg당) + 원거리 할증. 최소 요금 아래로는 내려가지 않는다.</p>
 */
@Component
public class DeliveryFeeCalculator {

    static final BigDecimal BASE_FEE = BigDecimal.valueOf(500);
    static final BigDecimal PER_KM = BigDecimal.valueOf(100);
    static final BigDecimal PER_KG = BigDecimal.valueOf(50);
    static final BigDecimal REMOTE_SURCHARGE = BigDecimal.valueOf(1000);
    static final BigDecimal MINIMUM_FEE = BigDecimal.valueOf(800);

    public BigDecimal calculate(FeeQuote quote) {
        BigDecimal total = BASE_FEE;
        if (quote.distanceKm() != null) {
            total = total.add(quote.distanceKm().multiply(PER_KM));
        }
        if (quote.weightKg() != null) {
            total = total.add(quote.weightKg().multiply(PER_KG));
        }
        if (quote.remote()) {
            total = total.add(REMOTE_SURCHARGE);
        }
        return total.max(MINIMUM_FEE);
    }
}
