package com.shecares.delivery.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class DeliveryFeeCalculatorTest {

    private final DeliveryFeeCalculator calculator = new DeliveryFeeCalculator();

    @Test
    @DisplayName("거리와 무게 할증을 기본요금에 더함")
    void calculate_DistanceAndWeight() {
        BigDecimal fee = calculator.calculate(
                new FeeQuote(BigDecimal.valueOf(10), BigDecimal.valueOf(4), false));

        // 500 + 10 * 100 + 4 * 50
        assertThat(fee).isEqualByComparingTo("1700");
    }

    @Test
    @DisplayName("원거리 지역은 1000 추가")
    void calculate_RemoteSurcharge() {
        BigDecimal fee = calculator.calculate(
                new FeeQuote(BigDecimal.valueOf(5), BigDecimal.ZERO, true));

        assertThat(fee).isEqualByComparingTo("2000");
    }

    @Test
    @DisplayName("최소 요금 800 미만으로 내려가지 않음")
    void calculate_MinimumFee() {
        assertThat(calculator.calculate(new FeeQuote(null, null, false)))
                .isEqualByComparingTo(DeliveryFeeCalculator.MINIMUM_FEE);
        assertThat(calculator.calculate(new FeeQuote(BigDecimal.ONE, BigDecimal.ONE, false)))
                .isEqualByComparingTo("800");
    }
}
