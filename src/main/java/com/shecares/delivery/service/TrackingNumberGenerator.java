package com.shecares.delivery.service;

import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.ThreadLocalRandom;

/**
 * {@code DEL-YYYYMMDD-NNNN} 형식의 추적번호 후보 생성기.
 * 중복 여부는 호출자가 저장소에서 확인한다.
 */
@Component
public class TrackingNumberGenerator {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.BASIC_ISO_DATE;

    public String generate() {
        return generate(LocalDate.now());
    }

    String generate(LocalDate date) {
        int suffix = ThreadLocalRandom.current().nextInt(1000, 10000);
        return "DEL-" + date.format(DATE_FORMAT) + "-" + suffix;
    }
}
