package com.shecares.delivery.service;

import com.shecares.delivery.entity.DeliveryStatus;
import com.shecares.delivery.repository.DeliveryRepository.StatusCount;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public record DeliveryStats(
        long totalDeliveries,
        long completedDeliveries,
        long pendingDeliveries,
        long inTransitDeliveries,
        long failedDeliveries
) {

    static DeliveryStats from(List<StatusCount> counts) {
        Map<DeliveryStatus, Long> byStatus = new EnumMap<>(DeliveryStatus.class);
        long total = 0;
        for (StatusCount count : counts) {
            byStatus.put(count.getStatus(), count.getTotal());
            total += count.getTotal();
        }
        return new DeliveryStats(
                total,
                byStatus.getOrDefault(DeliveryStatus.DELIVERED, 0L),
                byStatus.getOrDefault(DeliveryStatus.PENDING, 0L),
                byStatus.getOrDefault(DeliveryStatus.IN_TRANSIT, 0L),
                byStatus.getOrDefault(DeliveryStatus.FAILED, 0L));
    }
}
