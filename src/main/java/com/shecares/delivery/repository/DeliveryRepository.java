package com.shecares.delivery.repository;

import com.shecares.delivery.entity.Delivery;
import com.shecares.delivery.entity.DeliveryStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface DeliveryRepository extends JpaRepository<Delivery, Long> {

    /** One order has at most one delivery (unique constraint on order_id). */
    Optional<Delivery> findByOrderId(Long orderId);

    boolean existsByOrderId(Long orderId);

    Optional<Delivery> findByTrackingNumber(String trackingNumber);

    boolean existsByTrackingNumber(String trackingNumber);

    Page<Delivery> findByClientId(Long clientId, Pageable pageable);

    Page<Delivery> findByStatus(DeliveryStatus status, Pageable pageable);

    List<Delivery> findByScheduledDateBetweenOrderByScheduledDateAsc(LocalDateTime from, LocalDateTime to);

    @Query("SELECT d.status AS status, COUNT(d) AS total FROM Delivery d GROUP BY d.status")
    List<StatusCount> countGroupedByStatus();

    @Query("SELECT d.status AS status, COUNT(d) AS total FROM Delivery d " +
            "WHERE d.createdAt >= :from AND d.createdAt <= :to GROUP BY d.status")
    List<StatusCount> countGroupedByStatusCreatedBetween(@Param("from") LocalDateTime from,
                                                         @Param("to") LocalDateTime to);

    interface StatusCount {
        DeliveryStatus getStatus();

        long getTotal();
    }
}
