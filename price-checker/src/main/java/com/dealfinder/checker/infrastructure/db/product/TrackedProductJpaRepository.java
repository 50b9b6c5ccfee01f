package com.dealfinder.checker.infrastructure.db.product;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public interface TrackedProductJpaRepository extends JpaRepository<TrackedProductEntity, String> {

    List<TrackedProductEntity> findAllByOrderByCreatedAtAsc();

    @Modifying
    @Query("UPDATE TrackedProductEntity p SET p.lastKnownPrice = :price, p.lastCheckedAt = :checkedAt"
            + " WHERE p.productId = :productId")
    int updatePrice(String productId, BigDecimal price, Instant checkedAt);

    @Modifying
    @Query("UPDATE TrackedProductEntity p SET p.lastCheckedAt = :checkedAt WHERE p.productId = :productId")
    int touchCheckedAt(String productId, Instant checkedAt);
}
