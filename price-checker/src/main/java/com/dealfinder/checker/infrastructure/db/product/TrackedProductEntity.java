package com.dealfinder.checker.infrastructure.db.product;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "tracked_products")
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TrackedProductEntity {

    @Id
    @Column(name = "product_id", length = 64)
    private String productId;

    @Column(nullable = false)
    private String name;

    @Column(name = "search_query", length = 500)
    private String searchQuery;

    @Column(length = 2048)
    private String url;

    @Column(name = "target_price", precision = 12, scale = 2)
    private BigDecimal targetPrice;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(name = "last_known_price", precision = 12, scale = 2)
    private BigDecimal lastKnownPrice;

    @Column(name = "last_checked_at")
    private Instant lastCheckedAt;

    @Column(name = "subscriber_email", length = 320)
    private String subscriberEmail;

    @Column(name = "subscriber_phone", length = 32)
    private String subscriberPhone;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
