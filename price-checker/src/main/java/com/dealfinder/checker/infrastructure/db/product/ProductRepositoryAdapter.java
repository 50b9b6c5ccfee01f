package com.dealfinder.checker.infrastructure.db.product;

import com.dealfinder.checker.domain.product.ProductRepository;
import com.dealfinder.checker.domain.product.TrackedProduct;
import com.dealfinder.checker.infrastructure.db.product.mapper.TrackedProductEntityMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Slf4j
@Repository
@RequiredArgsConstructor
public class ProductRepositoryAdapter implements ProductRepository {

    private final TrackedProductJpaRepository jpaRepository;
    private final TrackedProductEntityMapper mapper;

    @Override
    @Transactional(readOnly = true, propagation = Propagation.REQUIRES_NEW)
    public List<TrackedProduct> listTrackedProducts() {
        return jpaRepository.findAllByOrderByCreatedAtAsc().stream()
                .map(mapper::toDomain)
                .toList();
    }

    @Override
    @Transactional
    public void updatePrice(String productId, BigDecimal price, Instant checkedAt) {
        if (jpaRepository.updatePrice(productId, price, checkedAt) == 0) {
            log.warn("Product {} vanished before its price could be updated", productId);
        }
    }

    @Override
    @Transactional
    public void markChecked(String productId, Instant checkedAt) {
        if (jpaRepository.touchCheckedAt(productId, checkedAt) == 0) {
            log.warn("Product {} vanished before it could be marked checked", productId);
        }
    }
}
