package com.dealfinder.checker.infrastructure.db.product.mapper;

import com.dealfinder.checker.domain.product.TrackedProduct;
import com.dealfinder.checker.infrastructure.db.product.TrackedProductEntity;
import org.mapstruct.Mapper;

@Mapper(componentModel = "spring")
public interface TrackedProductEntityMapper {

    TrackedProduct toDomain(TrackedProductEntity entity);

    TrackedProductEntity toEntity(TrackedProduct product);
}
