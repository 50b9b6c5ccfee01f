package com.dealfinder.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import lombok.Builder;

@Builder(toBuilder = true)
public record ProductOutcomeEvent(
        @JsonProperty("product_id") String productId,
        OutcomeKind outcome,
        @JsonProperty("error_kind") ErrorKind errorKind,
        @JsonProperty("old_price") BigDecimal oldPrice,
        @JsonProperty("new_price") BigDecimal newPrice,
        @JsonProperty("notification_id") String notificationId,
        String detail) {}
