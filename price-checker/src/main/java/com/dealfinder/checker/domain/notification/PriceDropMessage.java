package com.dealfinder.checker.domain.notification;

import com.dealfinder.checker.domain.product.TrackedProduct;

import java.math.BigDecimal;
import java.math.RoundingMode;

public record PriceDropMessage(String subject, String body) {

    public static PriceDropMessage of(TrackedProduct product, BigDecimal oldPrice, BigDecimal newPrice) {
        var currency = product.currency() != null ? product.currency() : "USD";
        var subject = "Price Drop: " + product.name();

        var body = new StringBuilder("Price Drop Alert!\n\n")
                .append(product.name()).append("\n\n");
        if (oldPrice != null && oldPrice.signum() > 0) {
            var saving = oldPrice.subtract(newPrice);
            var percent = saving.multiply(BigDecimal.valueOf(100)).divide(oldPrice, 1, RoundingMode.HALF_UP);
            body.append("Price dropped from ").append(money(oldPrice, currency))
                    .append(" to ").append(money(newPrice, currency)).append('\n')
                    .append("You save ").append(money(saving, currency))
                    .append(" (").append(percent.toPlainString()).append("% off!)\n");
        } else {
            body.append("Price is now ").append(money(newPrice, currency));
            if (product.targetPrice() != null) {
                body.append(", at or below your target of ").append(money(product.targetPrice(), currency));
            }
            body.append('\n');
        }
        if (product.url() != null && !product.url().isBlank()) {
            body.append("\nView deal: ").append(product.url());
        }
        return new PriceDropMessage(subject, body.toString());
    }

    static String money(BigDecimal amount, String currency) {
        var scaled = amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
        return "USD".equalsIgnoreCase(currency) ? "$" + scaled : scaled + " " + currency;
    }
}
