package com.snipebot.ledger;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A completed (or otherwise recorded) purchase. {@code ruleId} is null for purchases made outside a sniper.
 */
public record PurchaseRecord(
        long id,
        long itemId,
        long orderId,
        BigDecimal amount,
        String status,
        Long ruleId,
        Instant createdAt
) {
    public static final String STATUS_COMPLETED = "completed";
}
