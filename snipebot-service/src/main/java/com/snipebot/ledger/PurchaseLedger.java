package com.snipebot.ledger;

import java.math.BigDecimal;
import java.util.List;

public interface PurchaseLedger {

    PurchaseRecord recordCompleted(long itemId, long orderId, BigDecimal amount, Long ruleId);

    /**
     * Sum of completed purchase amounts attributed to the rule.
     */
    BigDecimal spentForRule(long ruleId);

    /**
     * Newest first.
     */
    List<PurchaseRecord> recent(int limit);
}
