package com.snipebot.ledger;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local ledger. Budgets reset on restart.
 */
@Slf4j
public class InMemoryPurchaseLedger implements PurchaseLedger {

    private final Clock clock;
    private final AtomicLong ids = new AtomicLong();
    private final List<PurchaseRecord> records = new CopyOnWriteArrayList<>();

    public InMemoryPurchaseLedger(Clock clock) {
        this.clock = clock;
    }

    @Override
    public PurchaseRecord recordCompleted(long itemId, long orderId, BigDecimal amount, Long ruleId) {
        PurchaseRecord record = new PurchaseRecord(
                ids.incrementAndGet(),
                itemId,
                orderId,
                amount == null ? BigDecimal.ZERO : amount,
                PurchaseRecord.STATUS_COMPLETED,
                ruleId,
                clock.instant());
        records.add(record);
        log.info("purchase recorded id={} itemId={} orderId={} amount={} ruleId={}",
                record.id(), itemId, orderId, record.amount(), ruleId);
        return record;
    }

    @Override
    public BigDecimal spentForRule(long ruleId) {
        return records.stream()
                .filter(r -> PurchaseRecord.STATUS_COMPLETED.equals(r.status()))
                .filter(r -> Objects.equals(r.ruleId(), ruleId))
                .map(PurchaseRecord::amount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    @Override
    public List<PurchaseRecord> recent(int limit) {
        List<PurchaseRecord> copy = new ArrayList<>(records);
        copy.sort(Comparator.comparing(PurchaseRecord::createdAt).thenComparing(PurchaseRecord::id).reversed());
        return copy.size() <= limit ? copy : List.copyOf(copy.subList(0, Math.max(0, limit)));
    }
}
