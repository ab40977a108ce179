package com.snipebot.sniper;

import com.snipebot.model.FeedItem;

import java.time.Instant;

/**
 * A pending purchase decision. The id has the form {@code sniper-{ruleId}-{itemId}-{epochMillis}}.
 */
public record Countdown(
        String id,
        FeedItem item,
        long ruleId,
        String ruleName,
        Instant startedAt,
        Instant expiresAt
) {
    static String idFor(long ruleId, long itemId, Instant startedAt) {
        return "sniper-" + ruleId + "-" + itemId + "-" + startedAt.toEpochMilli();
    }
}
