package com.snipebot.feed;

import com.snipebot.model.FeedItem;

import java.util.List;

/**
 * Outcome of one sweep over the enabled search endpoints.
 *
 * @param aborted true when the bridge was unreachable; nothing was published and the cycle counter did not move
 */
public record PollCycleReport(long cycle, int endpointCount, List<FeedItem> items, int newItemCount, boolean aborted) {

    static PollCycleReport aborted(long cycle, int endpointCount) {
        return new PollCycleReport(cycle, endpointCount, List.of(), 0, true);
    }
}
