package com.snipebot.sniper;

import com.snipebot.model.AcquisitionRule;
import com.snipebot.model.FeedItem;

import java.util.List;
import java.util.Locale;

/**
 * Rule filters, all of which must pass:
 * - price at or below the rule's max price
 * - every keyword appears in the title, case-insensitively
 * - the rule's condition appears in the item condition, case-insensitively; items with no condition pass
 */
public final class RuleMatcher {

    private RuleMatcher() {
    }

    public static boolean matches(FeedItem item, AcquisitionRule rule) {
        if (rule.priceMax() != null && item.priceValue().compareTo(rule.priceMax()) > 0) {
            return false;
        }

        List<String> keywords = rule.keywordList();
        if (!keywords.isEmpty()) {
            String title = item.title().toLowerCase(Locale.ROOT);
            for (String keyword : keywords) {
                if (!title.contains(keyword)) {
                    return false;
                }
            }
        }

        if (rule.condition() != null && item.condition() != null && !item.condition().isBlank()) {
            String wanted = rule.condition().toLowerCase(Locale.ROOT);
            return item.condition().toLowerCase(Locale.ROOT).contains(wanted);
        }
        return true;
    }
}
