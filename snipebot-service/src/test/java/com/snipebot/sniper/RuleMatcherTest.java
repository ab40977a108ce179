package com.snipebot.sniper;

import com.snipebot.model.AcquisitionRule;
import com.snipebot.model.FeedItem;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RuleMatcherTest {

    @Test
    void keywordsMustAllAppearInTitle() {
        AcquisitionRule rule = rule("20", "wool jumper", null);

        assertThat(RuleMatcher.matches(item("Cotton T-Shirt", "15", null), rule)).isFalse();
        assertThat(RuleMatcher.matches(item("Wool Jumper XL", "19.99", null), rule)).isTrue();
        assertThat(RuleMatcher.matches(item("Jumper, merino wool", "10", null), rule)).isTrue();
        assertThat(RuleMatcher.matches(item("Wool scarf", "10", null), rule)).isFalse();
    }

    @Test
    void priceAtMaxMatchesAndAboveDoesNot() {
        AcquisitionRule rule = rule("20", null, null);

        assertThat(RuleMatcher.matches(item("Anything", "20.00", null), rule)).isTrue();
        assertThat(RuleMatcher.matches(item("Anything", "20.01", null), rule)).isFalse();
    }

    @Test
    void blankFiltersMatchEverything() {
        AcquisitionRule rule = rule(null, "  ", "");

        assertThat(RuleMatcher.matches(item("Anything", "9999", "Very good"), rule)).isTrue();
    }

    @Test
    void conditionIsCaseInsensitiveSubstring() {
        AcquisitionRule rule = rule(null, null, "new");

        assertThat(RuleMatcher.matches(item("Boots", "10", "New with tags"), rule)).isTrue();
        assertThat(RuleMatcher.matches(item("Boots", "10", "Good"), rule)).isFalse();
    }

    @Test
    void itemWithoutConditionPassesConditionFilter() {
        AcquisitionRule rule = rule(null, null, "new");

        assertThat(RuleMatcher.matches(item("Boots", "10", null), rule)).isTrue();
        assertThat(RuleMatcher.matches(item("Boots", "10", " "), rule)).isTrue();
    }

    @Test
    void unparseablePriceCountsAsZero() {
        AcquisitionRule rule = rule("5", null, null);

        assertThat(RuleMatcher.matches(item("Boots", "n/a", null), rule)).isTrue();
    }

    private static AcquisitionRule rule(String priceMax, String keywords, String condition) {
        return new AcquisitionRule(1L, "rule", priceMax == null ? null : new BigDecimal(priceMax), keywords,
                condition, BigDecimal.ZERO, true);
    }

    private static FeedItem item(String title, String price, String condition) {
        return new FeedItem(1L, title, price, "GBP", "", "", condition, null, null, null, null, null,
                List.of("https://www.vinted.co.uk/catalog"), Instant.EPOCH);
    }
}
