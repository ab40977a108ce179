package com.snipebot.model;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * A user-defined sniper: filter plus cumulative budget.
 *
 * Blank keywords/condition and a null max price mean "no constraint". A budget limit of zero (or null)
 * means unlimited spend.
 */
public record AcquisitionRule(
    long id,
    String name,
    BigDecimal priceMax,
    String keywords,
    String condition,
    BigDecimal budgetLimit,
    boolean enabled
) {

  public AcquisitionRule {
    keywords = keywords == null || keywords.isBlank() ? null : keywords.trim();
    condition = condition == null || condition.isBlank() ? null : condition.trim();
    budgetLimit = budgetLimit == null ? BigDecimal.ZERO : budgetLimit;
  }

  public List<String> keywordList() {
    if (keywords == null) {
      return List.of();
    }
    return Arrays.stream(keywords.toLowerCase(Locale.ROOT).split("\\s+"))
        .filter(s -> !s.isEmpty())
        .toList();
  }

  public boolean hasBudgetLimit() {
    return budgetLimit.compareTo(BigDecimal.ZERO) > 0;
  }
}
