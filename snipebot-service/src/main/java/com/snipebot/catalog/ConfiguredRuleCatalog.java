package com.snipebot.catalog;

import com.snipebot.config.SnipebotProperties;
import com.snipebot.model.AcquisitionRule;

import java.util.List;

public class ConfiguredRuleCatalog implements RuleCatalog {

    private final List<AcquisitionRule> rules;

    public ConfiguredRuleCatalog(List<SnipebotProperties.Rule> configured) {
        this.rules = configured.stream()
                .map(r -> new AcquisitionRule(r.id(), r.name(), r.priceMax(), r.keywords(), r.condition(),
                        r.budgetLimit(), r.enabled()))
                .toList();
    }

    @Override
    public List<AcquisitionRule> all() {
        return rules;
    }
}
