package com.snipebot.catalog;

import com.snipebot.model.AcquisitionRule;

import java.util.List;

public interface RuleCatalog {

  List<AcquisitionRule> all();

  default List<AcquisitionRule> enabled() {
    return all().stream().filter(AcquisitionRule::enabled).toList();
  }
}
