package com.gentoro.deepresearch.pipeline;

import java.util.List;

/** Output of the planning stage. */
public record SearchPlan(List<SearchItem> searches) {
  public SearchPlan {
    searches = searches == null ? List.of() : List.copyOf(searches);
  }
}
