package com.gentoro.deepresearch.pipeline;

import java.util.List;

/**
 * SPI implemented by the agent layer. Each method is one upstream call; the runner wraps it with
 * retry and circuit breaking, so implementations simply throw on failure.
 */
public interface ResearchStages {

  SearchPlan plan(String query) throws Exception;

  /** Summarized result of a single search. */
  String search(SearchItem item) throws Exception;

  /** The final markdown report. */
  String write(String query, List<String> searchResults) throws Exception;
}
