package com.gentoro.deepresearch.pipeline;

/** One planned web search and the reason the planner gave for it. */
public record SearchItem(String query, String reason) {}
