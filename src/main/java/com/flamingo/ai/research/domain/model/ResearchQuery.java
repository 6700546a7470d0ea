package com.flamingo.ai.research.domain.model;

/**
 * A search query issued during one iteration of the research loop.
 *
 * @param text query text sent to the search backend
 * @param iteration iteration that produced the query
 * @param isRewrite true when generated on a retry pass with prior queries as negative context
 */
public record ResearchQuery(String text, int iteration, boolean isRewrite) {}
