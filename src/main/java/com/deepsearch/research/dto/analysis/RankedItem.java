package com.deepsearch.research.dto.analysis;

/**
 * A consolidated string and the number of times it was reported across sources.
 */
public record RankedItem(String item, long count) {
}
