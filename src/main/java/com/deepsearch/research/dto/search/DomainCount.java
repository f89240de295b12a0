package com.deepsearch.research.dto.search;

public record DomainCount(String domain, long count) {
}
