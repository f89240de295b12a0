package com.deepsearch.research.dto.session;

import com.deepsearch.research.dto.search.DomainCount;

import java.util.List;

public record StoreStatistics(
        long sessions,
        long sources,
        long reports,
        long cachedEmbeddings,
        List<DomainCount> topDomains
) {
}
