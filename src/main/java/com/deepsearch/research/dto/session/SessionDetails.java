package com.deepsearch.research.dto.session;

import com.deepsearch.research.entity.ResearchReport;
import com.deepsearch.research.entity.SearchSession;
import com.deepsearch.research.entity.WebSource;

import java.util.List;

public record SessionDetails(
        SearchSession session,
        List<WebSource> sources,
        List<ResearchReport> reports
) {
}
