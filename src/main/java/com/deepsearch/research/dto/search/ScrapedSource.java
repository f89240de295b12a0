package com.deepsearch.research.dto.search;

import java.time.Instant;

/**
 * Page content extracted from a search hit.
 * Only built when the page yielded at least the minimum amount of text.
 */
public record ScrapedSource(
        String url,
        String domain,
        String title,
        String description,
        String content,
        int wordCount,
        int contentLength,
        Instant scrapedAt,
        String searchTerm
) {
    public String getSnippet(int maxLength) {
        if (content == null) return "";
        if (content.length() <= maxLength) return content;
        return content.substring(0, maxLength);
    }
}
