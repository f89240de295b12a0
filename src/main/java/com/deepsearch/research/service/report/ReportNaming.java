package com.deepsearch.research.service.report;

import com.deepsearch.research.config.DeepSearchProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * File name and title of a report, derived from the query.
 */
@Component
@RequiredArgsConstructor
public class ReportNaming {

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMddHHmm").withZone(ZoneOffset.UTC);

    private static final String EMPTY_SLUG = "report";

    private final DeepSearchProperties properties;

    /**
     * {@code yyyyMMddHHmm_<slug>.md}, timestamp in UTC
     */
    public String filename(String query, Instant timestamp) {
        return TIMESTAMP.format(timestamp) + "_" + slug(query) + ".md";
    }

    /**
     * Lower-case ASCII slug: accents stripped, other symbols removed, whitespace runs joined by '_'.
     */
    public String slug(String query) {
        String slug = Normalizer.normalize(query.toLowerCase(Locale.ROOT), Normalizer.Form.NFD)
                .replaceAll("\\p{M}", "")
                .replaceAll("[^a-z0-9\\s]", "")
                .trim()
                .replaceAll("\\s+", "_");

        int maxLength = properties.getReports().getMaxSlugLength();
        if (slug.length() > maxLength) {
            slug = slug.substring(0, maxLength);
        }
        return slug.isEmpty() ? EMPTY_SLUG : slug;
    }

    /**
     * First words of the query, each capitalized
     */
    public String title(String query) {
        String trimmed = query.trim();
        if (trimmed.isEmpty()) {
            return "";
        }
        return Arrays.stream(trimmed.split("\\s+"))
                .limit(properties.getReports().getMaxTitleWords())
                .map(word -> word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1).toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(" "));
    }
}
