package com.deepsearch.research.service.search;

import com.deepsearch.research.config.DeepSearchProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Query-refinement variants ("dorks") derived from a base term.
 * Templates come from {@code deepsearch.search.dorks}; {@code {q}} stands for the term.
 */
@Component
public class DorkVariants {

    private static final String PLACEHOLDER = "{q}";

    private final List<String> templates;

    public DorkVariants(DeepSearchProperties properties) {
        this.templates = List.copyOf(properties.getSearch().getDorks());
    }

    public int count() {
        return templates.size();
    }

    public List<String> expand(String term) {
        return templates.stream()
                .map(template -> template.replace(PLACEHOLDER, term))
                .toList();
    }
}
