package com.deepsearch.research.service.analysis;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Decodes the structured part of a model answer into a typed record.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LlmResponseParser {

    private final ObjectMapper objectMapper;

    /**
     * Empty when the answer holds no JSON object or the object does not map onto {@code type}.
     */
    public <T> Optional<T> parse(String answer, Class<T> type) {
        Optional<String> json = JsonBlockExtractor.extractFirstObject(answer);
        if (json.isEmpty()) {
            log.warn("No JSON object found in model answer for {}", type.getSimpleName());
            return Optional.empty();
        }

        try {
            return Optional.ofNullable(objectMapper.readValue(json.get(), type));
        } catch (Exception e) {
            log.warn("Failed to decode model answer as {}: {}", type.getSimpleName(), e.getMessage());
            return Optional.empty();
        }
    }
}
