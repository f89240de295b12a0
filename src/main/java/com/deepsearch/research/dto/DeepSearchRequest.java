package com.deepsearch.research.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body for starting a research run. Unset options take their defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeepSearchRequest {

    @NotBlank(message = "Query is required")
    private String query;

    private Boolean useAdvancedSearch;

    private Boolean generateEmbeddings;

    @Min(value = 1, message = "maxSources must be at least 1")
    @Max(value = 200, message = "maxSources must be at most 200")
    private Integer maxSources;

    private Boolean saveToDatabase;
}
