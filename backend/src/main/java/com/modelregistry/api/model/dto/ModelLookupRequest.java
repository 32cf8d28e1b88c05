package com.modelregistry.api.model.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Identifies one stored model. Used by delete, search and get.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ModelLookupRequest {

    public static final String DEFAULT_DATABASE = "model_registry";
    public static final String DEFAULT_COLLECTION = "llm";

    @NotBlank(message = "Database is required")
    private String database = DEFAULT_DATABASE;

    @NotBlank(message = "Collection is required")
    private String collection = DEFAULT_COLLECTION;

    @NotBlank(message = "Model ID is required")
    private String modelId;
}
