package com.modelregistry.api.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Registers a model file that already exists on the registry host's filesystem.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoreModelRequest {

    @NotBlank(message = "Database is required")
    private String database;

    @NotBlank(message = "Collection is required")
    private String collection;

    @NotBlank(message = "Model path is required")
    private String modelPath;

    @NotBlank(message = "Model architecture is required")
    private String modelArchitecture;

    @NotNull(message = "Model version is required")
    private Double modelVersion;

    @NotBlank(message = "Project name is required")
    @JsonProperty("project_name")
    private String projectName;

    public ModelMetadata toMetadata() {
        return new ModelMetadata(modelArchitecture, modelVersion, projectName);
    }
}
