package com.modelregistry.api.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.bson.Document;

/**
 * Metadata stored alongside each model file in GridFS.
 * Field names match the keys of the stored metadata document.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ModelMetadata {

    public static final String ARCHITECTURE = "model_architecture";
    public static final String VERSION = "model_version";
    public static final String PROJECT = "project_name";

    @JsonProperty(ARCHITECTURE)
    private String modelArchitecture;

    @JsonProperty(VERSION)
    private Double modelVersion;

    @JsonProperty(PROJECT)
    private String projectName;

    public Document toDocument() {
        return new Document(ARCHITECTURE, modelArchitecture)
                .append(VERSION, modelVersion)
                .append(PROJECT, projectName);
    }

    public static ModelMetadata fromDocument(Document document) {
        if (document == null) {
            return new ModelMetadata();
        }
        Object version = document.get(VERSION);
        return new ModelMetadata(
                document.getString(ARCHITECTURE),
                version instanceof Number ? ((Number) version).doubleValue() : null,
                document.getString(PROJECT));
    }
}
