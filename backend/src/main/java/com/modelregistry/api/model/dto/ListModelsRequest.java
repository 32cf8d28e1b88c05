package com.modelregistry.api.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ListModelsRequest {

    @NotBlank(message = "Database is required")
    private String database = ModelLookupRequest.DEFAULT_DATABASE;

    @NotBlank(message = "Collection is required")
    private String collection = ModelLookupRequest.DEFAULT_COLLECTION;

    /**
     * Optional filter on {@code metadata.project_name}.
     */
    @JsonProperty("project_name")
    private String projectName;
}
