package com.modelregistry.api.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.ToString;
import org.springframework.web.bind.annotation.BindParam;

/**
 * Form fields sent with a multipart model upload. Carries the same
 * constraints as {@link StoreModelRequest}, without the server-side path.
 */
@Getter
@ToString
public class UploadModelRequest {

    @NotBlank(message = "Database is required")
    private final String database;

    @NotBlank(message = "Collection is required")
    private final String collection;

    @NotBlank(message = "Model architecture is required")
    private final String modelArchitecture;

    @NotNull(message = "Model version is required")
    private final Double modelVersion;

    @NotBlank(message = "Project name is required")
    private final String projectName;

    public UploadModelRequest(@BindParam("database") String database,
                              @BindParam("collection") String collection,
                              @BindParam("modelArchitecture") String modelArchitecture,
                              @BindParam("modelVersion") Double modelVersion,
                              @BindParam("project_name") String projectName) {
        this.database = database;
        this.collection = collection;
        this.modelArchitecture = modelArchitecture;
        this.modelVersion = modelVersion;
        this.projectName = projectName;
    }

    public ModelMetadata toMetadata() {
        return new ModelMetadata(modelArchitecture, modelVersion, projectName);
    }
}
