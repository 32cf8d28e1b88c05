package com.modelregistry.api.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.mongodb.client.gridfs.model.GridFSFile;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Description of a stored model file. The metadata is only filled in
 * when the file is listed on its own.
 */
@Data
@Builder
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ModelFileResponse {

    private String id;
    private String filename;
    private long length;
    private Instant uploadDate;
    private ModelMetadata metadata;

    public static ModelFileResponse fromFile(GridFSFile file) {
        return ModelFileResponse.builder()
                .id(file.getObjectId().toHexString())
                .filename(file.getFilename())
                .length(file.getLength())
                .uploadDate(file.getUploadDate() != null ? file.getUploadDate().toInstant() : null)
                .build();
    }

    public static ModelFileResponse fromFileWithMetadata(GridFSFile file) {
        ModelFileResponse response = fromFile(file);
        response.setMetadata(ModelMetadata.fromDocument(file.getMetadata()));
        return response;
    }
}
