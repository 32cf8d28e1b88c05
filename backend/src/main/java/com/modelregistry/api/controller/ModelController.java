package com.modelregistry.api.controller;

import com.modelregistry.api.model.dto.ListModelsRequest;
import com.modelregistry.api.model.dto.ModelFileResponse;
import com.modelregistry.api.model.dto.ModelLookupRequest;
import com.modelregistry.api.model.dto.ModelMetadata;
import com.modelregistry.api.model.dto.StoreModelRequest;
import com.modelregistry.api.model.dto.StoreModelResult;
import com.modelregistry.api.model.dto.UploadModelRequest;
import com.modelregistry.api.service.ModelStorageService;
import com.mongodb.client.gridfs.GridFSDownloadStream;
import com.mongodb.client.gridfs.model.GridFSFile;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.InputStreamResource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequiredArgsConstructor
@Tag(name = "Models", description = "Model storage in MongoDB GridFS")
public class ModelController {

    static final String STORED_MESSAGE = "Model stored successfully.";
    static final String DUPLICATE_MESSAGE = "Model already exists or could not be stored.";

    private final ModelStorageService modelStorageService;

    @PostMapping("/store_model")
    @Operation(summary = "Store a model file from the registry host in GridFS with metadata")
    public ResponseEntity<Map<String, String>> storeModel(@Valid @RequestBody StoreModelRequest request) {
        return ResponseEntity.ok(storeResponse(modelStorageService.storeModel(request)));
    }

    @PostMapping(value = "/upload_model", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Upload a model file and store it in GridFS with metadata")
    public ResponseEntity<Map<String, String>> uploadModel(
            @Valid @ModelAttribute UploadModelRequest request,
            @RequestPart("file") MultipartFile file) {
        return ResponseEntity.ok(storeResponse(modelStorageService.storeUpload(
                request.getDatabase(), request.getCollection(), request.toMetadata(), file)));
    }

    @DeleteMapping("/delete_model")
    @Operation(summary = "Delete a model from GridFS using its ID")
    public ResponseEntity<Map<String, String>> deleteModel(@Valid @RequestBody ModelLookupRequest request) {
        modelStorageService.deleteModel(request);
        return ResponseEntity.ok(Map.of("message",
                String.format("Model with ID '%s' deleted successfully.", request.getModelId())));
    }

    @PostMapping("/search_model")
    @Operation(summary = "Search for a model by its ID and return its metadata")
    public ResponseEntity<Map<String, Object>> searchModel(@Valid @RequestBody ModelLookupRequest request) {
        ModelMetadata metadata = modelStorageService.searchModel(request);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "success");
        body.put("model", metadata);
        return ResponseEntity.ok(body);
    }

    @PostMapping("/get_model")
    @Operation(summary = "Get a model's metadata and file details by its ID")
    public ResponseEntity<Map<String, Object>> getModel(@Valid @RequestBody ModelLookupRequest request) {
        GridFSFile file = modelStorageService.findModel(request);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "success");
        body.put("model", ModelMetadata.fromDocument(file.getMetadata()));
        body.put("file", ModelFileResponse.fromFile(file));
        return ResponseEntity.ok(body);
    }

    @PostMapping("/list_models")
    @Operation(summary = "List stored models, newest first, optionally filtered by project")
    public ResponseEntity<Map<String, Object>> listModels(@Valid @RequestBody ListModelsRequest request) {
        List<ModelFileResponse> models = modelStorageService.listModels(request);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "success");
        body.put("count", models.size());
        body.put("models", models);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/download_model")
    @Operation(summary = "Download the content of a stored model")
    public ResponseEntity<InputStreamResource> downloadModel(
            @RequestParam(defaultValue = ModelLookupRequest.DEFAULT_DATABASE) String database,
            @RequestParam(defaultValue = ModelLookupRequest.DEFAULT_COLLECTION) String collection,
            @RequestParam String modelId) {
        GridFSDownloadStream stream = modelStorageService.openModel(
                new ModelLookupRequest(database, collection, modelId));
        GridFSFile file = stream.getGridFSFile();

        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(file.getFilename(), StandardCharsets.UTF_8)
                        .build()
                        .toString())
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .contentLength(file.getLength())
                .body(new InputStreamResource(stream));
    }

    private Map<String, String> storeResponse(StoreModelResult result) {
        Map<String, String> body = new HashMap<>();
        if (result.isStored()) {
            body.put("message", STORED_MESSAGE);
            body.put("modelId", result.getModelId());
        } else {
            body.put("message", DUPLICATE_MESSAGE);
        }
        return body;
    }
}
