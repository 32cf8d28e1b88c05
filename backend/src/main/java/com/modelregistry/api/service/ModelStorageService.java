package com.modelregistry.api.service;

import com.modelregistry.api.exception.ApiException;
import com.modelregistry.api.model.dto.ListModelsRequest;
import com.modelregistry.api.model.dto.ModelFileResponse;
import com.modelregistry.api.model.dto.ModelLookupRequest;
import com.modelregistry.api.model.dto.ModelMetadata;
import com.modelregistry.api.model.dto.StoreModelRequest;
import com.modelregistry.api.model.dto.StoreModelResult;
import com.mongodb.ErrorCategory;
import com.mongodb.MongoException;
import com.mongodb.MongoGridFSException;
import com.mongodb.MongoWriteException;
import com.mongodb.client.gridfs.GridFSBucket;
import com.mongodb.client.gridfs.GridFSDownloadStream;
import com.mongodb.client.gridfs.model.GridFSFile;
import com.mongodb.client.gridfs.model.GridFSUploadOptions;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Sorts;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.BsonObjectId;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.bson.types.ObjectId;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Stores model files in GridFS and looks them up by id.
 * Each model is a GridFS file whose metadata document holds the
 * architecture, version and project name.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModelStorageService {

    static final String DEFAULT_UPLOAD_FILENAME = "model.bin";

    private final ModelBucketProvider bucketProvider;

    /**
     * Store a model file read from the registry host's filesystem.
     */
    public StoreModelResult storeModel(StoreModelRequest request) {
        Path path = Path.of(request.getModelPath());
        if (!Files.isRegularFile(path)) {
            throw new ApiException("Model file not found: " + request.getModelPath(), HttpStatus.BAD_REQUEST);
        }

        try (InputStream in = Files.newInputStream(path)) {
            return store(request.getDatabase(), request.getCollection(),
                    path.getFileName().toString(), request.toMetadata(), in);
        } catch (IOException e) {
            throw new ApiException("Failed to read model file: " + request.getModelPath(),
                    HttpStatus.INTERNAL_SERVER_ERROR, e);
        }
    }

    /**
     * Store a model file sent in a multipart request.
     */
    public StoreModelResult storeUpload(String database, String collection,
                                        ModelMetadata metadata, MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new ApiException("Model file is empty", HttpStatus.BAD_REQUEST);
        }

        String filename = StringUtils.getFilename(file.getOriginalFilename());
        if (!StringUtils.hasText(filename)) {
            filename = DEFAULT_UPLOAD_FILENAME;
        }

        try (InputStream in = file.getInputStream()) {
            return store(database, collection, filename, metadata, in);
        } catch (IOException e) {
            throw new ApiException("Failed to read uploaded model file", HttpStatus.INTERNAL_SERVER_ERROR, e);
        }
    }

    public void deleteModel(ModelLookupRequest request) {
        ObjectId id = parseModelId(request.getModelId());
        GridFSBucket bucket = bucketProvider.bucket(request.getDatabase(), request.getCollection());

        try {
            bucket.delete(id);
        } catch (MongoGridFSException e) {
            throw new ApiException("Model not found", HttpStatus.NOT_FOUND, e);
        } catch (MongoException e) {
            throw new ApiException("Failed to delete model: " + e.getMessage(), HttpStatus.INTERNAL_SERVER_ERROR, e);
        }

        log.info("Deleted model {} from {}.{}", id.toHexString(), request.getDatabase(), request.getCollection());
    }

    /**
     * Returns the metadata of a model, or throws NOT_FOUND.
     */
    public ModelMetadata searchModel(ModelLookupRequest request) {
        return ModelMetadata.fromDocument(findModel(request).getMetadata());
    }

    /**
     * Returns the GridFS file descriptor of a model, or throws NOT_FOUND.
     */
    public GridFSFile findModel(ModelLookupRequest request) {
        ObjectId id = parseModelId(request.getModelId());
        GridFSFile file = bucketProvider.bucket(request.getDatabase(), request.getCollection())
                .find(Filters.eq("_id", id))
                .first();

        if (file == null) {
            throw new ApiException("Model not found", HttpStatus.NOT_FOUND);
        }
        return file;
    }

    public List<ModelFileResponse> listModels(ListModelsRequest request) {
        Bson filter = StringUtils.hasText(request.getProjectName())
                ? Filters.eq("metadata." + ModelMetadata.PROJECT, request.getProjectName())
                : new Document();

        List<GridFSFile> files = bucketProvider.bucket(request.getDatabase(), request.getCollection())
                .find(filter)
                .sort(Sorts.descending("uploadDate"))
                .into(new ArrayList<>());

        return files.stream()
                .map(ModelFileResponse::fromFileWithMetadata)
                .toList();
    }

    /**
     * Opens the content of a model. The caller owns the returned stream.
     */
    public GridFSDownloadStream openModel(ModelLookupRequest request) {
        ObjectId id = parseModelId(request.getModelId());
        try {
            return bucketProvider.bucket(request.getDatabase(), request.getCollection())
                    .openDownloadStream(id);
        } catch (MongoGridFSException e) {
            throw new ApiException("Model not found", HttpStatus.NOT_FOUND, e);
        }
    }

    private StoreModelResult store(String database, String collection, String filename,
                                   ModelMetadata metadata, InputStream content) {
        GridFSBucket bucket = bucketProvider.bucket(database, collection);
        bucketProvider.ensureModelIndex(database, collection);

        try {
            GridFSFile existing = bucket.find(duplicateFilter(filename, metadata)).first();
            if (existing != null) {
                log.info("Model '{}' ({} v{}, project '{}') already exists in {}.{} as {}",
                        filename, metadata.getModelArchitecture(), metadata.getModelVersion(),
                        metadata.getProjectName(), database, collection, existing.getObjectId().toHexString());
                return StoreModelResult.duplicate();
            }

            ObjectId id = new ObjectId();
            try {
                bucket.uploadFromStream(new BsonObjectId(id), filename, content,
                        new GridFSUploadOptions().metadata(metadata.toDocument()));
            } catch (MongoWriteException e) {
                if (e.getError().getCategory() != ErrorCategory.DUPLICATE_KEY) {
                    throw e;
                }
                // An identical model was registered between the lookup and the upload
                bucketProvider.chunks(database, collection).deleteMany(Filters.eq("files_id", id));
                log.info("Model '{}' was stored concurrently in {}.{}, discarded upload {}",
                        filename, database, collection, id.toHexString());
                return StoreModelResult.duplicate();
            }

            log.info("Stored model '{}' ({} v{}, project '{}') in {}.{} as {}",
                    filename, metadata.getModelArchitecture(), metadata.getModelVersion(),
                    metadata.getProjectName(), database, collection, id.toHexString());
            return StoreModelResult.stored(id.toHexString());
        } catch (MongoException e) {
            throw new ApiException("Failed to store model: " + e.getMessage(), HttpStatus.INTERNAL_SERVER_ERROR, e);
        }
    }

    private Bson duplicateFilter(String filename, ModelMetadata metadata) {
        return Filters.and(
                Filters.eq("filename", filename),
                Filters.eq("metadata." + ModelMetadata.ARCHITECTURE, metadata.getModelArchitecture()),
                Filters.eq("metadata." + ModelMetadata.VERSION, metadata.getModelVersion()),
                Filters.eq("metadata." + ModelMetadata.PROJECT, metadata.getProjectName()));
    }

    static ObjectId parseModelId(String modelId) {
        if (modelId == null || !ObjectId.isValid(modelId)) {
            throw new ApiException("Invalid model ID: " + modelId, HttpStatus.BAD_REQUEST);
        }
        return new ObjectId(modelId);
    }
}
