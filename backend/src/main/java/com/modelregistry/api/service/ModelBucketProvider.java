package com.modelregistry.api.service;

import com.modelregistry.api.model.dto.ModelMetadata;
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.gridfs.GridFSBucket;
import com.mongodb.client.gridfs.GridFSBuckets;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves the GridFS bucket holding a model collection.
 * The bucket name is the collection name, so files land in
 * {@code <collection>.files} and {@code <collection>.chunks}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ModelBucketProvider {

    static final String MODEL_IDENTITY_INDEX = "model_identity";

    private final MongoClient mongoClient;

    private final Set<String> indexedBuckets = ConcurrentHashMap.newKeySet();

    public GridFSBucket bucket(String database, String collection) {
        return GridFSBuckets.create(mongoClient.getDatabase(database), collection);
    }

    public MongoCollection<Document> chunks(String database, String collection) {
        return mongoClient.getDatabase(database).getCollection(collection + ".chunks");
    }

    /**
     * Makes filename plus model metadata unique in the bucket, so two
     * concurrent stores of the same model cannot both register a file.
     * Attempted once per bucket for the lifetime of the process.
     */
    public void ensureModelIndex(String database, String collection) {
        if (!indexedBuckets.add(database + "." + collection)) {
            return;
        }

        try {
            mongoClient.getDatabase(database)
                    .getCollection(collection + ".files")
                    .createIndex(
                            Indexes.ascending(
                                    "filename",
                                    "metadata." + ModelMetadata.ARCHITECTURE,
                                    "metadata." + ModelMetadata.VERSION,
                                    "metadata." + ModelMetadata.PROJECT),
                            new IndexOptions().unique(true).name(MODEL_IDENTITY_INDEX));
        } catch (MongoException e) {
            // Buckets that already hold duplicates keep working on the find-before-upload check alone
            log.warn("Could not create unique model index on {}.{}.files: {}", database, collection, e.getMessage());
        }
    }
}
