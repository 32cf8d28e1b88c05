package com.modelregistry.api.service;

import com.mongodb.MongoClientSettings;
import com.mongodb.MongoCommandException;
import com.mongodb.ServerAddress;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.IndexOptions;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonString;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("ModelBucketProvider")
@ExtendWith(MockitoExtension.class)
class ModelBucketProviderTest {

    @Mock
    private MongoClient mongoClient;

    @Mock
    private MongoDatabase database;

    @Mock
    private MongoCollection<Document> files;

    @InjectMocks
    private ModelBucketProvider bucketProvider;

    @Test
    @DisplayName("should create a unique index on filename and model metadata")
    void shouldCreateUniqueModelIndex() {
        when(mongoClient.getDatabase("model_registry")).thenReturn(database);
        when(database.getCollection("llm.files")).thenReturn(files);

        bucketProvider.ensureModelIndex("model_registry", "llm");

        ArgumentCaptor<Bson> keys = ArgumentCaptor.forClass(Bson.class);
        ArgumentCaptor<IndexOptions> options = ArgumentCaptor.forClass(IndexOptions.class);
        verify(files).createIndex(keys.capture(), options.capture());

        BsonDocument keyDocument = keys.getValue()
                .toBsonDocument(BsonDocument.class, MongoClientSettings.getDefaultCodecRegistry());
        assertThat(keyDocument.keySet()).containsExactly(
                "filename",
                "metadata.model_architecture",
                "metadata.model_version",
                "metadata.project_name");
        assertThat(options.getValue().isUnique()).isTrue();
        assertThat(options.getValue().getName()).isEqualTo(ModelBucketProvider.MODEL_IDENTITY_INDEX);
    }

    @Test
    @DisplayName("should only try to create the index once per bucket")
    void shouldCreateIndexOncePerBucket() {
        when(mongoClient.getDatabase("model_registry")).thenReturn(database);
        when(database.getCollection("llm.files")).thenReturn(files);

        bucketProvider.ensureModelIndex("model_registry", "llm");
        bucketProvider.ensureModelIndex("model_registry", "llm");

        verify(files, times(1)).createIndex(any(Bson.class), any(IndexOptions.class));
    }

    @Test
    @DisplayName("should keep working when existing duplicates prevent the index")
    void shouldTolerateIndexFailure() {
        when(mongoClient.getDatabase("model_registry")).thenReturn(database);
        when(database.getCollection("llm.files")).thenReturn(files);
        BsonDocument response = new BsonDocument("ok", new BsonInt32(0))
                .append("code", new BsonInt32(11000))
                .append("errmsg", new BsonString("E11000 duplicate key error"));
        when(files.createIndex(any(Bson.class), any(IndexOptions.class)))
                .thenThrow(new MongoCommandException(response, new ServerAddress()));

        assertThatCode(() -> bucketProvider.ensureModelIndex("model_registry", "llm"))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("should resolve the chunks collection of a bucket")
    void shouldResolveChunks() {
        when(mongoClient.getDatabase("model_registry")).thenReturn(database);
        when(database.getCollection("llm.chunks")).thenReturn(files);

        assertThat(bucketProvider.chunks("model_registry", "llm")).isSameAs(files);
    }
}
