package com.modelregistry.api.config;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoCredential;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Builds the single pooled {@link MongoClient} used by the registry.
 * Spring Data's auto-configuration backs off when this bean is present,
 * so {@code MongoTemplate} shares the same client.
 */
@Slf4j
@Configuration
public class MongoConfig {

    @Bean(destroyMethod = "close")
    public MongoClient mongoClient(RegistryMongoProperties properties) {
        log.info("Connecting to MongoDB at {} (authSource={})", properties.getHost(), properties.getAuthDb());
        return MongoClients.create(buildSettings(properties));
    }

    static MongoClientSettings buildSettings(RegistryMongoProperties properties) {
        // Hosts go through ConnectionString; credentials are passed separately so they need no URI escaping
        ConnectionString hosts = new ConnectionString("mongodb://" + properties.getHost());

        MongoClientSettings.Builder builder = MongoClientSettings.builder()
                .applyConnectionString(hosts)
                .applyToClusterSettings(cluster -> cluster.serverSelectionTimeout(
                        properties.getServerSelectionTimeoutMs(), TimeUnit.MILLISECONDS))
                .applyToSocketSettings(socket -> socket.connectTimeout(
                        properties.getConnectTimeoutMs(), TimeUnit.MILLISECONDS));

        if (properties.getUsername() != null && !properties.getUsername().isBlank()) {
            builder.credential(MongoCredential.createCredential(
                    properties.getUsername(),
                    properties.getAuthDb(),
                    properties.getPassword() != null ? properties.getPassword().toCharArray() : new char[0]));
        }

        return builder.build();
    }
}
