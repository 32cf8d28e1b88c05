package com.modelregistry.api.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * MongoDB credentials and connection settings for the registry.
 * Populated from the {@code mongo_username}, {@code mongo_password},
 * {@code mongo_host} and {@code mongo_auth_db} environment variables
 * (see application.yml). The same username and password guard the HTTP API.
 */
@Data
@ConfigurationProperties(prefix = "registry.mongo")
public class RegistryMongoProperties {

    public static final String DEFAULT_HOST = "localhost:27017";
    public static final String DEFAULT_AUTH_DB = "admin";

    private String username;

    private String password;

    /**
     * Host list as it would appear after {@code mongodb://}, e.g. {@code db1:27017,db2:27017}.
     */
    private String host = DEFAULT_HOST;

    private String authDb = DEFAULT_AUTH_DB;

    private int serverSelectionTimeoutMs = 10_000;

    private int connectTimeoutMs = 10_000;
}
