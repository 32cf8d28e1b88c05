package com.modelregistry.api.config;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Validates critical configuration on application startup.
 * Fails fast if the registry credentials are missing, since every
 * request is authenticated against them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupValidator {

    private static final String HOST_PATTERN = "^[a-zA-Z0-9._-]+(:\\d{1,5})?(,[a-zA-Z0-9._-]+(:\\d{1,5})?)*$";

    private final RegistryMongoProperties properties;

    @PostConstruct
    public void validate() {
        log.info("Validating startup configuration...");

        validateCredentials();
        validateHost();
        validateAuthDb();

        log.info("Startup configuration validation complete");
    }

    private void validateCredentials() {
        if (properties.getUsername() == null || properties.getUsername().isBlank()) {
            throw new IllegalStateException(
                    "mongo_username environment variable must be set");
        }
        if (properties.getPassword() == null || properties.getPassword().isBlank()) {
            throw new IllegalStateException(
                    "mongo_password environment variable must be set");
        }
    }

    private void validateHost() {
        String host = properties.getHost();
        if (host == null || host.isBlank()) {
            throw new IllegalStateException(
                    "mongo_host must not be blank");
        }

        if (!host.matches(HOST_PATTERN)) {
            throw new IllegalStateException(
                    "mongo_host has invalid format: " + host);
        }

        if (RegistryMongoProperties.DEFAULT_HOST.equals(host)) {
            log.warn("mongo_host not configured, falling back to {}", RegistryMongoProperties.DEFAULT_HOST);
        } else {
            log.info("MongoDB host configured: {}", host);
        }
    }

    private void validateAuthDb() {
        String authDb = properties.getAuthDb();
        if (authDb == null || authDb.isBlank()) {
            throw new IllegalStateException(
                    "mongo_auth_db must not be blank");
        }

        if (RegistryMongoProperties.DEFAULT_AUTH_DB.equals(authDb)) {
            log.warn("mongo_auth_db not configured, authenticating against '{}'", authDb);
        }
    }
}
