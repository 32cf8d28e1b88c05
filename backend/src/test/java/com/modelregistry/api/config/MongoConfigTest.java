package com.modelregistry.api.config;

import com.mongodb.MongoClientSettings;
import com.mongodb.MongoCredential;
import com.mongodb.ServerAddress;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MongoConfig")
class MongoConfigTest {

    private RegistryMongoProperties properties(String username, String password, String host) {
        RegistryMongoProperties properties = new RegistryMongoProperties();
        properties.setUsername(username);
        properties.setPassword(password);
        properties.setHost(host);
        properties.setAuthDb("registry_auth");
        properties.setServerSelectionTimeoutMs(2_500);
        properties.setConnectTimeoutMs(1_500);
        return properties;
    }

    @Test
    @DisplayName("should authenticate against the configured auth database")
    void shouldBuildCredential() {
        MongoClientSettings settings = MongoConfig.buildSettings(
                properties("registry-admin", "p@ss/word:1", "localhost:27017"));

        MongoCredential credential = settings.getCredential();
        assertThat(credential).isNotNull();
        assertThat(credential.getUserName()).isEqualTo("registry-admin");
        assertThat(credential.getSource()).isEqualTo("registry_auth");
        assertThat(credential.getPassword()).isEqualTo("p@ss/word:1".toCharArray());
    }

    @Test
    @DisplayName("should connect to every host in the list")
    void shouldApplyHostList() {
        MongoClientSettings settings = MongoConfig.buildSettings(
                properties("registry-admin", "secret", "mongo-0:27017,mongo-1:27018"));

        assertThat(settings.getClusterSettings().getHosts())
                .containsExactly(new ServerAddress("mongo-0", 27017), new ServerAddress("mongo-1", 27018));
    }

    @Test
    @DisplayName("should apply configured timeouts")
    void shouldApplyTimeouts() {
        MongoClientSettings settings = MongoConfig.buildSettings(
                properties("registry-admin", "secret", "localhost:27017"));

        assertThat(settings.getClusterSettings().getServerSelectionTimeout(TimeUnit.MILLISECONDS)).isEqualTo(2_500);
        assertThat(settings.getSocketSettings().getConnectTimeout(TimeUnit.MILLISECONDS)).isEqualTo(1_500);
    }

    @Test
    @DisplayName("should omit the credential when no username is configured")
    void shouldSkipCredentialWithoutUsername() {
        MongoClientSettings settings = MongoConfig.buildSettings(properties("", "", "localhost:27017"));

        assertThat(settings.getCredential()).isNull();
    }
}
