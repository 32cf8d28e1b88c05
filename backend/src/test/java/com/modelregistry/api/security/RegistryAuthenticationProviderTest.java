package com.modelregistry.api.security;

import com.modelregistry.api.config.RegistryMongoProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.TestingAuthenticationToken;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@ExtendWith(OutputCaptureExtension.class)
@DisplayName("RegistryAuthenticationProvider")
class RegistryAuthenticationProviderTest {

    private RegistryAuthenticationProvider provider;

    @BeforeEach
    void setUp() {
        RegistryMongoProperties properties = new RegistryMongoProperties();
        properties.setUsername("registry-admin");
        properties.setPassword("p@ss:word/1");
        provider = new RegistryAuthenticationProvider(properties);
    }

    @Test
    @DisplayName("should authenticate matching credentials with the admin role")
    void shouldAuthenticate() {
        Authentication result = provider.authenticate(
                UsernamePasswordAuthenticationToken.unauthenticated("registry-admin", "p@ss:word/1"));

        assertThat(result.isAuthenticated()).isTrue();
        assertThat(result.getName()).isEqualTo("registry-admin");
        assertThat(result.getCredentials()).isNull();
        assertThat(result.getAuthorities()).extracting(GrantedAuthority::getAuthority)
                .containsExactly(RegistryAuthenticationProvider.ROLE_REGISTRY_ADMIN);
    }

    @Test
    @DisplayName("should reject a wrong password")
    void shouldRejectWrongPassword() {
        assertThatThrownBy(() -> provider.authenticate(
                UsernamePasswordAuthenticationToken.unauthenticated("registry-admin", "p@ss:word/2")))
                .isInstanceOf(BadCredentialsException.class)
                .hasMessage("Incorrect username or password");
    }

    @Test
    @DisplayName("should log a warning naming the attempted user on failure")
    void shouldLogFailedAttempt(CapturedOutput output) {
        assertThatThrownBy(() -> provider.authenticate(
                UsernamePasswordAuthenticationToken.unauthenticated("intruder", "guess")))
                .isInstanceOf(BadCredentialsException.class);

        assertThat(output.getAll())
                .contains("WARN")
                .contains("Failed authentication attempt for user: intruder");
    }

    @Test
    @DisplayName("should not log a warning on success")
    void shouldNotLogSuccessfulAttempt(CapturedOutput output) {
        provider.authenticate(UsernamePasswordAuthenticationToken.unauthenticated("registry-admin", "p@ss:word/1"));

        assertThat(output.getAll()).doesNotContain("Failed authentication attempt");
    }

    @Test
    @DisplayName("should reject a wrong username even with the right password")
    void shouldRejectWrongUsername() {
        assertThatThrownBy(() -> provider.authenticate(
                UsernamePasswordAuthenticationToken.unauthenticated("Registry-Admin", "p@ss:word/1")))
                .isInstanceOf(BadCredentialsException.class);
    }

    @Test
    @DisplayName("should reject when no credentials are configured")
    void shouldRejectWhenUnconfigured() {
        RegistryAuthenticationProvider unconfigured = new RegistryAuthenticationProvider(new RegistryMongoProperties());

        assertThatThrownBy(() -> unconfigured.authenticate(
                UsernamePasswordAuthenticationToken.unauthenticated("", "")))
                .isInstanceOf(BadCredentialsException.class);
    }

    @Test
    @DisplayName("should only support username/password tokens")
    void shouldSupportUsernamePasswordTokens() {
        assertThat(provider.supports(UsernamePasswordAuthenticationToken.class)).isTrue();
        assertThat(provider.supports(TestingAuthenticationToken.class)).isFalse();
    }

    @Test
    @DisplayName("constantTimeEquals should treat null as a mismatch")
    void constantTimeEqualsShouldHandleNull() {
        assertThat(RegistryAuthenticationProvider.constantTimeEquals(null, "x")).isFalse();
        assertThat(RegistryAuthenticationProvider.constantTimeEquals("x", null)).isFalse();
        assertThat(RegistryAuthenticationProvider.constantTimeEquals("x", "x")).isTrue();
    }
}
