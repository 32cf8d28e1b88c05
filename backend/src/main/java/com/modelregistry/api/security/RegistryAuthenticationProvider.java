package com.modelregistry.api.security;

import com.modelregistry.api.config.RegistryMongoProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.AuthenticationProvider;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

/**
 * Authenticates HTTP Basic credentials against the registry's MongoDB credentials.
 * Username and password are both compared in constant time.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RegistryAuthenticationProvider implements AuthenticationProvider {

    public static final String ROLE_REGISTRY_ADMIN = "ROLE_REGISTRY_ADMIN";

    private final RegistryMongoProperties properties;

    @Override
    public Authentication authenticate(Authentication authentication) throws AuthenticationException {
        String username = authentication.getName();
        Object credentials = authentication.getCredentials();
        String password = credentials != null ? credentials.toString() : "";

        boolean usernameMatches = constantTimeEquals(username, properties.getUsername());
        boolean passwordMatches = constantTimeEquals(password, properties.getPassword());

        if (!(usernameMatches && passwordMatches)) {
            log.warn("Failed authentication attempt for user: {}", username);
            throw new BadCredentialsException("Incorrect username or password");
        }

        return UsernamePasswordAuthenticationToken.authenticated(
                username, null, List.of(new SimpleGrantedAuthority(ROLE_REGISTRY_ADMIN)));
    }

    @Override
    public boolean supports(Class<?> authentication) {
        return UsernamePasswordAuthenticationToken.class.isAssignableFrom(authentication);
    }

    static boolean constantTimeEquals(String provided, String expected) {
        if (provided == null || expected == null) {
            return false;
        }
        return MessageDigest.isEqual(
                provided.getBytes(StandardCharsets.UTF_8),
                expected.getBytes(StandardCharsets.UTF_8));
    }
}
