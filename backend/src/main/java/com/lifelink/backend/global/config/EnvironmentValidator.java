package com.lifelink.backend.global.config;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails startup when a required property is missing or unusable.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    // HS256 needs a 256-bit key
    private static final int MIN_JWT_SECRET_BYTES = 32;
    private static final long MIN_JWT_EXPIRATION_MILLIS = 300_000L;
    private static final long MAX_JWT_EXPIRATION_MILLIS = 86_400_000L;

    private static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "jwt.secret",
            "jwt.expiration"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = new ArrayList<>();

        for (String property : REQUIRED_PROPERTIES) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(property));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add(property + ": missing");
            }
        }

        Optional.ofNullable(environment.getProperty("jwt.secret"))
                .filter(secret -> !secret.isBlank())
                .filter(secret -> secret.getBytes(StandardCharsets.UTF_8).length < MIN_JWT_SECRET_BYTES)
                .ifPresent(secret -> problems.add("jwt.secret: must be at least " + MIN_JWT_SECRET_BYTES + " bytes"));

        Optional<String> jwtExpiration = Optional.ofNullable(environment.getProperty("jwt.expiration"));
        if (jwtExpiration.isPresent() && !jwtExpiration.get().isBlank()) {
            try {
                long expiration = Long.parseLong(jwtExpiration.get().trim());
                if (expiration < MIN_JWT_EXPIRATION_MILLIS || expiration > MAX_JWT_EXPIRATION_MILLIS) {
                    problems.add("jwt.expiration: must be between 300000 and 86400000 milliseconds");
                }
            } catch (NumberFormatException e) {
                problems.add("jwt.expiration: must be numeric");
            }
        }

        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Environment validation failed - {}", problem));
            throw new IllegalStateException("Environment validation failed: " + String.join(", ", problems));
        }

        log.info("Environment validation passed");
    }
}
