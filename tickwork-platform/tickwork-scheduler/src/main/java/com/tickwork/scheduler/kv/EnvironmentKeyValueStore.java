package com.tickwork.scheduler.kv;

import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Key-value store backed by the Spring {@link Environment}, so values can come
 * from application.yml, environment variables or system properties.
 */
@Component
public class EnvironmentKeyValueStore implements KeyValueStore {

    private final Environment environment;

    public EnvironmentKeyValueStore(Environment environment) {
        this.environment = environment;
    }

    @Override
    public Optional<String> get(String key) {
        String value = environment.getProperty(key);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }
}
