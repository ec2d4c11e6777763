package com.verity.dataquality.runtime.config;

import org.slf4j.Logger;

import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * Typed lookups over an environment, used by configuration builders to apply
 * overrides. Blank values count as unset; invalid numbers are logged and ignored.
 */
public final class EnvironmentReader {
    private final Function<String, String> environment;
    private final Logger log;

    public EnvironmentReader(Function<String, String> environment, Logger log) {
        this.environment = environment;
        this.log = log;
    }

    public Optional<String> get(String key) {
        String value = environment.apply(key);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        log.debug("Environment override {}={}", key, value);
        return Optional.of(value.trim());
    }

    public Optional<Integer> getInt(String key) {
        return get(key).map(val -> {
            try {
                return Integer.parseInt(val);
            } catch (NumberFormatException e) {
                log.warn("Invalid int value for {}: {}", key, val);
                return null;
            }
        });
    }

    public Optional<Long> getLong(String key) {
        return get(key).map(val -> {
            try {
                return Long.parseLong(val);
            } catch (NumberFormatException e) {
                log.warn("Invalid long value for {}: {}", key, val);
                return null;
            }
        });
    }

    public Optional<Boolean> getBoolean(String key) {
        return get(key).map(val -> {
            String normalized = val.toLowerCase(Locale.ROOT);
            return "true".equals(normalized) || "1".equals(normalized) || "yes".equals(normalized);
        });
    }
}
