package dev.cellfmt.aligner.config;

import java.util.Optional;

/**
 * Reads configuration overrides from the host environment variables.
 */
public class SystemEnvironmentReader implements EnvironmentReader {

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(System.getenv(key)).filter(value -> !value.isEmpty());
    }
}
