package io.statsheets.core;

import java.util.Objects;

/**
 * A remote collection addressed by path, whose responses decode into records of {@code type}.
 */
public record Endpoint<T>(String path, Class<T> type) {
    public Endpoint {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(type, "type");
        if (path.isBlank()) throw new IllegalArgumentException("endpoint path must not be blank");
    }

    @Override
    public String toString() {
        return path;
    }
}
