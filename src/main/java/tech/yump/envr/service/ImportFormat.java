package tech.yump.envr.service;

import java.util.Locale;

/**
 * Text formats secrets can be imported from.
 */
public enum ImportFormat {
    /** .env lines. */
    ENV("env"),
    /** A JSON object, flat or nested by domain and project. */
    JSON("json"),
    /** The YAML equivalent of {@link #JSON}. */
    YAML("yaml");

    private final String id;

    ImportFormat(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * @throws IllegalArgumentException for an unknown format name
     */
    public static ImportFormat fromId(String id) {
        if (id == null || id.isBlank()) {
            return ENV;
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (ImportFormat format : values()) {
            if (format.id.equals(normalized)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown import format '" + id + "'. Supported: env, json, yaml");
    }
}
