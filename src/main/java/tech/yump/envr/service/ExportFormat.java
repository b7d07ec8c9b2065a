package tech.yump.envr.service;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Text formats secrets can be exported in.
 */
public enum ExportFormat {
    /** {@code KEY=value}, readable back as a .env file. */
    DOTENV("dotenv"),
    /** {@code export KEY='value'} for POSIX shells. */
    SHELL("shell"),
    /** One JSON object of name to value. */
    JSON("json"),
    /** {@code $env:KEY = 'value'} for PowerShell. */
    POWERSHELL("powershell");

    private final String id;

    ExportFormat(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * @throws IllegalArgumentException for an unknown format name
     */
    public static ExportFormat fromId(String id) {
        if (id == null || id.isBlank()) {
            return DOTENV;
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (ExportFormat format : values()) {
            if (format.id.equals(normalized)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown export format '" + id + "'. Supported: "
                + Arrays.stream(values()).map(ExportFormat::id).collect(Collectors.joining(", ")));
    }
}
