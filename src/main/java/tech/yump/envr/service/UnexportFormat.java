package tech.yump.envr.service;

import java.util.Locale;

/**
 * Shell flavours for the commands that undo an export.
 */
public enum UnexportFormat {
    /** {@code unset KEY} */
    UNIX("unix", "unset %s\n"),
    /** {@code Remove-Item Env:KEY} for PowerShell. */
    WIN("win", "Remove-Item Env:%s -ErrorAction SilentlyContinue\n");

    private final String id;
    private final String lineFormat;

    UnexportFormat(String id, String lineFormat) {
        this.id = id;
        this.lineFormat = lineFormat;
    }

    public String id() {
        return id;
    }

    String line(String name) {
        return String.format(lineFormat, name);
    }

    /**
     * @throws IllegalArgumentException for anything but unix or win
     */
    public static UnexportFormat fromId(String id) {
        if (id == null || id.isBlank()) {
            return UNIX;
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (UnexportFormat format : values()) {
            if (format.id.equals(normalized)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown unexport format '" + id + "'. Supported: unix, win");
    }
}
