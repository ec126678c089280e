package com.kingpin.pins;

import java.nio.file.Path;

/**
 * A non-fatal problem with one file during a load. The file contributes no pins but still gets its list.
 */
public record LoadWarning(Path file, Kind kind, String message) {
    public enum Kind {
        /** File missing or unreadable. */
        IO,
        /** File content is not valid JSON / CSV. */
        PARSE,
        /** Valid JSON in none of the supported export formats. */
        SCHEMA
    }

    @Override
    public String toString() {
        return kind + " " + file + ": " + message;
    }
}
