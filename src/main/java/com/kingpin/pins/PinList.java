package com.kingpin.pins;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable record representing a named group of pins, one per loaded file.
 * <p>
 * The name is the file's base name. {@code kind} is always {@link #CUSTOM} for now.
 */
public record PinList(@JsonProperty("name") String name, @JsonProperty("kind") String kind) {
    public static final String CUSTOM = "custom";

    public PinList(String name) {
        this(name, CUSTOM);
    }
}
