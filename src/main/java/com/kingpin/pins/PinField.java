package com.kingpin.pins;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Represents one canonical pin field together with the keys a flat place export may use for it.
 * <p>
 * The source keys are tried in order; the first one holding a non-blank text value wins.
 */
public class PinField {
    public final String fieldName;
    public final List<String> sourceKeys;

    public PinField(String fieldName, List<String> sourceKeys) {
        this.fieldName = fieldName;
        this.sourceKeys = sourceKeys;
    }

    /**
     * Resolves this field's text value from a JSON object using the fallback chain.
     * @param node JSON object to read (may be null or missing)
     * @return first non-blank text value, or null if none of the keys hold one
     */
    public String resolveText(JsonNode node) {
        if (node == null || !node.isObject()) return null;
        for (String key : sourceKeys) {
            JsonNode value = node.get(key);
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }
}
