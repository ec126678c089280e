package com.kingpin.pins;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural checks and value readers for Jackson trees used by the place format converters.
 * <p>
 * "Optional" checks accept a missing field or an explicit JSON null; anything else must have the expected type.
 */
final class JsonShapes {
    private JsonShapes() {}

    static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    static boolean optionalText(JsonNode parent, String field) {
        JsonNode v = parent.get(field);
        return isAbsent(v) || v.isTextual();
    }

    static boolean optionalObject(JsonNode parent, String field) {
        JsonNode v = parent.get(field);
        return isAbsent(v) || v.isObject();
    }

    static boolean optionalNumber(JsonNode parent, String field) {
        JsonNode v = parent.get(field);
        return isAbsent(v) || v.isNumber();
    }

    static boolean optionalInteger(JsonNode parent, String field) {
        JsonNode v = parent.get(field);
        return isAbsent(v) || (v.isNumber() && v.canConvertToExactIntegral());
    }

    static boolean optionalTextArray(JsonNode parent, String field) {
        JsonNode v = parent.get(field);
        if (isAbsent(v)) return true;
        if (!v.isArray()) return false;
        for (JsonNode item : v) {
            if (!item.isTextual()) return false;
        }
        return true;
    }

    static boolean optionalNumberArray(JsonNode parent, String field) {
        JsonNode v = parent.get(field);
        if (isAbsent(v)) return true;
        if (!v.isArray()) return false;
        for (JsonNode item : v) {
            if (!item.isNumber()) return false;
        }
        return true;
    }

    static boolean allText(JsonNode parent, String... fields) {
        for (String field : fields) {
            if (!optionalText(parent, field)) return false;
        }
        return true;
    }

    /**
     * @return the text value, or null when absent or blank
     */
    static String text(JsonNode parent, String field) {
        if (parent == null) return null;
        JsonNode v = parent.get(field);
        if (isAbsent(v) || !v.isTextual() || v.asText().isBlank()) return null;
        return v.asText();
    }

    /**
     * @return the first non-null value, or null if all are null
     */
    static String firstText(String... candidates) {
        for (String c : candidates) {
            if (c != null) return c;
        }
        return null;
    }

    static JsonNode child(JsonNode parent, String field) {
        if (parent == null) return null;
        JsonNode v = parent.get(field);
        return isAbsent(v) ? null : v;
    }

    static Double number(JsonNode parent, String field) {
        JsonNode v = child(parent, field);
        return v != null && v.isNumber() ? v.asDouble() : null;
    }

    /**
     * Decodes a fixed-point (E7) coordinate. Zero or absent values decode to null.
     */
    static Double e7(JsonNode parent, String field) {
        JsonNode v = child(parent, field);
        if (v == null || !v.isNumber()) return null;
        long fixed = v.asLong();
        return fixed == 0 ? null : fixed / 1e7;
    }

    static List<String> textList(JsonNode parent, String field) {
        JsonNode v = child(parent, field);
        List<String> out = new ArrayList<>();
        if (v == null || !v.isArray()) return out;
        for (JsonNode item : v) {
            if (item.isTextual()) out.add(item.asText());
        }
        return out;
    }
}
