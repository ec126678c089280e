package com.kingpin.pins;

import java.util.ArrayList;
import java.util.List;

/**
 * Central registry of the canonical pin fields.
 * Provides the output names used for JSON, CSV export and the DB schema, and the
 * fallback chains used to read flat place exports.
 */
public final class PinFieldRegistry {
    private PinFieldRegistry() {}

    public static final PinField NAME = new PinField("name", List.of("name", "title"));
    public static final PinField ADDRESS = new PinField("address", List.of("address"));
    public static final PinField LATITUDE = new PinField("latitude", List.of());
    public static final PinField LONGITUDE = new PinField("longitude", List.of());
    public static final PinField PLACE_ID = new PinField("place_id", List.of("placeId", "place_id"));
    public static final PinField NOTES = new PinField("notes", List.of("comment", "note", "notes"));
    public static final PinField DATE_SAVED = new PinField("date_saved", List.of("date", "date_saved"));
    public static final PinField URL = new PinField("url", List.of("url"));
    public static final PinField LIST_ID = new PinField("list_id", List.of());
    public static final PinField CATEGORIES = new PinField("categories", List.of("categories"));
    public static final PinField RATING = new PinField("rating", List.of("rating"));

    // Output order for CSV export
    private static final List<PinField> FIELDS = List.of(
        NAME, ADDRESS, LATITUDE, LONGITUDE, PLACE_ID, NOTES, DATE_SAVED, URL, LIST_ID, CATEGORIES, RATING
    );

    /**
     * Returns the list of all pin fields in output order.
     */
    public static List<PinField> getFields() {
        return FIELDS;
    }

    /**
     * Returns the list of all field names in output order.
     */
    public static List<String> getFieldNames() {
        List<String> names = new ArrayList<>();
        for (PinField f : FIELDS) names.add(f.fieldName);
        return names;
    }

    /**
     * Returns the PinField for a given field name, or null if not found.
     */
    public static PinField getField(String name) {
        for (PinField f : FIELDS) if (f.fieldName.equals(name)) return f;
        return null;
    }
}
