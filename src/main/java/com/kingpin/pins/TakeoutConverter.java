package com.kingpin.pins;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.kingpin.pins.JsonShapes.*;

/**
 * Converter for flat Takeout place exports: a single place object or an array of them.
 * <p>
 * This is the fallback format, so any JSON object is a candidate as long as the fields it reads have the
 * right types. Text fields are resolved through the fallback chains in {@link PinFieldRegistry}
 * (e.g. name from {@code name}, then {@code title}). Coordinates come from {@code location.latitudeE7} /
 * {@code location.longitudeE7}, else from plain {@code latitude} / {@code longitude} numbers as written by
 * the pin JSON serialization.
 */
public class TakeoutConverter implements PlaceFormatConverter {
    private static final Logger logger = LoggerFactory.getLogger(TakeoutConverter.class);

    private static final List<PinField> TEXT_FIELDS = List.of(
        PinFieldRegistry.NAME, PinFieldRegistry.ADDRESS, PinFieldRegistry.PLACE_ID,
        PinFieldRegistry.NOTES, PinFieldRegistry.DATE_SAVED, PinFieldRegistry.URL
    );

    @Override
    public String formatName() {
        return "takeout";
    }

    @Override
    public boolean accepts(JsonNode root) {
        if (root == null) return false;
        if (root.isObject()) return isValidPlace(root);
        if (!root.isArray()) return false;
        int index = 0;
        for (JsonNode place : root) {
            if (!isValidPlace(place)) {
                logger.debug("Entry #{} does not match the Takeout place shape: {}", index, place);
                return false;
            }
            index++;
        }
        return true;
    }

    private boolean isValidPlace(JsonNode place) {
        if (!place.isObject()) return false;
        for (PinField field : TEXT_FIELDS) {
            for (String key : field.sourceKeys) {
                if (!optionalText(place, key)) return false;
            }
        }
        if (!optionalNumber(place, "latitude") || !optionalNumber(place, "longitude")) return false;
        if (!optionalTextArray(place, "categories") || !optionalNumber(place, "rating")) return false;
        if (!optionalObject(place, "location")) return false;
        JsonNode location = child(place, "location");
        return location == null || (optionalText(location, "address")
            && optionalInteger(location, "latitudeE7") && optionalInteger(location, "longitudeE7"));
    }

    @Override
    public List<Pin> convert(JsonNode root, String listName) {
        List<Pin> pins = new ArrayList<>();
        if (root.isObject()) {
            pins.add(convertPlace(root, listName));
        } else {
            for (JsonNode place : root) {
                pins.add(convertPlace(place, listName));
            }
        }
        return pins;
    }

    private Pin convertPlace(JsonNode place, String listName) {
        JsonNode location = child(place, "location");
        Double latitude = e7(location, "latitudeE7");
        Double longitude = e7(location, "longitudeE7");
        if (latitude == null || longitude == null) {
            latitude = number(place, "latitude");
            longitude = number(place, "longitude");
        }
        return new Pin(
            PinFieldRegistry.NAME.resolveText(place),
            firstText(text(location, "address"), PinFieldRegistry.ADDRESS.resolveText(place)),
            latitude,
            longitude,
            PinFieldRegistry.PLACE_ID.resolveText(place),
            PinFieldRegistry.NOTES.resolveText(place),
            PinFieldRegistry.DATE_SAVED.resolveText(place),
            PinFieldRegistry.URL.resolveText(place),
            listName,
            textList(place, "categories"),
            number(place, "rating")
        );
    }
}
