package com.kingpin.pins;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.kingpin.pins.JsonShapes.*;

/**
 * Converter for shared Google Maps lists: {@code {"list": {"displayName": ..., "listItems": [...]}}}.
 * <p>
 * Each list item has a {@code title}, an optional {@code place} with E7 {@code latLng}, a
 * {@code singleLineAddress} and an id ({@code mid}, else {@code featureId.fprint}), and an optional
 * {@code viewer.url}. This shape carries no notes.
 */
public class MapListConverter implements PlaceFormatConverter {
    private static final Logger logger = LoggerFactory.getLogger(MapListConverter.class);

    @Override
    public String formatName() {
        return "maps-list";
    }

    @Override
    public boolean accepts(JsonNode root) {
        if (root == null || !root.isObject()) return false;
        JsonNode list = root.get("list");
        if (list == null || !list.isObject()) return false;
        if (!optionalText(list, "displayName")) return false;
        JsonNode items = child(list, "listItems");
        if (items == null) return true;
        if (!items.isArray()) return false;
        int index = 0;
        for (JsonNode item : items) {
            if (!isValidItem(item)) {
                logger.debug("List item #{} does not match the Maps list shape: {}", index, item);
                return false;
            }
            index++;
        }
        return true;
    }

    private boolean isValidItem(JsonNode item) {
        if (!item.isObject()) return false;
        if (!allText(item, "title", "createTime", "updateTime")) return false;
        if (!optionalObject(item, "place") || !optionalObject(item, "viewer")) return false;
        JsonNode viewer = child(item, "viewer");
        if (viewer != null && !optionalText(viewer, "url")) return false;
        JsonNode place = child(item, "place");
        if (place == null) return true;
        if (!allText(place, "query", "singleLineAddress", "mid")) return false;
        if (!optionalObject(place, "featureId") || !optionalObject(place, "latLng")) return false;
        JsonNode featureId = child(place, "featureId");
        if (featureId != null && !allText(featureId, "cellId", "fprint")) return false;
        JsonNode latLng = child(place, "latLng");
        return latLng == null || (optionalInteger(latLng, "latE7") && optionalInteger(latLng, "lngE7"));
    }

    @Override
    public List<Pin> convert(JsonNode root, String listName) {
        List<Pin> pins = new ArrayList<>();
        JsonNode items = child(root.get("list"), "listItems");
        if (items == null) return pins;
        for (JsonNode item : items) {
            JsonNode place = child(item, "place");
            JsonNode latLng = child(place, "latLng");
            pins.add(new Pin(
                text(item, "title"),
                text(place, "singleLineAddress"),
                e7(latLng, "latE7"),
                e7(latLng, "lngE7"),
                firstText(text(place, "mid"), text(child(place, "featureId"), "fprint")),
                null,
                text(item, "createTime"),
                text(child(item, "viewer"), "url"),
                listName
            ));
        }
        return pins;
    }
}
