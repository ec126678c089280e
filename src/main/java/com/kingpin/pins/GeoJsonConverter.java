package com.kingpin.pins;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.kingpin.pins.JsonShapes.*;

/**
 * Converter for GeoJSON feature collections (the "starred places" export).
 * <p>
 * Field resolution:
 * <ul>
 *   <li>name: {@code properties.location.name}, then {@code properties.name}, then {@link Pin#UNKNOWN_NAME}.</li>
 *   <li>address: {@code properties.location.address}, then {@code properties.address}.</li>
 *   <li>coordinates: {@code geometry.coordinates} is {@code [lng, lat]}; a zero value counts as missing.</li>
 *   <li>url: {@code properties.google_maps_url}, then {@code properties.url}.</li>
 *   <li>notes: {@code properties.comment}.</li>
 * </ul>
 */
public class GeoJsonConverter implements PlaceFormatConverter {
    private static final Logger logger = LoggerFactory.getLogger(GeoJsonConverter.class);

    @Override
    public String formatName() {
        return "geojson";
    }

    @Override
    public boolean accepts(JsonNode root) {
        if (root == null || !root.isObject()) return false;
        JsonNode features = root.get("features");
        if (features == null || !features.isArray()) return false;
        if (!optionalText(root, "type")) return false;
        int index = 0;
        for (JsonNode feature : features) {
            if (!isValidFeature(feature)) {
                logger.debug("Feature #{} does not match the GeoJSON shape: {}", index, feature);
                return false;
            }
            index++;
        }
        return true;
    }

    private boolean isValidFeature(JsonNode feature) {
        if (!feature.isObject() || !optionalText(feature, "type")) return false;
        JsonNode geometry = feature.get("geometry");
        if (geometry == null || !geometry.isObject()) return false;
        if (!optionalText(geometry, "type") || !optionalNumberArray(geometry, "coordinates")) return false;
        JsonNode properties = feature.get("properties");
        if (properties == null || !properties.isObject()) return false;
        if (!allText(properties, "name", "address", "place_id", "comment", "date", "url", "google_maps_url")) return false;
        if (!optionalTextArray(properties, "categories") || !optionalNumber(properties, "rating")) return false;
        if (!optionalObject(properties, "location")) return false;
        JsonNode location = child(properties, "location");
        return location == null || allText(location, "name", "address", "country_code");
    }

    @Override
    public List<Pin> convert(JsonNode root, String listName) {
        List<Pin> pins = new ArrayList<>();
        for (JsonNode feature : root.get("features")) {
            pins.add(convertFeature(feature, listName));
        }
        return pins;
    }

    private Pin convertFeature(JsonNode feature, String listName) {
        JsonNode properties = feature.get("properties");
        JsonNode location = child(properties, "location");
        JsonNode coordinates = child(feature.get("geometry"), "coordinates");

        Double latitude = null;
        Double longitude = null;
        if (coordinates != null && coordinates.size() >= 2) {
            double lng = coordinates.get(0).asDouble();
            double lat = coordinates.get(1).asDouble();
            // partial exports default missing coordinates to 0
            if (lat != 0) latitude = lat;
            if (lng != 0) longitude = lng;
        }

        return new Pin(
            firstText(text(location, "name"), text(properties, "name")),
            firstText(text(location, "address"), text(properties, "address")),
            latitude,
            longitude,
            text(properties, "place_id"),
            text(properties, "comment"),
            text(properties, "date"),
            firstText(text(properties, "google_maps_url"), text(properties, "url")),
            listName,
            textList(properties, "categories"),
            number(properties, "rating")
        );
    }
}
