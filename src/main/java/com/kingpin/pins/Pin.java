package com.kingpin.pins;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Immutable record representing one saved place ("pin") normalized from a mapping export.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Built by a {@link PlaceFormatConverter} (or the Takeout CSV reader in {@link CsvService}) while a file is loaded.</li>
 *   <li>{@code listName} is the base name of the source file; every pin belongs to exactly one {@link PinList}.</li>
 *   <li>Coordinates are kept as a pair: when either side is missing both are dropped.</li>
 *   <li>{@code categories} and {@code rating} are only present in some exports and may be empty/null.</li>
 * </ul>
 * <p>
 * Serialized with Jackson using the snake_case names of {@link PinFieldRegistry}; unset fields are omitted.
 *
 * @author Kingpin Team
 * @since 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Pin(
    @JsonProperty("name") String name,
    @JsonProperty("address") String address,
    @JsonProperty("latitude") Double latitude,
    @JsonProperty("longitude") Double longitude,
    @JsonProperty("place_id") String placeId,
    @JsonProperty("notes") String notes,
    @JsonProperty("date_saved") String dateSaved,
    @JsonProperty("url") String url,
    @JsonProperty("list_id") String listName,
    @JsonProperty("categories") @JsonInclude(JsonInclude.Include.NON_EMPTY) List<String> categories,
    @JsonProperty("rating") Double rating
) {
    /** Name used when a source entry carries no usable name. */
    public static final String UNKNOWN_NAME = "Unknown";

    public Pin {
        Objects.requireNonNull(listName, "listName");
        if (name == null || name.isBlank()) name = UNKNOWN_NAME;
        if (latitude == null || longitude == null) {
            latitude = null;
            longitude = null;
        }
        categories = categories == null ? List.of() : List.copyOf(categories);
    }

    /**
     * Short form used by converters for exports without categories or rating.
     */
    public Pin(String name, String address, Double latitude, Double longitude, String placeId,
               String notes, String dateSaved, String url, String listName) {
        this(name, address, latitude, longitude, placeId, notes, dateSaved, url, listName, List.of(), null);
    }

    /**
     * @return true when both coordinates are set
     */
    public boolean hasCoordinates() {
        return latitude != null && longitude != null;
    }
}
