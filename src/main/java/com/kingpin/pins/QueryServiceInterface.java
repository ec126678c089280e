package com.kingpin.pins;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only queries over one loaded pin snapshot. Arguments are expected to be validated by the caller
 * (see {@link ToolService}); no clamping happens here.
 */
public interface QueryServiceInterface {
    /** All lists in load order. */
    List<PinList> getAllLists();

    /** Names of all lists in load order. */
    List<String> getListNames();

    /** All pins in load order. */
    List<Pin> getAllPins();

    /** Pins whose list name equals {@code listName}, in load order. */
    List<Pin> getPinsByList(String listName);

    /** First pin with the given place id. */
    Optional<Pin> getPinByPlaceId(String placeId);

    /** First pin whose name equals {@code name} exactly. */
    Optional<Pin> getPinByExactName(String name);

    /**
     * Substring matches in load order, followed by fuzzy name matches by descending score.
     * @param query search text
     * @param limit maximum number of results
     * @return at most {@code limit} pins
     */
    List<Pin> searchPlaces(String query, int limit);

    /**
     * Pins with coordinates within {@code radiusKm} of the given point, using the planar approximation.
     */
    List<Pin> getPlacesNear(double latitude, double longitude, double radiusKm);

    /** Pins carrying the category, compared case-insensitively. */
    List<Pin> getPlacesByCategory(String category);

    /** Sorted, de-duplicated union of all categories. */
    List<String> getAllCategories();

    /**
     * Groups pins by their most specific category that has at least {@code minGroupSize} members.
     */
    Map<String, List<Pin>> groupByCategory(List<Pin> pins, int minGroupSize);
}
