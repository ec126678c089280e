package com.kingpin.pins;

/**
 * Text-producing operations exposed to remote tool callers and the command line.
 * <p>
 * Every operation validates its arguments and reports violations as an {@code "Error: ..."} result instead of
 * throwing. {@code limit} and {@code radiusKm} above their ceilings are clamped.
 */
public interface ToolServiceInterface {
    /**
     * Lists all lists with their pin counts.
     */
    String listLists();

    /**
     * Lists pins of one list (or all pins when {@code listName} is null/blank) with pagination.
     * @param listName list name, or null for all pins
     * @param limit page size, 1..{@value ToolService#MAX_LIST_LIMIT}
     * @param offset number of pins to skip, >= 0
     * @param withLinks include map links
     */
    String listPins(String listName, int limit, int offset, boolean withLinks);

    /**
     * Searches pins with exact and fuzzy matching and pagination.
     * @param query search text, required
     * @param limit page size, 1..{@value ToolService#MAX_SEARCH_LIMIT}
     * @param offset number of results to skip, >= 0
     * @param withLinks include map links
     */
    String searchPins(String query, int limit, int offset, boolean withLinks);

    /**
     * Describes the best pin for a name or partial name.
     * @param placeName name or part of a name
     * @param withLinks include direct, coordinate and place-id links
     */
    String getPinDetails(String placeName, boolean withLinks);

    /**
     * Finds pins near a point with pagination.
     * @param latitude -90..90
     * @param longitude -180..180
     * @param radiusKm > 0, clamped to {@value ToolService#MAX_RADIUS_KM}
     * @param limit page size, 1..{@value ToolService#MAX_SEARCH_LIMIT}
     * @param offset number of results to skip, >= 0
     * @param withLinks include map links
     */
    String findPinsNear(double latitude, double longitude, double radiusKm, int limit, int offset, boolean withLinks);
}
