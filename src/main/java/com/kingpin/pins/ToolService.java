package com.kingpin.pins;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Adapter turning query engine results into paginated text for tool callers.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Validates arguments: {@code limit >= 1}, {@code offset >= 0}, coordinates in range, {@code radiusKm > 0}.</li>
 *   <li>Clamps {@code limit} (200 for listing, 100 for search and proximity) and {@code radiusKm} (500).</li>
 *   <li>Takes one {@link QueryServiceInterface} per call so a concurrent reload never mixes two snapshots in one answer.</li>
 *   <li>An offset at or past the end produces an explicit "no more results" message.</li>
 * </ul>
 *
 * @author Kingpin Team
 * @since 1.0
 */
public class ToolService implements ToolServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(ToolService.class);

    public static final int MAX_LIST_LIMIT = 200;
    public static final int MAX_SEARCH_LIMIT = 100;
    public static final double MAX_RADIUS_KM = 500;
    // Extra results requested from the engine beyond limit + offset
    static final int SEARCH_HEADROOM = 50;
    static final double DETAILS_FUZZY_THRESHOLD = 0.6;
    static final int MAX_SUGGESTIONS = 3;

    private final Supplier<? extends QueryServiceInterface> queries;
    private final StringSimilarity similarity;

    public ToolService(PinRepository repository) {
        this(repository::query, new GestaltSimilarity());
    }

    /**
     * @param queries supplies the query service to use for each call
     * @param similarity name similarity used by {@link #getPinDetails(String, boolean)}
     */
    public ToolService(Supplier<? extends QueryServiceInterface> queries, StringSimilarity similarity) {
        this.queries = Objects.requireNonNull(queries, "queries");
        this.similarity = Objects.requireNonNull(similarity, "similarity");
    }

    @Override
    public String listLists() {
        QueryServiceInterface query = queries.get();
        List<PinList> lists = query.getAllLists();
        if (lists.isEmpty()) return "No lists found.";

        StringBuilder result = new StringBuilder();
        result.append(lists.size()).append(" lists:\n");
        int i = 1;
        for (PinList list : lists) {
            int count = query.getPinsByList(list.name()).size();
            result.append(i++).append(". ").append(list.name()).append(" (").append(count).append(")\n");
        }
        return result.toString().stripTrailing();
    }

    @Override
    public String listPins(String listName, int limit, int offset, boolean withLinks) {
        if (limit < 1) return reject("Error: limit must be ≥ 1");
        limit = Math.min(limit, MAX_LIST_LIMIT);
        if (offset < 0) return reject("Error: offset must be ≥ 0");

        QueryServiceInterface query = queries.get();
        boolean allPins = listName == null || listName.isBlank();
        List<Pin> all;
        if (allPins) {
            all = query.getAllPins();
        } else {
            List<String> names = query.getListNames();
            if (!names.contains(listName)) {
                return "List '" + listName + "' not found. Available: " + String.join(", ", names);
            }
            all = query.getPinsByList(listName);
        }

        List<Pin> page = page(all, offset, limit);
        if (page.isEmpty()) {
            if (all.isEmpty()) return "No pins found";
            return "Offset " + offset + " exceeds " + all.size() + " total pins";
        }

        StringBuilder result = new StringBuilder();
        result.append(allPins ? "All pins" : listName)
            .append(": ").append(page.size()).append('/').append(all.size())
            .append(" (from #").append(offset + 1).append(")\n");
        int i = offset + 1;
        for (Pin pin : page) {
            result.append(i++).append(". ").append(pin.name());
            if (allPins) result.append(" (").append(pin.listName()).append(')');
            result.append('\n');
            appendAddressAndNotes(result, pin);
            if (withLinks) appendLink(result, pin);
            result.append('\n');
        }
        return result.toString().stripTrailing();
    }

    @Override
    public String searchPins(String query, int limit, int offset, boolean withLinks) {
        if (query == null || query.isBlank()) return reject("Error: query required");
        if (limit < 1) return reject("Error: limit must be ≥ 1");
        limit = Math.min(limit, MAX_SEARCH_LIMIT);
        if (offset < 0) return reject("Error: offset must be ≥ 0");

        int wanted = (int) Math.min((long) limit + offset + SEARCH_HEADROOM, Integer.MAX_VALUE);
        List<Pin> all = queries.get().searchPlaces(query.strip(), wanted);
        List<Pin> page = page(all, offset, limit);
        if (page.isEmpty()) {
            if (all.isEmpty()) return "No matches for '" + query + "'";
            return "No results at offset " + offset + ". Found " + all.size() + " total matches for '" + query + "'";
        }

        StringBuilder result = new StringBuilder();
        result.append("Search '").append(query).append("': ").append(page.size()).append('/').append(all.size())
            .append(" (from #").append(offset + 1).append(")\n");
        int i = offset + 1;
        for (Pin pin : page) {
            result.append(i++).append(". ").append(pin.name()).append(" (").append(pin.listName()).append(")\n");
            appendAddressAndNotes(result, pin);
            if (withLinks) appendLink(result, pin);
            result.append('\n');
        }
        return result.toString().stripTrailing();
    }

    @Override
    public String getPinDetails(String placeName, boolean withLinks) {
        if (placeName == null || placeName.isBlank()) return reject("Error: place name required");
        String name = placeName.strip();
        String nameLower = name.toLowerCase(Locale.ROOT);
        List<Pin> pins = queries.get().getAllPins();

        Pin found = pins.stream()
            .filter(p -> p.name().toLowerCase(Locale.ROOT).contains(nameLower))
            .findFirst()
            .orElse(null);
        if (found == null) {
            double best = DETAILS_FUZZY_THRESHOLD;
            for (Pin pin : pins) {
                double score = similarity.similarity(nameLower, pin.name().toLowerCase(Locale.ROOT));
                if (score > best) {
                    best = score;
                    found = pin;
                }
            }
        }
        if (found == null) {
            List<String> words = Arrays.asList(nameLower.split("\\s+"));
            List<String> suggestions = pins.stream()
                .filter(p -> words.stream().anyMatch(w -> p.name().toLowerCase(Locale.ROOT).contains(w)))
                .map(Pin::name)
                .limit(MAX_SUGGESTIONS)
                .collect(Collectors.toList());
            if (!suggestions.isEmpty()) {
                return "Not found: '" + name + "'. Try: " + String.join(", ", suggestions);
            }
            return "Not found: '" + name + "'";
        }

        StringBuilder result = new StringBuilder();
        result.append(found.name()).append(" (").append(found.listName()).append(")\n");
        if (found.address() != null) result.append("Address: ").append(found.address()).append('\n');
        if (found.hasCoordinates()) {
            result.append(String.format(Locale.ROOT, "Coordinates: %.6f, %.6f\n", found.latitude(), found.longitude()));
        }
        if (found.notes() != null) result.append("Notes: ").append(found.notes()).append('\n');
        if (!found.categories().isEmpty()) {
            result.append("Categories: ").append(String.join(", ", found.categories())).append('\n');
        }
        if (withLinks) {
            if (found.url() != null) result.append("Direct link: ").append(found.url()).append('\n');
            if (found.hasCoordinates()) result.append("Google Maps: ").append(mapsLink(found)).append('\n');
            if (found.placeId() != null) {
                result.append("Place ID link: https://maps.google.com/place?q=place_id:").append(found.placeId()).append('\n');
            }
        }
        if (found.dateSaved() != null) result.append("Saved: ").append(found.dateSaved()).append('\n');
        return result.toString().stripTrailing();
    }

    @Override
    public String findPinsNear(double latitude, double longitude, double radiusKm, int limit, int offset, boolean withLinks) {
        // written so that NaN fails the range checks
        if (!(latitude >= -90 && latitude <= 90)) return reject("Error: latitude must be -90 to 90");
        if (!(longitude >= -180 && longitude <= 180)) return reject("Error: longitude must be -180 to 180");
        if (!(radiusKm > 0)) return reject("Error: radius must be > 0");
        radiusKm = Math.min(radiusKm, MAX_RADIUS_KM);
        if (limit < 1) return reject("Error: limit must be ≥ 1");
        limit = Math.min(limit, MAX_SEARCH_LIMIT);
        if (offset < 0) return reject("Error: offset must be ≥ 0");

        List<Pin> all = queries.get().getPlacesNear(latitude, longitude, radiusKm);
        List<Pin> page = page(all, offset, limit);
        String radius = formatNumber(radiusKm);
        if (page.isEmpty()) {
            if (all.isEmpty()) {
                return String.format(Locale.ROOT, "No pins within %skm of %.3f,%.3f", radius, latitude, longitude);
            }
            return "No results at offset " + offset + ". Found " + all.size() + " within " + radius + "km";
        }

        StringBuilder result = new StringBuilder();
        result.append("Within ").append(radius).append("km: ").append(page.size()).append('/').append(all.size())
            .append(" (from #").append(offset + 1).append(")\n");
        int i = offset + 1;
        for (Pin pin : page) {
            result.append(i++).append(". ").append(pin.name()).append(" (").append(pin.listName()).append(")\n");
            if (pin.address() != null) result.append("   Address: ").append(pin.address()).append('\n');
            result.append(String.format(Locale.ROOT, "   Location: %.4f,%.4f\n", pin.latitude(), pin.longitude()));
            if (withLinks) appendLink(result, pin);
            result.append('\n');
        }
        return result.toString().stripTrailing();
    }

    private static List<Pin> page(List<Pin> all, int offset, int limit) {
        if (offset >= all.size()) return List.of();
        return new ArrayList<>(all.subList(offset, (int) Math.min((long) offset + limit, all.size())));
    }

    private static void appendAddressAndNotes(StringBuilder result, Pin pin) {
        if (pin.address() != null) result.append("   Address: ").append(pin.address()).append('\n');
        if (pin.notes() != null) result.append("   Notes: ").append(pin.notes()).append('\n');
    }

    private static void appendLink(StringBuilder result, Pin pin) {
        if (pin.url() != null) {
            result.append("   Link: ").append(pin.url()).append('\n');
        } else if (pin.hasCoordinates()) {
            result.append("   Maps: ").append(mapsLink(pin)).append('\n');
        }
    }

    static String mapsLink(Pin pin) {
        return "https://maps.google.com/?q=" + pin.latitude() + "," + pin.longitude();
    }

    static String formatNumber(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }

    private static String reject(String message) {
        logger.warn("Rejected tool call: {}", message);
        return message;
    }
}
