package com.kingpin.pins;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Linear-scan query engine over an immutable {@link PinCollection}.
 * <p>
 * Search ranking:
 * <ol>
 *   <li>Exact phase: case-insensitive substring match of the query against "name address notes"
 *   (unset fields skipped). Matches keep load order and the scan stops as soon as {@code limit} are found.</li>
 *   <li>Fuzzy phase, only if the exact phase found fewer than {@code limit}: every other pin is scored by
 *   name similarity. A pin is kept if the score exceeds {@value #FUZZY_THRESHOLD}, or with the fixed score
 *   {@value #WORD_MATCH_SCORE} if one of the query's words occurs in its name. Kept pins are sorted by
 *   descending score.</li>
 * </ol>
 * <p>
 * Proximity uses a planar approximation, {@code sqrt(dLat^2 + dLng^2) * 111} km. It is reasonable for small
 * radii at mid latitudes and overestimates east-west distances towards the poles; it is not a great-circle
 * distance.
 *
 * @author Kingpin Team
 * @since 1.0
 */
public class QueryService implements QueryServiceInterface {
    static final double FUZZY_THRESHOLD = 0.5;
    static final double WORD_MATCH_SCORE = 0.4;
    static final double KM_PER_DEGREE = 111;
    static final String NO_CATEGORY = "other";

    private final PinCollection collection;
    private final StringSimilarity similarity;

    public QueryService(PinCollection collection) {
        this(collection, new GestaltSimilarity());
    }

    public QueryService(PinCollection collection, StringSimilarity similarity) {
        this.collection = Objects.requireNonNull(collection, "collection");
        this.similarity = Objects.requireNonNull(similarity, "similarity");
    }

    /**
     * @return the snapshot this service reads
     */
    public PinCollection collection() {
        return collection;
    }

    @Override
    public List<PinList> getAllLists() {
        return collection.lists();
    }

    @Override
    public List<String> getListNames() {
        return collection.lists().stream().map(PinList::name).collect(Collectors.toList());
    }

    @Override
    public List<Pin> getAllPins() {
        return collection.pins();
    }

    @Override
    public List<Pin> getPinsByList(String listName) {
        return collection.pins().stream()
            .filter(p -> p.listName().equals(listName))
            .collect(Collectors.toList());
    }

    @Override
    public Optional<Pin> getPinByPlaceId(String placeId) {
        return collection.pins().stream().filter(p -> Objects.equals(p.placeId(), placeId)).findFirst();
    }

    @Override
    public Optional<Pin> getPinByExactName(String name) {
        return collection.pins().stream().filter(p -> p.name().equals(name)).findFirst();
    }

    @Override
    public List<Pin> searchPlaces(String query, int limit) {
        String queryLower = query.toLowerCase(Locale.ROOT);
        List<Pin> pins = collection.pins();
        List<Pin> exact = new ArrayList<>();
        boolean[] matched = new boolean[pins.size()];

        for (int i = 0; i < pins.size() && exact.size() < limit; i++) {
            if (searchableText(pins.get(i)).contains(queryLower)) {
                exact.add(pins.get(i));
                matched[i] = true;
            }
        }
        if (exact.size() >= limit) return exact;

        String[] words = queryLower.trim().split("\\s+");
        List<ScoredPin> fuzzy = new ArrayList<>();
        for (int i = 0; i < pins.size(); i++) {
            if (matched[i]) continue;
            Pin pin = pins.get(i);
            String nameLower = pin.name().toLowerCase(Locale.ROOT);
            double score = similarity.similarity(queryLower, nameLower);
            if (score > FUZZY_THRESHOLD) {
                fuzzy.add(new ScoredPin(pin, score));
            } else if (containsAnyWord(nameLower, words)) {
                fuzzy.add(new ScoredPin(pin, WORD_MATCH_SCORE));
            }
        }
        fuzzy.sort(Comparator.comparingDouble(ScoredPin::score).reversed());

        List<Pin> results = new ArrayList<>(exact);
        for (ScoredPin scored : fuzzy) {
            if (results.size() >= limit) break;
            results.add(scored.pin());
        }
        return results;
    }

    @Override
    public List<Pin> getPlacesNear(double latitude, double longitude, double radiusKm) {
        return collection.pins().stream()
            .filter(Pin::hasCoordinates)
            .filter(p -> planarDistanceKm(latitude, longitude, p.latitude(), p.longitude()) <= radiusKm)
            .collect(Collectors.toList());
    }

    @Override
    public List<Pin> getPlacesByCategory(String category) {
        return collection.pins().stream()
            .filter(p -> p.categories().stream().anyMatch(c -> c.equalsIgnoreCase(category)))
            .collect(Collectors.toList());
    }

    @Override
    public List<String> getAllCategories() {
        TreeSet<String> categories = new TreeSet<>();
        for (Pin pin : collection.pins()) categories.addAll(pin.categories());
        return new ArrayList<>(categories);
    }

    /**
     * Each pin goes to the least common of its categories that is shared by at least {@code minGroupSize}
     * pins (ties broken by name). Pins with no such category fall back to their least common category,
     * and pins without categories to {@value #NO_CATEGORY}. Groups appear in first-seen order.
     */
    @Override
    public Map<String, List<Pin>> groupByCategory(List<Pin> pins, int minGroupSize) {
        Map<String, Integer> counts = new HashMap<>();
        for (Pin pin : pins) {
            for (String category : pin.categories()) counts.merge(category, 1, Integer::sum);
        }
        Map<String, List<Pin>> grouped = new LinkedHashMap<>();
        for (Pin pin : pins) {
            List<String> sorted = pin.categories().stream()
                .sorted(Comparator.<String>comparingInt(counts::get).thenComparing(Comparator.naturalOrder()))
                .collect(Collectors.toList());
            String selected = sorted.stream()
                .filter(c -> counts.get(c) >= minGroupSize)
                .findFirst()
                .orElse(sorted.isEmpty() ? NO_CATEGORY : sorted.get(0));
            grouped.computeIfAbsent(selected, k -> new ArrayList<>()).add(pin);
        }
        return grouped;
    }

    /**
     * Planar distance approximation in kilometres, see the class documentation for its limits.
     */
    public static double planarDistanceKm(double lat1, double lng1, double lat2, double lng2) {
        double dLat = lat1 - lat2;
        double dLng = lng1 - lng2;
        return Math.sqrt(dLat * dLat + dLng * dLng) * KM_PER_DEGREE;
    }

    private static String searchableText(Pin pin) {
        return Stream.of(pin.name(), pin.address(), pin.notes())
            .filter(Objects::nonNull)
            .collect(Collectors.joining(" "))
            .toLowerCase(Locale.ROOT);
    }

    private static boolean containsAnyWord(String nameLower, String[] words) {
        for (String word : words) {
            if (!word.isEmpty() && nameLower.contains(word)) return true;
        }
        return false;
    }

    private record ScoredPin(Pin pin, double score) {}
}
