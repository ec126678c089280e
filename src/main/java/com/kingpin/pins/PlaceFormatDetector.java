package com.kingpin.pins;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Selects the converter for a parsed export document.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Converters are tried in a fixed priority order: GeoJSON feature collection, Maps list, flat Takeout places.</li>
 *   <li>The first converter whose {@link PlaceFormatConverter#accepts(JsonNode)} passes converts the whole document; results are never combined.</li>
 *   <li>If none accepts, {@link UnrecognizedFormatException} is thrown and no pins are produced.</li>
 * </ul>
 */
public class PlaceFormatDetector {
    private static final Logger logger = LoggerFactory.getLogger(PlaceFormatDetector.class);

    private final List<PlaceFormatConverter> converters;

    public PlaceFormatDetector() {
        this(List.of(new GeoJsonConverter(), new MapListConverter(), new TakeoutConverter()));
    }

    /**
     * @param converters converters in priority order
     */
    public PlaceFormatDetector(List<PlaceFormatConverter> converters) {
        this.converters = List.copyOf(Objects.requireNonNull(converters, "converters"));
    }

    /**
     * Finds the first converter accepting the document.
     * @param root parsed JSON document
     * @return the matching converter, or empty if the document has no supported shape
     */
    public Optional<PlaceFormatConverter> detect(JsonNode root) {
        for (PlaceFormatConverter converter : converters) {
            if (converter.accepts(root)) {
                logger.debug("Detected format '{}'", converter.formatName());
                return Optional.of(converter);
            }
            logger.debug("Format '{}' rejected document", converter.formatName());
        }
        return Optional.empty();
    }

    /**
     * Detects the format of a document and converts it.
     * @param root parsed JSON document
     * @param listName list the pins belong to
     * @return converted pins in document order
     * @throws UnrecognizedFormatException if no converter accepts the document
     */
    public List<Pin> convert(JsonNode root, String listName) throws UnrecognizedFormatException {
        PlaceFormatConverter converter = detect(root)
            .orElseThrow(() -> new UnrecognizedFormatException("Document matches none of the supported formats: "
                + converters.stream().map(PlaceFormatConverter::formatName).toList()));
        return converter.convert(root, listName);
    }
}
