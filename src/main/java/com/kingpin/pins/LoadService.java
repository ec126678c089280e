package com.kingpin.pins;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Service reading export files into a {@link PinCollection}.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Each file gets a {@link PinList} named after its base name before it is read, so a file that fails
 *   still shows up as an (empty) list.</li>
 *   <li>{@code .csv} files go through {@link CsvServiceInterface#readTakeoutCsv}; everything else is parsed as
 *   JSON with Jackson and handed to the {@link PlaceFormatDetector}.</li>
 *   <li>I/O, parse and format failures are logged and collected as {@link LoadWarning}s; the load continues
 *   with the next file.</li>
 * </ul>
 *
 * @author Kingpin Team
 * @since 1.0
 */
public class LoadService implements LoadServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(LoadService.class);

    private final ObjectMapper mapper;
    private final PlaceFormatDetector detector;
    private final CsvServiceInterface csvService;
    private final Clock clock;

    public LoadService() {
        this(new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS), new PlaceFormatDetector(), new CsvService(), Clock.systemUTC());
    }

    public LoadService(ObjectMapper mapper, PlaceFormatDetector detector, CsvServiceInterface csvService, Clock clock) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.detector = Objects.requireNonNull(detector, "detector");
        this.csvService = Objects.requireNonNull(csvService, "csvService");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public PinCollection load(List<Path> files) {
        List<Pin> pins = new ArrayList<>();
        List<PinList> lists = new ArrayList<>();
        List<LoadWarning> warnings = new ArrayList<>();

        for (Path file : files) {
            String listName = Utils.listNameFor(file);
            lists.add(new PinList(listName));
            logger.info("Loading data from: {}", file);
            try {
                List<Pin> fromFile = Utils.isCsv(file) ? csvService.readTakeoutCsv(file, listName) : readJson(file, listName);
                pins.addAll(fromFile);
                logger.info("Loaded {} pins from {}", fromFile.size(), file.getFileName());
            } catch (JsonProcessingException e) {
                warn(warnings, file, LoadWarning.Kind.PARSE, e.getOriginalMessage());
            } catch (UnrecognizedFormatException e) {
                warn(warnings, file, LoadWarning.Kind.SCHEMA, e.getMessage());
            } catch (IOException e) {
                // CSV syntax errors are wrapped as IOException by the CSV service
                LoadWarning.Kind kind = Files.isRegularFile(file) && Files.isReadable(file) ? LoadWarning.Kind.PARSE : LoadWarning.Kind.IO;
                warn(warnings, file, kind, String.valueOf(e.getMessage()));
            }
        }

        logger.info("Total loaded: {} pins from {} files ({} with problems)", pins.size(), files.size(), warnings.size());
        return new PinCollection(pins, lists, warnings, 0, clock.instant());
    }

    private List<Pin> readJson(Path file, String listName) throws IOException, UnrecognizedFormatException {
        String content = Files.readString(file, StandardCharsets.UTF_8);
        JsonNode root = mapper.readTree(content);
        if (root == null || root.isMissingNode()) {
            throw new JsonParseException((JsonParser) null, "No JSON content in file");
        }
        return detector.convert(root, listName);
    }

    private static void warn(List<LoadWarning> warnings, Path file, LoadWarning.Kind kind, String message) {
        LoadWarning warning = new LoadWarning(file, kind, message);
        logger.warn("Error loading data from {} ({}): {}", file, kind, message);
        warnings.add(warning);
    }
}
