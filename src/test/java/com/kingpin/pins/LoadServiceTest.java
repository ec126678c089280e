package com.kingpin.pins;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class LoadServiceTest {
    private static final Instant NOW = Instant.parse("2024-06-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private final LoadService loadService = new LoadService(
        new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS),
        new PlaceFormatDetector(),
        new CsvService(),
        Clock.fixed(NOW, ZoneOffset.UTC));

    private static Path fixtures() throws URISyntaxException {
        return Path.of(LoadServiceTest.class.getResource("/fixtures").toURI());
    }

    @Test
    void testLoadsEveryFixtureFormat() throws Exception {
        List<Path> files = Utils.findDataFiles(fixtures());
        PinCollection collection = loadService.load(files);

        assertTrue(collection.warnings().isEmpty(), collection.warnings().toString());
        assertEquals(List.of("Favourites", "Saved Places", "Starred places", "Want to go"),
            collection.lists().stream().map(PinList::name).collect(Collectors.toList()));
        assertEquals(12, collection.pins().size());
        assertEquals(NOW, collection.loadedAt());
        assertEquals(0, collection.version());

        // file order, then order within the file
        assertEquals("Katz's Delicatessen", collection.pins().get(0).name());
        assertEquals("Blue Bottle Coffee", collection.pins().get(3).name());
        assertEquals("Joe's Pizza", collection.pins().get(6).name());
        assertEquals("Statue of Liberty", collection.pins().get(9).name());
    }

    @Test
    void testMalformedFileKeepsItsListAndReportsParseProblem() throws IOException {
        Path good = Files.writeString(tempDir.resolve("good.json"), "[{\"name\": \"Kept\"}]");
        Path bad = Files.writeString(tempDir.resolve("bad.json"), "{\"features\": [");

        PinCollection collection = loadService.load(List.of(good, bad));
        assertEquals(List.of(new PinList("good"), new PinList("bad")), collection.lists());
        assertEquals(1, collection.pins().size());
        assertEquals("good", collection.pins().get(0).listName());

        assertEquals(1, collection.warnings().size());
        LoadWarning warning = collection.warnings().get(0);
        assertEquals(bad, warning.file());
        assertEquals(LoadWarning.Kind.PARSE, warning.kind());
    }

    @Test
    void testEmptyAndTrailingContentAreParseProblems() throws IOException {
        Path empty = Files.writeString(tempDir.resolve("empty.json"), "   ");
        Path trailing = Files.writeString(tempDir.resolve("trailing.json"), "[] []");

        PinCollection collection = loadService.load(List.of(empty, trailing));
        assertEquals(2, collection.lists().size());
        assertEquals(List.of(LoadWarning.Kind.PARSE, LoadWarning.Kind.PARSE),
            collection.warnings().stream().map(LoadWarning::kind).collect(Collectors.toList()));
    }

    @Test
    void testUnsupportedShapeIsSchemaProblem() throws IOException {
        Path scalar = Files.writeString(tempDir.resolve("scalar.json"), "42");
        PinCollection collection = loadService.load(List.of(scalar));
        assertTrue(collection.isEmpty());
        assertEquals(List.of(new PinList("scalar")), collection.lists());
        assertEquals(LoadWarning.Kind.SCHEMA, collection.warnings().get(0).kind());
    }

    @Test
    void testMissingFileIsIoProblem() {
        Path missing = tempDir.resolve("gone.json");
        PinCollection collection = loadService.load(List.of(missing));
        assertEquals(List.of(new PinList("gone")), collection.lists());
        assertEquals(LoadWarning.Kind.IO, collection.warnings().get(0).kind());
    }

    @Test
    void testDirectoryNamedLikeDataFileIsIoProblem() throws IOException {
        Path folder = Files.createDirectories(tempDir.resolve("folder.json"));
        PinCollection collection = loadService.load(List.of(folder));
        assertEquals(List.of(new PinList("folder")), collection.lists());
        assertEquals(1, collection.warnings().size());
        assertEquals(LoadWarning.Kind.IO, collection.warnings().get(0).kind());
    }

    @Test
    void testEmptyArrayGivesEmptyList() throws IOException {
        Path none = Files.writeString(tempDir.resolve("none.json"), "[]");
        PinCollection collection = loadService.load(List.of(none));
        assertTrue(collection.isEmpty());
        assertTrue(collection.warnings().isEmpty());
        assertEquals(List.of(new PinList("none")), collection.lists());
    }

    @Test
    void testTakeoutCsvRowsBecomePins() throws Exception {
        PinCollection collection = loadService.load(List.of(fixtures().resolve("Favourites.csv")));
        List<Pin> pins = collection.pins();
        assertEquals(3, pins.size());
        assertEquals("Katz's Delicatessen", pins.get(0).name());
        assertEquals("Pastrami", pins.get(0).notes());
        assertEquals("https://www.google.com/maps/place/Katz", pins.get(0).url());
        assertNull(pins.get(1).notes());
        assertEquals(Pin.UNKNOWN_NAME, pins.get(2).name());
        assertEquals("No title here", pins.get(2).notes());
        assertTrue(pins.stream().noneMatch(Pin::hasCoordinates));
    }
}
