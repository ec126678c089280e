package com.kingpin.pins;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Main test suite for the saved places tool.
 * Covers the helpers, the pin records, configuration and the command line entry point.
 */
public class MainTest {
    @TempDir
    Path tempDir;

    @Test
    void testSanitizeFilename() {
        String input = "My:Pins/Name?*<>|";
        String sanitized = Utils.sanitizeFilename(input);
        assertEquals("My_Pins_Name______", sanitized);
        assertEquals("", Utils.sanitizeFilename(null));
    }

    @Test
    void testListNameForStripsDirectoryAndExtension() {
        assertEquals("Want to go", Utils.listNameFor(Path.of("exports", "Want to go.json")));
        assertEquals("archive.v2", Utils.listNameFor(Path.of("archive.v2.csv")));
        assertEquals(".hidden", Utils.listNameFor(Path.of(".hidden")));
    }

    @Test
    void testFindDataFilesWalksDirectoriesAndSorts() throws IOException {
        Path nested = Files.createDirectories(tempDir.resolve("nested"));
        Files.writeString(tempDir.resolve("b.json"), "[]");
        Files.writeString(nested.resolve("a.CSV"), "Title,Note,URL\n");
        Files.writeString(tempDir.resolve("readme.txt"), "not data");

        List<Path> files = Utils.findDataFiles(tempDir);
        assertEquals(List.of(tempDir.resolve("b.json"), nested.resolve("a.CSV")), files);
        assertEquals(List.of(tempDir.resolve("b.json")), Utils.findDataFiles(tempDir.resolve("b.json")));
        assertTrue(Utils.findDataFiles(tempDir.resolve("missing")).isEmpty());
    }

    @Test
    void testPinFieldRegistryGetField() {
        PinField field = PinFieldRegistry.getField("notes");
        assertNotNull(field);
        assertEquals("notes", field.fieldName);
        assertEquals(List.of("comment", "note", "notes"), field.sourceKeys);
        assertNull(PinFieldRegistry.getField("nope"));
        assertEquals(PinFieldRegistry.getFields().size(), PinFieldRegistry.getFieldNames().size());
    }

    @Test
    void testPinRecordDefaults() {
        Pin pin = new Pin("  ", null, 40.0, null, null, null, null, null, "Starred");
        assertEquals(Pin.UNKNOWN_NAME, pin.name());
        assertNull(pin.latitude());
        assertNull(pin.longitude());
        assertFalse(pin.hasCoordinates());
        assertTrue(pin.categories().isEmpty());
        assertThrows(NullPointerException.class, () -> new Pin("x", null, null, null, null, null, null, null, null));
    }

    @Test
    void testPinListRecord() {
        PinList list = new PinList("Favourites");
        assertEquals("Favourites", list.name());
        assertEquals(PinList.CUSTOM, list.kind());
    }

    @Test
    void testPinConfigPrecedenceAndFallbacks() {
        PinConfig config = new PinConfig(Map.of(
            "KINGPIN_DATA_PATH", "/srv/pins",
            "KINGPIN_DEFAULT_RADIUS_KM", "2.5",
            "EMBEDDED_PG_PORT", "not-a-port"));
        assertEquals(Path.of("/srv/pins"), config.dataPath());
        assertEquals(2.5, config.defaultRadiusKm());
        assertEquals(PinConfig.DEFAULT_PG_PORT, config.embeddedPgPort());
        assertEquals(Path.of(PinConfig.DEFAULT_EXPORT_DIR), config.exportDir());
        assertEquals(PinConfig.DEFAULT_PG_DATA_DIR, config.embeddedPgDataDir());

        PinConfig defaults = new PinConfig(Map.of());
        assertEquals(Path.of(PinConfig.DEFAULT_DATA_PATH), defaults.dataPath());
        assertEquals(PinConfig.DEFAULT_RADIUS_KM, defaults.defaultRadiusKm());
    }

    @Test
    void testRunWithoutCommandPrintsUsage() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        int code = Main.run(new String[0], new PrintStream(buffer, true, StandardCharsets.UTF_8), new PinConfig(Map.of()));
        assertEquals(2, code);
        assertTrue(buffer.toString(StandardCharsets.UTF_8).startsWith("Usage: kingpin"));
    }

    @Test
    void testRunCommandsAgainstDataDirectory() throws IOException {
        Files.writeString(tempDir.resolve("Coffee.json"),
            "[{\"name\": \"Blue Bottle\", \"latitude\": 40.7428, \"longitude\": -74.006, \"categories\": [\"cafe\"]},"
                + " {\"name\": \"Stumptown\", \"latitude\": 40.7455, \"longitude\": -73.988, \"categories\": [\"cafe\"]}]");
        Files.writeString(tempDir.resolve("broken.json"), "{not json");
        PinConfig config = new PinConfig(Map.of(
            "KINGPIN_DATA_PATH", tempDir.toString(),
            "KINGPIN_EXPORT_DIR", tempDir.resolve("out").toString()));

        String lists = runAndCapture(config, 0, "lists");
        assertTrue(lists.contains("2 lists:"));
        assertTrue(lists.contains("1. Coffee (2)"));
        assertTrue(lists.contains("2. broken (0)"));

        String search = runAndCapture(config, 0, "search", "blue");
        assertTrue(search.contains("1. Blue Bottle (Coffee)"));

        String near = runAndCapture(config, 0, "near", "40.7428", "-74.006", "1");
        assertTrue(near.contains("Within 1km: 1/1"));

        assertTrue(runAndCapture(config, 0, "categories").contains("cafe (2)"));
        assertTrue(runAndCapture(config, 0, "groups").contains("cafe (2)\n   Blue Bottle\n   Stumptown"));

        String category = runAndCapture(config, 0, "category", "Cafe");
        assertTrue(category.contains("2 pins in category 'Cafe':\n  1. Blue Bottle\n  2. Stumptown"), category);
        assertTrue(runAndCapture(config, 0, "category", "bar").contains("No pins found in category 'bar'"));
        assertTrue(runAndCapture(config, 2, "category").startsWith("Usage:"));

        String stats = runAndCapture(config, 0, "stats");
        assertTrue(stats.contains("Total pins: 2"));
        assertTrue(stats.contains("Categories: 1"));
        assertTrue(stats.contains("Pins with coordinates: 2"));
        assertTrue(stats.contains("Pins with notes: 0"));
        assertTrue(stats.contains("Pins with ratings: 0"));
        assertTrue(runAndCapture(config, 2, "near", "north", "south").startsWith("Error: invalid number"));
        assertTrue(runAndCapture(config, 2, "frobnicate").startsWith("Usage:"));

        String export = runAndCapture(config, 0, "export", "all pins.csv");
        assertTrue(export.startsWith("Exported 2 pins"));
        assertTrue(Files.exists(tempDir.resolve("out").resolve("all_pins.csv")));
    }

    @Test
    void testDatabaseCommandsAfterImport() throws IOException {
        Files.writeString(tempDir.resolve("Coffee.json"),
            "[{\"name\": \"Blue Bottle\", \"url\": \"https://example.com/blue\"}, {\"name\": \"Stumptown\"}]");
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        PinConfig config = new PinConfig(Map.of(
            "KINGPIN_DATA_PATH", tempDir.toString(),
            "EMBEDDED_PG_DATA_DIR", tempDir.resolve("pg").toString(),
            "EMBEDDED_PG_PORT", String.valueOf(port)));

        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        int imported = Main.run(new String[]{"import"}, new PrintStream(buffer, true, StandardCharsets.UTF_8), config);
        assumeTrue(imported == 0, "embedded PostgreSQL not available: " + buffer.toString(StandardCharsets.UTF_8));
        assertTrue(buffer.toString(StandardCharsets.UTF_8).startsWith("Imported 2 pins"));

        assertTrue(runAndCapture(config, 0, "stored", "Coffee").startsWith("2 stored pins:\n  1. Blue Bottle\n  2. Stumptown"));
        assertTrue(runAndCapture(config, 0, "has", "https://example.com/blue").startsWith("Stored: https://example.com/blue"));
        assertTrue(runAndCapture(config, 1, "has", "https://example.com/gone").startsWith("Not stored:"));

        assertTrue(runAndCapture(config, 0, "delete", "Blue").startsWith("Deleted 1 pins named 'Blue Bottle'"));
        assertTrue(runAndCapture(config, 1, "rm", "Blue").startsWith("'Blue' not found in the database"));
        assertTrue(runAndCapture(config, 0, "stored").startsWith("1 stored pins:\n  1. Stumptown"));
        assertTrue(runAndCapture(config, 2, "delete").startsWith("Usage:"));
    }

    @Test
    void testRunReportsEmptyDataPath() {
        PinConfig config = new PinConfig(Map.of("KINGPIN_DATA_PATH", tempDir.resolve("missing").toString()));
        String output = runAndCapture(config, 0, "lists");
        assertTrue(output.startsWith("No pins loaded from"));
        assertTrue(output.contains("No lists found."));
    }

    private static String runAndCapture(PinConfig config, int expectedCode, String... args) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        int code = Main.run(args, new PrintStream(buffer, true, StandardCharsets.UTF_8), config);
        String output = buffer.toString(StandardCharsets.UTF_8);
        assertEquals(expectedCode, code, output);
        return output;
    }
}
