package com.kingpin.pins;

import com.opencsv.CSVReader;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CsvServiceTest {
    @TempDir
    Path tempDir;

    @Test
    void testWritePinsToCSV() throws Exception {
        CsvService csvService = new CsvService(tempDir.resolve("exports"));
        Pin pin = new Pin("Joe's Pizza", "7 Carmine St, New York", 40.7306, -74.0021, "place-1", "Best\nslice",
            "2021-03-04", "https://example.com/joes", "Food", List.of("pizza", "food"), 4.5);
        Pin bare = new Pin(null, null, null, null, null, null, null, null, "Food");

        Path written = csvService.writePinsToCSV(List.of(pin, bare), "My Pins.csv");
        assertEquals(tempDir.resolve("exports").resolve("My_Pins.csv"), written);

        List<String[]> rows;
        try (Reader in = Files.newBufferedReader(written, StandardCharsets.UTF_8); CSVReader reader = new CSVReader(in)) {
            rows = reader.readAll();
        }
        assertEquals(3, rows.size());
        assertArrayEquals(PinFieldRegistry.getFieldNames().toArray(String[]::new), rows.get(0));
        assertArrayEquals(new String[]{"Joe's Pizza", "7 Carmine St  New York", "40.7306", "-74.0021", "place-1",
            "Best slice", "2021-03-04", "https://example.com/joes", "Food", "pizza;food", "4.5"}, rows.get(1));
        assertEquals("Unknown", rows.get(2)[0]);
        assertEquals("", rows.get(2)[2]);
    }

    @Test
    void testWritePinsToCSVRejectsBadArguments() {
        CsvService csvService = new CsvService(tempDir);
        assertThrows(IllegalArgumentException.class, () -> csvService.writePinsToCSV(null, "x.csv"));
        assertThrows(IllegalArgumentException.class, () -> csvService.writePinsToCSV(List.of(), "  "));
    }

    @Test
    void testReadTakeoutCsv() throws Exception {
        Path file = Files.writeString(tempDir.resolve("Want to go.csv"),
            "Title,Note,URL,Tags,Comment\n\"Le Bernardin, NYC\",\"tasting menu\",https://example.com/lb,,\n");
        List<Pin> pins = new CsvService(tempDir).readTakeoutCsv(file, "Want to go");
        assertEquals(1, pins.size());
        assertEquals("Le Bernardin, NYC", pins.get(0).name());
        assertEquals("tasting menu", pins.get(0).notes());
        assertEquals("https://example.com/lb", pins.get(0).url());
        assertEquals("Want to go", pins.get(0).listName());
    }

    @Test
    void testReadTakeoutCsvHeaderOnly() throws Exception {
        Path file = Files.writeString(tempDir.resolve("empty.csv"), "Title,Note,URL\n");
        assertTrue(new CsvService(tempDir).readTakeoutCsv(file, "empty").isEmpty());
    }
}
