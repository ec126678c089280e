package com.kingpin.pins;

import com.opencsv.CSVReader;
import com.opencsv.CSVWriter;
import com.opencsv.exceptions.CsvException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Service for CSV files using OpenCSV.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Import: Takeout saved lists ("Want to go", "Favourites", ...) are exported as CSV with a
 *   {@code Title,Note,URL} header. Each row becomes a pin without address or coordinates.</li>
 *   <li>Export: writes every canonical field in {@link PinFieldRegistry} order into the export directory.</li>
 * </ul>
 *
 * @author Kingpin Team
 * @since 1.0
 */
public class CsvService implements CsvServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(CsvService.class);

    private final Path exportDir;

    public CsvService() {
        this(Path.of(PinConfig.DEFAULT_EXPORT_DIR));
    }

    /**
     * @param exportDir directory CSV exports are written into
     */
    public CsvService(Path exportDir) {
        this.exportDir = exportDir;
    }

    /**
     * Writes a list of pins to a CSV file.
     * @param pins List of Pin records to export
     * @param filename Output CSV filename, sanitized before use
     * @return path of the written file
     * @throws IOException if file writing fails
     */
    @Override
    public Path writePinsToCSV(List<Pin> pins, String filename) throws IOException {
        if (pins == null) {
            logger.warn("Attempted to write null pin list to CSV: {}", filename);
            throw new IllegalArgumentException("Pin list cannot be null");
        }
        if (filename == null || filename.trim().isEmpty()) {
            logger.warn("Attempted to write CSV with invalid filename: {}", filename);
            throw new IllegalArgumentException("Filename cannot be null or empty");
        }
        Files.createDirectories(exportDir);
        Path target = exportDir.resolve(Utils.sanitizeFilename(filename));
        try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(out)) {
            writer.writeNext(PinFieldRegistry.getFieldNames().toArray(String[]::new));
            for (Pin pin : pins) {
                writer.writeNext(new String[]{
                    safe(pin.name()),
                    safe(pin.address()),
                    pin.latitude() == null ? "" : pin.latitude().toString(),
                    pin.longitude() == null ? "" : pin.longitude().toString(),
                    safe(pin.placeId()),
                    safe(pin.notes()),
                    safe(pin.dateSaved()),
                    safe(pin.url()),
                    safe(pin.listName()),
                    safe(String.join(";", pin.categories())),
                    pin.rating() == null ? "" : pin.rating().toString()
                });
            }
        }
        logger.info("Wrote {} pins to CSV file: {}", pins.size(), target);
        return target;
    }

    /**
     * Reads a Takeout saved-list CSV. The header row is skipped; blank cells become unset fields.
     * @param file CSV file to read
     * @param listName list the pins belong to
     * @return pins in row order
     * @throws IOException if the file cannot be read or parsed
     */
    @Override
    public List<Pin> readTakeoutCsv(Path file, String listName) throws IOException {
        List<String[]> rows;
        try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVReader reader = new CSVReader(in)) {
            rows = reader.readAll();
        } catch (CsvException e) {
            throw new IOException("Invalid CSV at line " + e.getLineNumber() + ": " + e.getMessage(), e);
        }
        List<Pin> pins = new ArrayList<>();
        for (int i = 1; i < rows.size(); i++) {
            String[] row = rows.get(i);
            if (row.length == 0 || (row.length == 1 && row[0].isBlank())) continue;
            pins.add(new Pin(cell(row, 0), null, null, null, null, cell(row, 1), null, cell(row, 2), listName));
        }
        logger.debug("Read {} rows from Takeout CSV {}", pins.size(), file);
        return pins;
    }

    private static String cell(String[] row, int index) {
        if (index >= row.length) return null;
        String value = row[index].trim();
        return value.isEmpty() ? null : value;
    }

    /**
     * Safely converts a string for CSV output, removing commas and newlines.
     * @param s Input string
     * @return Sanitized string
     */
    private static String safe(String s) {
        // Replace commas with space and collapse any CR/LF characters into a single space, then trim
        return s == null ? "" : s.replace(",", " ").replaceAll("[\\r\\n]+", " ").trim();
    }
}
