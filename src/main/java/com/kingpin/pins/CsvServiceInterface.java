package com.kingpin.pins;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Interface for CSV import and export of pins.
 */
public interface CsvServiceInterface {
    /**
     * Writes a list of pins to a CSV file with a header row of canonical field names.
     * @param pins List of Pin objects to export to CSV
     * @param filename Name of the output CSV file
     * @return path of the written file
     * @throws IOException if file writing fails
     */
    Path writePinsToCSV(List<Pin> pins, String filename) throws IOException;

    /**
     * Reads a Takeout saved-list CSV ({@code Title,Note,URL,...}) into pins.
     * @param file CSV file to read
     * @param listName list the pins belong to
     * @return pins in row order
     * @throws IOException if the file cannot be read or is not valid CSV
     */
    List<Pin> readTakeoutCsv(Path file, String listName) throws IOException;
}
