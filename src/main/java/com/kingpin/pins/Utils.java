package com.kingpin.pins;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Utility class for common helper methods used in loading and file operations.
 *
 * @author Kingpin Team
 * @since 1.0
 */
public class Utils {
    private static final Logger logger = LoggerFactory.getLogger(Utils.class);

    /**
     * Sanitizes a filename by replacing each special character and whitespace with an underscore.
     * @param name Input filename
     * @return Sanitized filename
     */
    public static String sanitizeFilename(String name) {
        // Replace each invalid character or whitespace with a single underscore
        return name == null ? "" : name.replaceAll("[*?\"<>|/:\\s]", "_");
    }

    /**
     * Derives the list name of a data file: its base name without the final extension.
     * @param file data file path
     * @return list name, e.g. {@code "Want to go"} for {@code exports/Want to go.json}
     */
    public static String listNameFor(Path file) {
        String base = file.getFileName().toString();
        int dot = base.lastIndexOf('.');
        return dot > 0 ? base.substring(0, dot) : base;
    }

    /**
     * Resolves a file or directory into the data files to load.
     * Directories are walked recursively; only {@code .json} and {@code .csv} files are kept, sorted by path.
     * @param path file or directory
     * @return data files, empty if the path is missing or holds none
     */
    public static List<Path> findDataFiles(Path path) {
        if (path == null || !Files.exists(path)) {
            logger.error("Data path does not exist: {}", path);
            return List.of();
        }
        if (Files.isRegularFile(path)) {
            return List.of(path);
        }
        try (Stream<Path> walk = Files.walk(path)) {
            List<Path> files = walk
                .filter(Files::isRegularFile)
                .filter(Utils::isDataFile)
                .sorted()
                .collect(Collectors.toList());
            if (files.isEmpty()) {
                logger.error("No JSON or CSV files found in {}", path);
            } else {
                logger.info("Found {} data files to process in {}", files.size(), path);
            }
            return files;
        } catch (IOException e) {
            logger.error("Failed to scan data path {}: {}", path, e.getMessage());
            return List.of();
        }
    }

    static boolean isCsv(Path file) {
        return file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".csv");
    }

    private static boolean isDataFile(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".json") || name.endsWith(".csv");
    }
}
