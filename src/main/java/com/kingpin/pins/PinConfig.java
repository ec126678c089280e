package com.kingpin.pins;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Map;

/**
 * Runtime settings, each read from a JVM system property, then the environment variable of the same name,
 * then a default.
 * <ul>
 *   <li>{@code KINGPIN_DATA_PATH}: file or directory of exports to load (default {@value #DEFAULT_DATA_PATH}).</li>
 *   <li>{@code KINGPIN_DEFAULT_RADIUS_KM}: radius of {@code near} when none is given (default 10).</li>
 *   <li>{@code KINGPIN_EXPORT_DIR}: CSV export directory (default {@value #DEFAULT_EXPORT_DIR}).</li>
 *   <li>{@code EMBEDDED_PG_PORT} / {@code EMBEDDED_PG_DATA_DIR}: embedded Postgres settings.</li>
 * </ul>
 */
public final class PinConfig {
    private static final Logger logger = LoggerFactory.getLogger(PinConfig.class);

    public static final String DEFAULT_DATA_PATH = "data";
    public static final String DEFAULT_EXPORT_DIR = "kingpin-data";
    public static final double DEFAULT_RADIUS_KM = 10;
    public static final int DEFAULT_PG_PORT = 5432;
    public static final String DEFAULT_PG_DATA_DIR = "kingpin-data/pgdata";

    private final Map<String, String> env;

    public PinConfig() {
        this(System.getenv());
    }

    /**
     * @param env environment variables to fall back on when no system property is set
     */
    public PinConfig(Map<String, String> env) {
        this.env = env;
    }

    public Path dataPath() {
        return Path.of(get("KINGPIN_DATA_PATH", DEFAULT_DATA_PATH));
    }

    public Path exportDir() {
        return Path.of(get("KINGPIN_EXPORT_DIR", DEFAULT_EXPORT_DIR));
    }

    public double defaultRadiusKm() {
        String raw = get("KINGPIN_DEFAULT_RADIUS_KM", null);
        if (raw == null) return DEFAULT_RADIUS_KM;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid KINGPIN_DEFAULT_RADIUS_KM '{}', using {}", raw, DEFAULT_RADIUS_KM);
            return DEFAULT_RADIUS_KM;
        }
    }

    public int embeddedPgPort() {
        String raw = get("EMBEDDED_PG_PORT", null);
        if (raw == null) return DEFAULT_PG_PORT;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid EMBEDDED_PG_PORT '{}', using {}", raw, DEFAULT_PG_PORT);
            return DEFAULT_PG_PORT;
        }
    }

    public String embeddedPgDataDir() {
        return get("EMBEDDED_PG_DATA_DIR", DEFAULT_PG_DATA_DIR);
    }

    String get(String key, String defaultValue) {
        return System.getProperty(key, env.getOrDefault(key, defaultValue));
    }
}
