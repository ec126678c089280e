package com.kingpin.pins;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.sql.*;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Service storing pins in PostgreSQL.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Stores every canonical pin field; categories are kept as a JSONB array.</li>
 *   <li>{@code url} is unique, so importing the same export twice does not duplicate pins.
 *       Pins without a url are kept once per list and name.</li>
 *   <li>SQL errors are logged and reported through the return value, never thrown.</li>
 * </ul>
 * <p>
 * The in-memory query engine never reads from here; this store backs the {@code import} command.
 *
 * @author Kingpin Team
 * @since 1.0
 */
@SuppressWarnings("SqlResolve")
public class PostgresService implements PostgresServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(PostgresService.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final String url;
    private final String user;
    private final String password;
    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * Constructs a PostgresService with the given connection parameters.
     * @param url JDBC URL
     * @param user Database user
     * @param password Database password
     */
    public PostgresService(String url, String user, String password) {
        this.url = url;
        this.user = user;
        this.password = password;
    }

    /**
     * Opens a new database connection.
     * @return Connection
     * @throws SQLException if connection fails
     */
    public Connection connect() throws SQLException {
        return DriverManager.getConnection(url, user, password);
    }

    @Override
    public void createTables() {
        String pinTable = "CREATE TABLE IF NOT EXISTS pins (" +
                "id SERIAL PRIMARY KEY, " +
                "list TEXT NOT NULL, " +
                "name TEXT NOT NULL, " +
                "note TEXT, address TEXT, " +
                "latitude DOUBLE PRECISION, longitude DOUBLE PRECISION, " +
                "categories_json JSONB, rating DOUBLE PRECISION, " +
                "place_id TEXT, date_saved TEXT, " +
                "url TEXT UNIQUE" +
                ")";
        try (Connection conn = connect(); Statement stmt = conn.createStatement()) {
            stmt.execute(pinTable);
            logger.info("Ensured pins table exists.");
        } catch (SQLException e) {
            logger.error("Error creating tables: {}", e.getMessage());
        }
    }

    @Override
    public int insertPins(List<Pin> pins) {
        if (pins == null || pins.isEmpty()) {
            logger.warn("Empty pin list for DB insert");
            return 0;
        }
        String sql = "INSERT INTO pins (list, name, note, address, latitude, longitude, categories_json, rating, place_id, date_saved, url) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) ON CONFLICT (url) DO NOTHING";
        // url-less pins are unique per (list, name); the url constraint cannot see them
        String storedSql = "SELECT 1 FROM pins WHERE url IS NULL AND list = ? AND name = ?";
        try (Connection conn = connect();
             PreparedStatement ps = conn.prepareStatement(sql);
             PreparedStatement stored = conn.prepareStatement(storedSql)) {
            Set<List<String>> batchedWithoutUrl = new HashSet<>();
            int skipped = 0;
            for (Pin pin : pins) {
                if (pin.url() == null) {
                    List<String> key = List.of(pin.listName(), pin.name());
                    if (!batchedWithoutUrl.add(key) || isStoredWithoutUrl(stored, key)) {
                        skipped++;
                        continue;
                    }
                }
                ps.setString(1, pin.listName());
                ps.setString(2, pin.name());
                ps.setString(3, pin.notes());
                ps.setString(4, pin.address());
                setDouble(ps, 5, pin.latitude());
                setDouble(ps, 6, pin.longitude());
                ps.setObject(7, mapper.writeValueAsString(pin.categories()), Types.OTHER);
                setDouble(ps, 8, pin.rating());
                ps.setString(9, pin.placeId());
                ps.setString(10, pin.dateSaved());
                ps.setString(11, pin.url());
                ps.addBatch();
            }
            if (skipped > 0) logger.debug("Skipped {} url-less pins already stored under the same list and name", skipped);
            int inserted = 0;
            for (int count : ps.executeBatch()) {
                if (count > 0) inserted += count;
            }
            logger.info("Inserted {} of {} pins ({} already stored).", inserted, pins.size(), pins.size() - inserted);
            return inserted;
        } catch (SQLException e) {
            logger.error("Error inserting pins: {}", e.getMessage());
        } catch (JsonProcessingException e) {
            logger.error("Error serializing pin categories: {}", e.getMessage());
        }
        return -1;
    }

    private static boolean isStoredWithoutUrl(PreparedStatement stored, List<String> key) throws SQLException {
        stored.setString(1, key.get(0));
        stored.setString(2, key.get(1));
        try (ResultSet rs = stored.executeQuery()) {
            return rs.next();
        }
    }

    @Override
    public boolean exists(String pinUrl) {
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement("SELECT 1 FROM pins WHERE url = ?")) {
            ps.setString(1, pinUrl);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            logger.error("Error checking pin url {}: {}", pinUrl, e.getMessage());
            return false;
        }
    }

    @Override
    public Optional<Pin> findByName(String namePrefix) {
        List<Pin> found = query("SELECT * FROM pins WHERE name LIKE ? ORDER BY id LIMIT 1", escapeLike(namePrefix) + "%");
        return found.stream().findFirst();
    }

    @Override
    public List<Pin> findByList(String listPrefix) {
        if (listPrefix == null || listPrefix.isBlank()) {
            return query("SELECT * FROM pins ORDER BY id");
        }
        return query("SELECT * FROM pins WHERE list LIKE ? ORDER BY id", escapeLike(listPrefix) + "%");
    }

    @Override
    public List<String> listNames() {
        List<String> names = new ArrayList<>();
        try (Connection conn = connect();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT list FROM pins GROUP BY list ORDER BY MIN(id)")) {
            while (rs.next()) names.add(rs.getString(1));
        } catch (SQLException e) {
            logger.error("Error listing pin lists: {}", e.getMessage());
        }
        return names;
    }

    @Override
    public int deleteByName(String name) {
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement("DELETE FROM pins WHERE name = ?")) {
            ps.setString(1, name);
            int deleted = ps.executeUpdate();
            logger.info("Deleted {} pins named '{}'", deleted, name);
            return deleted;
        } catch (SQLException e) {
            logger.error("Error deleting pin '{}': {}", name, e.getMessage());
            return -1;
        }
    }

    private List<Pin> query(String sql, String... params) {
        List<Pin> pins = new ArrayList<>();
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) ps.setString(i + 1, params[i]);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) pins.add(fromRow(rs));
            }
        } catch (SQLException e) {
            logger.error("Error querying pins: {}", e.getMessage());
        }
        return pins;
    }

    private Pin fromRow(ResultSet rs) throws SQLException {
        List<String> categories = List.of();
        String json = rs.getString("categories_json");
        if (json != null) {
            try {
                categories = mapper.readValue(json, STRING_LIST);
            } catch (JsonProcessingException e) {
                logger.warn("Ignoring malformed categories for pin id {}: {}", rs.getInt("id"), e.getMessage());
            }
        }
        return new Pin(
            rs.getString("name"),
            rs.getString("address"),
            getDouble(rs, "latitude"),
            getDouble(rs, "longitude"),
            rs.getString("place_id"),
            rs.getString("note"),
            rs.getString("date_saved"),
            rs.getString("url"),
            rs.getString("list"),
            categories,
            getDouble(rs, "rating")
        );
    }

    private static void setDouble(PreparedStatement ps, int index, Double value) throws SQLException {
        if (value != null) ps.setDouble(index, value); else ps.setNull(index, Types.DOUBLE);
    }

    private static Double getDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    private static String escapeLike(String s) {
        return s.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    /**
     * Starts an embedded PostgreSQL instance on a specific port for local use and returns it.
     * @param dataDir directory under which to store DB data
     * @param port port number for the Postgres server
     * @return EmbeddedPostgres instance
     */
    public static EmbeddedPostgres startEmbedded(String dataDir, int port) {
        try {
            EmbeddedPostgres postgres = EmbeddedPostgres.builder()
                .setDataDirectory(Paths.get(dataDir))
                .setCleanDataDirectory(false)
                .setPort(port)
                .start();
            logger.info("Embedded PostgreSQL started at {} on port {}", dataDir, port);
            return postgres;
        } catch (Exception e) {
            logger.error("Failed to start embedded PostgreSQL on port {}: {}", port, e.getMessage());
            throw new RuntimeException(e);
        }
    }

    /**
     * Connects to an embedded instance with its default superuser and ensures the table exists.
     * @param postgres running embedded instance
     * @return ready-to-use service
     */
    public static PostgresService forEmbedded(EmbeddedPostgres postgres) {
        String dbUrl = String.format("jdbc:postgresql://localhost:%d/postgres", postgres.getPort());
        PostgresService service = new PostgresService(dbUrl, "postgres", "postgres");
        service.createTables();
        return service;
    }
}
