package com.kingpin.pins;

import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.ToIntFunction;

/**
 * Main entry point for the saved places tool.
 * Loads the exports found under {@code KINGPIN_DATA_PATH} and answers list, search and proximity commands,
 * exports pins to CSV or imports them into an embedded PostgreSQL database.
 *
 * @author Kingpin Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final String USAGE = String.join("\n",
        "Usage: kingpin <command> [args]",
        "  lists                       list all pin lists with counts",
        "  list [name]                 list pins, optionally of one list",
        "  search <query>              search pins by name, address and notes",
        "  describe <name>             show details of one pin",
        "  near <lat> <lng> [km]       pins within a radius",
        "  categories                  all categories with pin counts",
        "  category <name>             pins in one category",
        "  groups [minGroupSize]       pins grouped by their most specific category",
        "  stats                       pin counts and field coverage",
        "  export <file.csv>           export all pins to CSV",
        "  import                      load pins into the embedded database",
        "  stored [list]               pins stored in the embedded database",
        "  has <url>                   check whether a pin url is stored",
        "  delete <name>               delete stored pins by name (alias: rm)",
        "  db                          start the embedded database only");

    /**
     * Main application entry point.
     * @param args Command-line arguments
     */
    public static void main(String[] args) {
        System.exit(run(args, System.out, new PinConfig()));
    }

    /**
     * Runs one command.
     * @return process exit code: 0 on success, 1 on failure, 2 on bad usage
     */
    static int run(String[] args, PrintStream out, PinConfig config) {
        String command = (args != null && args.length > 0) ? args[0].trim().toLowerCase(Locale.ROOT) : "";
        List<String> rest = args == null || args.length < 2 ? List.of() : Arrays.asList(args).subList(1, args.length);
        if (command.isBlank() || command.equals("help")) {
            out.println(USAGE);
            return command.isBlank() ? 2 : 0;
        }
        switch (command) {
            case "db" -> {
                return runDatabaseOnly(out, config);
            }
            case "stored" -> {
                String list = rest.isEmpty() ? null : String.join(" ", rest);
                return withDatabase(out, config, db -> printStored(out, db.findByList(list)));
            }
            case "has" -> {
                if (rest.isEmpty()) return usage(out);
                String url = rest.get(0);
                return withDatabase(out, config, db -> {
                    boolean stored = db.exists(url);
                    out.println((stored ? "Stored: " : "Not stored: ") + url);
                    return stored ? 0 : 1;
                });
            }
            case "delete", "rm" -> {
                if (rest.isEmpty()) return usage(out);
                return withDatabase(out, config, db -> deleteStored(out, db, String.join(" ", rest)));
            }
            default -> {
                // remaining commands work on the loaded exports
            }
        }

        PinRepository repository = new PinRepository(new LoadService());
        PinCollection loaded = repository.reload(Utils.findDataFiles(config.dataPath()));
        if (loaded.isEmpty()) {
            out.println("No pins loaded from " + config.dataPath() + (loaded.warnings().isEmpty() ? "" : " (" + loaded.warnings().size() + " files failed)"));
        }
        ToolService tools = new ToolService(repository);

        try {
            switch (command) {
                case "lists" -> out.println(tools.listLists());
                case "list", "ls" -> out.println(tools.listPins(rest.isEmpty() ? null : String.join(" ", rest), 50, 0, false));
                case "search" -> {
                    if (rest.isEmpty()) return usage(out);
                    out.println(tools.searchPins(String.join(" ", rest), 30, 0, true));
                }
                case "describe", "get" -> {
                    if (rest.isEmpty()) return usage(out);
                    out.println(tools.getPinDetails(String.join(" ", rest), true));
                }
                case "near" -> {
                    if (rest.size() < 2) return usage(out);
                    double radius = rest.size() > 2 ? Double.parseDouble(rest.get(2)) : config.defaultRadiusKm();
                    out.println(tools.findPinsNear(Double.parseDouble(rest.get(0)), Double.parseDouble(rest.get(1)), radius, 30, 0, true));
                }
                case "categories" -> printCategories(out, repository.query());
                case "category" -> {
                    if (rest.isEmpty()) return usage(out);
                    printCategory(out, repository.query(), String.join(" ", rest));
                }
                case "stats" -> printStats(out, repository.query());
                case "groups" -> printGroups(out, repository.query(), rest.isEmpty() ? 2 : Integer.parseInt(rest.get(0)));
                case "export" -> {
                    if (rest.isEmpty()) return usage(out);
                    Path written = new CsvService(config.exportDir()).writePinsToCSV(loaded.pins(), rest.get(0));
                    out.println("Exported " + loaded.pins().size() + " pins to " + written);
                }
                case "import" -> {
                    return importIntoDatabase(out, config, loaded);
                }
                default -> {
                    return usage(out);
                }
            }
        } catch (NumberFormatException e) {
            out.println("Error: invalid number: " + e.getMessage());
            return 2;
        } catch (IOException e) {
            logger.error("Command '{}' failed: {}", command, e.getMessage());
            out.println("Error: " + e.getMessage());
            return 1;
        }
        return 0;
    }

    private static int usage(PrintStream out) {
        out.println(USAGE);
        return 2;
    }

    private static void printCategories(PrintStream out, QueryServiceInterface query) {
        List<String> categories = query.getAllCategories();
        if (categories.isEmpty()) {
            out.println("No categories found.");
            return;
        }
        for (String category : categories) {
            out.println(category + " (" + query.getPlacesByCategory(category).size() + ")");
        }
    }

    private static void printCategory(PrintStream out, QueryServiceInterface query, String category) {
        List<Pin> pins = query.getPlacesByCategory(category);
        if (pins.isEmpty()) {
            out.println("No pins found in category '" + category + "'");
            return;
        }
        out.println(pins.size() + " pins in category '" + category + "':");
        printNumbered(out, pins);
    }

    private static void printStats(PrintStream out, QueryServiceInterface query) {
        List<Pin> pins = query.getAllPins();
        out.println("Pin statistics");
        out.println("  Total pins: " + pins.size());
        out.println("  Categories: " + query.getAllCategories().size());
        out.println("  Pins with coordinates: " + pins.stream().filter(Pin::hasCoordinates).count());
        out.println("  Pins with notes: " + pins.stream().filter(p -> p.notes() != null).count());
        out.println("  Pins with ratings: " + pins.stream().filter(p -> p.rating() != null).count());
    }

    private static void printNumbered(PrintStream out, List<Pin> pins) {
        for (int i = 0; i < pins.size(); i++) {
            Pin pin = pins.get(i);
            out.println(String.format("%3d. %s", i + 1, pin.name()));
            if (pin.address() != null) out.println("     " + pin.address());
        }
    }

    private static void printGroups(PrintStream out, QueryServiceInterface query, int minGroupSize) {
        Map<String, List<Pin>> groups = query.groupByCategory(query.getAllPins(), minGroupSize);
        for (Map.Entry<String, List<Pin>> group : groups.entrySet()) {
            out.println(group.getKey() + " (" + group.getValue().size() + ")");
            for (Pin pin : group.getValue()) out.println("   " + pin.name());
        }
    }

    private static int importIntoDatabase(PrintStream out, PinConfig config, PinCollection loaded) {
        try (EmbeddedPostgres postgres = PostgresService.startEmbedded(config.embeddedPgDataDir(), config.embeddedPgPort())) {
            PostgresServiceInterface postgresService = PostgresService.forEmbedded(postgres);
            int inserted = postgresService.insertPins(loaded.pins());
            if (inserted < 0) {
                out.println("Import failed, see log for details");
                return 1;
            }
            out.println("Imported " + inserted + " pins (" + (loaded.pins().size() - inserted) + " already stored) into "
                + postgresService.listNames().size() + " lists");
            return 0;
        } catch (Exception e) {
            logger.error("Failed to import into embedded PostgreSQL: {}", e.getMessage());
            out.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private static int printStored(PrintStream out, List<Pin> pins) {
        if (pins.isEmpty()) {
            out.println("No stored pins found.");
            return 0;
        }
        out.println(pins.size() + " stored pins:");
        printNumbered(out, pins);
        return 0;
    }

    private static int deleteStored(PrintStream out, PostgresServiceInterface db, String name) {
        Optional<Pin> match = db.findByName(name);
        if (match.isEmpty()) {
            out.println("'" + name + "' not found in the database");
            return 1;
        }
        String matchedName = match.get().name();
        int deleted = db.deleteByName(matchedName);
        if (deleted < 0) {
            out.println("Delete failed, see log for details");
            return 1;
        }
        out.println("Deleted " + deleted + " pins named '" + matchedName + "'");
        return 0;
    }

    /**
     * Starts the embedded database, runs one command against it and stops it again.
     * @return the command's exit code, or 1 when the database cannot be started
     */
    private static int withDatabase(PrintStream out, PinConfig config, ToIntFunction<PostgresServiceInterface> command) {
        try (EmbeddedPostgres postgres = PostgresService.startEmbedded(config.embeddedPgDataDir(), config.embeddedPgPort())) {
            return command.applyAsInt(PostgresService.forEmbedded(postgres));
        } catch (IOException | RuntimeException e) {
            logger.error("Embedded PostgreSQL command failed: {}", e.getMessage());
            out.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private static int runDatabaseOnly(PrintStream out, PinConfig config) {
        try (EmbeddedPostgres postgres = PostgresService.startEmbedded(config.embeddedPgDataDir(), config.embeddedPgPort())) {
            PostgresService.forEmbedded(postgres);
            out.println("Embedded Postgres started.");
            out.println("JDBC URL: " + String.format("jdbc:postgresql://localhost:%d/postgres", postgres.getPort()));
            out.println("DB user: postgres");
            out.println("Data directory: " + config.embeddedPgDataDir());
            out.println("Press Enter to stop the embedded DB and exit.");
            System.in.read();
            return 0;
        } catch (Exception e) {
            logger.error("Failed to start embedded Postgres in db-only mode: {}", e.getMessage());
            return 1;
        }
    }
}
