package com.raceintel.racedata.cli;

import com.raceintel.racedata.RaceDataApplication;
import com.raceintel.racedata.exception.RaceDataException;
import com.raceintel.racedata.model.ImportSummary;
import com.raceintel.racedata.model.SourceType;
import com.raceintel.racedata.service.RaceDataImportService;
import org.springframework.boot.Banner;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Command line entry point for importing a directory of race CSV exports.
 *
 * Usage: race-import &lt;data-directory&gt; [--db PATH] [--verbose] [--force]
 *
 * Exit code 0 with a per-entity summary on success, 1 with the failure message otherwise.
 */
public class ImportCli {

    private static final String RULE = "=".repeat(60);

    private static final String USAGE = """
            Racing Data Import

            Usage: race-import <data-directory> [options]

            Arguments:
              <data-directory>    Directory containing the race CSV files (required)

            Options:
              --db, --database    SQLite database file (default: ./data/racing.db)
              -v, --verbose       Debug logging and full stack traces on failure
              --force             Re-import files already imported with identical content
              -h, --help          Show this help message

            Environment:
              DB_PATH             Database file path (overridden by --db)

            CSV files recognised (case-insensitive, .csv extension):
              Results:    *results*
              Lap times:  *lap_time*
              Sections:   *endurance* or *section*
              Telemetry:  *telemetry*
              Weather:    *weather*
            """;

    public static void main(String[] args) {
        System.exit(new ImportCli().run(args, System.getenv(), System.out, System.err));
    }

    public int run(String[] args, Map<String, String> env, PrintStream out, PrintStream err) {
        ImportOptions options;
        try {
            options = ImportOptions.parse(args, env);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.println("Run with --help for usage information");
            return 1;
        }

        if (options.help()) {
            out.print(USAGE);
            return 0;
        }

        String invalid = validateDataDirectory(options.dataDirectory());
        if (invalid != null) {
            err.println("Error: " + invalid);
            return 1;
        }

        Path dataDirectory = options.dataDirectory().toAbsolutePath().normalize();
        Path dbPath = Paths.get(options.dbPath()).toAbsolutePath().normalize();

        out.println(RULE);
        out.println("Racing Data Import");
        out.println(RULE);
        out.println("Data directory: " + dataDirectory);
        out.println("Database path:  " + dbPath);
        out.println(RULE);

        try (ConfigurableApplicationContext context = startContext(dbPath, options.verbose())) {
            ImportSummary summary = context.getBean(RaceDataImportService.class)
                    .importDirectory(dataDirectory, options.force());
            printSummary(out, summary);
            return 0;

        } catch (RuntimeException e) {
            String kind = e instanceof RaceDataException rde ? rde.getCode().name() : e.getClass().getSimpleName();
            err.println("Error [" + kind + "]: " + e.getMessage());
            if (options.verbose()) {
                e.printStackTrace(err);
            } else {
                err.println("Run with --verbose for details");
            }
            return 1;
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private String validateDataDirectory(Path dataDirectory) {
        if (dataDirectory == null) {
            return "Data directory is required. Run with --help for usage information";
        }
        if (!Files.exists(dataDirectory)) {
            return "Data directory not found: " + dataDirectory;
        }
        if (!Files.isDirectory(dataDirectory)) {
            return "Path is not a directory: " + dataDirectory;
        }
        return null;
    }

    private ConfigurableApplicationContext startContext(Path dbPath, boolean verbose) {
        // command line properties outrank application.yml and the environment
        List<String> springArgs = new ArrayList<>();
        springArgs.add("--race-data.store.path=" + dbPath);
        if (verbose) {
            springArgs.add("--logging.level.com.raceintel=DEBUG");
        }
        return new SpringApplicationBuilder(RaceDataApplication.class)
                .web(WebApplicationType.NONE)
                .bannerMode(Banner.Mode.OFF)
                .logStartupInfo(false)
                .run(springArgs.toArray(String[]::new));
    }

    private void printSummary(PrintStream out, ImportSummary summary) {
        out.println();
        out.println(RULE);
        out.println("Import Summary");
        out.println(RULE);
        out.printf("Vehicles:   %,d%n", summary.getVehicles());
        out.printf("Lap times:  %,d%n", summary.written(SourceType.LAP_TIMES));
        out.printf("Telemetry:  %,d%n", summary.written(SourceType.TELEMETRY));
        out.printf("Results:    %,d%n", summary.written(SourceType.RESULTS));
        out.printf("Sections:   %,d%n", summary.written(SourceType.SECTIONS));
        out.printf("Weather:    %,d%n", summary.written(SourceType.WEATHER));
        out.printf("Skipped rows:  %,d%n", summary.getRowsSkipped());
        out.printf("Skipped files: %,d (already imported)%n", summary.getFilesSkipped());
        out.println(RULE);
    }
}
