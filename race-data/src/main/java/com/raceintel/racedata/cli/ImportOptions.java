package com.raceintel.racedata.cli;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Parsed command line of the import CLI.
 *
 * The store path comes from {@code --db}, else the {@code DB_PATH} environment variable,
 * else {@link #DEFAULT_DB_PATH}.
 */
public record ImportOptions(Path dataDirectory, String dbPath, boolean verbose, boolean force, boolean help) {

    public static final String DEFAULT_DB_PATH = "./data/racing.db";
    public static final String DB_PATH_ENV = "DB_PATH";

    /**
     * @throws IllegalArgumentException on an unknown option, a missing option value or a second directory
     */
    public static ImportOptions parse(String[] args, Map<String, String> env) {
        Path dataDirectory = null;
        String dbPath = null;
        boolean verbose = false;
        boolean force = false;
        boolean help = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-h", "--help" -> help = true;
                case "-v", "--verbose" -> verbose = true;
                case "--force" -> force = true;
                case "--db", "--database" -> {
                    if (i + 1 >= args.length || args[i + 1].startsWith("-")) {
                        throw new IllegalArgumentException(arg + " requires a path");
                    }
                    dbPath = args[++i];
                }
                default -> {
                    if (arg.startsWith("--db=") || arg.startsWith("--database=")) {
                        dbPath = arg.substring(arg.indexOf('=') + 1);
                    } else if (arg.startsWith("-")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    } else if (dataDirectory != null) {
                        throw new IllegalArgumentException("Unexpected argument: " + arg);
                    } else {
                        dataDirectory = Paths.get(arg);
                    }
                }
            }
        }

        if (dbPath == null || dbPath.isBlank()) {
            String fromEnv = env.get(DB_PATH_ENV);
            dbPath = fromEnv != null && !fromEnv.isBlank() ? fromEnv : DEFAULT_DB_PATH;
        }
        return new ImportOptions(dataDirectory, dbPath, verbose, force, help);
    }
}
