package com.raceintel.racedata.service;

import com.raceintel.racedata.config.RaceDataProperties;
import com.raceintel.racedata.exception.ErrorCode;
import com.raceintel.racedata.exception.ImportException;
import com.raceintel.racedata.exception.RaceDataException;
import com.raceintel.racedata.model.ImportRun;
import com.raceintel.racedata.model.ImportSummary;
import com.raceintel.racedata.model.SourceBatch;
import com.raceintel.racedata.model.SourceType;
import com.raceintel.racedata.model.VehicleIdentity;
import com.raceintel.racedata.model.VehicleScopedRow;
import com.raceintel.racedata.output.ImportRunRecorder;
import com.raceintel.racedata.output.ReferentialLoader;
import com.raceintel.racedata.output.SchemaManager;
import com.raceintel.racedata.parser.CsvSourceParser;
import com.raceintel.racedata.parser.ParseResult;
import com.raceintel.racedata.parser.VehicleCsvSourceParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Orchestrates one import run over a data directory.
 *
 * Files are processed one at a time in source order (results, lap times, sections,
 * telemetry, weather). Each file is parsed, its vehicle references resolved, and its rows
 * loaded in a single transaction. A file whose content was already imported successfully
 * is skipped unless forced. The first load failure aborts the run; files committed before
 * it stay committed. Vehicle summaries are re-derived at the end either way.
 */
@Service
@Slf4j
public class RaceDataImportService {

    private final SourceFileScanner scanner;
    private final Map<SourceType, CsvSourceParser<?>> parsers = new EnumMap<>(SourceType.class);
    private final ReferentialLoader loader;
    private final ImportRunRecorder runRecorder;
    private final SchemaManager schemaManager;
    private final AggregateStatisticsService statistics;
    private final RaceDataProperties properties;

    public RaceDataImportService(SourceFileScanner scanner,
                                 List<CsvSourceParser<?>> parsers,
                                 ReferentialLoader loader,
                                 ImportRunRecorder runRecorder,
                                 SchemaManager schemaManager,
                                 AggregateStatisticsService statistics,
                                 RaceDataProperties properties) {
        this.scanner = scanner;
        parsers.forEach(p -> this.parsers.put(p.sourceType(), p));
        this.loader = loader;
        this.runRecorder = runRecorder;
        this.schemaManager = schemaManager;
        this.statistics = statistics;
        this.properties = properties;
    }

    public ImportSummary importDirectory(Path dataDir) {
        return importDirectory(dataDir, properties.getImporting().isForce());
    }

    /**
     * @param force re-import files whose content has already been imported
     * @throws ImportException on the first file that fails to load
     */
    public ImportSummary importDirectory(Path dataDir, boolean force) {
        long start = System.nanoTime();
        log.info("Starting race data import from {}{}", dataDir, force ? " (forced)" : "");

        Map<SourceType, List<Path>> files = scanner.scan(dataDir);
        schemaManager.ensureSchema();

        VehicleIdentityResolver resolver = new VehicleIdentityResolver(properties.getIdentity());
        ImportSummary summary = new ImportSummary();

        try {
            for (SourceType type : SourceType.values()) {
                for (Path file : files.get(type)) {
                    importFile(file, type, resolver, force, summary);
                }
            }
        } catch (RaceDataException e) {
            summary.setVehicles(resolver.identities().size());
            try {
                statistics.recomputeAll();
            } catch (Exception recomputeFailure) {
                log.warn("Could not recompute vehicle statistics after failed import: {}",
                        recomputeFailure.getMessage());
            }
            throw e;
        }

        statistics.recomputeAll();
        summary.setVehicles(resolver.identities().size());

        log.info("Import completed in {}s: {} vehicles, {} files imported, {} skipped, {} rows skipped",
                Duration.ofNanos(System.nanoTime() - start).toMillis() / 1000.0,
                summary.getVehicles(), summary.getFilesImported(), summary.getFilesSkipped(),
                summary.getRowsSkipped());
        return summary;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void importFile(Path file, SourceType type, VehicleIdentityResolver resolver,
                            boolean force, ImportSummary summary) {
        String fileName = file.getFileName().toString();

        ImportRun run = ImportRun.builder()
                .runId(UUID.randomUUID().toString())
                .fileName(fileName)
                .sourceType(type)
                .checksum(checksum(file))
                .startedAt(LocalDateTime.now())
                .status(ImportRun.Status.RUNNING)
                .build();

        if (!force && runRecorder.alreadyImported(fileName, run.getChecksum())) {
            log.info("Skipping {}: already imported with identical content (use --force to re-import)", fileName);
            run.setStatus(ImportRun.Status.SKIPPED);
            run.setCompletedAt(LocalDateTime.now());
            runRecorder.record(run);
            summary.setFilesSkipped(summary.getFilesSkipped() + 1);
            return;
        }

        try {
            CsvSourceParser<?> parser = parsers.get(type);
            ParsedFile parsed = parser instanceof VehicleCsvSourceParser<?> vehicleParser
                    ? parseAndResolve(vehicleParser, file, resolver)
                    : parse(parser, file);

            int written = loader.load(new SourceBatch(fileName, type, parsed.rows()), parsed.identities());
            if (written != parsed.rows().size()) {
                throw new ImportException(fileName + ": wrote " + written + " of " + parsed.rows().size() + " rows");
            }

            run.setRecordsParsed(parsed.parsed());
            run.setRecordsSkipped(parsed.skipped());
            run.setRecordsWritten(written);
            run.setStatus(ImportRun.Status.SUCCESS);

            summary.addWritten(type, written);
            summary.setRowsSkipped(summary.getRowsSkipped() + parsed.skipped());
            summary.setFilesImported(summary.getFilesImported() + 1);

        } catch (RaceDataException e) {
            log.error("Failed importing {}: {}", fileName, e.getMessage());
            run.setStatus(ImportRun.Status.FAILED);
            run.setErrorMessage(e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed importing {}", fileName, e);
            run.setStatus(ImportRun.Status.FAILED);
            run.setErrorMessage(e.toString());
            throw new ImportException("Import of " + fileName + " failed: " + e, e);
        } finally {
            run.setCompletedAt(LocalDateTime.now());
            runRecorder.record(run);
        }
    }

    private <T extends VehicleScopedRow<T>> ParsedFile parseAndResolve(VehicleCsvSourceParser<T> parser, Path file,
                                                                      VehicleIdentityResolver resolver) {
        ParseResult<T> parsed = parser.parse(file);
        VehicleIdentityResolver.Resolution<T> resolution = resolver.resolveRows(parsed.source(), parsed.rows());
        return new ParsedFile(parsed.parsed(), resolution.rows(), resolution.identities(),
                parsed.skipped() + resolution.rejected());
    }

    private ParsedFile parse(CsvSourceParser<?> parser, Path file) {
        ParseResult<?> parsed = parser.parse(file);
        return new ParsedFile(parsed.parsed(), parsed.rows(), List.of(), parsed.skipped());
    }

    /** Rows of one file ready to load, with the vehicles they reference. */
    private record ParsedFile(int parsed, List<?> rows, Collection<VehicleIdentity> identities, int skipped) {
    }

    static String checksum(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] buffer = new byte[64 * 1024];
            int n;
            while ((n = in.read(buffer)) != -1) {
                digest.update(buffer, 0, n);
            }
            return HexFormat.of().formatHex(digest.digest());
        } catch (IOException e) {
            throw new ImportException("Cannot read " + file + ": " + e.getMessage(), e);
        } catch (NoSuchAlgorithmException e) {
            throw new RaceDataException(ErrorCode.CONFIG_ERROR, "SHA-256 not available", e);
        }
    }
}
