package com.raceintel.racedata.output;

import com.raceintel.racedata.config.RaceDataProperties;
import com.raceintel.racedata.exception.ImportException;
import com.raceintel.racedata.model.LapRow;
import com.raceintel.racedata.model.ResultRow;
import com.raceintel.racedata.model.SectionRow;
import com.raceintel.racedata.model.SourceBatch;
import com.raceintel.racedata.model.TelemetryRow;
import com.raceintel.racedata.model.VehicleIdentity;
import com.raceintel.racedata.model.WeatherRow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ParameterizedPreparedStatementSetter;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Writes one source file's rows in a single transaction.
 *
 * Order inside the transaction: INSERT OR IGNORE of every vehicle identity the file
 * references, then the dependent rows as JDBC batches over one prepared statement.
 * Any failure rolls the whole file back, so a file is either fully visible or not at all.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ReferentialLoader {

    private static final String INSERT_VEHICLE =
            "INSERT OR IGNORE INTO vehicles (vehicle_id, car_number) VALUES (?, ?)";

    private static final String INSERT_LAP = """
            INSERT INTO lap_times (vehicle_id, lap, lap_time, timestamp)
            VALUES (?, ?, ?, ?)""";

    private static final String INSERT_TELEMETRY = """
            INSERT INTO telemetry (vehicle_id, lap, timestamp, telemetry_name, telemetry_value)
            VALUES (?, ?, ?, ?, ?)""";

    private static final String INSERT_RESULT = """
            INSERT INTO race_results
            (vehicle_id, position, car_number, laps, total_time, gap_first, gap_previous, best_lap_time, class)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)""";

    private static final String INSERT_SECTION = """
            INSERT INTO section_times (vehicle_id, lap, s1, s2, s3, lap_time, top_speed)
            VALUES (?, ?, ?, ?, ?, ?, ?)""";

    private static final String INSERT_WEATHER = """
            INSERT INTO weather
            (timestamp, air_temp, track_temp, humidity, pressure, wind_speed, wind_direction, rain)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)""";

    private final JdbcTemplate jdbcTemplate;
    private final PlatformTransactionManager transactionManager;
    private final RaceDataProperties properties;

    /**
     * @param identities vehicles the batch references; written first
     * @return number of dependent rows inserted
     * @throws ImportException if anything fails; nothing from the batch is left behind
     */
    public int load(SourceBatch batch, Collection<VehicleIdentity> identities) {
        TransactionTemplate transaction = new TransactionTemplate(transactionManager);
        try {
            Integer written = transaction.execute(status -> {
                int newVehicles = writeVehicles(identities);
                int rows = writeRows(batch);
                log.info("{}: {} {} rows written, {} new vehicles", batch.fileName(), rows, batch.type(), newVehicles);
                return rows;
            });
            return written == null ? 0 : written;
        } catch (DataAccessException | TransactionException e) {
            String cause = NestedExceptionUtils.getMostSpecificCause(e).getMessage();
            log.error("Import of {} rolled back: {}", batch.fileName(), cause);
            throw new ImportException("Import of " + batch.fileName() + " failed and was rolled back: " + cause, e);
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private int writeVehicles(Collection<VehicleIdentity> identities) {
        if (identities.isEmpty()) return 0;
        return batch(INSERT_VEHICLE, new ArrayList<>(identities), (ps, v) -> {
            ps.setString(1, v.vehicleId());
            ps.setInt(2, v.carNumber());
        });
    }

    private int writeRows(SourceBatch batch) {
        return switch (batch.type()) {
            case LAP_TIMES -> batch(INSERT_LAP, batch.rowsAs(LapRow.class), (ps, r) -> {
                ps.setString(1, r.getVehicleId());
                ps.setInt(2, r.getLap());
                ps.setDouble(3, r.getLapTime());
                ps.setString(4, StoreTimestamps.format(r.getTimestamp()));
            });
            case TELEMETRY -> batch(INSERT_TELEMETRY, batch.rowsAs(TelemetryRow.class), (ps, r) -> {
                ps.setString(1, r.getVehicleId());
                setInteger(ps, 2, r.getLap());
                ps.setString(3, StoreTimestamps.format(r.getTimestamp()));
                ps.setString(4, r.getTelemetryName());
                ps.setDouble(5, r.getTelemetryValue());
            });
            case RESULTS -> batch(INSERT_RESULT, batch.rowsAs(ResultRow.class), (ps, r) -> {
                ps.setString(1, r.getVehicleId());
                ps.setInt(2, r.getPosition());
                ps.setInt(3, r.getCarNumber());
                ps.setInt(4, r.getLaps());
                ps.setString(5, r.getTotalTime());
                ps.setString(6, r.getGapFirst());
                ps.setString(7, r.getGapPrevious());
                ps.setString(8, r.getBestLapTime());
                ps.setString(9, r.getVehicleClass());
            });
            case SECTIONS -> batch(INSERT_SECTION, batch.rowsAs(SectionRow.class), (ps, r) -> {
                ps.setString(1, r.getVehicleId());
                ps.setInt(2, r.getLap());
                setDouble(ps, 3, r.getS1());
                setDouble(ps, 4, r.getS2());
                setDouble(ps, 5, r.getS3());
                setDouble(ps, 6, r.getLapTime());
                setDouble(ps, 7, r.getTopSpeed());
            });
            case WEATHER -> batch(INSERT_WEATHER, batch.rowsAs(WeatherRow.class), (ps, r) -> {
                ps.setString(1, StoreTimestamps.format(r.getTimestamp()));
                setDouble(ps, 2, r.getAirTemp());
                setDouble(ps, 3, r.getTrackTemp());
                setDouble(ps, 4, r.getHumidity());
                setDouble(ps, 5, r.getPressure());
                setDouble(ps, 6, r.getWindSpeed());
                setDouble(ps, 7, r.getWindDirection());
                setDouble(ps, 8, r.getRain());
            });
        };
    }

    private <T> int batch(String sql, List<T> rows, ParameterizedPreparedStatementSetter<T> setter) {
        if (rows.isEmpty()) return 0;

        int batchSize = properties.getImporting().getBatchSize();
        int[][] counts = jdbcTemplate.batchUpdate(sql, rows, batchSize, setter);

        int total = 0;
        for (int[] chunk : counts) {
            for (int count : chunk) {
                total += count == Statement.SUCCESS_NO_INFO ? 1 : Math.max(count, 0);
            }
        }
        log.debug("Batched {} statements in {} chunks of up to {}", rows.size(), counts.length, batchSize);
        return total;
    }

    private static void setDouble(PreparedStatement ps, int idx, Double value) throws SQLException {
        if (value == null) ps.setNull(idx, Types.REAL);
        else ps.setDouble(idx, value);
    }

    private static void setInteger(PreparedStatement ps, int idx, Integer value) throws SQLException {
        if (value == null) ps.setNull(idx, Types.INTEGER);
        else ps.setInt(idx, value);
    }
}
