package com.raceintel.racedata.service;

import com.raceintel.racedata.config.RaceDataProperties;
import com.raceintel.racedata.model.ChannelSummary;
import com.raceintel.racedata.model.LapStatistics;
import com.raceintel.racedata.model.Vehicle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Derives the per-vehicle summary columns from the raw rows.
 *
 * The summary on the vehicles row is redundant: every column can be re-derived from
 * lap_times, telemetry and race_results at any time, and {@link #recomputeAll()} does exactly that.
 * Lap times are in milliseconds throughout.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AggregateStatisticsService {

    private final JdbcTemplate jdbcTemplate;
    private final RaceDataProperties properties;

    private static final String RECOMPUTE = """
            UPDATE vehicles SET
                fastest_lap = (SELECT MIN(l.lap_time) FROM lap_times l WHERE l.vehicle_id = vehicles.vehicle_id),
                average_lap = (SELECT AVG(l.lap_time) FROM lap_times l WHERE l.vehicle_id = vehicles.vehicle_id),
                total_laps  = (SELECT COUNT(*) FROM lap_times l WHERE l.vehicle_id = vehicles.vehicle_id),
                max_speed   = (SELECT MAX(t.telemetry_value) FROM telemetry t
                               WHERE t.vehicle_id = vehicles.vehicle_id AND t.telemetry_name IN (%s)),
                position    = COALESCE((SELECT r.position FROM race_results r
                                        WHERE r.vehicle_id = vehicles.vehicle_id), position),
                class       = COALESCE((SELECT r.class FROM race_results r
                                        WHERE r.vehicle_id = vehicles.vehicle_id), class)
            """;

    private static final RowMapper<Vehicle> VEHICLE_MAPPER = AggregateStatisticsService::mapVehicle;

    /**
     * Re-derive the summary of every vehicle.
     *
     * @return number of vehicles updated
     */
    public int recomputeAll() {
        List<String> channels = speedChannels();
        int updated = jdbcTemplate.update(String.format(RECOMPUTE, placeholders(channels.size())), channels.toArray());
        log.info("Recomputed summary statistics for {} vehicles", updated);
        return updated;
    }

    public boolean recompute(String vehicleId) {
        List<String> channels = speedChannels();
        List<Object> args = new ArrayList<>(channels);
        args.add(vehicleId);
        String sql = String.format(RECOMPUTE, placeholders(channels.size())) + " WHERE vehicle_id = ?";
        return jdbcTemplate.update(sql, args.toArray()) > 0;
    }

    /**
     * Lap-time statistics, optionally restricted to an inclusive lap range.
     * Null bounds are open.
     */
    public LapStatistics lapStatistics(String vehicleId, Integer minLap, Integer maxLap) {
        StringBuilder sql = new StringBuilder("SELECT lap_time FROM lap_times WHERE vehicle_id = ?");
        List<Object> args = new ArrayList<>();
        args.add(vehicleId);
        if (minLap != null) {
            sql.append(" AND lap >= ?");
            args.add(minLap);
        }
        if (maxLap != null) {
            sql.append(" AND lap <= ?");
            args.add(maxLap);
        }

        List<Double> lapTimes = jdbcTemplate.queryForList(sql.toString(), Double.class, args.toArray());
        return LapStatistics.of(lapTimes);
    }

    /** Per-channel counts and ranges for a vehicle, optionally for one lap only. */
    public List<ChannelSummary> telemetrySummary(String vehicleId, Integer lap) {
        String sql = """
                SELECT telemetry_name,
                       COUNT(*)              AS n,
                       MIN(telemetry_value)  AS min_value,
                       MAX(telemetry_value)  AS max_value,
                       AVG(telemetry_value)  AS avg_value
                FROM telemetry
                WHERE vehicle_id = ? %s
                GROUP BY telemetry_name
                ORDER BY telemetry_name
                """.formatted(lap != null ? "AND lap = ?" : "");

        Object[] args = lap != null ? new Object[]{vehicleId, lap} : new Object[]{vehicleId};
        return jdbcTemplate.query(sql, (rs, i) -> new ChannelSummary(
                rs.getString("telemetry_name"),
                rs.getLong("n"),
                rs.getDouble("min_value"),
                rs.getDouble("max_value"),
                rs.getDouble("avg_value")), args);
    }

    public Optional<Vehicle> findVehicle(String vehicleId) {
        List<Vehicle> found = jdbcTemplate.query(
                "SELECT * FROM vehicles WHERE vehicle_id = ?", VEHICLE_MAPPER, vehicleId);
        return found.stream().findFirst();
    }

    public List<Vehicle> listVehicles() {
        return jdbcTemplate.query("SELECT * FROM vehicles ORDER BY car_number", VEHICLE_MAPPER);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private List<String> speedChannels() {
        List<String> channels = properties.getStatistics().getSpeedChannels();
        // IN () is a syntax error; an impossible name keeps max_speed null instead
        return channels == null || channels.isEmpty() ? List.of("") : channels;
    }

    private static String placeholders(int n) {
        return String.join(", ", Collections.nCopies(n, "?"));
    }

    private static Vehicle mapVehicle(ResultSet rs, int rowNum) throws SQLException {
        return Vehicle.builder()
                .vehicleId(rs.getString("vehicle_id"))
                .carNumber(rs.getInt("car_number"))
                .vehicleClass(rs.getString("class"))
                .fastestLap(nullableDouble(rs, "fastest_lap"))
                .averageLap(nullableDouble(rs, "average_lap"))
                .totalLaps(nullableInt(rs, "total_laps"))
                .maxSpeed(nullableDouble(rs, "max_speed"))
                .position(nullableInt(rs, "position"))
                .build();
    }

    private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }
}
