package com.raceintel.racedata.replay;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Keyset pagination over telemetry. Pages continue from the last (timestamp, id) seen
 * rather than an OFFSET, so rows appended by a concurrent import never shift a page boundary.
 */
@Component
@RequiredArgsConstructor
public class JdbcTelemetryPageReader implements TelemetryPageReader {

    private static final RowMapper<TelemetryPoint> MAPPER = (rs, i) -> {
        int lap = rs.getInt("lap");
        return new TelemetryPoint(
                rs.getLong("id"),
                rs.getString("vehicle_id"),
                rs.wasNull() ? null : lap,
                rs.getString("timestamp"),
                rs.getString("telemetry_name"),
                rs.getDouble("telemetry_value"));
    };

    private final JdbcTemplate jdbcTemplate;

    @Override
    public List<TelemetryPoint> readPage(ReplayRequest request, TelemetryPoint after, int limit) {
        StringBuilder sql = new StringBuilder("""
                SELECT id, vehicle_id, lap, timestamp, telemetry_name, telemetry_value
                FROM telemetry
                WHERE vehicle_id = ?""");
        List<Object> args = new ArrayList<>();
        args.add(request.vehicleId());

        if (request.lap() != null) {
            sql.append(" AND lap = ?");
            args.add(request.lap());
        }
        if (!request.telemetryNames().isEmpty()) {
            sql.append(" AND telemetry_name IN (")
                    .append(String.join(", ", Collections.nCopies(request.telemetryNames().size(), "?")))
                    .append(")");
            args.addAll(request.telemetryNames());
        }
        if (after != null) {
            sql.append(" AND (timestamp > ? OR (timestamp = ? AND id > ?))");
            args.add(after.timestamp());
            args.add(after.timestamp());
            args.add(after.id());
        }
        sql.append(" ORDER BY timestamp, id LIMIT ?");
        args.add(limit);

        return jdbcTemplate.query(sql.toString(), MAPPER, args.toArray());
    }
}
