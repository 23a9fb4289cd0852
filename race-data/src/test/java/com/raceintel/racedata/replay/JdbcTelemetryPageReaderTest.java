package com.raceintel.racedata.replay;

import com.raceintel.racedata.StoreTestSupport;
import com.raceintel.racedata.model.SourceBatch;
import com.raceintel.racedata.model.SourceType;
import com.raceintel.racedata.model.TelemetryRow;
import com.raceintel.racedata.model.VehicleIdentity;
import com.raceintel.racedata.output.ReferentialLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Keyset pagination over real telemetry rows inserted out of time order.
 */
@SpringBootTest
@ActiveProfiles("test")
class JdbcTelemetryPageReaderTest {

    private static final VehicleIdentity CAR = new VehicleIdentity("GR86-004-78", 78);
    private static final Instant T0 = Instant.parse("2025-04-27T14:00:00Z");

    @Autowired
    private JdbcTelemetryPageReader reader;

    @Autowired
    private ReferentialLoader loader;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        StoreTestSupport.clear(jdbcTemplate);
        // arrival order is not time order; three rows share one timestamp
        loader.load(new SourceBatch("t.csv", SourceType.TELEMETRY, List.of(
                row(3, 1, "vCar", 3),
                row(1, 1, "vCar", 1),
                row(2, 1, "vCar", 21),
                row(2, 1, "aps", 22),
                row(2, 1, "gear", 23),
                row(5, 2, "vCar", 5),
                row(4, 2, "aps", 4))), List.of(CAR));
    }

    @Test
    void testPagesAreChronologicalWithoutGapsOrDuplicates() {
        ReplayRequest request = new ReplayRequest(CAR.vehicleId(), null, null, 1.0);

        List<TelemetryPoint> all = new ArrayList<>();
        TelemetryPoint last = null;
        List<TelemetryPoint> page;
        do {
            page = reader.readPage(request, last, 2);
            all.addAll(page);
            if (!page.isEmpty()) last = page.get(page.size() - 1);
        } while (page.size() == 2);

        assertEquals(7, all.size());
        assertEquals(7, all.stream().map(TelemetryPoint::id).distinct().count());
        for (int i = 1; i < all.size(); i++) {
            TelemetryPoint prev = all.get(i - 1);
            TelemetryPoint cur = all.get(i);
            int byTime = prev.timestamp().compareTo(cur.timestamp());
            assertTrue(byTime < 0 || (byTime == 0 && prev.id() < cur.id()), "out of order at " + i);
        }
        assertEquals(1.0, all.get(0).telemetryValue());
        assertEquals(5.0, all.get(6).telemetryValue());
    }

    @Test
    void testLapAndChannelFilters() {
        List<TelemetryPoint> lapTwo = reader.readPage(new ReplayRequest(CAR.vehicleId(), 2, null, 1.0), null, 100);
        assertEquals(2, lapTwo.size());
        assertEquals("aps", lapTwo.get(0).telemetryName());

        List<TelemetryPoint> vCar = reader.readPage(
                new ReplayRequest(CAR.vehicleId(), null, List.of("vCar", "gear"), 1.0), null, 100);
        assertEquals(5, vCar.size());
        assertTrue(vCar.stream().allMatch(p -> p.telemetryName().equals("vCar") || p.telemetryName().equals("gear")));
    }

    @Test
    void testUnknownVehicleReadsNothing() {
        assertTrue(reader.readPage(new ReplayRequest("GR86-004-999", null, null, 1.0), null, 100).isEmpty());
    }

    private TelemetryRow row(int second, int lap, String name, double value) {
        return TelemetryRow.builder()
                .vehicleId(CAR.vehicleId())
                .lap(lap)
                .timestamp(T0.plusSeconds(second))
                .telemetryName(name)
                .telemetryValue(value)
                .build();
    }
}
