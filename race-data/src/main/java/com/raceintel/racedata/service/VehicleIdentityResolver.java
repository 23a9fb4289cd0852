package com.raceintel.racedata.service;

import com.raceintel.racedata.config.RaceDataProperties;
import com.raceintel.racedata.exception.IdentityException;
import com.raceintel.racedata.model.VehicleIdentity;
import com.raceintel.racedata.model.VehicleScopedRow;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps car numbers to canonical vehicle ids and collects the identities seen in one import run.
 *
 * {@link #resolve(int)} is a pure function of the car number and the configured template,
 * so lap, telemetry and result rows for the same car always land on the same id without a
 * join table. Ids supplied directly by a source (GR86-002-78, or just 78) are canonicalised
 * through the car number in their last numeric segment.
 *
 * One instance per import run; not thread-safe.
 */
@Slf4j
public class VehicleIdentityResolver {

    private static final Pattern TRAILING_NUMBER = Pattern.compile("(\\d+)\\s*$");

    private final RaceDataProperties.Identity template;
    private final Map<String, VehicleIdentity> seen = new LinkedHashMap<>();

    public VehicleIdentityResolver(RaceDataProperties.Identity template) {
        this.template = template;
    }

    public String resolve(int carNumber) {
        if (carNumber <= 0) {
            throw new IdentityException("Car number must be positive: " + carNumber);
        }
        return template.getPrefix()
                + "-" + pad(template.getSeries(), template.getSeriesWidth())
                + "-" + pad(carNumber, template.getNumberWidth());
    }

    /**
     * Canonical id for a vehicle reference as a source supplied it.
     */
    public String resolveSupplied(String vehicleRef) {
        return identify(vehicleRef).vehicleId();
    }

    public VehicleIdentity identify(String vehicleRef) {
        if (vehicleRef == null || vehicleRef.isBlank()) {
            throw new IdentityException("Missing vehicle reference");
        }
        Matcher m = TRAILING_NUMBER.matcher(vehicleRef.trim());
        if (!m.find()) {
            throw new IdentityException("No car number in vehicle reference '" + vehicleRef + "'");
        }
        int carNumber;
        try {
            carNumber = Integer.parseInt(m.group(1));
        } catch (NumberFormatException e) {
            throw new IdentityException("Car number out of range in '" + vehicleRef + "'");
        }
        return new VehicleIdentity(resolve(carNumber), carNumber);
    }

    /**
     * Resolve every row of one file, registering each identity with this run.
     * Rows whose reference cannot be resolved are dropped and reported in the result.
     */
    public <T extends VehicleScopedRow<T>> Resolution<T> resolveRows(String source, List<T> rows) {
        List<T> resolved = new ArrayList<>(rows.size());
        Map<String, VehicleIdentity> fileIdentities = new LinkedHashMap<>();
        int rejected = 0;

        for (T row : rows) {
            try {
                VehicleIdentity identity = identify(row.getVehicleRef());
                fileIdentities.putIfAbsent(identity.vehicleId(), identity);
                resolved.add(row.withVehicleId(identity.vehicleId()));
            } catch (IdentityException e) {
                rejected++;
                if (rejected == 1) {
                    log.warn("{}: {}", source, e.getMessage());
                }
            }
        }

        if (rejected > 0) {
            log.warn("{}: {} records dropped with unresolvable vehicle references", source, rejected);
        }
        fileIdentities.values().forEach(id -> seen.putIfAbsent(id.vehicleId(), id));
        return new Resolution<>(resolved, List.copyOf(fileIdentities.values()), rejected);
    }

    /** Every identity registered so far in this run, in first-seen order. */
    public Collection<VehicleIdentity> identities() {
        return Collections.unmodifiableCollection(seen.values());
    }

    private String pad(int value, int width) {
        return width > 0 ? String.format("%0" + width + "d", value) : String.valueOf(value);
    }

    public record Resolution<T>(List<T> rows, Collection<VehicleIdentity> identities, int rejected) {}
}
