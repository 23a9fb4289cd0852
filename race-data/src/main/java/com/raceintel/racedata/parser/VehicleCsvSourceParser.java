package com.raceintel.racedata.parser;

import com.raceintel.racedata.model.VehicleScopedRow;

/**
 * Parser for a source whose rows reference a vehicle and must be resolved before loading.
 */
public abstract class VehicleCsvSourceParser<T extends VehicleScopedRow<T>> extends CsvSourceParser<T> {
}
