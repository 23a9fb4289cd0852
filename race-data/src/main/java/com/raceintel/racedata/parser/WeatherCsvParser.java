package com.raceintel.racedata.parser;

import com.raceintel.racedata.model.SourceType;
import com.raceintel.racedata.model.WeatherRow;
import org.springframework.stereotype.Component;

/**
 * Weather station log. TIME_UTC_SECONDS is epoch seconds; TIME_UTC_STR is used when it is absent.
 */
@Component
public class WeatherCsvParser extends CsvSourceParser<WeatherRow> {

    @Override
    public SourceType sourceType() {
        return SourceType.WEATHER;
    }

    @Override
    protected WeatherRow mapRow(CsvRow row) {
        return WeatherRow.builder()
                .timestamp(row.requireTimestamp("time_utc_seconds", "time_utc_str", "timestamp"))
                .airTemp(row.optionalDouble("air_temp"))
                .trackTemp(row.optionalDouble("track_temp"))
                .humidity(row.optionalDouble("humidity"))
                .pressure(row.optionalDouble("pressure"))
                .windSpeed(row.optionalDouble("wind_speed"))
                .windDirection(row.optionalDouble("wind_direction"))
                .rain(row.optionalDouble("rain"))
                .build();
    }
}
