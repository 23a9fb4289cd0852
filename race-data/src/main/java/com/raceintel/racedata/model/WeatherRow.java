package com.raceintel.racedata.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class WeatherRow {

    Instant timestamp;
    Double airTemp;
    Double trackTemp;
    Double humidity;
    Double pressure;
    Double windSpeed;
    Double windDirection;
    Double rain;
}
