package com.raceintel.racedata.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "race-data")
@Data
public class RaceDataProperties {

    private Store store = new Store();
    private Identity identity = new Identity();
    private Import importing = new Import();
    private Statistics statistics = new Statistics();
    private Replay replay = new Replay();

    @Data
    public static class Store {
        private String path = "./data/racing.db";
        private int busyTimeoutMs = 5000;
        private int maxPoolSize = 8;
    }

    /**
     * Vehicle ids are rendered as PREFIX-SERIES-NUMBER, e.g. GR86-004-78.
     */
    @Data
    public static class Identity {
        private String prefix = "GR86";
        private int series = 4;
        private int seriesWidth = 3;
        /** 0 = no padding on the car number */
        private int numberWidth = 0;
    }

    @Data
    public static class Import {
        private int batchSize = 1000;
        private boolean force = false;
    }

    @Data
    public static class Statistics {
        private List<String> speedChannels = new ArrayList<>(List.of("vCar", "speed_can"));
    }

    @Data
    public static class Replay {
        private int pageSize = 100;
        private double defaultPlaybackSpeed = 1.0;
        private double minPlaybackSpeed = 0.1;
        private double maxPlaybackSpeed = 10.0;
        private long minDelayMs = 1;
        private int maxConcurrentSessions = 16;
        /** 0 = never time out the SSE connection */
        private long emitterTimeoutMs = 0;
    }
}
