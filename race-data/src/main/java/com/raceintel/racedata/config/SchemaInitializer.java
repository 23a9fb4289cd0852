package com.raceintel.racedata.config;

import com.raceintel.racedata.output.SchemaManager;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Ensures the store schema exists as soon as the context is up, for both the
 * replay server and the import CLI.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SchemaInitializer {

    private final SchemaManager schemaManager;
    private final RaceDataProperties properties;

    @PostConstruct
    public void onStartup() {
        try {
            schemaManager.ensureSchema();
            log.info("Race data store ready at {}", properties.getStore().getPath());
        } catch (Exception e) {
            // the import service re-checks before writing and fails loudly there
            log.warn("Could not initialise race data schema: {}", e.getMessage());
        }
    }
}
