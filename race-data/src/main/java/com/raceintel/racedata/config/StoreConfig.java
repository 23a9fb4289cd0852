package com.raceintel.racedata.config;

import com.raceintel.racedata.exception.ErrorCode;
import com.raceintel.racedata.exception.RaceDataException;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Wires the SQLite store and the replay worker pool.
 *
 * The store runs in WAL mode so replay readers are not blocked by an import in progress.
 * Foreign keys are enforced on every pooled connection.
 */
@Configuration
@Slf4j
public class StoreConfig {

    @Bean(destroyMethod = "close")
    public HikariDataSource dataSource(RaceDataProperties properties) {
        RaceDataProperties.Store store = properties.getStore();
        Path dbPath = Paths.get(store.getPath()).toAbsolutePath();
        ensureDirectory(dbPath.getParent());

        HikariConfig config = new HikariConfig();
        config.setPoolName("race-data-store");
        config.setDriverClassName("org.sqlite.JDBC");
        config.setJdbcUrl("jdbc:sqlite:" + dbPath);
        config.setMaximumPoolSize(store.getMaxPoolSize());
        config.addDataSourceProperty("foreign_keys", "true");
        config.addDataSourceProperty("journal_mode", "WAL");
        config.addDataSourceProperty("busy_timeout", String.valueOf(store.getBusyTimeoutMs()));

        log.info("Opening race data store at {}", dbPath);
        return new HikariDataSource(config);
    }

    @Bean(destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor replayExecutor(RaceDataProperties properties) {
        int sessions = properties.getReplay().getMaxConcurrentSessions();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(sessions);
        executor.setMaxPoolSize(sessions);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("replay-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    private void ensureDirectory(Path dir) {
        if (dir == null) return;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new RaceDataException(ErrorCode.CONFIG_ERROR, "Cannot create store directory: " + dir, e);
        }
    }
}
