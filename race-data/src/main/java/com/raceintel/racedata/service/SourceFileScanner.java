package com.raceintel.racedata.service;

import com.raceintel.racedata.exception.ErrorCode;
import com.raceintel.racedata.exception.RaceDataException;
import com.raceintel.racedata.model.SourceType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Classifies the CSV files of a data directory by source type.
 * Only the top level of the directory is scanned.
 */
@Component
@Slf4j
public class SourceFileScanner {

    /**
     * @return every source type mapped to its files, sorted by name; types with no files map to an empty list
     */
    public Map<SourceType, List<Path>> scan(Path dataDir) {
        if (!Files.isDirectory(dataDir)) {
            throw new RaceDataException(ErrorCode.CONFIG_ERROR, "Data directory not found: " + dataDir);
        }

        Map<SourceType, List<Path>> found = new EnumMap<>(SourceType.class);
        for (SourceType type : SourceType.values()) {
            found.put(type, new ArrayList<>());
        }

        try (Stream<Path> entries = Files.list(dataDir)) {
            entries.filter(Files::isRegularFile)
                    .sorted()
                    .forEach(file -> {
                        String name = file.getFileName().toString();
                        Optional<SourceType> type = SourceType.forFileName(name);
                        if (type.isPresent()) {
                            found.get(type.get()).add(file);
                        } else {
                            log.debug("Ignoring {}", name);
                        }
                    });
        } catch (IOException e) {
            throw new RaceDataException(ErrorCode.CONFIG_ERROR, "Cannot list data directory " + dataDir, e);
        }

        found.forEach((type, files) -> log.info("Found {} {} file(s)", files.size(), type));
        return found;
    }
}
