package org.carball.relinfer.source;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.relinfer.exception.ConfigurationException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Slf4j
public class DatasetSnapshotLoader {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public DatasetSnapshot load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new ConfigurationException("Dataset snapshot not found: " + file);
        }

        try {
            DatasetSnapshot snapshot = objectMapper.readValue(file.toFile(), DatasetSnapshot.class);
            if (snapshot.getTables() == null || snapshot.getTables().isEmpty()) {
                throw new ConfigurationException("Dataset snapshot " + file + " contains no tables");
            }
            if (snapshot.getSourceId() == null) {
                snapshot.setSourceId(file.getFileName().toString());
            }
            for (DatasetSnapshot.TableData table : snapshot.getTables()) {
                if (table.getName() == null || table.getName().isBlank()) {
                    throw new ConfigurationException("Dataset snapshot " + file + " has a table without a name");
                }
                if (table.getKeyColumn() == null) {
                    table.setKeyColumn("id");
                }
            }
            log.info("Loaded snapshot '{}' with {} tables from {}",
                    snapshot.getSourceId(), snapshot.getTables().size(), file);
            return snapshot;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to parse dataset snapshot " + file + ": " + e.getMessage(), e);
        }
    }
}
