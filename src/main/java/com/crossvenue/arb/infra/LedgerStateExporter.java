package com.crossvenue.arb.infra;

import com.crossvenue.arb.config.ArbitrageProperties;
import com.crossvenue.arb.risk.LedgerSnapshot;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes ledger snapshots as JSON to {@code arb.infra.ledger-state-file}. The file is replaced
 * atomically so readers never see a partial snapshot.
 */
@Slf4j
@Component
public class LedgerStateExporter {

    private final ObjectMapper objectMapper;
    private final Path stateFile;

    public LedgerStateExporter(ObjectMapper objectMapper, ArbitrageProperties properties) {
        this.objectMapper = objectMapper;
        String file = properties.getInfra().getLedgerStateFile();
        this.stateFile = file == null || file.isBlank() ? null : Path.of(file);
    }

    public boolean isEnabled() {
        return stateFile != null;
    }

    /**
     * @return true if the snapshot was written
     */
    public synchronized boolean export(LedgerSnapshot snapshot) {
        if (stateFile == null) {
            return false;
        }
        try {
            Path dir = stateFile.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            Path tmp = Files.createTempFile(dir, stateFile.getFileName().toString(), ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), snapshot);
            Files.move(tmp, stateFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Ledger state written to {}", stateFile);
            return true;
        } catch (IOException e) {
            log.error("Failed to write ledger state to {}", stateFile, e);
            return false;
        }
    }
}
