package com.crossvenue.arb.infra;

import com.crossvenue.arb.TestFixtures;
import com.crossvenue.arb.config.ArbitrageProperties;
import com.crossvenue.arb.domain.CapitalAllocation;
import com.crossvenue.arb.domain.Side;
import com.crossvenue.arb.domain.StrategyKind;
import com.crossvenue.arb.risk.CapitalLedger;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class LedgerStateExporterTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    @Test
    void writesSnapshotAsJson(@TempDir Path dir) throws Exception {
        Path stateFile = dir.resolve("state").resolve("ledger.json");
        ArbitrageProperties properties = TestFixtures.properties();
        properties.getInfra().setLedgerStateFile(stateFile.toString());
        CapitalLedger ledger = new CapitalLedger(properties, Clock.fixed(TestFixtures.NOW, ZoneOffset.UTC));
        CapitalAllocation allocation = ledger.authorize("opp-1", StrategyKind.REBALANCING, new BigDecimal("250"))
                .getAllocation();
        String positionId = ledger.recordOpen(allocation, new BigDecimal("0.40"), Side.BUY).getPositionId();
        ledger.authorize("opp-2", StrategyKind.COMBINATORIAL, new BigDecimal("100"));

        LedgerStateExporter exporter = new LedgerStateExporter(objectMapper, properties);

        assertTrue(exporter.isEnabled());
        assertTrue(exporter.export(ledger.snapshot()));

        JsonNode state = objectMapper.readTree(Files.readString(stateFile));
        assertEquals(10000, state.get("totalCapitalUsd").asInt());
        assertEquals(positionId, state.get("positions").get(0).get("positionId").asText());
        assertEquals("OPEN", state.get("positions").get(0).get("status").asText());
        assertEquals("opp-2", state.get("reservations").get(0).get("opportunityId").asText());
        assertEquals(0, state.get("pnlHistory").size());
        try (Stream<Path> files = Files.list(stateFile.getParent())) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void disabledWithoutConfiguredFile() {
        LedgerStateExporter exporter = new LedgerStateExporter(objectMapper, TestFixtures.properties());

        assertFalse(exporter.isEnabled());
        assertFalse(exporter.export(null));
    }
}
