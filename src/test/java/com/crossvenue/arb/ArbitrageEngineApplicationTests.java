package com.crossvenue.arb;

import com.crossvenue.arb.core.ArbitrageEngine;
import com.crossvenue.arb.core.ArbitrageOrchestrator;
import com.crossvenue.arb.execution.TwoLegExecutor;
import com.crossvenue.arb.execution.UnhedgedExposurePolicy;
import com.crossvenue.arb.execution.VenueAdapterRegistry;
import com.crossvenue.arb.infra.PaperVenueAdapter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "arb.scan.enabled=false")
class ArbitrageEngineApplicationTests {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private TwoLegExecutor executor;

    @Autowired
    private VenueAdapterRegistry venueAdapters;

    @Test
    void contextLoads() {
        assertNotNull(context.getBean(ArbitrageEngine.class));
        assertTrue(context.getBeansOfType(ArbitrageOrchestrator.class).isEmpty());
        assertEquals(UnhedgedExposurePolicy.ALERT_ONLY, executor.getUnhedgedPolicy());
        assertInstanceOf(PaperVenueAdapter.class, venueAdapters.resolve("kalshi"));
    }
}
