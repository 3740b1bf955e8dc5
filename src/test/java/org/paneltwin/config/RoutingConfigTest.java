package org.paneltwin.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Routing Config Tests")
class RoutingConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(RoutingConfig.PROP_RESOLUTION_MM);
        System.clearProperty(RoutingConfig.PROP_MAX_EXPANDED_CELLS);
        System.clearProperty(RoutingConfig.PROP_SNAP_TOLERANCE_MM);
    }

    @Test
    @DisplayName("Built-in defaults apply without properties")
    void testDefaults() {
        RoutingConfig config = RoutingConfig.defaults();
        assertEquals(10.0d, config.getResolutionMm());
        assertEquals(5.0d, config.getClearanceMm());
        assertEquals(2_000_000, config.getMaxExpandedCells());
        assertEquals(17.5d, config.getModuleWidthMm());
        assertEquals(30.0d, config.getSnapToleranceMm());
        assertEquals(2.0d, config.getWireThicknessMm());
    }

    @Test
    @DisplayName("System properties override defaults")
    void testOverrides() {
        System.setProperty(RoutingConfig.PROP_RESOLUTION_MM, "5");
        System.setProperty(RoutingConfig.PROP_MAX_EXPANDED_CELLS, " 1000 ");
        RoutingConfig config = RoutingConfig.defaults();
        assertEquals(5.0d, config.getResolutionMm());
        assertEquals(1000, config.getMaxExpandedCells());
    }

    @Test
    @DisplayName("Unparsable properties fall back")
    void testFallback() {
        System.setProperty(RoutingConfig.PROP_RESOLUTION_MM, "fine");
        System.setProperty(RoutingConfig.PROP_SNAP_TOLERANCE_MM, "NaN");
        RoutingConfig config = RoutingConfig.defaults();
        assertEquals(RoutingConfig.DEFAULT_RESOLUTION_MM, config.getResolutionMm());
        assertEquals(RoutingConfig.DEFAULT_SNAP_TOLERANCE_MM, config.getSnapToleranceMm());
    }
}
