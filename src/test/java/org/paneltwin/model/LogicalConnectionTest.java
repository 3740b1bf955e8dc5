package org.paneltwin.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Logical Connection Tests")
class LogicalConnectionTest {

    private static LogicalConnection connection(String id, PinRef from, PinRef to, WireType type, String label) {
        return LogicalConnection.builder()
                .id(id)
                .fromPin(from)
                .toPin(to)
                .wireType(type)
                .label(label)
                .build();
    }

    @Test
    @DisplayName("Same pins in either direction are the same pair")
    void testEqualsIgnoringOrder() {
        PinRef l1 = PinRef.of("MCB_1", "L1");
        PinRef a1 = PinRef.of("RELAY_1", "A1");
        LogicalConnection forward = connection("CONN_1", l1, a1, WireType.POWER, null);
        LogicalConnection reversed = connection("CONN_2", a1, l1, WireType.SIGNAL, "24VDC");

        assertTrue(forward.equalsIgnoringOrder(reversed));
        assertTrue(reversed.equalsIgnoringOrder(forward));
        assertTrue(forward.equalsIgnoringOrder(forward));
        assertNotEquals(forward, reversed);
    }

    @Test
    @DisplayName("Different pins or a shared single pin are different pairs")
    void testDifferentPairs() {
        PinRef l1 = PinRef.of("MCB_1", "L1");
        PinRef out = PinRef.of("MCB_1", "OUT");
        PinRef a1 = PinRef.of("RELAY_1", "A1");
        LogicalConnection base = connection("CONN_1", l1, a1, WireType.POWER, null);

        assertFalse(base.equalsIgnoringOrder(connection("CONN_2", out, a1, WireType.POWER, null)));
        assertFalse(base.equalsIgnoringOrder(connection("CONN_3", a1, a1, WireType.POWER, null)));
        assertFalse(base.equalsIgnoringOrder(connection("CONN_4", l1, l1, WireType.POWER, null)));
        assertFalse(base.equalsIgnoringOrder(null));
    }

    @Test
    @DisplayName("References match either end's instance")
    void testReferences() {
        LogicalConnection connection = connection(
                "CONN_1", PinRef.of("MCB_1", "OUT"), PinRef.of("RELAY_1", "A1"), WireType.POWER, null);
        assertTrue(connection.references("MCB_1"));
        assertTrue(connection.references("RELAY_1"));
        assertFalse(connection.references("TERMINAL_1"));
    }
}
