package com.example.covenant;

import com.example.covenant.adversary.ThreatTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ThreatTableTest {

    private final ThreatTable table = new ThreatTable(Fixtures.quietBalance().getThreat());

    private static Map<String, Double> gains(Object... pairs) {
        Map<String, Double> m = new HashMap<>();
        for (int i = 0; i + 1 < pairs.length; i += 2) {
            m.put((String) pairs[i], ((Number) pairs[i + 1]).doubleValue());
        }
        return m;
    }

    @Test
    void testRoundGain_weights() {
        // 2 * 10 * 1.0 + 10 * 1.0 + 10 * 0.8
        assertEquals(38.0, table.roundGain(2, 10, 10, 10), 1e-9);
    }

    @Test
    @DisplayName("Negative armor never produces negative threat")
    void testRoundGain_flooredAtZero() {
        assertEquals(0.0, table.roundGain(-5, 10, 0, 0), 1e-9);
    }

    @Test
    void testUpdate_decaysThenAdds() {
        table.update(gains("a", 40));
        table.update(gains("a", 10, "b", 5));
        // 40 * 0.75 + 10
        assertEquals(40.0, table.get("a"), 1e-9);
        assertEquals(5.0, table.get("b"), 1e-9);
    }

    @Test
    void testUpdate_prunesBelowEpsilon() {
        table.update(gains("a", 0.2));
        table.update(gains());
        // 0.15 stays, then 0.1125 stays, then 0.084 drops
        table.update(gains());
        assertTrue(table.get("a") > 0);
        table.update(gains());
        assertEquals(0.0, table.get("a"), 1e-9);
        assertTrue(table.isEmpty());
    }

    @Test
    void testDeathReduction() {
        table.update(gains("a", 40, "b", 10));
        table.applyDeathReduction();
        assertEquals(20.0, table.get("a"), 1e-9);
        assertEquals(5.0, table.get("b"), 1e-9);
    }

    @Test
    void testRemoveAndSnapshot() {
        table.update(gains("a", 40, "b", 10));
        table.remove("a");
        assertEquals(1, table.snapshot().size());
        assertThrows(UnsupportedOperationException.class, () -> table.snapshot().put("c", 1.0));
        for (double v : table.snapshot().values()) {
            assertTrue(v >= 0);
        }
    }
}
