package com.example.covenant;

import com.example.covenant.config.ConfigurationException;
import com.example.covenant.config.GameBalance;
import com.example.covenant.config.GameBalanceLoader;
import com.example.covenant.model.AbilityCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for loading and validating balance settings.
 */
public class GameBalanceLoaderTest {

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    private static Map<String, Object> override(String key, Object value) {
        Map<String, Object> m = new HashMap<>();
        m.put(key, value);
        return m;
    }

    @Test
    @DisplayName("Bundled defaults load with their documented values")
    void testDefaults() {
        GameBalance b = GameBalanceLoader.loadDefaults();

        assertEquals(0.1, b.getArmor().getReductionRate(), 1e-9);
        assertEquals(0.75, b.getArmor().getMaxReduction(), 1e-9);
        assertEquals(2.0, b.getArmor().getNegativeCap(), 1e-9);
        assertEquals(1.5, b.getVariance().getCritMultiplier(), 1e-9);
        assertEquals(5, b.getCoordination().getMaxCoordinators());
        assertEquals(25.0, b.getComeback().getThresholdPercent(), 1e-9);
        assertEquals(0.45, b.getCorruption().getBaseChance(), 1e-9);
        assertEquals(1, b.getCorruption().getMaxPerRound());
        assertEquals(0.25, b.getThreat().getDecayRate(), 1e-9);
        assertEquals(100, b.getAdversary().getBaseHp());
        assertEquals(10, b.getEffects().getMaxTurns());
        assertEquals(0, b.getPendingDeathHp());
        assertNull(b.getCooldownOverride("slash"));
    }

    @Test
    void testOverrideReplacesValue() {
        GameBalance b = GameBalanceLoader.loadDefaults(override("variance.critChance", 0.2));
        assertEquals(0.2, b.getVariance().getCritChance(), 1e-9);
        assertEquals(0.05, b.getVariance().getFailChance(), 1e-9);
    }

    @Test
    void testCooldownOverride() {
        GameBalance b = GameBalanceLoader.loadDefaults(override("abilityCooldowns.slash", 3));
        assertEquals(Integer.valueOf(3), b.getCooldownOverride("slash"));
    }

    @Test
    void testPriorityBands() {
        GameBalance.PriorityBands bands = GameBalanceLoader.loadDefaults().getPriorityBands();
        assertTrue(bands.isWithinExpectedBand(AbilityCategory.HEAL, 10000));
        assertFalse(bands.isWithinExpectedBand(AbilityCategory.HEAL, 1000));
        // reflexive abilities may come from any category
        assertTrue(bands.isWithinExpectedBand(AbilityCategory.ATTACK, 5));
    }

    // === Validation ===

    @Test
    void testInvalid_chancesAboveOne() {
        Map<String, Object> o = new HashMap<>();
        o.put("variance.critChance", 0.5);
        o.put("variance.failChance", 0.4);
        o.put("variance.wildChance", 0.2);
        assertThrows(ConfigurationException.class, () -> GameBalanceLoader.loadDefaults(o));
    }

    @Test
    void testInvalid_negativeChance() {
        assertThrows(ConfigurationException.class,
                () -> GameBalanceLoader.loadDefaults(override("variance.critChance", -0.1)));
    }

    @Test
    void testInvalid_wrongType() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> GameBalanceLoader.loadDefaults(override("armor.reductionRate", "lots")));
        assertTrue(e.getMessage().contains("armor.reductionRate"), e.getMessage());
    }

    @Test
    void testInvalid_negativeCooldownOverride() {
        assertThrows(ConfigurationException.class,
                () -> GameBalanceLoader.loadDefaults(override("abilityCooldowns.slash", -1)));
    }

    @Test
    void testInvalid_missingSection() {
        assertThrows(ConfigurationException.class,
                () -> GameBalanceLoader.load(yaml("armor:\n  reductionRate: 0.1\n"), Collections.emptyMap()));
    }

    @Test
    void testInvalid_notYaml() {
        assertThrows(ConfigurationException.class,
                () -> GameBalanceLoader.load(yaml("armor: [unclosed\n"), null));
        assertThrows(ConfigurationException.class,
                () -> GameBalanceLoader.load(yaml("- just\n- a list\n"), null));
    }

    @Test
    void testInvalid_missingResource() {
        assertThrows(ConfigurationException.class,
                () -> GameBalanceLoader.loadResource("/config/nope.yaml", null));
    }
}
