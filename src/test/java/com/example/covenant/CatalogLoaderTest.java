package com.example.covenant;

import com.example.covenant.config.CatalogLoader;
import com.example.covenant.config.ConfigurationException;
import com.example.covenant.config.GameBalance;
import com.example.covenant.config.GameBalanceLoader;
import com.example.covenant.effect.EffectDefinition;
import com.example.covenant.effect.EffectRegistry;
import com.example.covenant.model.Ability;
import com.example.covenant.model.AbilityCatalog;
import com.example.covenant.model.AbilityCategory;
import com.example.covenant.model.TargetShape;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the ability catalog and status effect registry loaders.
 */
public class CatalogLoaderTest {

    private final GameBalance balance = GameBalanceLoader.loadDefaults();

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    private static String ability(String id, String category, String target, int priority, int cooldown, String extra) {
        return "abilities:\n"
                + "  - id: " + id + "\n"
                + "    category: " + category + "\n"
                + "    target: " + target + "\n"
                + "    priority: " + priority + "\n"
                + "    cooldown: " + cooldown + "\n"
                + extra;
    }

    // === Bundled catalogs ===

    @Test
    @DisplayName("Bundled effects and abilities load and cross-reference")
    void testDefaults() {
        EffectRegistry effects = CatalogLoader.loadDefaultEffects();
        AbilityCatalog abilities = CatalogLoader.loadDefaultAbilities(balance, effects);

        assertEquals(15, effects.getDefinitions().size());
        assertEquals(19, abilities.size());
        for (Ability a : abilities.all()) {
            if (a.hasEffect()) {
                assertTrue(effects.contains(a.getEffectId()), a.getId());
            }
        }
    }

    @Test
    void testDefaults_effectDetails() {
        EffectRegistry effects = CatalogLoader.loadDefaultEffects();

        EffectDefinition poison = effects.getDefinition("poison");
        assertEquals(EffectDefinition.Type.DOT, poison.getType());
        assertTrue(poison.isStackable());
        assertTrue(poison.hasFlag(EffectDefinition.Flag.TRIGGERS_SECONDARY_DECAY));

        EffectDefinition stone = effects.getDefinition("stoneArmor");
        assertTrue(stone.isPermanent());
        assertEquals(-1.0, stone.getMagnitude("minimum", 0), 1e-9);

        assertTrue(effects.getDefinition("enraged").hasFlag(EffectDefinition.Flag.BLOCKS_HEALING));
    }

    @Test
    void testDefaults_abilityDetails() {
        AbilityCatalog abilities = CatalogLoader.loadDefaultAbilities(balance, CatalogLoader.loadDefaultEffects());

        Ability fireball = abilities.get("fireball");
        assertEquals(AbilityCategory.ATTACK, fireball.getCategory());
        assertEquals(TargetShape.SINGLE_OTHER, fireball.getTargetShape());
        assertEquals(22.0, fireball.getDamage(), 1e-9);
        assertEquals("poison", fireball.getEffectId());
        assertTrue(abilities.get("blizzard").includesAdversary());
    }

    @Test
    void testCooldownOverrideApplied() {
        GameBalance b = GameBalanceLoader.loadDefaults(Collections.singletonMap("abilityCooldowns.slash", 4));
        AbilityCatalog abilities = CatalogLoader.loadDefaultAbilities(b, CatalogLoader.loadDefaultEffects());
        assertEquals(4, abilities.get("slash").getCooldown());
    }

    // === Abilities ===

    @Test
    void testAbility_minimal() {
        AbilityCatalog c = CatalogLoader.loadAbilities(
                yaml(ability("jab", "attack", "single_other", 1000, 0, "    params: { damage: 9 }\n")),
                "test", balance, Fixtures.EFFECTS);
        assertEquals(9.0, c.get("jab").getDamage(), 1e-9);
        assertEquals("jab", c.get("jab").getName());
    }

    @Test
    @DisplayName("A priority outside its band is accepted")
    void testAbility_outOfBandIsOnlyWarned() {
        AbilityCatalog c = CatalogLoader.loadAbilities(
                yaml(ability("slowHeal", "HEAL", "SELF", 2000, 0, "")), "test", balance, Fixtures.EFFECTS);
        assertEquals(2000, c.get("slowHeal").getPriority());
    }

    @Test
    void testAbility_unknownEffect() {
        assertThrows(ConfigurationException.class, () -> CatalogLoader.loadAbilities(
                yaml(ability("hex", "SPECIAL", "SINGLE_OTHER", 500, 0, "    effect: cursed\n")),
                "test", balance, Fixtures.EFFECTS));
    }

    @Test
    void testAbility_unknownCategory() {
        assertThrows(ConfigurationException.class, () -> CatalogLoader.loadAbilities(
                yaml(ability("dance", "PERFORMANCE", "SELF", 500, 0, "")), "test", balance, Fixtures.EFFECTS));
    }

    @Test
    void testAbility_negativeCooldown() {
        assertThrows(ConfigurationException.class, () -> CatalogLoader.loadAbilities(
                yaml(ability("jab", "ATTACK", "SINGLE_OTHER", 1000, -1, "")), "test", balance, Fixtures.EFFECTS));
    }

    @Test
    void testAbility_duplicateId() {
        String twice = ability("jab", "ATTACK", "SINGLE_OTHER", 1000, 0, "")
                + "  - id: jab\n    category: ATTACK\n    target: SINGLE_OTHER\n    priority: 1001\n";
        assertThrows(ConfigurationException.class,
                () -> CatalogLoader.loadAbilities(yaml(twice), "test", balance, Fixtures.EFFECTS));
    }

    @Test
    void testAbility_missingList() {
        assertThrows(ConfigurationException.class,
                () -> CatalogLoader.loadAbilities(yaml("spells: []\n"), "test", balance, Fixtures.EFFECTS));
    }

    // === Effects ===

    @Test
    void testEffect_zeroDuration() {
        assertThrows(ConfigurationException.class, () -> CatalogLoader.loadEffects(yaml(
                "effects:\n  - id: blink\n    type: CONTROL\n    duration: 0\n    priority: 1\n"), "test"));
    }

    @Test
    void testEffect_unknownFlag() {
        assertThrows(ConfigurationException.class, () -> CatalogLoader.loadEffects(yaml(
                "effects:\n  - id: blink\n    type: CONTROL\n    duration: 1\n    priority: 1\n"
                        + "    flags: [TELEPORTS]\n"), "test"));
    }

    @Test
    void testEffect_defaults() {
        EffectRegistry r = CatalogLoader.loadEffects(yaml(
                "effects:\n  - id: blink\n    type: CONTROL\n    duration: 2\n    priority: 1\n"), "test");
        EffectDefinition blink = r.getDefinition("blink");
        assertFalse(blink.isStackable());
        assertTrue(blink.isRefreshable());
        assertTrue(blink.getFlags().isEmpty());
        assertEquals("blink", blink.getName());
    }
}
