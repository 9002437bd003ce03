package com.example.covenant;

import com.example.covenant.combat.GameSession;
import com.example.covenant.config.CatalogLoader;
import com.example.covenant.config.GameBalance;
import com.example.covenant.config.GameBalanceLoader;
import com.example.covenant.effect.EffectRegistry;
import com.example.covenant.effect.StatusEffectEngine;
import com.example.covenant.model.Ability;
import com.example.covenant.model.AbilityCatalog;
import com.example.covenant.model.AbilityCategory;
import com.example.covenant.model.Allegiance;
import com.example.covenant.model.Participant;
import com.example.covenant.model.TargetShape;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Shared setup for tests: balance with luck and comeback switched off, the bundled catalogs,
 * and a few flat-number abilities that make arithmetic easy to follow.
 */
final class Fixtures {

    static final EffectRegistry EFFECTS = CatalogLoader.loadDefaultEffects();

    private Fixtures() {}

    /**
     * Defaults with no variance and no comeback, plus the given overrides.
     */
    static GameBalance quietBalance(Object... overrides) {
        Map<String, Object> o = new HashMap<>();
        o.put("variance.critChance", 0.0);
        o.put("variance.failChance", 0.0);
        o.put("variance.wildChance", 0.0);
        o.put("comeback.enabled", false);
        for (int i = 0; i + 1 < overrides.length; i += 2) {
            o.put((String) overrides[i], overrides[i + 1]);
        }
        return GameBalanceLoader.loadDefaults(o);
    }

    static StatusEffectEngine engine(GameBalance balance) {
        return new StatusEffectEngine(EFFECTS, balance.getEffects());
    }

    static Ability ability(String id, AbilityCategory category, TargetShape shape, int priority, int cooldown,
                           String effectId, Object... params) {
        Map<String, Double> p = new HashMap<>();
        for (int i = 0; i + 1 < params.length; i += 2) {
            p.put((String) params[i], ((Number) params[i + 1]).doubleValue());
        }
        return new Ability(id, id, category, shape, p, priority, cooldown, effectId);
    }

    static Ability strike(String id, int damage, int priority) {
        return ability(id, AbilityCategory.ATTACK, TargetShape.SINGLE_OTHER, priority, 0, null, "damage", damage);
    }

    /**
     * Bundled abilities plus a handful of test-only ones:
     * strike40 / strike30 (plain attacks), mend20 (plain heal), sureBash (always stuns),
     * guard (self armor via shieldWall's effect).
     */
    static AbilityCatalog catalog(GameBalance balance, Ability... extra) {
        List<Ability> all = new ArrayList<>(CatalogLoader.loadDefaultAbilities(balance, EFFECTS).all());
        all.add(strike("strike40", 40, 1000));
        all.add(strike("strike30", 30, 1000));
        all.add(ability("mend20", AbilityCategory.HEAL, TargetShape.SINGLE_OTHER, 10000, 0, null, "heal", 20));
        all.add(ability("sureBash", AbilityCategory.SPECIAL, TargetShape.SINGLE_OTHER, 520, 0, "stunned",
                "duration", 1));
        all.addAll(Arrays.asList(extra));
        return new AbilityCatalog(all);
    }

    static Participant participant(String id, int seat, int hp, String... abilities) {
        return new Participant(id, id, seat, hp, 0.0, 1.0, new LinkedHashSet<>(Arrays.asList(abilities)),
                Allegiance.COOPERATIVE);
    }

    static Participant corrupted(String id, int seat, int hp, String... abilities) {
        Participant p = participant(id, seat, hp, abilities);
        p.setAllegiance(Allegiance.CORRUPTED);
        return p;
    }

    static String[] allAbilities() {
        return new String[] { "slash", "fireball", "lightning", "blizzard", "poisonStrike", "heal", "bandage",
                "shieldWall", "shadowVeil", "huntersMark", "strike40", "strike30", "mend20", "sureBash",
                "unstoppableRage", "rejuvenation" };
    }

    static GameSession.Builder session(GameBalance balance, AbilityCatalog catalog) {
        return GameSession.builder(balance, catalog, EFFECTS).seed(42L);
    }
}
