package com.example.covenant.combat;

import com.example.covenant.model.Ability;
import com.example.covenant.model.AbilityCategory;
import com.example.covenant.model.GameAction;
import com.example.covenant.model.TargetShape;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Counts, per target and category, how many distinct actors aimed a single-target
 * attack or heal at it this round.
 */
public class CoordinationTally {

    private final Map<String, Set<String>> actorsByKey = new HashMap<>();

    private static String key(String targetId, AbilityCategory category) {
        return category.name() + ":" + targetId;
    }

    static boolean qualifies(Ability ability) {
        return ability.getTargetShape() == TargetShape.SINGLE_OTHER
                && (ability.getCategory() == AbilityCategory.ATTACK || ability.getCategory() == AbilityCategory.HEAL);
    }

    public void record(GameAction action, Ability ability) {
        if (action.getTargetId() == null || !qualifies(ability)) return;
        actorsByKey.computeIfAbsent(key(action.getTargetId(), ability.getCategory()), k -> new LinkedHashSet<>())
                .add(action.getActorId());
    }

    /**
     * Number of actors (including the asking one) coordinating on this target with this category.
     */
    public int coordinators(String targetId, AbilityCategory category) {
        Set<String> actors = actorsByKey.get(key(targetId, category));
        return actors == null ? 0 : actors.size();
    }
}
