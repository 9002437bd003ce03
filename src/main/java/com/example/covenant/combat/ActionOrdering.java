package com.example.covenant.combat;

import com.example.covenant.model.Ability;
import com.example.covenant.model.AbilityCatalog;
import com.example.covenant.model.GameAction;
import com.example.covenant.model.Participant;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Execution order for a round: ability priority ascending, then seat ascending.
 * The same submissions always produce the same order.
 */
public final class ActionOrdering {

    private ActionOrdering() {}

    public static List<GameAction> order(Collection<GameAction> actions, AbilityCatalog catalog,
                                         Map<String, Participant> roster) {
        List<GameAction> sorted = new ArrayList<>(actions);
        sorted.sort(Comparator
                .comparingInt((GameAction a) -> priorityOf(a, catalog))
                .thenComparingInt(a -> seatOf(a, roster))
                .thenComparing(GameAction::getActorId));
        return sorted;
    }

    private static int priorityOf(GameAction action, AbilityCatalog catalog) {
        Ability ability = catalog.get(action.getAbilityId());
        return ability != null ? ability.getPriority() : Integer.MAX_VALUE;
    }

    private static int seatOf(GameAction action, Map<String, Participant> roster) {
        Participant p = roster.get(action.getActorId());
        return p != null ? p.getSeat() : Integer.MAX_VALUE;
    }
}
