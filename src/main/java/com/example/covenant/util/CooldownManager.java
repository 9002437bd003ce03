package com.example.covenant.util;

import com.example.covenant.model.Ability;
import com.example.covenant.model.Cooldown;
import com.example.covenant.model.Participant;

import java.util.Collection;
import java.util.Map;

/**
 * Round-based ability cooldowns for one session.
 *
 * Cooldowns tick once at the start of each round's resolution, after that round's actions
 * were validated. An ability with cooldown N used in round r is therefore refused in rounds
 * r+1 .. r+N and usable again in round r+N+1.
 */
public class CooldownManager {

    /**
     * Start the ability's cooldown for the participant. Abilities without a cooldown are ignored.
     */
    public void start(Participant participant, Ability ability) {
        if (participant == null || !ability.hasCooldown()) return;
        participant.getCooldowns().put(ability.getId(), new Cooldown(ability.getId(), ability.getCooldown()));
    }

    public boolean isOnCooldown(Participant participant, String abilityId) {
        Cooldown cd = participant.getCooldowns().get(abilityId);
        return cd != null && !cd.isExpired();
    }

    /**
     * @return rounds left, or 0 if the ability is ready
     */
    public int getRemaining(Participant participant, String abilityId) {
        Cooldown cd = participant.getCooldowns().get(abilityId);
        return cd != null ? cd.getRemainingRounds() : 0;
    }

    /**
     * Count every cooldown down by one round and drop the expired ones.
     */
    public void tick(Collection<Participant> participants) {
        for (Participant p : participants) {
            Map<String, Cooldown> cooldowns = p.getCooldowns();
            cooldowns.entrySet().removeIf(entry -> entry.getValue().tick());
        }
    }

    public void clear(Participant participant) {
        participant.getCooldowns().clear();
    }
}
