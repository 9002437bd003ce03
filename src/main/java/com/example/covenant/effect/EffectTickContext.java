package com.example.covenant.effect;

import com.example.covenant.model.Adversary;
import com.example.covenant.model.Participant;

/**
 * What an effect handler may touch while the end-of-round pass runs.
 * Implemented by the round resolver so effects never write hp directly.
 */
public interface EffectTickContext {

    /**
     * Apply periodic damage, bypassing armor.
     * @return hp actually removed
     */
    int applyTickDamage(Participant owner, int amount, EffectInstance source);

    /**
     * Apply periodic healing; may roll detection against the effect's source.
     * @return hp actually restored
     */
    int applyTickHealing(Participant owner, int amount, EffectInstance source);

    Adversary getAdversary();

    void onExpired(Participant owner, EffectInstance instance);
}
