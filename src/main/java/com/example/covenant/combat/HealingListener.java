package com.example.covenant.combat;

import com.example.covenant.model.Participant;

/**
 * Notified after every heal that actually restored hp.
 */
public interface HealingListener {

    /**
     * @param healer participant whose ability or effect produced the heal; may be null for passives
     * @param overTime true for heal-over-time ticks
     */
    void onHealed(RoundContext ctx, Participant healer, Participant target, int amount, boolean overTime);
}
