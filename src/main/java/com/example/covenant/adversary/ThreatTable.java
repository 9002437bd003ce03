package com.example.covenant.adversary;

import com.example.covenant.config.GameBalance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-participant threat toward the adversary.
 *
 * Round gain = armor * damageToAdversary * armorWeight + damageDealt * damageWeight
 *            + healingDone * healWeight, floored at zero.
 * Each update decays existing scores by {@code decayRate}, adds the round's gains, and drops
 * anything below {@code epsilon}, so every stored score is positive.
 */
public class ThreatTable {

    private static final Logger logger = LoggerFactory.getLogger(ThreatTable.class);

    private final GameBalance.Threat cfg;
    private final Map<String, Double> threat = new LinkedHashMap<>();

    public ThreatTable(GameBalance.Threat cfg) {
        this.cfg = cfg;
    }

    public double roundGain(double armor, int damageToAdversary, int damageDealt, int healingDone) {
        double gain = armor * damageToAdversary * cfg.getArmorWeight()
                + damageDealt * cfg.getDamageWeight()
                + healingDone * cfg.getHealWeight();
        return Math.max(0, gain);
    }

    /**
     * Decay every score, then add this round's gains.
     */
    public void update(Map<String, Double> gains) {
        double keep = 1.0 - cfg.getDecayRate();
        for (Map.Entry<String, Double> e : threat.entrySet()) {
            e.setValue(e.getValue() * keep);
        }
        for (Map.Entry<String, Double> e : gains.entrySet()) {
            if (e.getValue() > 0) {
                threat.merge(e.getKey(), e.getValue(), Double::sum);
            }
        }
        prune();
        logger.debug("Threat after update: {}", threat);
    }

    /**
     * One-time cut when the adversary falls.
     */
    public void applyDeathReduction() {
        double keep = 1.0 - cfg.getDeathReduction();
        for (Map.Entry<String, Double> e : threat.entrySet()) {
            e.setValue(e.getValue() * keep);
        }
        prune();
    }

    private void prune() {
        Iterator<Map.Entry<String, Double>> it = threat.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Double> e = it.next();
            if (!(e.getValue() >= cfg.getEpsilon())) it.remove();
        }
    }

    public void remove(String participantId) {
        threat.remove(participantId);
    }

    public double get(String participantId) {
        return threat.getOrDefault(participantId, 0.0);
    }

    public boolean isEmpty() { return threat.isEmpty(); }

    public Map<String, Double> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(threat));
    }
}
