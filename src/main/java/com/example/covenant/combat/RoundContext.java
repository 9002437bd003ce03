package com.example.covenant.combat;

import com.example.covenant.model.GameAction;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Scratch state for one round: ordered actions, the event log, coordination counts and
 * per-participant tallies. Owned by the resolver for the duration of the round, then dropped.
 */
public class RoundContext {

    /**
     * What one participant did this round, fed into threat.
     */
    public static final class Tally {
        private int damageDealt;
        private int damageToAdversary;
        private int healingDone;

        public int getDamageDealt() { return damageDealt; }
        public int getDamageToAdversary() { return damageToAdversary; }
        public int getHealingDone() { return healingDone; }
    }

    private final int round;
    private final Random random;
    private final Random hiddenRandom;
    private final List<GameAction> orderedActions = new ArrayList<>();
    private final List<RoundEvent> events = new ArrayList<>();
    private final CoordinationTally coordination = new CoordinationTally();
    private final Map<String, Tally> tallies = new LinkedHashMap<>();
    private final Map<String, Integer> startHp = new LinkedHashMap<>();
    private final Map<String, Integer> hpDeltas = new HashMap<>();
    private final Map<String, String> lethalSources = new HashMap<>();
    private final Set<String> revealed = new HashSet<>();
    private boolean comebackActive;

    /**
     * @param random drives visible randomness (variance, redirects, adversary ties)
     * @param hiddenRandom drives the hidden protocol only (conversion and detection rolls)
     */
    public RoundContext(int round, Random random, Random hiddenRandom) {
        this.round = round;
        this.random = random;
        this.hiddenRandom = hiddenRandom;
    }

    public int getRound() { return round; }
    public Random getRandom() { return random; }
    public Random getHiddenRandom() { return hiddenRandom; }

    public List<GameAction> getOrderedActions() { return orderedActions; }

    public void setOrderedActions(Collection<GameAction> actions) {
        orderedActions.clear();
        orderedActions.addAll(actions);
    }

    public CoordinationTally getCoordination() { return coordination; }

    // Event log

    public void log(RoundEvent event) {
        events.add(event);
    }

    public void publicEvent(RoundEvent.Type type, String actorId, String targetId, String abilityId, int amount,
                            String message) {
        events.add(RoundEvent.publicEvent(type, round, actorId, targetId, abilityId, amount, message));
    }

    public void publicEvent(RoundEvent.Type type, String message) {
        events.add(RoundEvent.publicEvent(type, round, message));
    }

    public void privateEvent(RoundEvent.Type type, String actorId, String targetId, int amount, String message,
                             Collection<String> recipients) {
        events.add(RoundEvent.privateEvent(type, round, actorId, targetId, amount, message, recipients));
    }

    public List<RoundEvent> getEvents() { return Collections.unmodifiableList(events); }

    // Tallies

    public Tally tally(String participantId) {
        return tallies.computeIfAbsent(participantId, k -> new Tally());
    }

    public Map<String, Tally> getTallies() { return Collections.unmodifiableMap(tallies); }

    void addDamageDealt(String actorId, int amount, boolean toAdversary) {
        Tally t = tally(actorId);
        t.damageDealt += amount;
        if (toAdversary) t.damageToAdversary += amount;
    }

    void addHealingDone(String actorId, int amount) {
        tally(actorId).healingDone += amount;
    }

    // HP bookkeeping for the post-round invariant check

    public void recordStartHp(String participantId, int hp) {
        startHp.put(participantId, hp);
    }

    void recordHpDelta(String participantId, int delta) {
        hpDeltas.merge(participantId, delta, Integer::sum);
    }

    public Integer getStartHp(String participantId) { return startHp.get(participantId); }

    public int getHpDelta(String participantId) {
        return hpDeltas.getOrDefault(participantId, 0);
    }

    void recordLethalSource(String participantId, String sourceId) {
        lethalSources.put(participantId, sourceId);
    }

    public String getLethalSource(String participantId) { return lethalSources.get(participantId); }

    // Flags

    public boolean isComebackActive() { return comebackActive; }
    public void setComebackActive(boolean comebackActive) { this.comebackActive = comebackActive; }

    /**
     * Participants whose allegiance was exposed to a healer this round.
     */
    public boolean isRevealed(String participantId) { return revealed.contains(participantId); }
    public void markRevealed(String participantId) { revealed.add(participantId); }
}
