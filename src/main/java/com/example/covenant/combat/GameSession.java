package com.example.covenant.combat;

import com.example.covenant.adversary.AdversaryController;
import com.example.covenant.adversary.ThreatTable;
import com.example.covenant.config.ConfigurationException;
import com.example.covenant.config.GameBalance;
import com.example.covenant.corruption.CorruptionSystem;
import com.example.covenant.effect.EffectRegistry;
import com.example.covenant.effect.StatusEffectEngine;
import com.example.covenant.model.AbilityCatalog;
import com.example.covenant.model.Adversary;
import com.example.covenant.model.GameAction;
import com.example.covenant.model.Participant;
import com.example.covenant.model.ParticipantStats;
import com.example.covenant.outcome.GameOutcome;
import com.example.covenant.outcome.WinConditionEvaluator;
import com.example.covenant.util.AbilityCheck;
import com.example.covenant.util.CooldownManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * One game: its participants, adversary, threat table, cooldowns and corruption bookkeeping,
 * and the resolver that advances them one round at a time.
 *
 * Sessions share nothing mutable with each other; only the catalog and effect registry are shared.
 * Rounds on a session are serialized.
 */
public class GameSession {

    private static final Logger logger = LoggerFactory.getLogger(GameSession.class);

    private final String id;
    private final GameBalance balance;
    private final AbilityCatalog catalog;
    private final StatusEffectEngine effects;
    private final List<Participant> participants;
    private final Map<String, Participant> roster;
    private final Adversary adversary;
    private final Random random;
    private final Random hiddenRandom;
    private final CooldownManager cooldowns = new CooldownManager();
    private final CorruptionSystem corruption;
    private final AdversaryController adversaryController;
    private final RoundResolver resolver;
    private final List<RoundObserver> observers = new CopyOnWriteArrayList<>();
    private final List<RoundEvent> history = new ArrayList<>();

    private SessionState state = SessionState.INITIALIZING;
    private int round = 0;
    private GameOutcome outcome = GameOutcome.IN_PROGRESS;

    private GameSession(Builder b) {
        this.id = b.id;
        this.balance = b.balance;
        this.catalog = b.catalog;
        this.effects = new StatusEffectEngine(b.effectRegistry, b.balance.getEffects());
        List<Participant> sorted = new ArrayList<>(b.participants);
        sorted.sort(Comparator.comparingInt(Participant::getSeat));
        this.participants = Collections.unmodifiableList(sorted);
        Map<String, Participant> byId = new LinkedHashMap<>();
        for (Participant p : sorted) byId.put(p.getId(), p);
        this.roster = Collections.unmodifiableMap(byId);
        this.random = new Random(b.seed);
        this.hiddenRandom = new Random(~b.seed);
        CombatCalculator calc = new CombatCalculator(balance);
        this.adversary = b.adversaryName == null ? null
                : new Adversary(b.adversaryName, b.adversaryLevel, calc.adversaryMaxHp(b.adversaryLevel), 0);
        this.corruption = new CorruptionSystem(balance, effects);
        this.adversaryController = new AdversaryController(calc, effects, new ThreatTable(balance.getThreat()));
        this.resolver = new RoundResolver(balance, catalog, effects, cooldowns, corruption, adversaryController);
        for (Map.Entry<String, List<String>> e : b.passives.entrySet()) {
            for (String effectId : e.getValue()) {
                effects.apply(roster.get(e.getKey()), effectId, null);
            }
        }
    }

    public static Builder builder(GameBalance balance, AbilityCatalog catalog, EffectRegistry effectRegistry) {
        return new Builder(balance, catalog, effectRegistry);
    }

    // ========== Lifecycle ==========

    public synchronized void start() {
        if (state != SessionState.INITIALIZING) {
            throw new IllegalStateException("Session " + id + " already started");
        }
        state = SessionState.ACTIVE;
        logger.info("Session {} started with {} participant(s)", id, participants.size());
    }

    /**
     * Open action collection for the next round. Only living participants are expected to act.
     */
    public synchronized ActionCollector openRound() {
        ensureActive();
        Set<String> expected = new LinkedHashSet<>();
        for (Participant p : participants) {
            if (p.isAlive()) expected.add(p.getId());
        }
        return new ActionCollector(round + 1, expected, this::validate);
    }

    public AbilityCheck.CheckResult validate(GameAction action) {
        return AbilityCheck.canSubmit(action, roster, catalog, cooldowns, adversary);
    }

    /**
     * Resolve the next round from a closed collection batch.
     *
     * @throws InvariantViolationException if the round left the session inconsistent; the session is then corrupted
     */
    public synchronized RoundResult resolveRound(ActionCollector.Batch batch) {
        ensureActive();
        if (batch.getRound() != round + 1) {
            throw new IllegalStateException("Batch is for round " + batch.getRound() + " but next round is " + (round + 1));
        }
        return doResolve(batch.getActions(), batch.getRejections());
    }

    /**
     * Resolve the next round from actions gathered elsewhere. Each actor's first valid action counts.
     */
    public synchronized RoundResult resolveRound(Collection<GameAction> actions) {
        ensureActive();
        return doResolve(new ArrayList<>(actions), Collections.emptyList());
    }

    private RoundResult doResolve(List<GameAction> actions, List<ActionCollector.Rejection> earlier) {
        round++;
        RoundContext ctx = new RoundContext(round, random, hiddenRandom);
        ctx.publicEvent(RoundEvent.Type.ROUND_START, "Round " + round + " begins.");
        for (ActionCollector.Rejection r : earlier) {
            logRejection(ctx, r.getAction(), r.getReason());
        }
        List<GameAction> valid = new ArrayList<>();
        Set<String> acted = new HashSet<>();
        for (GameAction a : actions) {
            AbilityCheck.CheckResult check = validate(a);
            if (check.isFailure()) {
                logRejection(ctx, a, check.getFailureMessage());
            } else if (!acted.add(a.getActorId())) {
                logRejection(ctx, a, "An action was already submitted this round.");
            } else {
                valid.add(a);
            }
        }

        RoundResult result;
        try {
            result = resolver.resolve(ctx, valid, participants, adversary);
        } catch (InvariantViolationException e) {
            state = SessionState.CORRUPTED;
            logger.error("Session {} corrupted: {}", id, e.getMessage());
            throw e;
        }
        history.addAll(result.getEvents());
        outcome = result.getOutcome();
        if (outcome.isTerminal()) {
            state = SessionState.ENDED;
            logger.info("Session {} ended after round {}: {}", id, round, outcome.getDisplayName());
        }
        notifyObservers(result);
        return result;
    }

    private static void logRejection(RoundContext ctx, GameAction action, String reason) {
        ctx.privateEvent(RoundEvent.Type.REJECTED, action.getActorId(), action.getTargetId(), 0, reason,
                Collections.singletonList(action.getActorId()));
    }

    private void notifyObservers(RoundResult result) {
        for (RoundObserver o : observers) {
            try {
                o.onRoundResolved(result);
            } catch (RuntimeException e) {
                logger.warn("Round observer {} failed on round {}", o, result.getRound(), e);
            }
        }
    }

    private void ensureActive() {
        if (state == SessionState.CORRUPTED) {
            throw new IllegalStateException("Session " + id + " is corrupted and cannot continue");
        }
        if (state != SessionState.ACTIVE) {
            throw new IllegalStateException("Session " + id + " is " + state.getDisplayName().toLowerCase());
        }
    }

    // ========== Accessors ==========

    public String getId() { return id; }
    public synchronized SessionState getState() { return state; }
    public synchronized int getRound() { return round; }
    public synchronized GameOutcome getOutcome() { return outcome; }
    public GameBalance getBalance() { return balance; }
    public List<Participant> getParticipants() { return participants; }
    public Participant getParticipant(String participantId) { return roster.get(participantId); }
    public Adversary getAdversary() { return adversary; }
    public ThreatTable getThreatTable() { return adversaryController.getThreatTable(); }
    public StatusEffectEngine getEffects() { return effects; }
    public CooldownManager getCooldowns() { return cooldowns; }

    public synchronized List<RoundEvent> getHistory() {
        return Collections.unmodifiableList(new ArrayList<>(history));
    }

    /**
     * Win conditions against the current state, without resolving anything.
     */
    public GameOutcome evaluate() {
        return WinConditionEvaluator.evaluate(participants);
    }

    public Map<String, ParticipantStats.Snapshot> statsSnapshot() {
        Map<String, ParticipantStats.Snapshot> out = new LinkedHashMap<>();
        for (Participant p : participants) out.put(p.getId(), p.getStats().snapshot());
        return out;
    }

    public void addObserver(RoundObserver observer) {
        observers.add(observer);
    }

    // ========== Builder ==========

    public static final class Builder {
        private final GameBalance balance;
        private final AbilityCatalog catalog;
        private final EffectRegistry effectRegistry;
        private final List<Participant> participants = new ArrayList<>();
        private final Map<String, List<String>> passives = new LinkedHashMap<>();
        private String id = "session";
        private long seed = System.nanoTime();
        private String adversaryName = "The Adversary";
        private int adversaryLevel = 1;

        private Builder(GameBalance balance, AbilityCatalog catalog, EffectRegistry effectRegistry) {
            this.balance = balance;
            this.catalog = catalog;
            this.effectRegistry = effectRegistry;
        }

        public Builder id(String id) { this.id = id; return this; }
        public Builder seed(long seed) { this.seed = seed; return this; }

        public Builder participant(Participant p) {
            participants.add(p);
            return this;
        }

        /**
         * Permanent effect (racial or class passive) applied when the session is built.
         */
        public Builder passive(String participantId, String effectId) {
            passives.computeIfAbsent(participantId, k -> new ArrayList<>()).add(effectId);
            return this;
        }

        public Builder adversary(String name, int level) {
            this.adversaryName = name;
            this.adversaryLevel = level;
            return this;
        }

        public Builder noAdversary() {
            this.adversaryName = null;
            return this;
        }

        /**
         * @throws ConfigurationException if the setup is inconsistent
         */
        public GameSession build() {
            if (balance == null || catalog == null || effectRegistry == null) {
                throw new ConfigurationException("Balance, ability catalog and effect registry are required");
            }
            if (participants.isEmpty()) {
                throw new ConfigurationException("A session needs at least one participant");
            }
            Set<String> ids = new HashSet<>();
            Set<Integer> seats = new HashSet<>();
            for (Participant p : participants) {
                if (!ids.add(p.getId())) {
                    throw new ConfigurationException("Duplicate participant id '" + p.getId() + "'");
                }
                if (Adversary.ID.equals(p.getId())) {
                    throw new ConfigurationException("Participant id '" + Adversary.ID + "' is reserved");
                }
                if (!seats.add(p.getSeat())) {
                    throw new ConfigurationException("Duplicate seat " + p.getSeat());
                }
                for (String abilityId : p.getAbilityIds()) {
                    if (!catalog.contains(abilityId)) {
                        throw new ConfigurationException(p.getId() + " has unknown ability '" + abilityId + "'");
                    }
                }
            }
            for (Map.Entry<String, List<String>> e : passives.entrySet()) {
                if (!ids.contains(e.getKey())) {
                    throw new ConfigurationException("Passive for unknown participant '" + e.getKey() + "'");
                }
                for (String effectId : e.getValue()) {
                    if (!effectRegistry.contains(effectId)) {
                        throw new ConfigurationException("Unknown passive effect '" + effectId + "'");
                    }
                }
            }
            if (adversaryName != null && adversaryLevel < 1) {
                throw new ConfigurationException("Adversary level must be at least 1");
            }
            return new GameSession(this);
        }
    }
}
