package com.example.covenant.combat;

import com.example.covenant.model.GameAction;
import com.example.covenant.util.AbilityCheck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Gathers one action per living participant for a round.
 *
 * Participants may submit from any thread. Collection ends when everyone has submitted or the
 * caller's deadline passes; participants who stayed silent simply take no action. An aborted
 * collector releases its waiters and its round is never resolved, so aborting touches no game state.
 */
public class ActionCollector {

    private static final Logger logger = LoggerFactory.getLogger(ActionCollector.class);

    public enum Phase { OPEN, CLOSED, ABORTED }

    /**
     * A refused submission and the reason given to the submitter.
     */
    public static final class Rejection {
        private final GameAction action;
        private final String reason;

        Rejection(GameAction action, String reason) {
            this.action = action;
            this.reason = reason;
        }

        public GameAction getAction() { return action; }
        public String getReason() { return reason; }
    }

    /**
     * The closed result of a collection phase.
     */
    public static final class Batch {
        private final int round;
        private final List<GameAction> actions;
        private final List<Rejection> rejections;
        private final Set<String> missing;
        private final boolean timedOut;

        Batch(int round, List<GameAction> actions, List<Rejection> rejections, Set<String> missing, boolean timedOut) {
            this.round = round;
            this.actions = Collections.unmodifiableList(actions);
            this.rejections = Collections.unmodifiableList(rejections);
            this.missing = Collections.unmodifiableSet(missing);
            this.timedOut = timedOut;
        }

        public int getRound() { return round; }
        public List<GameAction> getActions() { return actions; }
        public List<Rejection> getRejections() { return rejections; }
        public Set<String> getMissing() { return missing; }
        public boolean isTimedOut() { return timedOut; }
    }

    private final int round;
    private final Set<String> expectedActors;
    private final Function<GameAction, AbilityCheck.CheckResult> validator;
    private final Map<String, GameAction> accepted = new LinkedHashMap<>();
    private final Queue<Rejection> rejections = new ConcurrentLinkedQueue<>();
    private final CountDownLatch remaining;
    private Phase phase = Phase.OPEN;
    private Batch batch;

    public ActionCollector(int round, Set<String> expectedActors, Function<GameAction, AbilityCheck.CheckResult> validator) {
        this.round = round;
        this.expectedActors = Collections.unmodifiableSet(new LinkedHashSet<>(expectedActors));
        this.validator = validator;
        this.remaining = new CountDownLatch(this.expectedActors.size());
    }

    public int getRound() { return round; }

    public synchronized Phase getPhase() { return phase; }

    public Set<String> getExpectedActors() { return expectedActors; }

    /**
     * Submit one participant's action. Safe to call concurrently.
     */
    public AbilityCheck.CheckResult submit(GameAction action) {
        if (action == null || !expectedActors.contains(action.getActorId())) {
            return reject(action, "Not expecting an action from "
                    + (action == null ? "nobody" : action.getActorId()) + " this round.");
        }
        AbilityCheck.CheckResult check = validator.apply(action);
        if (check.isFailure()) {
            return reject(action, check.getFailureMessage());
        }
        synchronized (this) {
            if (phase != Phase.OPEN) {
                return reject(action, "Action collection for round " + round + " is closed.");
            }
            if (accepted.containsKey(action.getActorId())) {
                return reject(action, "An action was already submitted this round.");
            }
            accepted.put(action.getActorId(), action);
        }
        remaining.countDown();
        logger.debug("Round {}: accepted {}", round, action);
        return AbilityCheck.CheckResult.success();
    }

    private AbilityCheck.CheckResult reject(GameAction action, String reason) {
        if (action != null) {
            rejections.add(new Rejection(action, reason));
        }
        logger.debug("Round {}: rejected {} ({})", round, action, reason);
        return AbilityCheck.CheckResult.failure(reason);
    }

    /**
     * Block until every expected participant has submitted or the deadline passes, then close.
     *
     * @throws CancellationException if the round was aborted
     */
    public Batch awaitActions(long timeout, TimeUnit unit) throws InterruptedException {
        boolean complete = remaining.await(timeout, unit);
        return close(!complete);
    }

    /**
     * Close without waiting.
     *
     * @throws CancellationException if the round was aborted
     */
    public Batch close() {
        return close(remaining.getCount() > 0);
    }

    private synchronized Batch close(boolean timedOut) {
        if (phase == Phase.ABORTED) {
            throw new CancellationException("Round " + round + " was aborted");
        }
        if (batch != null) return batch;
        phase = Phase.CLOSED;
        Set<String> missing = new LinkedHashSet<>(expectedActors);
        missing.removeAll(accepted.keySet());
        if (!missing.isEmpty()) {
            logger.info("Round {}: no action from {}", round, missing);
        }
        batch = new Batch(round, new ArrayList<>(accepted.values()), new ArrayList<>(rejections), missing,
                timedOut && !missing.isEmpty());
        return batch;
    }

    /**
     * Cancel the round before resolution. Has no effect once the batch was closed.
     *
     * @return true if the collector is now aborted
     */
    public boolean abort() {
        synchronized (this) {
            if (phase == Phase.CLOSED) return false;
            phase = Phase.ABORTED;
        }
        while (remaining.getCount() > 0) {
            remaining.countDown();
        }
        logger.info("Round {}: collection aborted", round);
        return true;
    }
}
