package com.example.covenant.combat;

import com.example.covenant.effect.StatusEffectEngine;
import com.example.covenant.model.Ability;
import com.example.covenant.model.Adversary;
import com.example.covenant.model.GameAction;
import com.example.covenant.model.Participant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Re-validates targets when an action executes, since earlier actions may have felled or hidden them.
 *
 * <ul>
 *   <li>a target that is dead or pending death makes the action a no-op</li>
 *   <li>a single-target attack on a hidden participant moves to a random legal alternative</li>
 *   <li>any other ability on a hidden participant fails without a public trace</li>
 *   <li>area abilities rebuild their list now, leaving out the fallen (and, for attacks, the hidden)</li>
 * </ul>
 */
public class TargetResolver {

    private static final Logger logger = LoggerFactory.getLogger(TargetResolver.class);

    /**
     * Outcome of resolving one action's targets.
     */
    public static final class Resolution {
        private final List<CombatTarget> targets;
        private final CombatTarget redirectedFrom;
        private final String noOpReason;
        private final boolean silent;

        private Resolution(List<CombatTarget> targets, CombatTarget redirectedFrom, String noOpReason, boolean silent) {
            this.targets = targets;
            this.redirectedFrom = redirectedFrom;
            this.noOpReason = noOpReason;
            this.silent = silent;
        }

        static Resolution of(List<CombatTarget> targets) {
            return new Resolution(Collections.unmodifiableList(targets), null, null, false);
        }

        static Resolution redirected(CombatTarget to, CombatTarget from) {
            return new Resolution(Collections.singletonList(to), from, null, false);
        }

        static Resolution noOp(String reason) {
            return new Resolution(Collections.emptyList(), null, reason, false);
        }

        static Resolution silentFailure() {
            return new Resolution(Collections.emptyList(), null, null, true);
        }

        public List<CombatTarget> getTargets() { return targets; }
        public boolean isRedirected() { return redirectedFrom != null; }
        public CombatTarget getRedirectedFrom() { return redirectedFrom; }
        public boolean isNoOp() { return targets.isEmpty(); }
        public String getNoOpReason() { return noOpReason; }
        public boolean isSilent() { return silent; }
    }

    private final StatusEffectEngine effects;

    public TargetResolver(StatusEffectEngine effects) {
        this.effects = effects;
    }

    /**
     * @param participants every participant in seat order
     */
    public Resolution resolve(GameAction action, Ability ability, Participant actor, List<Participant> participants,
                              Adversary adversary, Random random) {
        switch (ability.getTargetShape()) {
            case SELF:
                return Resolution.of(new ArrayList<>(Collections.singletonList(CombatTarget.of(actor))));
            case ALL_OTHERS:
                return resolveArea(ability, actor, participants, adversary);
            case SINGLE_OTHER:
            default:
                return resolveSingle(action, ability, actor, participants, adversary, random);
        }
    }

    private Resolution resolveArea(Ability ability, Participant actor, List<Participant> participants,
                                   Adversary adversary) {
        List<CombatTarget> targets = new ArrayList<>();
        for (Participant p : participants) {
            if (p == actor || !p.isActive()) continue;
            if (ability.isAttack() && effects.preventsTargeting(p)) continue;
            targets.add(CombatTarget.of(p));
        }
        if (ability.isAttack() && ability.includesAdversary() && adversary != null && adversary.isAlive()) {
            targets.add(CombatTarget.of(adversary));
        }
        if (targets.isEmpty()) {
            return Resolution.noOp("no targets remain");
        }
        return Resolution.of(targets);
    }

    private Resolution resolveSingle(GameAction action, Ability ability, Participant actor,
                                     List<Participant> participants, Adversary adversary, Random random) {
        if (action.targetsAdversary()) {
            if (adversary == null || !adversary.isAlive()) {
                return Resolution.noOp("the adversary is already down");
            }
            return Resolution.of(new ArrayList<>(Collections.singletonList(CombatTarget.of(adversary))));
        }
        Participant target = find(participants, action.getTargetId());
        if (target == null || !target.isActive()) {
            return Resolution.noOp("the target is no longer standing");
        }
        if (!effects.preventsTargeting(target)) {
            return Resolution.of(new ArrayList<>(Collections.singletonList(CombatTarget.of(target))));
        }
        if (!ability.isAttack()) {
            logger.debug("{} on hidden {} fizzles", ability.getId(), target.getId());
            return Resolution.silentFailure();
        }
        List<CombatTarget> candidates = alternatives(ability, actor, CombatTarget.of(target), participants, adversary);
        if (candidates.isEmpty()) {
            return Resolution.noOp("the target vanished from sight");
        }
        CombatTarget chosen = candidates.get(random.nextInt(candidates.size()));
        logger.debug("{} redirected from hidden {} to {}", ability.getId(), target.getId(), chosen.getId());
        return Resolution.redirected(chosen, CombatTarget.of(target));
    }

    /**
     * Random other target for a wild variance roll, or null when there is none.
     */
    public CombatTarget wildRedirect(Ability ability, Participant actor, CombatTarget original,
                                     List<Participant> participants, Adversary adversary, Random random) {
        List<CombatTarget> candidates = alternatives(ability, actor, original, participants, adversary);
        if (candidates.isEmpty()) return null;
        return candidates.get(random.nextInt(candidates.size()));
    }

    /**
     * Legal targets other than the actor and the original. The adversary is only an option for attacks.
     */
    List<CombatTarget> alternatives(Ability ability, Participant actor, CombatTarget original,
                                    List<Participant> participants, Adversary adversary) {
        List<CombatTarget> out = new ArrayList<>();
        for (Participant p : participants) {
            if (p == actor || !p.isActive() || p.getId().equals(original.getId())) continue;
            if (ability.isAttack() && effects.preventsTargeting(p)) continue;
            out.add(CombatTarget.of(p));
        }
        if (ability.isAttack() && adversary != null && adversary.isAlive() && !original.isAdversary()) {
            out.add(CombatTarget.of(adversary));
        }
        return out;
    }

    private static Participant find(List<Participant> participants, String id) {
        for (Participant p : participants) {
            if (p.getId().equals(id)) return p;
        }
        return null;
    }
}
