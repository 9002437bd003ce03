package com.example.covenant.util;

import com.example.covenant.model.Ability;
import com.example.covenant.model.AbilityCatalog;
import com.example.covenant.model.Adversary;
import com.example.covenant.model.GameAction;
import com.example.covenant.model.Participant;

import java.util.Map;

/**
 * Collection-time validation of a submitted action: the actor can act, knows the ability,
 * the ability is off cooldown, and the target is in the legal set for its shape.
 * Whether the target is still legal when the action executes is decided later, by the resolver.
 */
public class AbilityCheck {

    /**
     * Result of an ability check - either success (null message) or failure with a reason.
     */
    public static class CheckResult {
        private final boolean success;
        private final String failureMessage;

        private CheckResult(boolean success, String failureMessage) {
            this.success = success;
            this.failureMessage = failureMessage;
        }

        public static CheckResult success() {
            return new CheckResult(true, null);
        }

        public static CheckResult failure(String message) {
            return new CheckResult(false, message);
        }

        public boolean isSuccess() { return success; }
        public boolean isFailure() { return !success; }
        public String getFailureMessage() { return failureMessage; }
    }

    public static CheckResult canSubmit(GameAction action, Map<String, Participant> roster, AbilityCatalog catalog,
                                        CooldownManager cooldowns, Adversary adversary) {
        if (action == null) {
            return CheckResult.failure("No action submitted.");
        }
        Participant actor = roster.get(action.getActorId());
        if (actor == null) {
            return CheckResult.failure("Unknown participant '" + action.getActorId() + "'.");
        }
        if (!actor.isAlive()) {
            return CheckResult.failure(actor.getName() + " is dead and cannot act.");
        }
        Ability ability = catalog.get(action.getAbilityId());
        if (ability == null) {
            return CheckResult.failure("Unknown ability '" + action.getAbilityId() + "'.");
        }
        if (!actor.hasAbility(ability.getId())) {
            return CheckResult.failure(actor.getName() + " does not know " + ability.getName() + ".");
        }
        if (cooldowns.isOnCooldown(actor, ability.getId())) {
            int rounds = cooldowns.getRemaining(actor, ability.getId());
            return CheckResult.failure(ability.getName() + " is on cooldown for another " + rounds + " round"
                    + (rounds != 1 ? "s" : "") + ".");
        }
        return checkTarget(action, actor, ability, roster, adversary);
    }

    private static CheckResult checkTarget(GameAction action, Participant actor, Ability ability,
                                           Map<String, Participant> roster, Adversary adversary) {
        String targetId = action.getTargetId();
        switch (ability.getTargetShape()) {
            case SELF:
                if (targetId != null && !targetId.equals(actor.getId())) {
                    return CheckResult.failure(ability.getName() + " can only target yourself.");
                }
                return CheckResult.success();
            case ALL_OTHERS:
                return CheckResult.success();
            case SINGLE_OTHER:
            default:
                if (targetId == null) {
                    return CheckResult.failure(ability.getName() + " needs a target.");
                }
                if (targetId.equals(actor.getId())) {
                    return CheckResult.failure(ability.getName() + " cannot target yourself.");
                }
                if (Adversary.ID.equals(targetId)) {
                    if (!ability.isAttack()) {
                        return CheckResult.failure(ability.getName() + " cannot target the adversary.");
                    }
                    if (adversary == null || !adversary.isAlive()) {
                        return CheckResult.failure("The adversary is not present.");
                    }
                    return CheckResult.success();
                }
                Participant target = roster.get(targetId);
                if (target == null || !target.isAlive()) {
                    return CheckResult.failure("Invalid target '" + targetId + "'.");
                }
                return CheckResult.success();
        }
    }
}
