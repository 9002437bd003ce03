package com.example.covenant.combat;

import com.example.covenant.effect.EffectDefinition;
import com.example.covenant.effect.EffectInstance;
import com.example.covenant.effect.EffectTickContext;
import com.example.covenant.effect.StatusEffectEngine;
import com.example.covenant.effect.UndyingEffect;
import com.example.covenant.model.Adversary;
import com.example.covenant.model.Participant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The only place hp changes during a round.
 *
 * Every change is recorded as a delta in the {@link RoundContext} so the post-round check can
 * prove no damage or healing was applied twice. Lethal damage moves a participant into pending
 * death; {@link #commitDeaths(List)} settles those once, at round end.
 */
public class HealthLedger implements EffectTickContext {

    private static final Logger logger = LoggerFactory.getLogger(HealthLedger.class);

    private final RoundContext ctx;
    private final StatusEffectEngine effects;
    private final Adversary adversary;
    private final Map<String, Participant> roster;
    private final int pendingDeathHp;
    private final HealingListener healingListener;

    public HealthLedger(RoundContext ctx, StatusEffectEngine effects, Adversary adversary,
                        Map<String, Participant> roster, int pendingDeathHp, HealingListener healingListener) {
        this.ctx = ctx;
        this.effects = effects;
        this.adversary = adversary;
        this.roster = roster;
        this.pendingDeathHp = pendingDeathHp;
        this.healingListener = healingListener;
    }

    /**
     * Clamp-subtract damage from a participant.
     *
     * @param actor attacking participant, or null for the adversary
     * @return hp actually removed
     */
    public int damageParticipant(Participant actor, Participant target, int amount, String abilityId) {
        if (amount <= 0 || !target.isActive()) return 0;
        int before = target.getHp();
        target.setHp(before - amount);
        int actual = before - target.getHp();
        ctx.recordHpDelta(target.getId(), -actual);
        target.getStats().addDamageTaken(actual);
        if (actor != null) {
            actor.getStats().addDamageDealt(actual, false);
            ctx.addDamageDealt(actor.getId(), actual, false);
        }
        if (target.getHp() == 0) {
            enterPendingDeath(target, actor != null ? actor.getId() : Adversary.ID);
        }
        return actual;
    }

    private void enterPendingDeath(Participant target, String sourceId) {
        int shown = Math.min(pendingDeathHp, target.getMaxHp());
        ctx.recordHpDelta(target.getId(), shown - target.getHp());
        target.enterPendingDeath(shown);
        ctx.recordLethalSource(target.getId(), sourceId);
        ctx.publicEvent(RoundEvent.Type.PENDING_DEATH, sourceId, target.getId(), null, 0,
                target.getName() + " has fallen and is near death.");
        logger.debug("{} pending death (source {})", target.getId(), sourceId);
    }

    /**
     * @return hp actually removed from the adversary
     */
    public int damageAdversary(Participant actor, int amount) {
        if (amount <= 0 || adversary == null || !adversary.isAlive()) return 0;
        int actual = adversary.takeDamage(amount);
        actor.getStats().addDamageDealt(actual, true);
        ctx.addDamageDealt(actor.getId(), actual, true);
        if (!adversary.isAlive()) {
            actor.getStats().addKill();
            ctx.publicEvent(RoundEvent.Type.ADVERSARY_DEFEATED, actor.getId(), Adversary.ID, null, 0,
                    adversary.getName() + " has been defeated by " + actor.getName() + "!");
            logger.info("Round {}: adversary defeated by {}", ctx.getRound(), actor.getId());
        }
        return actual;
    }

    /**
     * Restore hp. Healing lands in full whatever the target's allegiance; only blocking effects
     * (rage) stop it.
     *
     * @param healer participant responsible for the heal, may be null
     * @return hp actually restored
     */
    public int heal(Participant healer, Participant target, int amount, String abilityId, boolean overTime) {
        if (amount <= 0 || !target.isActive()) return 0;
        if (effects.blocksHealing(target)) {
            ctx.publicEvent(RoundEvent.Type.HEAL_BLOCKED, healer != null ? healer.getId() : null, target.getId(),
                    abilityId, 0, target.getName() + " is too enraged to accept healing.");
            return 0;
        }
        int before = target.getHp();
        target.setHp(before + amount);
        int actual = target.getHp() - before;
        ctx.recordHpDelta(target.getId(), actual);
        if (healer != null) {
            healer.getStats().addHealingDone(actual, healer == target);
            ctx.addHealingDone(healer.getId(), actual);
        }
        if (healingListener != null) {
            healingListener.onHealed(ctx, healer, target, actual, overTime);
        }
        return actual;
    }

    // ========== EffectTickContext ==========

    @Override
    public int applyTickDamage(Participant owner, int amount, EffectInstance source) {
        Participant sourceActor = source.getSourceId() != null ? roster.get(source.getSourceId()) : null;
        int dealt = damageParticipant(sourceActor, owner, amount, null);
        if (dealt > 0) {
            ctx.publicEvent(RoundEvent.Type.DAMAGE, source.getSourceId(), owner.getId(), null, dealt,
                    owner.getName() + " suffers " + dealt + " damage from " + source.getDefinition().getName() + ".");
        }
        return dealt;
    }

    @Override
    public int applyTickHealing(Participant owner, int amount, EffectInstance source) {
        Participant healer = source.getSourceId() != null ? roster.get(source.getSourceId()) : null;
        int healed = heal(healer, owner, amount, null, true);
        if (healed > 0) {
            ctx.publicEvent(RoundEvent.Type.HEAL, source.getSourceId(), owner.getId(), null, healed,
                    owner.getName() + " recovers " + healed + " hp from " + source.getDefinition().getName() + ".");
        }
        return healed;
    }

    @Override
    public Adversary getAdversary() { return adversary; }

    @Override
    public void onExpired(Participant owner, EffectInstance instance) {
        String message = instance.getDefinition().getName() + " has worn off " + owner.getName() + ".";
        if (!instance.getDefinition().hasFlag(EffectDefinition.Flag.HIDDEN)) {
            ctx.publicEvent(RoundEvent.Type.EFFECT_EXPIRED, null, owner.getId(), null, 0, message);
        } else if (instance.getSourceId() != null) {
            ctx.privateEvent(RoundEvent.Type.EFFECT_EXPIRED, instance.getSourceId(), owner.getId(), 0, message,
                    Collections.singletonList(instance.getSourceId()));
        }
    }

    // ========== Round end ==========

    /**
     * Settle every pending death, in seat order. A revival effect with uses left brings the
     * participant back; otherwise the death commits and exactly one DEATH event is logged.
     *
     * @return participants whose death was committed
     */
    public List<Participant> commitDeaths(List<Participant> participants) {
        List<Participant> died = new ArrayList<>();
        for (Participant p : participants) {
            if (!p.isPendingDeath()) continue;
            UndyingEffect.Instance revival = effects.findRevival(p);
            if (revival != null) {
                int hp = revival.consume();
                int before = p.getHp();
                p.revive(hp);
                ctx.recordHpDelta(p.getId(), p.getHp() - before);
                p.getStats().addRevive();
                ctx.publicEvent(RoundEvent.Type.REVIVED, p.getId(), p.getId(), null, p.getHp(),
                        p.getName() + " refuses to die and rises with " + p.getHp() + " hp!");
                logger.info("Round {}: {} revived", ctx.getRound(), p.getId());
                continue;
            }
            int before = p.getHp();
            p.commitDeath();
            ctx.recordHpDelta(p.getId(), p.getHp() - before);
            for (EffectInstance e : new ArrayList<>(p.getEffects())) {
                p.removeEffect(e);
            }
            String killerId = ctx.getLethalSource(p.getId());
            Participant killer = killerId != null ? roster.get(killerId) : null;
            if (killer != null && killer != p) {
                killer.getStats().addKill();
            }
            ctx.publicEvent(RoundEvent.Type.DEATH, killerId, p.getId(), null, 0, p.getName() + " has died.");
            logger.info("Round {}: {} died", ctx.getRound(), p.getId());
            died.add(p);
        }
        return died;
    }
}
