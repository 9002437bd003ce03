package com.example.covenant.adversary;

import com.example.covenant.combat.CombatCalculator;
import com.example.covenant.combat.CombatTarget;
import com.example.covenant.combat.HealthLedger;
import com.example.covenant.combat.HitContext;
import com.example.covenant.combat.ModifierPipeline;
import com.example.covenant.combat.RoundContext;
import com.example.covenant.combat.RoundEvent;
import com.example.covenant.config.GameBalance;
import com.example.covenant.effect.StatusEffectEngine;
import com.example.covenant.model.Adversary;
import com.example.covenant.model.Participant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Runs the adversary's turn: threat bookkeeping, target choice, the strike itself, and the
 * respawn-or-age step at round end.
 *
 * Target choice: highest threat among eligible participants. Hidden participants are not
 * eligible (unless {@code threat.ignoreStealth}); whoever was struck in the last
 * {@code avoidLastTargetRounds} rounds is skipped unless nobody else is left. Ties break at
 * random. With no threat on the table the adversary goes for the lowest hp.
 */
public class AdversaryController {

    private static final Logger logger = LoggerFactory.getLogger(AdversaryController.class);
    private static final double TIE_EPSILON = 1e-9;
    private static final String NO_TARGET = "";

    private final GameBalance.Threat cfg;
    private final CombatCalculator calc;
    private final StatusEffectEngine effects;
    private final ThreatTable threat;
    private final LinkedList<String> recentTargets = new LinkedList<>();

    public AdversaryController(CombatCalculator calc, StatusEffectEngine effects, ThreatTable threat) {
        this.cfg = calc.getBalance().getThreat();
        this.calc = calc;
        this.effects = effects;
        this.threat = threat;
    }

    public ThreatTable getThreatTable() { return threat; }

    /**
     * Fold this round's tallies into the threat table.
     */
    public void updateThreat(RoundContext ctx, List<Participant> participants) {
        if (!cfg.isEnabled()) return;
        Map<String, Double> gains = new HashMap<>();
        for (Participant p : participants) {
            if (!p.isAlive()) continue;
            RoundContext.Tally t = ctx.getTallies().get(p.getId());
            if (t == null) continue;
            double armor = p.getArmor() + effects.armorBonus(p);
            gains.put(p.getId(), threat.roundGain(armor, t.getDamageToAdversary(), t.getDamageDealt(), t.getHealingDone()));
        }
        threat.update(gains);
    }

    /**
     * Pick the adversary's target, or null if nobody can be struck.
     */
    public Participant selectTarget(List<Participant> participants, Random random) {
        List<Participant> eligible = new ArrayList<>();
        for (Participant p : participants) {
            if (!p.isActive()) continue;
            if (!cfg.isIgnoreStealth() && effects.preventsTargeting(p)) continue;
            eligible.add(p);
        }
        if (eligible.isEmpty()) return null;

        List<Participant> fresh = new ArrayList<>();
        for (Participant p : eligible) {
            if (!recentTargets.contains(p.getId())) fresh.add(p);
        }
        List<Participant> pool = fresh.isEmpty() ? eligible : fresh;

        double best = 0;
        for (Participant p : pool) best = Math.max(best, threat.get(p.getId()));
        if (!cfg.isEnabled() || best < cfg.getEpsilon()) {
            return lowestHp(pool, random);
        }
        List<Participant> top = new ArrayList<>();
        for (Participant p : pool) {
            if (Math.abs(threat.get(p.getId()) - best) <= TIE_EPSILON) top.add(p);
        }
        return pickTie(top, random);
    }

    private Participant lowestHp(List<Participant> pool, Random random) {
        int min = Integer.MAX_VALUE;
        for (Participant p : pool) min = Math.min(min, p.getHp());
        List<Participant> lowest = new ArrayList<>();
        for (Participant p : pool) {
            if (p.getHp() == min) lowest.add(p);
        }
        return pickTie(lowest, random);
    }

    private Participant pickTie(List<Participant> tied, Random random) {
        if (tied.size() == 1 || !cfg.isTiebreakRandom()) return tied.get(0);
        return tied.get(random.nextInt(tied.size()));
    }

    /**
     * Threat update, then one strike at the chosen target. A defeated adversary does not strike.
     */
    public void takeTurn(RoundContext ctx, Adversary adversary, List<Participant> participants,
                         HealthLedger ledger, ModifierPipeline pipeline) {
        updateThreat(ctx, participants);
        if (adversary == null) return;
        if (!adversary.isAlive()) {
            remember(NO_TARGET);
            return;
        }
        Participant target = selectTarget(participants, ctx.getRandom());
        if (target == null) {
            remember(NO_TARGET);
            ctx.publicEvent(RoundEvent.Type.ADVERSARY_ATTACK, adversary.getName() + " finds no one to strike.");
            return;
        }
        int base = calc.adversaryDamage(adversary.getAge());
        int damage = pipeline.resolve(HitContext.adversaryStrike(base, CombatTarget.of(target), ctx.isComebackActive()));
        int dealt = ledger.damageParticipant(null, target, damage, null);
        if (dealt > 0 && effects.degradeOnHit(target)) {
            ctx.publicEvent(RoundEvent.Type.ARMOR_DEGRADED, Adversary.ID, target.getId(), null, 0,
                    target.getName() + "'s stone armor cracks.");
        }
        ctx.publicEvent(RoundEvent.Type.ADVERSARY_ATTACK, Adversary.ID, target.getId(), null, dealt,
                adversary.getName() + " attacks " + target.getName() + " for " + dealt + " damage.");
        logger.debug("Round {}: adversary hit {} for {} (base {}, threat {})", ctx.getRound(), target.getId(),
                dealt, base, threat.get(target.getId()));
        remember(target.getId());
    }

    private void remember(String targetId) {
        recentTargets.addLast(targetId);
        while (recentTargets.size() > cfg.getAvoidLastTargetRounds()) {
            recentTargets.removeFirst();
        }
    }

    /**
     * A fallen adversary respawns one level higher and the threat table is cut once;
     * a surviving one grows a round older.
     */
    public void endOfRound(RoundContext ctx, Adversary adversary) {
        if (adversary == null) return;
        if (!adversary.isAlive()) {
            adversary.respawn(calc.adversaryMaxHp(adversary.getLevel() + 1));
            threat.applyDeathReduction();
            ctx.publicEvent(RoundEvent.Type.ADVERSARY_RESPAWN, null, Adversary.ID, null, adversary.getMaxHp(),
                    adversary.getName() + " returns stronger (level " + adversary.getLevel() + ", "
                            + adversary.getMaxHp() + " hp).");
            logger.info("Round {}: adversary respawned at level {}", ctx.getRound(), adversary.getLevel());
        } else {
            adversary.incrementAge();
        }
    }

    public List<String> getRecentTargets() {
        return new ArrayList<>(recentTargets);
    }
}
