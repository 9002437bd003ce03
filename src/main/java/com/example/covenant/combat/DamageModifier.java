package com.example.covenant.combat;

/**
 * One stage of the damage/heal pipeline. Stages read participant state but never mutate it.
 */
public interface DamageModifier {

    String name();

    HitContext apply(HitContext hit);
}
