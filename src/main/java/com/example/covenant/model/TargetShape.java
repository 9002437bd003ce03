package com.example.covenant.model;

/**
 * Who an ability can be aimed at.
 */
public enum TargetShape {
    /** Only the actor */
    SELF,
    /** One participant other than the actor, or the adversary */
    SINGLE_OTHER,
    /** Every other living participant, resolved at execution time */
    ALL_OTHERS
}
