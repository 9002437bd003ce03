package com.example.covenant.model;

/**
 * Hidden allegiance of a participant. Never visible to peers; only the corruption
 * and win-condition components branch on it.
 */
public enum Allegiance {
    COOPERATIVE,
    CORRUPTED
}
