package com.example.covenant.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only ability lookup shared by every session.
 */
public class AbilityCatalog {

    private final Map<String, Ability> abilities;

    public AbilityCatalog(Collection<Ability> list) {
        Map<String, Ability> byId = new LinkedHashMap<>();
        for (Ability a : list) {
            if (byId.put(a.getId(), a) != null) {
                throw new IllegalArgumentException("Duplicate ability id: " + a.getId());
            }
        }
        this.abilities = Collections.unmodifiableMap(byId);
    }

    public Ability get(String id) { return id == null ? null : abilities.get(id); }

    public boolean contains(String id) { return id != null && abilities.containsKey(id); }

    public Collection<Ability> all() { return abilities.values(); }

    public int size() { return abilities.size(); }
}
