package com.example.covenant.combat;

import com.example.covenant.model.ParticipantStats;
import com.example.covenant.outcome.GameOutcome;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything a resolved round hands back: the ordered event log, the win-condition result
 * and read-only statistics snapshots.
 */
public class RoundResult {

    private final int round;
    private final List<RoundEvent> events;
    private final GameOutcome outcome;
    private final Map<String, ParticipantStats.Snapshot> stats;

    public RoundResult(int round, List<RoundEvent> events, GameOutcome outcome,
                       Map<String, ParticipantStats.Snapshot> stats) {
        this.round = round;
        this.events = Collections.unmodifiableList(new ArrayList<>(events));
        this.outcome = outcome;
        this.stats = Collections.unmodifiableMap(new LinkedHashMap<>(stats));
    }

    public int getRound() { return round; }
    public List<RoundEvent> getEvents() { return events; }
    public GameOutcome getOutcome() { return outcome; }
    public Map<String, ParticipantStats.Snapshot> getStats() { return stats; }

    public List<RoundEvent> getPublicEvents() {
        List<RoundEvent> out = new ArrayList<>();
        for (RoundEvent e : events) {
            if (e.isPublic()) out.add(e);
        }
        return out;
    }

    /**
     * The log as one participant is allowed to see it.
     */
    public List<RoundEvent> eventsVisibleTo(String participantId) {
        List<RoundEvent> out = new ArrayList<>();
        for (RoundEvent e : events) {
            if (e.isVisibleTo(participantId)) out.add(e);
        }
        return out;
    }

    public List<RoundEvent> eventsOfType(RoundEvent.Type type) {
        List<RoundEvent> out = new ArrayList<>();
        for (RoundEvent e : events) {
            if (e.getType() == type) out.add(e);
        }
        return out;
    }
}
