package com.siteintel.scrape.events;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Phase state machine for one run: pending, then in-progress, then complete, skipped or failed.
 * A phase may only start once every earlier phase has reached a final state.
 */
public class PhaseTracker {
    private final Map<Phase, PhaseStatus> statuses = new EnumMap<>(Phase.class);
    private final Set<Phase> skipRequested;

    public PhaseTracker(Set<Phase> skipRequested) {
        this.skipRequested = skipRequested == null || skipRequested.isEmpty()
            ? EnumSet.noneOf(Phase.class)
            : EnumSet.copyOf(skipRequested);
        this.skipRequested.remove(Phase.COMPLETE);
        for (Phase phase : Phase.values()) {
            statuses.put(phase, PhaseStatus.PENDING);
        }
    }

    public synchronized boolean isSkipRequested(Phase phase) {
        return skipRequested.contains(phase);
    }

    public synchronized void start(Phase phase) {
        requireStatus(phase, PhaseStatus.PENDING, "start");
        for (Phase earlier : Phase.values()) {
            if (earlier.ordinal() >= phase.ordinal()) {
                break;
            }
            if (!statuses.get(earlier).isTerminal()) {
                throw new IllegalStateException(
                    "Cannot start " + phase.wireName() + " while " + earlier.wireName() + " is " + statuses.get(earlier).wireName()
                );
            }
        }
        statuses.put(phase, PhaseStatus.IN_PROGRESS);
    }

    public synchronized void complete(Phase phase) {
        requireStatus(phase, PhaseStatus.IN_PROGRESS, "complete");
        statuses.put(phase, PhaseStatus.COMPLETE);
    }

    public synchronized void fail(Phase phase) {
        requireStatus(phase, PhaseStatus.IN_PROGRESS, "fail");
        statuses.put(phase, PhaseStatus.FAILED);
    }

    public synchronized void skip(Phase phase) {
        requireStatus(phase, PhaseStatus.PENDING, "skip");
        statuses.put(phase, PhaseStatus.SKIPPED);
    }

    /**
     * Skips every phase still pending, apart from the terminal one. Used when a run stops early.
     */
    public synchronized void skipRemaining() {
        for (Phase phase : Phase.values()) {
            if (phase != Phase.COMPLETE && statuses.get(phase) == PhaseStatus.PENDING) {
                statuses.put(phase, PhaseStatus.SKIPPED);
            }
        }
    }

    /**
     * Marks an in-progress phase failed. No-op for phases in any other state.
     */
    public synchronized void failIfRunning(Phase phase) {
        if (statuses.get(phase) == PhaseStatus.IN_PROGRESS) {
            statuses.put(phase, PhaseStatus.FAILED);
        }
    }

    public synchronized PhaseStatus status(Phase phase) {
        return statuses.get(phase);
    }

    /**
     * Wire names of the phases that completed, in pipeline order. The terminal phase is not listed.
     */
    public synchronized List<String> phasesRun() {
        List<String> run = new ArrayList<>();
        for (Phase phase : Phase.values()) {
            if (phase != Phase.COMPLETE && statuses.get(phase) == PhaseStatus.COMPLETE) {
                run.add(phase.wireName());
            }
        }
        return Collections.unmodifiableList(run);
    }

    public synchronized Map<String, String> snapshot() {
        Map<String, String> snapshot = new LinkedHashMap<>();
        statuses.forEach((phase, status) -> snapshot.put(phase.wireName(), status.wireName()));
        return snapshot;
    }

    private void requireStatus(Phase phase, PhaseStatus expected, String action) {
        PhaseStatus current = statuses.get(phase);
        if (current != expected) {
            throw new IllegalStateException(
                "Cannot " + action + " phase " + phase.wireName() + " in state " + current.wireName()
            );
        }
    }
}
