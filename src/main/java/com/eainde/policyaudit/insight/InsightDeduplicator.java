package com.eainde.policyaudit.insight;

import com.eainde.policyaudit.model.InsightStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Collapses the current run's findings against the insight store.
 *
 * <h3>Per finding:</h3>
 * <ol>
 *   <li>signature already tracked → RECURRING, count + 1</li>
 *   <li>otherwise the {@link SimilarityGate} may name an equivalent entry of the same type and
 *       subject from an earlier run → RECURRING on that entry</li>
 *   <li>otherwise → NEW entry with count 1</li>
 * </ol>
 *
 * <p>One deduplicator serves one run. Updates are staged in the store and made durable by a
 * single {@link #commit()} at the end of the run.</p>
 */
@Slf4j
public class InsightDeduplicator {

    private final InsightStore store;
    private final SimilarityGate gate;
    private final String runId;

    private int processed;
    private int fresh;
    private int recurring;
    private boolean committed;

    public InsightDeduplicator(InsightStore store, SimilarityGate gate, String runId) {
        this.store = store;
        this.gate = gate;
        this.runId = runId;
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    public List<InsightOutcome> process(List<InsightCandidate> candidates) {
        List<InsightOutcome> outcomes = new ArrayList<>(candidates.size());
        for (InsightCandidate candidate : candidates) {
            outcomes.add(process(candidate));
        }
        return outcomes;
    }

    public InsightOutcome process(InsightCandidate candidate) {
        if (committed) {
            throw new IllegalStateException("Run " + runId + " is already committed");
        }
        processed++;

        Optional<InsightEntry> exact = store.get(candidate.signature());
        if (exact.isPresent()) {
            return recur(candidate, exact.get());
        }

        // entries first seen in this run are distinct findings of the same document
        List<InsightEntry> sameType = store.entries().stream()
                .filter(e -> e.comparableTo(candidate) && !runId.equals(e.firstSeenRunId()))
                .toList();
        if (!sameType.isEmpty()) {
            Optional<InsightEntry> equivalent = gate.findEquivalent(candidate, sameType)
                    .flatMap(store::get);
            if (equivalent.isPresent()) {
                log.debug("Near-duplicate {} merged into {}", candidate.signature(),
                        equivalent.get().canonicalSignature());
                return recur(candidate, equivalent.get());
            }
        }

        InsightEntry entry = InsightEntry.first(candidate, runId);
        store.stage(entry);
        fresh++;
        return new InsightOutcome(candidate.signature(), entry.canonicalSignature(), InsightStatus.NEW, 1);
    }

    /** Flushes the staged updates once; later calls are rejected. */
    public InsightSummary commit() {
        if (committed) {
            throw new IllegalStateException("Run " + runId + " is already committed");
        }
        store.flush();
        committed = true;
        InsightSummary summary = summary();
        log.info("Insights for run {}: {} findings, {} new, {} recurring, {} tracked ({})",
                runId, summary.totalFindings(), summary.newFindings(), summary.recurring(),
                summary.trackedEntries(), store.mode());
        return summary;
    }

    public InsightSummary summary() {
        return new InsightSummary(runId, store.mode(), processed, fresh, recurring, store.entries().size());
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    private InsightOutcome recur(InsightCandidate candidate, InsightEntry entry) {
        InsightEntry updated = entry.seenAgain(runId);
        store.stage(updated);
        recurring++;
        return new InsightOutcome(candidate.signature(), updated.canonicalSignature(),
                InsightStatus.RECURRING, updated.occurrenceCount());
    }
}
