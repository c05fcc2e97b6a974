package com.eainde.policyaudit.collaborator;

import com.eainde.policyaudit.insight.InsightCandidate;
import com.eainde.policyaudit.insight.InsightEntry;
import com.eainde.policyaudit.insight.SimilarityGate;
import com.eainde.policyaudit.key.StringSimilarity;
import com.eainde.policyaudit.thread.MdcAwareExecutor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Near-duplicate gate that asks the collaborator first and falls back to a deterministic gate.
 *
 * <p>Only the {@value #MAX_TRACKED} most similar tracked entries are offered, so the prompt
 * stays small. A group that joins the candidate with a tracked entry names that entry;
 * anything else, including a failed or slow call, defers to the fallback.</p>
 */
@Slf4j
public class CollaboratorSimilarityGate implements SimilarityGate {

    static final int MAX_TRACKED = 20;
    static final String CANDIDATE_ID = "NEW";

    private final ReasoningCollaborator collaborator;
    private final SimilarityGate fallback;
    private final MdcAwareExecutor executor;
    private final Duration callTimeout;

    public CollaboratorSimilarityGate(ReasoningCollaborator collaborator, SimilarityGate fallback,
                                      MdcAwareExecutor executor, Duration callTimeout) {
        this.collaborator = collaborator;
        this.fallback = fallback;
        this.executor = executor;
        this.callTimeout = callTimeout;
    }

    @Override
    public Optional<String> findEquivalent(InsightCandidate candidate, List<InsightEntry> tracked) {
        List<InsightEntry> offered = tracked.stream()
                .sorted(Comparator.comparingDouble((InsightEntry e) ->
                        StringSimilarity.ratio(candidate.normalizedDescription(), e.normalizedDescription())).reversed())
                .limit(MAX_TRACKED)
                .toList();

        List<DuplicateCandidate> input = new ArrayList<>(offered.size() + 1);
        input.add(new DuplicateCandidate(CANDIDATE_ID, candidate.normalizedDescription()));
        for (InsightEntry entry : offered) {
            input.add(new DuplicateCandidate(entry.canonicalSignature(), entry.normalizedDescription()));
        }

        Future<List<DuplicateGroup>> call = executor.submit(() -> collaborator.groupDuplicates(input));
        try {
            List<DuplicateGroup> groups = call.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return equivalentIn(groups, offered);
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("Duplicate grouping timed out after {}, using fallback gate", callTimeout);
        } catch (ExecutionException e) {
            log.warn("Duplicate grouping failed: {}, using fallback gate", e.getCause().getMessage());
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
        }
        return fallback.findEquivalent(candidate, tracked);
    }

    private static Optional<String> equivalentIn(List<DuplicateGroup> groups, List<InsightEntry> offered) {
        for (DuplicateGroup group : groups) {
            if (!group.contains(CANDIDATE_ID)) {
                continue;
            }
            if (group.masterId() != null && !CANDIDATE_ID.equals(group.masterId()) && isOffered(group.masterId(), offered)) {
                return Optional.of(group.masterId());
            }
            for (String id : group.mergedIds()) {
                if (!CANDIDATE_ID.equals(id) && isOffered(id, offered)) {
                    return Optional.of(id);
                }
            }
        }
        return Optional.empty();
    }

    private static boolean isOffered(String id, List<InsightEntry> offered) {
        return offered.stream().anyMatch(e -> e.canonicalSignature().equals(id));
    }
}
