package com.eainde.policyaudit.pipeline;

import com.eainde.policyaudit.collaborator.ChunkReviewExecutor;
import com.eainde.policyaudit.detect.ContradictionDetector;
import com.eainde.policyaudit.gap.GapAnalyzer;
import com.eainde.policyaudit.insight.InsightDeduplicator;
import com.eainde.policyaudit.insight.InsightOutcome;
import com.eainde.policyaudit.insight.InsightSignatures;
import com.eainde.policyaudit.insight.InsightStoreFactory;
import com.eainde.policyaudit.insight.SimilarityGate;
import com.eainde.policyaudit.key.ServiceKeyResolver;
import com.eainde.policyaudit.model.Contradiction;
import com.eainde.policyaudit.model.ContradictionRow;
import com.eainde.policyaudit.model.Gap;
import com.eainde.policyaudit.model.GapRow;
import com.eainde.policyaudit.model.RawRuleRecord;
import com.eainde.policyaudit.model.Rule;
import com.eainde.policyaudit.normalize.RuleNormalizer;
import com.eainde.policyaudit.score.ConfidenceScorer;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Runs one analysis from raw rows to deduplicated findings.
 *
 * <h3>Steps:</h3>
 * <pre>
 * raw rows ─► normalize ─► resolve keys ─► [collaborator review] ─► detect ─┐
 *                                                                 gaps ────┤
 *                                          score ◄─────────────────────────┘
 *                                            │
 *                                            ▼
 *                              deduplicate ─► commit store ─► AnalysisResult
 * </pre>
 *
 * <p>Without a {@link ChunkReviewExecutor} the run is fully deterministic. The insight store
 * is opened fresh for every run and flushed once, after all findings have been processed; a
 * failure before that point leaves a cumulative store file untouched.</p>
 */
@Slf4j
public class PolicyAnalysisPipeline {

    public static final String RUN_ID_MDC_KEY = "runId";

    private static final DateTimeFormatter RUN_ID_TIME = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss");

    private final RuleNormalizer normalizer;
    private final ServiceKeyResolver keyResolver;
    private final ContradictionDetector contradictionDetector;
    private final GapAnalyzer gapAnalyzer;
    private final ConfidenceScorer scorer;
    private final InsightSignatures signatures;
    private final InsightStoreFactory storeFactory;
    private final SimilarityGate similarityGate;
    private final ChunkReviewExecutor chunkReview;

    public PolicyAnalysisPipeline(RuleNormalizer normalizer,
                                  ServiceKeyResolver keyResolver,
                                  ContradictionDetector contradictionDetector,
                                  GapAnalyzer gapAnalyzer,
                                  ConfidenceScorer scorer,
                                  InsightSignatures signatures,
                                  InsightStoreFactory storeFactory,
                                  SimilarityGate similarityGate,
                                  ChunkReviewExecutor chunkReview) {
        this.normalizer = normalizer;
        this.keyResolver = keyResolver;
        this.contradictionDetector = contradictionDetector;
        this.gapAnalyzer = gapAnalyzer;
        this.scorer = scorer;
        this.signatures = signatures;
        this.storeFactory = storeFactory;
        this.similarityGate = similarityGate;
        this.chunkReview = chunkReview;
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    public AnalysisResult run(List<RawRuleRecord> records) {
        return run(records, newRunId());
    }

    public AnalysisResult run(List<RawRuleRecord> records, String runId) {
        MDC.put(RUN_ID_MDC_KEY, runId);
        try {
            log.info("Run {} started: {} raw rows, {} insight store", runId, records.size(), storeFactory.mode());
            return analyze(normalizer.normalizeAll(records), runId);
        } finally {
            MDC.remove(RUN_ID_MDC_KEY);
        }
    }

    /** Same as {@link #run(List, String)} for rules that are already normalized. */
    public AnalysisResult analyzeRules(List<Rule> rules, String runId) {
        MDC.put(RUN_ID_MDC_KEY, runId);
        try {
            return analyze(rules, runId);
        } finally {
            MDC.remove(RUN_ID_MDC_KEY);
        }
    }

    public static String newRunId() {
        return "run-" + LocalDateTime.now().format(RUN_ID_TIME) + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    private AnalysisResult analyze(List<Rule> normalized, String runId) {
        // ── Keys + optional review ─────────────────────────────────────
        List<Rule> rules = keyResolver.resolveAll(normalized);
        if (chunkReview != null) {
            rules = chunkReview.review(rules);
        }

        // ── Findings ───────────────────────────────────────────────────
        List<Contradiction> contradictions = scorer.scoreContradictions(contradictionDetector.detectAll(rules));
        List<Gap> gaps = scorer.scoreGaps(gapAnalyzer.analyze(rules));

        // ── Deduplicate + commit ───────────────────────────────────────
        InsightDeduplicator deduplicator = new InsightDeduplicator(storeFactory.open(), similarityGate, runId);

        List<ContradictionRow> contradictionRows = new ArrayList<>(contradictions.size());
        for (Contradiction contradiction : contradictions) {
            InsightOutcome outcome = deduplicator.process(signatures.candidate(contradiction));
            contradictionRows.add(ContradictionRow.of(contradiction, outcome.status(), outcome.occurrenceCount()));
        }

        List<GapRow> gapRows = new ArrayList<>(gaps.size());
        for (Gap gap : gaps) {
            if (gap.status().isActionable()) {
                InsightOutcome outcome = deduplicator.process(signatures.candidate(gap));
                gapRows.add(GapRow.of(gap, outcome.status(), outcome.occurrenceCount()));
            } else {
                gapRows.add(GapRow.of(gap, null, 0));
            }
        }

        AnalysisResult result = new AnalysisResult(rules, contradictionRows, gapRows, deduplicator.commit());
        log.info("Run {} finished: {} rules, {} contradictions flagged, {} actionable gaps",
                runId, rules.size(), contradictionRows.size(),
                gaps.stream().filter(g -> g.status().isActionable()).count());
        return result;
    }
}
