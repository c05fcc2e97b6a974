package com.eainde.policyaudit.pipeline;

import com.eainde.policyaudit.collaborator.ChunkReview;
import com.eainde.policyaudit.collaborator.ChunkReviewExecutor;
import com.eainde.policyaudit.collaborator.DuplicateCandidate;
import com.eainde.policyaudit.collaborator.DuplicateGroup;
import com.eainde.policyaudit.collaborator.ReasoningCollaborator;
import com.eainde.policyaudit.collaborator.RuleChunk;
import com.eainde.policyaudit.detect.ContradictionDetector;
import com.eainde.policyaudit.detect.DetectionSettings;
import com.eainde.policyaudit.gap.ExpectationConfigLoader;
import com.eainde.policyaudit.gap.GapAnalyzer;
import com.eainde.policyaudit.insight.InsightSignatures;
import com.eainde.policyaudit.insight.InsightStoreFactory;
import com.eainde.policyaudit.insight.StoreMode;
import com.eainde.policyaudit.insight.StringSimilarityGate;
import com.eainde.policyaudit.key.ServiceKeyResolver;
import com.eainde.policyaudit.model.ConfidenceTier;
import com.eainde.policyaudit.model.ContradictionRow;
import com.eainde.policyaudit.model.ContradictionType;
import com.eainde.policyaudit.model.GapRow;
import com.eainde.policyaudit.model.GapStatus;
import com.eainde.policyaudit.model.InsightStatus;
import com.eainde.policyaudit.model.RawRuleRecord;
import com.eainde.policyaudit.model.Severity;
import com.eainde.policyaudit.normalize.RuleNormalizer;
import com.eainde.policyaudit.score.ConfidenceScorer;
import com.eainde.policyaudit.thread.MdcAwareExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PolicyAnalysisPipelineTest {

    static final List<RawRuleRecord> HEMODIALYSIS_ROWS = List.of(
            RawRuleRecord.ofText("Haemodialysis | KES 10,650 per session | Level 4-6 | 3 sessions per week", 8),
            RawRuleRecord.ofText("Haemodialysis | KES 10,650 per session | Level 4-6 | 2 sessions per week", 15));

    private final ObjectMapper objectMapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    static PolicyAnalysisPipeline newPipeline(ObjectMapper objectMapper, InsightStoreFactory storeFactory,
                                              ChunkReviewExecutor chunkReview) {
        return new PolicyAnalysisPipeline(
                RuleNormalizer.builder().build(),
                new ServiceKeyResolver(),
                new ContradictionDetector(DetectionSettings.defaults()),
                new GapAnalyzer(new ExpectationConfigLoader().load("classpath:expectations.yaml")),
                new ConfidenceScorer(),
                new InsightSignatures(objectMapper),
                storeFactory,
                new StringSimilarityGate(),
                chunkReview);
    }

    private PolicyAnalysisPipeline pipeline(InsightStoreFactory storeFactory, ChunkReviewExecutor chunkReview) {
        return newPipeline(objectMapper, storeFactory, chunkReview);
    }

    private static GapRow gap(AnalysisResult result, String condition) {
        return result.gaps().stream().filter(g -> g.condition().equals(condition)).findFirst().orElseThrow();
    }

    @Nested
    @DisplayName("a single run")
    class SingleRun {

        @Test
        @DisplayName("conflicting weekly limits become one scored, NEW contradiction")
        void limitContradiction() {
            AnalysisResult result = pipeline(InsightStoreFactory.ephemeral(), null).run(HEMODIALYSIS_ROWS, "run-1");

            assertThat(result.rules()).extracting(r -> r.serviceKey())
                    .containsOnly("dialysis:hemodialysis");
            assertThat(result.contradictions()).singleElement().satisfies(row -> {
                assertThat(row.type()).isEqualTo(ContradictionType.LIMIT);
                assertThat(row.details()).isEqualTo("3 vs 2 per_week");
                assertThat(row.severity()).isEqualTo(Severity.HIGH);
                assertThat(row.leftPage()).isEqualTo(8);
                assertThat(row.rightPage()).isEqualTo(15);
                assertThat(row.confidenceTier()).isEqualTo(ConfidenceTier.HIGH);
                assertThat(row.insightStatus()).isEqualTo(InsightStatus.NEW);
                assertThat(row.occurrenceCount()).isEqualTo(1);
            });
        }

        @Test
        @DisplayName("every expected condition gets a row; adequate ones are not tracked")
        void gapRows() {
            AnalysisResult result = pipeline(InsightStoreFactory.ephemeral(), null).run(HEMODIALYSIS_ROWS, "run-1");

            assertThat(result.gaps()).hasSize(12);
            GapRow kidney = gap(result, "Chronic kidney disease");
            assertThat(kidney.status()).isEqualTo(GapStatus.ADEQUATE);
            assertThat(kidney.insightStatus()).isNull();
            assertThat(kidney.occurrenceCount()).isZero();

            GapRow stroke = gap(result, "Stroke rehabilitation");
            assertThat(stroke.status()).isEqualTo(GapStatus.NO_COVERAGE_FOUND);
            assertThat(stroke.confidenceTier()).isEqualTo(ConfidenceTier.HIGH);
            assertThat(stroke.insightStatus()).isEqualTo(InsightStatus.NEW);
            assertThat(stroke.evidence()).containsExactly("no matches found");

            assertThat(result.summary().totalFindings()).isEqualTo(1 + 11);
            assertThat(result.summary().newFindings()).isEqualTo(12);
        }

        @Test
        @DisplayName("the run id is only in the MDC while the run lasts")
        void runIdMdc() {
            pipeline(InsightStoreFactory.ephemeral(), null).run(HEMODIALYSIS_ROWS, "run-1");

            assertThat(MDC.get(PolicyAnalysisPipeline.RUN_ID_MDC_KEY)).isNull();
            assertThat(PolicyAnalysisPipeline.newRunId()).matches("run-\\d{8}T\\d{6}-[0-9a-f]{8}");
        }

        @Test
        @DisplayName("rows that name no service are never compared with each other")
        void rowsWithoutServiceNotCompared() {
            AnalysisResult result = pipeline(InsightStoreFactory.ephemeral(), null).run(List.of(
                    RawRuleRecord.ofText("KES 3,000 per session", 4),
                    RawRuleRecord.ofText("KES 45,000 per session", 19)), "run-1");

            assertThat(result.rules()).extracting(r -> r.serviceKey()).containsOnly("other:general");
            assertThat(result.contradictions()).isEmpty();
        }

        @Test
        @DisplayName("no rows still reports every condition as uncovered")
        void emptyInput() {
            AnalysisResult result = pipeline(InsightStoreFactory.ephemeral(), null).run(List.of(), "run-1");

            assertThat(result.contradictions()).isEmpty();
            assertThat(result.gaps()).allMatch(g -> g.status() == GapStatus.NO_COVERAGE_FOUND)
                    .allMatch(g -> g.confidenceTier() == ConfidenceTier.LOW);
        }
    }

    @Nested
    @DisplayName("across runs")
    class AcrossRuns {

        @Test
        @DisplayName("ephemeral mode reports the same findings as NEW every time")
        void ephemeral() {
            PolicyAnalysisPipeline pipeline = pipeline(InsightStoreFactory.ephemeral(), null);

            pipeline.run(HEMODIALYSIS_ROWS, "run-1");
            AnalysisResult second = pipeline.run(HEMODIALYSIS_ROWS, "run-2");

            assertThat(second.contradictions()).extracting(ContradictionRow::insightStatus)
                    .containsOnly(InsightStatus.NEW);
            assertThat(second.summary().storeMode()).isEqualTo(StoreMode.EPHEMERAL);
            assertThat(second.summary().recurring()).isZero();
        }

        @Test
        @DisplayName("cumulative mode counts repeat findings")
        void cumulative() {
            InsightStoreFactory factory = new InsightStoreFactory(StoreMode.CUMULATIVE,
                    tempDir.resolve("insights.json"), objectMapper);
            PolicyAnalysisPipeline pipeline = pipeline(factory, null);

            pipeline.run(HEMODIALYSIS_ROWS, "run-1");
            AnalysisResult second = pipeline.run(HEMODIALYSIS_ROWS, "run-2");

            assertThat(second.contradictions()).singleElement().satisfies(row -> {
                assertThat(row.insightStatus()).isEqualTo(InsightStatus.RECURRING);
                assertThat(row.occurrenceCount()).isEqualTo(2);
            });
            assertThat(second.summary().newFindings()).isZero();
            assertThat(second.summary().trackedEntries()).isEqualTo(12);
        }
    }

    @Test
    @DisplayName("collaborator disagreement lowers the contradiction's tier")
    void collaboratorReview() {
        ReasoningCollaborator lukewarm = new ReasoningCollaborator() {
            @Override
            public ChunkReview reviewChunk(RuleChunk chunk) {
                Map<Integer, Double> agreement = new HashMap<>();
                for (int i = 0; i < chunk.size(); i++) {
                    agreement.put(i, 0.6);
                }
                return new ChunkReview(chunk.chunkIndex(), agreement);
            }

            @Override
            public List<DuplicateGroup> groupDuplicates(List<DuplicateCandidate> candidates) {
                return List.of();
            }
        };

        try (MdcAwareExecutor executor = new MdcAwareExecutor(2, "pipeline-test")) {
            AnalysisResult result = pipeline(InsightStoreFactory.ephemeral(),
                    new ChunkReviewExecutor(lukewarm, executor)).run(HEMODIALYSIS_ROWS, "run-1");

            assertThat(result.rules()).allMatch(r -> r.collaboratorAgreement() == 0.6);
            assertThat(result.contradictions()).singleElement()
                    .satisfies(row -> assertThat(row.confidenceTier()).isEqualTo(ConfidenceTier.MEDIUM));
        }
    }
}
