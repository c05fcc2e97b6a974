package com.eainde.policyaudit.config;

import com.eainde.policyaudit.collaborator.ChunkReviewExecutor;
import com.eainde.policyaudit.collaborator.CollaboratorSimilarityGate;
import com.eainde.policyaudit.collaborator.ReasoningCollaborator;
import com.eainde.policyaudit.detect.ContradictionDetector;
import com.eainde.policyaudit.detect.DetectionSettings;
import com.eainde.policyaudit.gap.ExpectationConfigLoader;
import com.eainde.policyaudit.gap.GapAnalyzer;
import com.eainde.policyaudit.insight.InsightSignatures;
import com.eainde.policyaudit.insight.InsightStoreFactory;
import com.eainde.policyaudit.insight.SimilarityGate;
import com.eainde.policyaudit.insight.StoreMode;
import com.eainde.policyaudit.insight.StringSimilarityGate;
import com.eainde.policyaudit.key.ServiceKeyResolver;
import com.eainde.policyaudit.normalize.RuleNormalizer;
import com.eainde.policyaudit.pipeline.PolicyAnalysisPipeline;
import com.eainde.policyaudit.score.ConfidenceScorer;
import com.eainde.policyaudit.thread.MdcAwareExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Wires the analysis components. The components themselves are plain classes; every tunable
 * lives here with its default.
 *
 * <h3>Collaborator:</h3>
 * <p>When a {@link ReasoningCollaborator} bean exists (see {@link CollaboratorConfig}) the
 * pipeline gets chunk review and the collaborator-backed similarity gate. Otherwise the run is
 * fully deterministic.</p>
 */
@Log4j2
@Configuration
public class PolicyAuditConfig {

    // ── Normalizer config ───────────────────────────────────────────────
    @Value("${policy-audit.normalizer.min-facility-level:1}")
    private int minFacilityLevel;

    @Value("${policy-audit.normalizer.max-facility-level:6}")
    private int maxFacilityLevel;

    @Value("${policy-audit.normalizer.snippet-min-length:150}")
    private int snippetMinLength;

    @Value("${policy-audit.normalizer.snippet-max-length:300}")
    private int snippetMaxLength;

    // ── Keys + detection config ─────────────────────────────────────────
    @Value("${policy-audit.service-key.similarity-threshold:0.80}")
    private double serviceKeyThreshold;

    @Value("${policy-audit.detection.tariff-variance-threshold:0.20}")
    private double tariffVarianceThreshold;

    @Value("${policy-audit.detection.high-severity-variance:0.50}")
    private double highSeverityVariance;

    // ── Gap config ──────────────────────────────────────────────────────
    @Value("${policy-audit.gaps.expectations-location:classpath:expectations.yaml}")
    private String expectationsLocation;

    @Value("${policy-audit.gaps.adequacy-threshold:2}")
    private int adequacyThreshold;

    // ── Insight config ──────────────────────────────────────────────────
    @Value("${policy-audit.insights.mode:EPHEMERAL}")
    private StoreMode storeMode;

    @Value("${policy-audit.insights.store-path:insights/insight-store.json}")
    private String storePath;

    @Value("${policy-audit.insights.similarity-threshold:0.85}")
    private double insightSimilarityThreshold;

    // ── Collaborator execution config ───────────────────────────────────
    @Value("${policy-audit.collaborator.max-concurrent-calls:3}")
    private int maxConcurrentCalls;

    @Value("${policy-audit.collaborator.call-timeout:30s}")
    private Duration callTimeout;

    @Value("${policy-audit.collaborator.max-rules-per-chunk:25}")
    private int maxRulesPerChunk;

    // =========================================================================
    //  Components
    // =========================================================================

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Bean
    public RuleNormalizer ruleNormalizer() {
        return RuleNormalizer.builder()
                .facilityLevelRange(minFacilityLevel, maxFacilityLevel)
                .snippetLength(snippetMinLength, snippetMaxLength)
                .build();
    }

    @Bean
    public ServiceKeyResolver serviceKeyResolver() {
        return new ServiceKeyResolver(serviceKeyThreshold);
    }

    @Bean
    public ContradictionDetector contradictionDetector() {
        DetectionSettings defaults = DetectionSettings.defaults();
        return new ContradictionDetector(new DetectionSettings(tariffVarianceThreshold, highSeverityVariance,
                defaults.highRiskCategories(), defaults.highRiskKeywords()));
    }

    @Bean
    public GapAnalyzer gapAnalyzer() {
        return new GapAnalyzer(new ExpectationConfigLoader().load(expectationsLocation), adequacyThreshold);
    }

    @Bean
    public ConfidenceScorer confidenceScorer() {
        return new ConfidenceScorer();
    }

    @Bean
    public InsightSignatures insightSignatures(ObjectMapper objectMapper) {
        return new InsightSignatures(objectMapper);
    }

    @Bean
    public InsightStoreFactory insightStoreFactory(ObjectMapper objectMapper) {
        log.info("Insight store mode: {}{}", storeMode,
                storeMode == StoreMode.CUMULATIVE ? " (" + storePath + ")" : "");
        return new InsightStoreFactory(storeMode,
                storeMode == StoreMode.CUMULATIVE ? Path.of(storePath) : null, objectMapper);
    }

    @Bean(destroyMethod = "close")
    public MdcAwareExecutor collaboratorExecutor() {
        return new MdcAwareExecutor(maxConcurrentCalls, "collaborator");
    }

    @Bean
    public SimilarityGate similarityGate(ObjectProvider<ReasoningCollaborator> collaborator,
                                         MdcAwareExecutor collaboratorExecutor) {
        StringSimilarityGate fallback = new StringSimilarityGate(insightSimilarityThreshold);
        ReasoningCollaborator available = collaborator.getIfAvailable();
        if (available == null) {
            return fallback;
        }
        return new CollaboratorSimilarityGate(available, fallback, collaboratorExecutor, callTimeout);
    }

    @Bean
    public PolicyAnalysisPipeline policyAnalysisPipeline(RuleNormalizer normalizer,
                                                         ServiceKeyResolver keyResolver,
                                                         ContradictionDetector contradictionDetector,
                                                         GapAnalyzer gapAnalyzer,
                                                         ConfidenceScorer scorer,
                                                         InsightSignatures signatures,
                                                         InsightStoreFactory storeFactory,
                                                         SimilarityGate similarityGate,
                                                         ObjectProvider<ReasoningCollaborator> collaborator,
                                                         MdcAwareExecutor collaboratorExecutor) {
        ReasoningCollaborator available = collaborator.getIfAvailable();
        ChunkReviewExecutor chunkReview = available == null
                ? null
                : new ChunkReviewExecutor(available, collaboratorExecutor, maxConcurrentCalls, callTimeout, maxRulesPerChunk);
        log.info("Pipeline ready (collaborator {})", available == null ? "disabled" : "enabled");
        return new PolicyAnalysisPipeline(normalizer, keyResolver, contradictionDetector, gapAnalyzer,
                scorer, signatures, storeFactory, similarityGate, chunkReview);
    }
}
