package com.eainde.policyaudit;

import com.eainde.policyaudit.collaborator.ReasoningCollaborator;
import com.eainde.policyaudit.insight.InsightStoreFactory;
import com.eainde.policyaudit.insight.SimilarityGate;
import com.eainde.policyaudit.insight.StoreMode;
import com.eainde.policyaudit.insight.StringSimilarityGate;
import com.eainde.policyaudit.model.RawRuleRecord;
import com.eainde.policyaudit.pipeline.AnalysisFileRunner;
import com.eainde.policyaudit.pipeline.AnalysisResult;
import com.eainde.policyaudit.pipeline.PolicyAnalysisPipeline;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class PolicyAuditApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private PolicyAnalysisPipeline pipeline;

    @Test
    @DisplayName("default configuration runs deterministically with an ephemeral store")
    void defaultWiring() {
        assertThat(context.getBeansOfType(ReasoningCollaborator.class)).isEmpty();
        assertThat(context.getBeansOfType(AnalysisFileRunner.class)).isEmpty();
        assertThat(context.getBean(SimilarityGate.class)).isInstanceOf(StringSimilarityGate.class);
        assertThat(context.getBean(InsightStoreFactory.class).mode()).isEqualTo(StoreMode.EPHEMERAL);
    }

    @Test
    @DisplayName("the wired pipeline analyzes rows end to end")
    void wiredPipeline() {
        AnalysisResult result = pipeline.run(List.of(
                RawRuleRecord.ofText("Haemodialysis | KES 10,650 per session | Level 4-6 | 3 sessions per week", 8),
                RawRuleRecord.ofText("Haemodialysis | KES 10,650 per session | Level 4-6 | 2 sessions per week", 15)));

        assertThat(result.contradictions()).hasSize(1);
        assertThat(result.gaps()).hasSize(12);
    }
}
