package com.eainde.policyaudit.collaborator;

import com.eainde.policyaudit.insight.InsightCandidate;
import com.eainde.policyaudit.insight.InsightEntry;
import com.eainde.policyaudit.insight.InsightSignatures;
import com.eainde.policyaudit.insight.StringSimilarityGate;
import com.eainde.policyaudit.model.FindingType;
import com.eainde.policyaudit.thread.MdcAwareExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CollaboratorSimilarityGateTest {

    @Mock
    private ReasoningCollaborator collaborator;

    private final MdcAwareExecutor executor = new MdcAwareExecutor(1, "gate-test");

    @AfterEach
    void tearDown() {
        executor.close();
    }

    private static InsightCandidate candidate(String description) {
        return new InsightCandidate(FindingType.GAP, description,
                InsightSignatures.signature(FindingType.GAP, description), null, null);
    }

    private static InsightEntry tracked(String description) {
        return InsightEntry.first(candidate(description), "run-1");
    }

    private CollaboratorSimilarityGate gate() {
        return new CollaboratorSimilarityGate(collaborator, new StringSimilarityGate(), executor, Duration.ofSeconds(2));
    }

    @Test
    @DisplayName("a group joining the candidate with a tracked entry names that entry")
    void collaboratorMatch() {
        InsightEntry mental = tracked("mental health|no_coverage_found");
        InsightEntry stroke = tracked("stroke rehabilitation|no_coverage_found");
        when(collaborator.groupDuplicates(anyList())).thenReturn(List.of(
                new DuplicateGroup(stroke.canonicalSignature(),
                        List.of(stroke.canonicalSignature(), CollaboratorSimilarityGate.CANDIDATE_ID), "stroke")));

        assertThat(gate().findEquivalent(candidate("post stroke rehab|no_coverage_found"), List.of(mental, stroke)))
                .contains(stroke.canonicalSignature());
    }

    @Test
    @DisplayName("groups without the candidate mean no equivalent")
    void noGroupForCandidate() {
        InsightEntry stroke = tracked("stroke rehabilitation|no_coverage_found");
        when(collaborator.groupDuplicates(anyList())).thenReturn(List.of());

        assertThat(gate().findEquivalent(candidate("stroke rehabilitation|no_coverage_found "), List.of(stroke)))
                .isEmpty();
    }

    @Test
    @DisplayName("ids that were never offered are ignored")
    void unknownId() {
        InsightEntry stroke = tracked("stroke rehabilitation|no_coverage_found");
        when(collaborator.groupDuplicates(anyList())).thenReturn(List.of(
                new DuplicateGroup("F99", List.of("F99", CollaboratorSimilarityGate.CANDIDATE_ID), null)));

        assertThat(gate().findEquivalent(candidate("autism|no_coverage_found"), List.of(stroke))).isEmpty();
    }

    @Test
    @DisplayName("a failed call falls back to string similarity")
    void fallback() {
        InsightEntry stroke = tracked("stroke rehabilitation|no_coverage_found");
        when(collaborator.groupDuplicates(anyList())).thenThrow(new CollaboratorException("model unavailable"));

        assertThat(gate().findEquivalent(candidate("stroke rehabilitaton|no_coverage_found"), List.of(stroke)))
                .contains(stroke.canonicalSignature());
    }
}
