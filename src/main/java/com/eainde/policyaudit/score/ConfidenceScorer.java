package com.eainde.policyaudit.score;

import com.eainde.policyaudit.model.ConfidenceTier;
import com.eainde.policyaudit.model.Contradiction;
import com.eainde.policyaudit.model.Gap;
import com.eainde.policyaudit.model.GapStatus;

import java.util.ArrayList;
import java.util.List;

/**
 * Assigns a {@link ConfidenceTier} to every finding from up to three signals:
 *
 * <ul>
 *   <li><b>pattern specificity</b>: how specific the extraction patterns behind the finding were</li>
 *   <li><b>corroboration</b>: how many evidence snippets back it</li>
 *   <li><b>collaborator agreement</b>: only when the reasoning collaborator reviewed the rules</li>
 * </ul>
 *
 * <p>The tier is the weakest of the signals that are present. A strong signal never lifts a
 * finding above a weak one, and a missing collaborator leaves the deterministic tier as is.</p>
 */
public class ConfidenceScorer {

    public static final double HIGH_AGREEMENT = 0.8;
    public static final double MEDIUM_AGREEMENT = 0.5;

    /** A snippet shorter than this is a bare cell value, not corroborating context. */
    static final int SUBSTANTIAL_SNIPPET = 50;

    // =========================================================================
    //  Contradictions
    // =========================================================================

    public List<Contradiction> scoreContradictions(List<Contradiction> contradictions) {
        List<Contradiction> scored = new ArrayList<>(contradictions.size());
        for (Contradiction c : contradictions) {
            scored.add(c.withConfidenceTier(score(c)));
        }
        return scored;
    }

    public ConfidenceTier score(Contradiction contradiction) {
        int substantial = 0;
        if (contradiction.left().snippet().length() > SUBSTANTIAL_SNIPPET) substantial++;
        if (contradiction.right().snippet().length() > SUBSTANTIAL_SNIPPET) substantial++;
        return ConfidenceTier.weakest(
                contradiction.specificityTier(),
                corroborationTier(substantial),
                agreementTier(contradiction.collaboratorAgreement()));
    }

    // =========================================================================
    //  Gaps
    // =========================================================================

    public List<Gap> scoreGaps(List<Gap> gaps) {
        List<Gap> scored = new ArrayList<>(gaps.size());
        for (Gap gap : gaps) {
            scored.add(gap.withConfidenceTier(score(gap)));
        }
        return scored;
    }

    public ConfidenceTier score(Gap gap) {
        if (gap.status() == GapStatus.NO_COVERAGE_FOUND) {
            // absence is only meaningful if something was searched
            return gap.searchedRuleCount() > 0 ? ConfidenceTier.HIGH : ConfidenceTier.LOW;
        }
        return ConfidenceTier.weakest(gap.weakestMatch(), corroborationTier(gap.matchCount()));
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    static ConfidenceTier corroborationTier(int snippets) {
        if (snippets >= 2) return ConfidenceTier.HIGH;
        if (snippets == 1) return ConfidenceTier.MEDIUM;
        return ConfidenceTier.LOW;
    }

    /** Null when the collaborator did not take part, so it drops out of the minimum. */
    static ConfidenceTier agreementTier(Double agreement) {
        if (agreement == null) {
            return null;
        }
        if (agreement >= HIGH_AGREEMENT) return ConfidenceTier.HIGH;
        if (agreement >= MEDIUM_AGREEMENT) return ConfidenceTier.MEDIUM;
        return ConfidenceTier.LOW;
    }
}
