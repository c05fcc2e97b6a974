package com.eainde.policyaudit.detect;

import com.eainde.policyaudit.model.Contradiction;
import com.eainde.policyaudit.model.ContradictionType;
import com.eainde.policyaudit.model.Rule;

import java.util.List;
import java.util.Optional;

/** Flags a service that is declared covered in one place and excluded in another. */
public class CoverageContradictionDetector extends AbstractContradictionDetector<String> {

    public CoverageContradictionDetector(SeverityPolicy severityPolicy) {
        super(severityPolicy);
    }

    @Override
    public ContradictionType type() {
        return ContradictionType.COVERAGE;
    }

    @Override
    protected List<String> groupKeys(Rule rule) {
        return List.of(rule.serviceKey());
    }

    @Override
    protected List<Contradiction> compare(String serviceKey, List<Rule> group) {
        Optional<Rule> included = group.stream().filter(r -> !r.isExcluded()).findFirst();
        Optional<Rule> excluded = group.stream().filter(Rule::isExcluded).findFirst();
        if (included.isEmpty() || excluded.isEmpty()) {
            return List.of();
        }
        Rule left = included.get();
        Rule right = excluded.get();
        String details = String.format("Included (p.%d) vs Excluded (p.%d)", left.sourcePage(), right.sourcePage());
        return List.of(Contradiction.flagged(type(), serviceKey, null, details, left, right,
                severityPolicy.severity(SeverityPolicy.TOTAL_DISAGREEMENT, serviceKey, left.category()),
                group.size(), weakestAgreement(group)));
    }
}
