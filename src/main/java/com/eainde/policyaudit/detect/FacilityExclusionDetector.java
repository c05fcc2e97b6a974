package com.eainde.policyaudit.detect;

import com.eainde.policyaudit.model.Contradiction;
import com.eainde.policyaudit.model.ContradictionType;
import com.eainde.policyaudit.model.Rule;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Flags facility levels at which a service is both excluded and included.
 * One finding per overlapping level; disjoint level sets produce nothing.
 */
public class FacilityExclusionDetector extends AbstractContradictionDetector<String> {

    public FacilityExclusionDetector(SeverityPolicy severityPolicy) {
        super(severityPolicy);
    }

    @Override
    public ContradictionType type() {
        return ContradictionType.FACILITY_EXCLUSION;
    }

    @Override
    protected List<String> groupKeys(Rule rule) {
        return rule.facilityLevels().isEmpty() ? List.of() : List.of(rule.serviceKey());
    }

    @Override
    protected List<Contradiction> compare(String serviceKey, List<Rule> group) {
        SortedSet<Integer> excludedLevels = new TreeSet<>();
        SortedSet<Integer> includedLevels = new TreeSet<>();
        for (Rule rule : group) {
            (rule.isExcluded() ? excludedLevels : includedLevels).addAll(rule.facilityLevels());
        }
        excludedLevels.retainAll(includedLevels);

        List<Contradiction> findings = new ArrayList<>();
        for (int level : excludedLevels) {
            Rule excluded = firstAt(group, level, true);
            Rule included = firstAt(group, level, false);
            String details = String.format("Level %d excluded (p.%d) but included (p.%d)",
                    level, excluded.sourcePage(), included.sourcePage());
            findings.add(Contradiction.flagged(type(), serviceKey, "level_" + level, details, excluded, included,
                    severityPolicy.severity(SeverityPolicy.TOTAL_DISAGREEMENT, serviceKey, excluded.category()),
                    group.size(), weakestAgreement(group)));
        }
        return findings;
    }

    private static Rule firstAt(List<Rule> group, int level, boolean excluded) {
        return group.stream()
                .filter(r -> r.isExcluded() == excluded && r.facilityLevels().contains(level))
                .findFirst()
                .orElseThrow();
    }
}
