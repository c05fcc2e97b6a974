package com.eainde.policyaudit.detect;

import com.eainde.policyaudit.model.Contradiction;
import com.eainde.policyaudit.model.ContradictionType;
import com.eainde.policyaudit.model.LimitType;
import com.eainde.policyaudit.model.Rule;

import java.util.Comparator;
import java.util.List;

/**
 * Flags a service that states different utilization limits for the same window, such as
 * 3 dialysis sessions per week on one page and 2 on another. The two most divergent values
 * are reported, earlier page on the left.
 */
public class LimitContradictionDetector extends AbstractContradictionDetector<LimitContradictionDetector.LimitGroup> {

    record LimitGroup(String serviceKey, LimitType limitType) {
    }

    public LimitContradictionDetector(SeverityPolicy severityPolicy) {
        super(severityPolicy);
    }

    @Override
    public ContradictionType type() {
        return ContradictionType.LIMIT;
    }

    @Override
    protected List<LimitGroup> groupKeys(Rule rule) {
        return rule.limits().keySet().stream()
                .map(type -> new LimitGroup(rule.serviceKey(), type))
                .toList();
    }

    @Override
    protected List<Contradiction> compare(LimitGroup key, List<Rule> group) {
        Comparator<Rule> byLimit = Comparator.comparing(r -> r.limits().get(key.limitType()));
        Rule lowest = group.stream().min(byLimit).orElseThrow();
        Rule highest = group.stream().max(byLimit.thenComparing(Rule::sourcePage, Comparator.reverseOrder()))
                .orElseThrow();
        int min = lowest.limits().get(key.limitType());
        int max = highest.limits().get(key.limitType());
        if (min == max) {
            return List.of();
        }

        List<Rule> sides = inPageOrder(lowest, highest);
        Rule left = sides.get(0);
        Rule right = sides.get(1);
        double spread = min <= 0 ? Double.POSITIVE_INFINITY : (double) (max - min) / min;
        String details = String.format("%d vs %d %s", left.limits().get(key.limitType()),
                right.limits().get(key.limitType()), key.limitType().label());
        return List.of(Contradiction.flagged(type(), key.serviceKey(), key.limitType().label(), details,
                left, right, severityPolicy.severity(spread, key.serviceKey(), left.category()),
                group.size(), weakestAgreement(group)));
    }
}
