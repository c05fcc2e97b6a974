package com.eainde.policyaudit.detect;

import com.eainde.policyaudit.model.Contradiction;
import com.eainde.policyaudit.model.ContradictionType;
import com.eainde.policyaudit.model.Rule;
import com.eainde.policyaudit.model.TariffUnit;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.List;

/**
 * Flags a service whose tariff for the same billing unit varies by more than the configured
 * spread. Rules with an unspecified unit are never compared, and different units never share
 * a group, so "per session" against "per day" is not a contradiction.
 */
public class TariffContradictionDetector extends AbstractContradictionDetector<TariffContradictionDetector.TariffGroup> {

    record TariffGroup(String serviceKey, TariffUnit unit) {
    }

    private final double varianceThreshold;

    public TariffContradictionDetector(SeverityPolicy severityPolicy, double varianceThreshold) {
        super(severityPolicy);
        this.varianceThreshold = varianceThreshold;
    }

    @Override
    public ContradictionType type() {
        return ContradictionType.TARIFF;
    }

    @Override
    protected List<TariffGroup> groupKeys(Rule rule) {
        if (!rule.hasTariff() || !rule.tariffUnit().isSpecified()) {
            return List.of();
        }
        return List.of(new TariffGroup(rule.serviceKey(), rule.tariffUnit()));
    }

    @Override
    protected List<Contradiction> compare(TariffGroup key, List<Rule> group) {
        // group is page ordered, so min/max pick the earliest page among equal values
        Rule cheapest = group.stream().min(Comparator.comparing(Rule::tariffValue)).orElseThrow();
        Rule dearest = group.stream().max(Comparator.comparing(Rule::tariffValue)
                .thenComparing(Rule::sourcePage, Comparator.reverseOrder())).orElseThrow();
        BigDecimal min = cheapest.tariffValue();
        BigDecimal max = dearest.tariffValue();
        if (min.compareTo(max) == 0) {
            return List.of();
        }
        double variance = min.signum() <= 0
                ? Double.POSITIVE_INFINITY
                : max.subtract(min).divide(min, 6, RoundingMode.HALF_UP).doubleValue();
        if (variance <= varianceThreshold) {
            return List.of();
        }

        List<Rule> sides = inPageOrder(cheapest, dearest);
        Rule left = sides.get(0);
        Rule right = sides.get(1);
        String details = String.format("KES %s vs KES %s %s (variance %s)",
                left.tariffValue().toPlainString(), right.tariffValue().toPlainString(), key.unit().label(),
                Double.isInfinite(variance) ? "unbounded" : Math.round(variance * 100) + "%");
        return List.of(Contradiction.flagged(type(), key.serviceKey(), key.unit().label(), details, left, right,
                severityPolicy.severity(variance, key.serviceKey(), left.category()),
                group.size(), weakestAgreement(group)));
    }
}
