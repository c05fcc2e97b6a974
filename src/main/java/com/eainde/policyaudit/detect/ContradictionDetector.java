package com.eainde.policyaudit.detect;

import com.eainde.policyaudit.model.Contradiction;
import com.eainde.policyaudit.model.Rule;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the four contradiction detectors over a resolved rule set.
 *
 * <p>Detectors are independent; results are concatenated in a fixed order
 * (tariff, limit, coverage, facility exclusion).</p>
 *
 * <h3>Usage:</h3>
 * <pre>
 * ContradictionDetector detector = new ContradictionDetector(DetectionSettings.defaults());
 * List&lt;Contradiction&gt; findings = detector.detectAll(resolvedRules);
 * </pre>
 */
@Slf4j
public class ContradictionDetector {

    private final List<AbstractContradictionDetector<?>> detectors;

    public ContradictionDetector(DetectionSettings settings) {
        SeverityPolicy severityPolicy = new SeverityPolicy(settings);
        this.detectors = List.of(
                new TariffContradictionDetector(severityPolicy, settings.tariffVarianceThreshold()),
                new LimitContradictionDetector(severityPolicy),
                new CoverageContradictionDetector(severityPolicy),
                new FacilityExclusionDetector(severityPolicy));
    }

    public List<Contradiction> detectAll(List<Rule> rules) {
        List<Contradiction> all = new ArrayList<>();
        for (AbstractContradictionDetector<?> detector : detectors) {
            List<Contradiction> found = detector.detect(rules);
            log.info("{} contradictions flagged: {}", detector.type(), found.size());
            all.addAll(found);
        }
        return all;
    }
}
