package com.eainde.policyaudit.detect;

import com.eainde.policyaudit.key.ServiceKeyResolver;
import com.eainde.policyaudit.model.Contradiction;
import com.eainde.policyaudit.model.ContradictionType;
import com.eainde.policyaudit.model.EvidenceIntegrityException;
import com.eainde.policyaudit.model.Rule;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Base class for the four detectors: group rules by a detector-specific key, then compare
 * within each group.
 *
 * <p>Groups are visited in the order of their key's {@code toString()}, so output order is
 * stable across runs. A group whose candidate finding cannot cite evidence on both sides is
 * skipped with a warning; no placeholder finding is ever emitted. Rules whose key names no
 * service are left out, since sharing that key says nothing about sharing a service.</p>
 *
 * @param <K> group key type
 */
@Slf4j
public abstract class AbstractContradictionDetector<K> {

    /** Page order, then snippet text. */
    protected static final Comparator<Rule> BY_PAGE = Comparator.comparingInt(Rule::sourcePage)
            .thenComparing(Rule::evidenceSnippet);

    protected final SeverityPolicy severityPolicy;

    protected AbstractContradictionDetector(SeverityPolicy severityPolicy) {
        this.severityPolicy = severityPolicy;
    }

    // -------------------------------------------------------------------------
    // Template
    // -------------------------------------------------------------------------

    public final List<Contradiction> detect(List<Rule> rules) {
        Map<K, List<Rule>> groups = new TreeMap<>(Comparator.comparing(Object::toString));
        int unresolved = 0;
        for (Rule rule : rules) {
            if (rule.serviceKey() == null || rule.serviceKey().isBlank()) {
                continue;
            }
            if (ServiceKeyResolver.isUnresolved(rule.serviceKey())) {
                unresolved++;
                continue;
            }
            for (K key : groupKeys(rule)) {
                groups.computeIfAbsent(key, k -> new ArrayList<>()).add(rule);
            }
        }

        List<Contradiction> findings = new ArrayList<>();
        groups.forEach((key, group) -> {
            if (group.size() < 2) {
                return;
            }
            group.sort(BY_PAGE);
            try {
                findings.addAll(compare(key, group));
            } catch (EvidenceIntegrityException e) {
                log.warn("{} skipped group {}: {}", type(), key, e.getMessage());
            }
        });
        log.debug("{} detector: {} groups, {} findings, {} rules without a service", type(), groups.size(),
                findings.size(), unresolved);
        return findings;
    }

    // -------------------------------------------------------------------------
    // Subclass contract
    // -------------------------------------------------------------------------

    public abstract ContradictionType type();

    /** Keys the rule belongs to; empty when the rule has nothing this detector can compare. */
    protected abstract List<K> groupKeys(Rule rule);

    /**
     * @param key   group key
     * @param group at least two rules, sorted by page
     */
    protected abstract List<Contradiction> compare(K key, List<Rule> group);

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    /** Weakest collaborator agreement of the group, null when no rule was reviewed. */
    protected static Double weakestAgreement(List<Rule> group) {
        return group.stream()
                .map(Rule::collaboratorAgreement)
                .filter(Objects::nonNull)
                .min(Double::compare)
                .orElse(null);
    }

    /** Returns the two rules in page order as {left, right}. */
    protected static List<Rule> inPageOrder(Rule a, Rule b) {
        return BY_PAGE.compare(a, b) <= 0 ? List.of(a, b) : List.of(b, a);
    }
}
