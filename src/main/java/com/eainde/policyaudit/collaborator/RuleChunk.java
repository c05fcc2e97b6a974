package com.eainde.policyaudit.collaborator;

import com.eainde.policyaudit.model.Rule;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Rules of one page sent to the collaborator together.
 *
 * @param chunkIndex  position of the chunk in the run
 * @param page        source page shared by the rules
 * @param ruleIndexes positions of the rules in the full rule list
 * @param rules       the rules themselves, same order as {@code ruleIndexes}
 */
public record RuleChunk(int chunkIndex, int page, List<Integer> ruleIndexes, List<Rule> rules) {

    public RuleChunk {
        ruleIndexes = List.copyOf(ruleIndexes);
        rules = List.copyOf(rules);
        if (ruleIndexes.size() != rules.size()) {
            throw new IllegalArgumentException("ruleIndexes and rules differ in size");
        }
    }

    public int size() {
        return rules.size();
    }

    /**
     * Splits rules into page chunks in page order. A page with more than {@code maxRulesPerChunk}
     * rules is split further.
     */
    public static List<RuleChunk> byPage(List<Rule> rules, int maxRulesPerChunk) {
        if (maxRulesPerChunk < 1) {
            throw new IllegalArgumentException("maxRulesPerChunk must be >= 1");
        }
        Map<Integer, List<Integer>> indexesByPage = new TreeMap<>();
        for (int i = 0; i < rules.size(); i++) {
            indexesByPage.computeIfAbsent(rules.get(i).sourcePage(), p -> new ArrayList<>()).add(i);
        }

        List<RuleChunk> chunks = new ArrayList<>();
        indexesByPage.forEach((page, indexes) -> {
            for (int from = 0; from < indexes.size(); from += maxRulesPerChunk) {
                List<Integer> slice = indexes.subList(from, Math.min(from + maxRulesPerChunk, indexes.size()));
                chunks.add(new RuleChunk(chunks.size(), page, slice, slice.stream().map(rules::get).toList()));
            }
        });
        return chunks;
    }
}
