package com.eainde.policyaudit.insight;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-run deduplication counts.
 *
 * @param runId          run identifier
 * @param storeMode      ephemeral or cumulative
 * @param totalFindings  findings processed in this run
 * @param newFindings    findings never seen before
 * @param recurring      findings matching a tracked entry
 * @param trackedEntries entries in the store after this run
 */
public record InsightSummary(
        @JsonProperty("run_id")          String runId,
        @JsonProperty("store_mode")      StoreMode storeMode,
        @JsonProperty("total_findings")  int totalFindings,
        @JsonProperty("new_findings")    int newFindings,
        @JsonProperty("recurring")       int recurring,
        @JsonProperty("tracked_entries") int trackedEntries
) {
}
