package com.eainde.policyaudit.collaborator;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Descriptions the collaborator considers the same finding.
 *
 * @param masterId        id that represents the group
 * @param mergedIds       all ids in the group, master included
 * @param bestDescription clearest wording of the finding
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DuplicateGroup(
        @JsonProperty("master_id")        String masterId,
        @JsonProperty("merged_ids")       List<String> mergedIds,
        @JsonProperty("best_description") String bestDescription
) {

    public DuplicateGroup {
        mergedIds = mergedIds == null ? List.of() : List.copyOf(mergedIds);
    }

    public boolean contains(String id) {
        return id.equals(masterId) || mergedIds.contains(id);
    }
}
