package com.eainde.policyaudit.collaborator;

/**
 * A finding description offered for duplicate grouping.
 *
 * @param id          caller-chosen identifier echoed back in the groups
 * @param description normalized finding description
 */
public record DuplicateCandidate(String id, String description) {
}
