package com.eainde.policyaudit.collaborator;

import java.util.List;

/**
 * Optional reasoning service consulted during analysis.
 *
 * <p>Its output is advisory. A chunk review only yields agreement scores that feed the
 * confidence scorer; it never rewrites extracted fields, adds findings, or removes them.
 * Implementations throw {@link CollaboratorException} on any failure so callers can fall back
 * to the deterministic path.</p>
 */
public interface ReasoningCollaborator {

    /** Scores how faithfully each rule of the chunk reflects its evidence snippet. */
    ChunkReview reviewChunk(RuleChunk chunk);

    /** Groups descriptions that state the same finding in different words. */
    List<DuplicateGroup> groupDuplicates(List<DuplicateCandidate> candidates);
}
