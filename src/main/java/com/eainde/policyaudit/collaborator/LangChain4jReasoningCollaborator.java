package com.eainde.policyaudit.collaborator;

import com.eainde.policyaudit.model.Rule;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link ReasoningCollaborator} backed by a langchain4j {@link PolicyReasoningAgent}.
 *
 * <h3>Boundary:</h3>
 * <ul>
 *   <li>Input: rules and findings serialized to compact JSON</li>
 *   <li>Output: JSON text, stripped of markdown fences and parsed with Jackson</li>
 *   <li>Anything unparseable or out of range becomes a {@link CollaboratorException}</li>
 *   <li>Answers that parsed are kept in the {@link CollaboratorAnswerCache} and replayed on re-runs</li>
 * </ul>
 */
@Slf4j
public class LangChain4jReasoningCollaborator implements ReasoningCollaborator {

    static final String REVIEW_TAG = "review";
    static final String GROUPING_TAG = "group";

    private final PolicyReasoningAgent agent;
    private final ObjectMapper objectMapper;
    private final CollaboratorAnswerCache cache;

    public LangChain4jReasoningCollaborator(PolicyReasoningAgent agent, ObjectMapper objectMapper,
                                            CollaboratorAnswerCache cache) {
        this.agent = agent;
        this.objectMapper = objectMapper;
        this.cache = cache;
    }

    public LangChain4jReasoningCollaborator(PolicyReasoningAgent agent, ObjectMapper objectMapper) {
        this(agent, objectMapper, CollaboratorAnswerCache.disabled());
    }

    // =========================================================================
    //  Chunk review
    // =========================================================================

    @Override
    public ChunkReview reviewChunk(RuleChunk chunk) {
        String rulesJson = rulesJson(chunk);
        String prompt = chunk.page() + "\0" + rulesJson;
        Optional<ChunkReview> cached = cache.get(REVIEW_TAG, prompt).flatMap(answer -> replay(chunk, answer));
        if (cached.isPresent()) {
            return cached.get();
        }

        String answer;
        try {
            answer = agent.reviewRules(chunk.page(), rulesJson);
        } catch (RuntimeException e) {
            throw new CollaboratorException("Review of chunk " + chunk.chunkIndex() + " failed", e);
        }
        ChunkReview review = parseReview(chunk, answer);
        cache.put(REVIEW_TAG, prompt, answer);
        return review;
    }

    private Optional<ChunkReview> replay(RuleChunk chunk, String answer) {
        try {
            return Optional.of(parseReview(chunk, answer));
        } catch (CollaboratorException e) {
            log.warn("Ignoring unreadable cached review for chunk {}: {}", chunk.chunkIndex(), e.getMessage());
            return Optional.empty();
        }
    }

    ChunkReview parseReview(RuleChunk chunk, String answer) {
        JsonNode reviews = readTree(answer).path("reviews");
        if (!reviews.isArray()) {
            throw new CollaboratorException("Review of chunk " + chunk.chunkIndex() + " has no 'reviews' array");
        }
        Map<Integer, Double> agreement = new HashMap<>();
        for (JsonNode review : reviews) {
            JsonNode index = review.get("index");
            JsonNode score = review.get("agreement");
            if (index == null || !index.canConvertToInt() || score == null || !score.isNumber()) {
                log.debug("Skipping malformed review entry {}", review);
                continue;
            }
            int i = index.asInt();
            if (i < 0 || i >= chunk.size()) {
                log.debug("Skipping review for unknown index {} in chunk {}", i, chunk.chunkIndex());
                continue;
            }
            agreement.put(i, Math.max(0.0, Math.min(1.0, score.asDouble())));
        }
        return new ChunkReview(chunk.chunkIndex(), agreement);
    }

    private String rulesJson(RuleChunk chunk) {
        ArrayNode array = objectMapper.createArrayNode();
        for (int i = 0; i < chunk.size(); i++) {
            Rule rule = chunk.rules().get(i);
            ObjectNode node = array.addObject();
            node.put("index", i);
            node.put("service", rule.serviceDescription());
            if (rule.hasTariff()) {
                node.put("tariff_value", rule.tariffValue());
                node.put("tariff_unit", rule.tariffUnit().label());
            }
            node.put("coverage_status", rule.coverageStatus().name());
            node.set("facility_levels", objectMapper.valueToTree(rule.facilityLevels()));
            node.set("limits", objectMapper.valueToTree(rule.limits()));
            node.put("snippet", rule.evidenceSnippet());
        }
        return write(array);
    }

    // =========================================================================
    //  Duplicate grouping
    // =========================================================================

    @Override
    public List<DuplicateGroup> groupDuplicates(List<DuplicateCandidate> candidates) {
        if (candidates.size() < 2) {
            return List.of();
        }
        ArrayNode array = objectMapper.createArrayNode();
        for (DuplicateCandidate candidate : candidates) {
            array.addObject()
                    .put("id", candidate.id())
                    .put("description", candidate.description());
        }
        String prompt = write(array);
        Optional<String> cached = cache.get(GROUPING_TAG, prompt);
        if (cached.isPresent()) {
            try {
                return parseGroups(cached.get());
            } catch (CollaboratorException e) {
                log.warn("Ignoring unreadable cached duplicate grouping: {}", e.getMessage());
            }
        }

        String answer;
        try {
            answer = agent.groupDuplicates(prompt);
        } catch (RuntimeException e) {
            throw new CollaboratorException("Duplicate grouping failed", e);
        }
        List<DuplicateGroup> groups = parseGroups(answer);
        cache.put(GROUPING_TAG, prompt, answer);
        return groups;
    }

    private List<DuplicateGroup> parseGroups(String answer) {
        JsonNode groups = readTree(answer).path("groups");
        if (!groups.isArray()) {
            throw new CollaboratorException("Duplicate grouping answer has no 'groups' array");
        }
        try {
            return objectMapper.convertValue(groups, new TypeReference<List<DuplicateGroup>>() {});
        } catch (IllegalArgumentException e) {
            throw new CollaboratorException("Unreadable duplicate groups", e);
        }
    }

    // =========================================================================
    //  JSON helpers
    // =========================================================================

    private JsonNode readTree(String answer) {
        if (answer == null || answer.isBlank()) {
            throw new CollaboratorException("Collaborator returned an empty answer");
        }
        try {
            return objectMapper.readTree(cleanJson(answer));
        } catch (JsonProcessingException e) {
            throw new CollaboratorException("Collaborator answer is not valid JSON", e);
        }
    }

    private String write(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new CollaboratorException("Could not serialize collaborator input", e);
        }
    }

    /** Removes markdown code fences the model sometimes wraps around its JSON. */
    static String cleanJson(String json) {
        return json.replace("```json", "").replace("```", "").trim();
    }
}
