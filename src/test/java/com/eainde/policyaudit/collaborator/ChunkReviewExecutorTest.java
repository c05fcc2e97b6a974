package com.eainde.policyaudit.collaborator;

import com.eainde.policyaudit.model.Rule;
import com.eainde.policyaudit.thread.MdcAwareExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkReviewExecutorTest {

    private final MdcAwareExecutor executor = new MdcAwareExecutor(3, "review-test");
    private final CountDownLatch never = new CountDownLatch(1);

    @AfterEach
    void tearDown() {
        never.countDown();
        executor.close();
    }

    private static Rule rule(String description, int page) {
        return Rule.of(description).serviceKey("other:" + description.toLowerCase()).sourcePage(page).build();
    }

    /** Collaborator whose chunk reviews come from {@code reviewer}; grouping is unused here. */
    private static ReasoningCollaborator reviewing(Function<RuleChunk, ChunkReview> reviewer) {
        return new ReasoningCollaborator() {
            @Override
            public ChunkReview reviewChunk(RuleChunk chunk) {
                return reviewer.apply(chunk);
            }

            @Override
            public List<DuplicateGroup> groupDuplicates(List<DuplicateCandidate> candidates) {
                return List.of();
            }
        };
    }

    private static ChunkReview agreeAll(RuleChunk chunk, double score) {
        Map<Integer, Double> agreement = new HashMap<>();
        for (int i = 0; i < chunk.size(); i++) {
            agreement.put(i, score);
        }
        return new ChunkReview(chunk.chunkIndex(), agreement);
    }

    @Test
    @DisplayName("every reviewed rule gets its agreement; order is preserved")
    void reviewsAll() {
        List<Rule> rules = List.of(rule("Dialysis", 2), rule("Scan", 1), rule("Physio", 2));
        ChunkReviewExecutor review = new ChunkReviewExecutor(
                reviewing(chunk -> agreeAll(chunk, chunk.page() == 1 ? 0.4 : 0.9)), executor);

        List<Rule> reviewed = review.review(rules);

        assertThat(reviewed).extracting(Rule::serviceDescription).containsExactly("Dialysis", "Scan", "Physio");
        assertThat(reviewed).extracting(Rule::collaboratorAgreement).containsExactly(0.9, 0.4, 0.9);
    }

    @Test
    @DisplayName("a timed-out chunk falls back while the others succeed")
    void timeoutFallsBack() {
        List<Rule> rules = List.of(rule("Dialysis", 1), rule("Scan", 2), rule("Physio", 3));
        ChunkReviewExecutor review = new ChunkReviewExecutor(reviewing(chunk -> {
            if (chunk.page() == 2) {
                try {
                    never.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return agreeAll(chunk, 0.9);
        }), executor, 3, Duration.ofMillis(300), 25);

        List<Rule> reviewed = review.review(rules);

        assertThat(reviewed).extracting(Rule::collaboratorAgreement).containsExactly(0.9, null, 0.9);
    }

    @Test
    @DisplayName("a call that ignores interrupts does not hold up the next chunk")
    void stuckCallDoesNotStarveOthers() {
        List<Rule> rules = List.of(rule("Dialysis", 1), rule("Scan", 2));
        MdcAwareExecutor singleWorker = new MdcAwareExecutor(1, "stuck-test");
        ChunkReviewExecutor review = new ChunkReviewExecutor(reviewing(chunk -> {
            if (chunk.page() == 1) {
                long until = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(1_500);
                while (System.nanoTime() < until) {
                    Thread.onSpinWait();
                }
            }
            return agreeAll(chunk, 0.8);
        }), singleWorker, 1, Duration.ofMillis(500), 25);

        try {
            List<Rule> reviewed = review.review(rules);

            assertThat(reviewed).extracting(Rule::collaboratorAgreement).containsExactly(null, 0.8);
        } finally {
            singleWorker.close();
        }
    }

    @Test
    @DisplayName("time spent waiting for a free slot does not count against a call")
    void timeoutStartsWhenCallRuns() {
        List<Rule> rules = List.of(rule("A", 1), rule("B", 2), rule("C", 3));
        ChunkReviewExecutor review = new ChunkReviewExecutor(reviewing(chunk -> {
            try {
                Thread.sleep(200);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return agreeAll(chunk, 0.6);
        }), executor, 1, Duration.ofMillis(400), 25);

        List<Rule> reviewed = review.review(rules);

        assertThat(reviewed).extracting(Rule::collaboratorAgreement).containsExactly(0.6, 0.6, 0.6);
    }

    @Test
    @DisplayName("a failing chunk keeps its deterministic state")
    void failureFallsBack() {
        List<Rule> rules = List.of(rule("Dialysis", 1), rule("Scan", 2));
        ChunkReviewExecutor review = new ChunkReviewExecutor(reviewing(chunk -> {
            if (chunk.page() == 1) {
                throw new CollaboratorException("model unavailable");
            }
            return agreeAll(chunk, 0.7);
        }), executor);

        List<Rule> reviewed = review.review(rules);

        assertThat(reviewed).extracting(Rule::collaboratorAgreement).containsExactly(null, 0.7);
    }

    @Test
    @DisplayName("no more than maxConcurrentCalls chunks run at once")
    void boundedParallelism() {
        List<Rule> rules = List.of(rule("A", 1), rule("B", 2), rule("C", 3), rule("D", 4), rule("E", 5));
        Set<Integer> running = ConcurrentHashMap.newKeySet();
        int[] peak = {0};
        ChunkReviewExecutor review = new ChunkReviewExecutor(reviewing(chunk -> {
            running.add(chunk.chunkIndex());
            synchronized (peak) {
                peak[0] = Math.max(peak[0], running.size());
            }
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            running.remove(chunk.chunkIndex());
            return agreeAll(chunk, 1.0);
        }), executor, 2, Duration.ofSeconds(5), 25);

        List<Rule> reviewed = review.review(rules);

        assertThat(reviewed).allMatch(r -> r.collaboratorAgreement() == 1.0);
        assertThat(peak[0]).isLessThanOrEqualTo(2);
    }

    @Test
    @DisplayName("large pages are split into several chunks")
    void splitsLargePages() {
        List<Rule> rules = List.of(rule("A", 1), rule("B", 1), rule("C", 1), rule("D", 2));

        List<RuleChunk> chunks = RuleChunk.byPage(rules, 2);

        assertThat(chunks).extracting(RuleChunk::page).containsExactly(1, 1, 2);
        assertThat(chunks).extracting(RuleChunk::ruleIndexes)
                .containsExactly(List.of(0, 1), List.of(2), List.of(3));
    }

    @Test
    @DisplayName("invalid settings are rejected")
    void invalidSettings() {
        ReasoningCollaborator collaborator = reviewing(chunk -> agreeAll(chunk, 1.0));

        assertThatThrownBy(() -> new ChunkReviewExecutor(collaborator, executor, 0, Duration.ofSeconds(1), 25))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ChunkReviewExecutor(collaborator, executor, 3, Duration.ZERO, 25))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
