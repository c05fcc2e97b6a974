package com.eainde.policyaudit.collaborator;

import com.eainde.policyaudit.model.Rule;
import com.eainde.policyaudit.thread.MdcAwareExecutor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Sends page chunks to the {@link ReasoningCollaborator} with bounded parallelism.
 *
 * <h3>Execution:</h3>
 * <pre>
 * chunks:  [p1] [p2] [p3] [p4] [p5]     maxConcurrentCalls = 3
 * permits: p1 p2 p3 start at once; p4 starts when any of them finishes or times out
 * timeout: callTimeout per call, counted from the moment that call starts running
 * </pre>
 *
 * <p>A chunk whose call fails or overruns its timeout keeps its rules unreviewed (agreement
 * stays null). A timed-out call is interrupted and its permit handed on at once; if the call
 * ignores the interrupt its worker is abandoned, never waited for, so other chunks are
 * unaffected. The output has the same rules in the same order as the input; only
 * {@code collaboratorAgreement} is filled in.</p>
 */
@Slf4j
public class ChunkReviewExecutor {

    public static final int DEFAULT_MAX_CONCURRENT_CALLS = 3;
    public static final Duration DEFAULT_CALL_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_RULES_PER_CHUNK = 25;

    private final ReasoningCollaborator collaborator;
    private final MdcAwareExecutor executor;
    private final int maxConcurrentCalls;
    private final Duration callTimeout;
    private final int maxRulesPerChunk;

    /** One dispatched chunk: the result the caller waits on and the worker task behind it. */
    private record PendingCall(RuleChunk chunk, CompletableFuture<ChunkReview> result, Future<?> task) {

        void abandon() {
            result.cancel(false);
            task.cancel(true);
        }
    }

    public ChunkReviewExecutor(ReasoningCollaborator collaborator, MdcAwareExecutor executor,
                               int maxConcurrentCalls, Duration callTimeout, int maxRulesPerChunk) {
        if (maxConcurrentCalls < 1) {
            throw new IllegalArgumentException("maxConcurrentCalls must be >= 1");
        }
        if (callTimeout == null || callTimeout.isNegative() || callTimeout.isZero()) {
            throw new IllegalArgumentException("callTimeout must be positive");
        }
        this.collaborator = collaborator;
        this.executor = executor;
        this.maxConcurrentCalls = maxConcurrentCalls;
        this.callTimeout = callTimeout;
        this.maxRulesPerChunk = maxRulesPerChunk;
    }

    public ChunkReviewExecutor(ReasoningCollaborator collaborator, MdcAwareExecutor executor) {
        this(collaborator, executor, DEFAULT_MAX_CONCURRENT_CALLS, DEFAULT_CALL_TIMEOUT, DEFAULT_MAX_RULES_PER_CHUNK);
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    public List<Rule> review(List<Rule> rules) {
        List<RuleChunk> chunks = RuleChunk.byPage(rules, maxRulesPerChunk);
        List<Rule> reviewed = new ArrayList<>(rules);
        Semaphore permits = new Semaphore(maxConcurrentCalls);
        List<PendingCall> calls = new ArrayList<>(chunks.size());

        // ── Dispatch, at most maxConcurrentCalls in flight ─────────────
        try {
            for (RuleChunk chunk : chunks) {
                permits.acquire();
                calls.add(start(chunk, permits));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Chunk review interrupted after dispatching {} of {} chunks", calls.size(), chunks.size());
        }

        // ── Collect ────────────────────────────────────────────────────
        int succeeded = 0;
        for (int i = 0; i < calls.size(); i++) {
            PendingCall call = calls.get(i);
            if (Thread.currentThread().isInterrupted()) {
                calls.subList(i, calls.size()).forEach(PendingCall::abandon);
                break;
            }
            ChunkReview result = await(call);
            if (result != null) {
                apply(call.chunk(), result, reviewed);
                succeeded++;
            }
        }

        log.info("Collaborator reviewed {}/{} chunks ({} rules)", succeeded, chunks.size(), rules.size());
        return reviewed;
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    /**
     * Submits one chunk. The timeout is armed inside the worker, so time spent before the
     * call actually runs never counts against it. Completion in any form returns the permit.
     */
    private PendingCall start(RuleChunk chunk, Semaphore permits) {
        CompletableFuture<ChunkReview> result = new CompletableFuture<>();
        Future<?> task;
        try {
            task = executor.submit(() -> {
                result.orTimeout(callTimeout.toNanos(), TimeUnit.NANOSECONDS);
                try {
                    result.complete(collaborator.reviewChunk(chunk));
                } catch (RuntimeException e) {
                    result.completeExceptionally(e);
                }
                return null;
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(e);
            task = CompletableFuture.completedFuture(null);
        }
        Future<?> worker = task;
        result.whenComplete((review, error) -> {
            permits.release();
            if (error instanceof TimeoutException) {
                worker.cancel(true);
            }
        });
        return new PendingCall(chunk, result, worker);
    }

    /** The chunk's review, or null where the chunk falls back. */
    private ChunkReview await(PendingCall call) {
        RuleChunk chunk = call.chunk();
        try {
            return call.result().get();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof TimeoutException) {
                log.warn("Chunk {} (p.{}) timed out after {}; keeping deterministic confidence",
                        chunk.chunkIndex(), chunk.page(), callTimeout);
            } else {
                log.warn("Chunk {} (p.{}) review failed: {}; keeping deterministic confidence",
                        chunk.chunkIndex(), chunk.page(), e.getCause().getMessage());
            }
            return null;
        } catch (CancellationException e) {
            log.debug("Chunk {} (p.{}) abandoned", chunk.chunkIndex(), chunk.page());
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.abandon();
            return null;
        }
    }

    private static void apply(RuleChunk chunk, ChunkReview review, List<Rule> reviewed) {
        for (int pos = 0; pos < chunk.size(); pos++) {
            OptionalDouble agreement = review.agreementFor(pos);
            if (agreement.isPresent()) {
                int index = chunk.ruleIndexes().get(pos);
                reviewed.set(index, reviewed.get(index).withCollaboratorAgreement(agreement.getAsDouble()));
            }
        }
    }
}
