package com.purchasingpower.etlinsight.search.impl;

import com.purchasingpower.etlinsight.configuration.SearchProperties;
import com.purchasingpower.etlinsight.core.SearchCandidate;
import com.purchasingpower.etlinsight.knowledge.IndexScope;
import com.purchasingpower.etlinsight.knowledge.SemanticIndex;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs semantic index queries under a timeout and turns every failure into an
 * explicit "unavailable" answer for that call.
 *
 * <p>No lock is held while waiting; a timed-out call is cancelled and its result,
 * if it ever arrives, is discarded.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class GuardedSemanticIndex {

    private final SemanticIndex index;
    private final Executor executor;
    private final SearchProperties properties;
    private final AtomicLong unavailableCount = new AtomicLong();

    public GuardedSemanticIndex(SemanticIndex index,
                                @Qualifier("semanticIndexExecutor") Executor executor,
                                SearchProperties properties) {
        this.index = index;
        this.executor = executor;
        this.properties = properties;
    }

    public IndexAnswer query(String text, int topK, IndexScope scope) {
        CompletableFuture<List<SearchCandidate>> future;
        try {
            future = CompletableFuture.supplyAsync(() -> index.query(text, topK, scope), executor);
        } catch (RuntimeException e) {
            return unavailable(text, "executor rejected the call: " + e.getMessage());
        }

        try {
            List<SearchCandidate> candidates = future.get(properties.getIndexTimeoutMs(), TimeUnit.MILLISECONDS);
            return IndexAnswer.of(candidates != null ? candidates : List.of());

        } catch (TimeoutException e) {
            future.cancel(true);
            return unavailable(text, "timed out after " + properties.getIndexTimeoutMs() + "ms");

        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return unavailable(text, cause.getMessage());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return unavailable(text, "interrupted");
        }
    }

    /**
     * Index calls that failed or timed out since startup.
     */
    public long getUnavailableCount() {
        return unavailableCount.get();
    }

    private IndexAnswer unavailable(String text, String reason) {
        unavailableCount.incrementAndGet();
        log.warn("Semantic index unavailable for '{}': {}", text, reason);
        return IndexAnswer.unavailable(reason);
    }

    /**
     * Candidates from the index, or the reason it could not answer.
     */
    public record IndexAnswer(boolean available, List<SearchCandidate> candidates, String failure) {

        static IndexAnswer of(List<SearchCandidate> candidates) {
            return new IndexAnswer(true, candidates, null);
        }

        static IndexAnswer unavailable(String failure) {
            return new IndexAnswer(false, List.of(), failure);
        }
    }
}
