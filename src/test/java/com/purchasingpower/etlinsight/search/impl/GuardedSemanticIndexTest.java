package com.purchasingpower.etlinsight.search.impl;

import com.purchasingpower.etlinsight.configuration.SearchProperties;
import com.purchasingpower.etlinsight.core.SearchCandidate;
import com.purchasingpower.etlinsight.knowledge.IndexScope;
import com.purchasingpower.etlinsight.search.impl.GuardedSemanticIndex.IndexAnswer;
import com.purchasingpower.etlinsight.support.StubSemanticIndex;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Guarded semantic index")
class GuardedSemanticIndexTest {

    private ExecutorService executor;
    private SearchProperties properties;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        properties = new SearchProperties();
        properties.setIndexTimeoutMs(200);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Passes candidates through when the index answers in time")
    void answersInTime() {
        StubSemanticIndex index = new StubSemanticIndex()
            .answer(IndexScope.WORKFLOWS, SearchCandidate.forWorkflow("set30", "LOAD_CUSTOMERS", 0.1));
        GuardedSemanticIndex guarded = new GuardedSemanticIndex(index, executor, properties);

        IndexAnswer answer = guarded.query("customers", 10, IndexScope.WORKFLOWS);

        assertThat(answer.available()).isTrue();
        assertThat(answer.candidates()).extracting(SearchCandidate::workflowName).containsExactly("LOAD_CUSTOMERS");
        assertThat(guarded.getUnavailableCount()).isZero();
    }

    @Test
    @DisplayName("A failing index becomes an unavailable answer and is counted")
    void failureIsUnavailable() {
        GuardedSemanticIndex guarded = new GuardedSemanticIndex(new StubSemanticIndex().failing(), executor, properties);

        IndexAnswer answer = guarded.query("customers", 10, IndexScope.WORKFLOWS);

        assertThat(answer.available()).isFalse();
        assertThat(answer.candidates()).isEmpty();
        assertThat(answer.failure()).contains("Vector store unreachable");
        assertThat(guarded.getUnavailableCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("A slow index times out instead of blocking the caller")
    void slowIndexTimesOut() {
        // Given: the index takes far longer than the 200ms budget
        GuardedSemanticIndex guarded = new GuardedSemanticIndex(new StubSemanticIndex().delayed(5_000), executor, properties);

        // When
        long start = System.currentTimeMillis();
        IndexAnswer answer = guarded.query("customers", 10, IndexScope.WORKFLOWS);
        long elapsed = System.currentTimeMillis() - start;

        // Then
        assertThat(answer.available()).isFalse();
        assertThat(answer.failure()).contains("timed out");
        assertThat(elapsed).isLessThan(2_000);
        assertThat(guarded.getUnavailableCount()).isEqualTo(1);
    }
}
