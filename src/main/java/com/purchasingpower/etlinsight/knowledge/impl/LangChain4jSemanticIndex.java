package com.purchasingpower.etlinsight.knowledge.impl;

import com.google.common.collect.Lists;
import com.purchasingpower.etlinsight.core.ComponentKind;
import com.purchasingpower.etlinsight.core.SearchCandidate;
import com.purchasingpower.etlinsight.core.WorkflowRecord;
import com.purchasingpower.etlinsight.exception.SemanticIndexException;
import com.purchasingpower.etlinsight.knowledge.IndexScope;
import com.purchasingpower.etlinsight.knowledge.IndexStatus;
import com.purchasingpower.etlinsight.knowledge.SemanticIndex;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.filter.Filter;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

/**
 * LangChain4j-backed semantic index.
 *
 * <p>Each rebuild embeds every document into a fresh {@link InMemoryEmbeddingStore}
 * and only then swaps it in, so queries keep hitting the previous generation until
 * the new one is complete. Distance is reported as {@code 1 - relevance score}.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class LangChain4jSemanticIndex implements SemanticIndex {

    private final EmbeddingModel embeddingModel;
    private final WorkflowDocumentBuilder documentBuilder;
    private final int batchSize;

    private final AtomicReference<Generation> current = new AtomicReference<>();
    private volatile IndexStatus status = IndexStatus.EMPTY;

    public LangChain4jSemanticIndex(EmbeddingModel embeddingModel,
                                    WorkflowDocumentBuilder documentBuilder,
                                    @Value("${app.ollama.embed-batch-size:64}") int batchSize) {
        this.embeddingModel = embeddingModel;
        this.documentBuilder = documentBuilder;
        this.batchSize = Math.max(1, batchSize);
    }

    @Override
    public void index(List<WorkflowRecord> records) {
        long start = System.currentTimeMillis();
        int documents = 0;

        try {
            List<TextSegment> segments = documentBuilder.build(records);
            documents = segments.size();
            InMemoryEmbeddingStore<TextSegment> store = new InMemoryEmbeddingStore<>();
            for (List<TextSegment> batch : Lists.partition(segments, batchSize)) {
                List<Embedding> embeddings = embeddingModel.embedAll(batch).content();
                if (embeddings == null || embeddings.size() != batch.size()) {
                    throw new SemanticIndexException("Embedding model returned "
                        + (embeddings == null ? 0 : embeddings.size()) + " vectors for " + batch.size() + " documents");
                }
                store.addAll(embeddings, batch);
            }

            current.set(new Generation(store, segments.size()));
            status = IndexStatus.READY;
            log.info("Semantic index rebuilt: {} workflows, {} documents in {}ms",
                records.size(), segments.size(), System.currentTimeMillis() - start);

        } catch (RuntimeException e) {
            status = current.get() != null ? IndexStatus.STALE : IndexStatus.UNAVAILABLE;
            log.error("Semantic index rebuild failed ({} documents), status now {}: {}",
                documents, status, e.getMessage());
            if (e instanceof SemanticIndexException) {
                throw e;
            }
            throw new SemanticIndexException("Semantic index rebuild failed", e);
        }
    }

    @Override
    public List<SearchCandidate> query(String text, int topK, IndexScope scope) {
        Generation generation = current.get();
        if (generation == null) {
            throw new SemanticIndexException("Semantic index has not been built");
        }
        if (generation.documentCount() == 0) {
            return List.of();
        }

        Embedding queryEmbedding;
        try {
            queryEmbedding = embeddingModel.embed(text).content();
        } catch (RuntimeException e) {
            throw new SemanticIndexException("Query embedding failed for '" + text + "'", e);
        }

        EmbeddingSearchRequest request = EmbeddingSearchRequest.builder()
            .queryEmbedding(queryEmbedding)
            .maxResults(topK)
            .minScore(0.0)
            .filter(filterFor(scope))
            .build();

        List<SearchCandidate> candidates = new ArrayList<>();
        for (EmbeddingMatch<TextSegment> match : generation.store().search(request).matches()) {
            SearchCandidate candidate = toCandidate(match);
            if (candidate != null) {
                candidates.add(candidate);
            }
        }
        log.debug("Index query '{}' ({}) returned {} candidates", text, scope, candidates.size());
        return candidates;
    }

    @Override
    public void clear() {
        current.set(null);
        status = IndexStatus.EMPTY;
        log.info("Semantic index cleared");
    }

    @Override
    public IndexStatus status() {
        return status;
    }

    @Override
    public int documentCount() {
        Generation generation = current.get();
        return generation != null ? generation.documentCount() : 0;
    }

    private Filter filterFor(IndexScope scope) {
        String kind = WorkflowDocumentBuilder.DOC_KIND;
        return switch (scope) {
            case WORKFLOWS -> metadataKey(kind).isEqualTo(WorkflowDocumentBuilder.WORKFLOW_KIND);
            case SOURCE_TABLES -> metadataKey(kind).isEqualTo(ComponentKind.SOURCE_TABLE.tag());
            case TARGET_TABLES -> metadataKey(kind).isEqualTo(ComponentKind.TARGET_TABLE.tag());
            case TRANSFORMATIONS -> metadataKey(kind).isEqualTo(ComponentKind.TRANSFORMATION.tag());
            case ALL_COMPONENTS -> metadataKey(kind).isNotEqualTo(WorkflowDocumentBuilder.WORKFLOW_KIND);
        };
    }

    private SearchCandidate toCandidate(EmbeddingMatch<TextSegment> match) {
        if (match.embedded() == null) {
            return null;
        }
        Metadata metadata = match.embedded().metadata();
        String setId = metadata.getString(WorkflowDocumentBuilder.SET_ID);
        String workflowName = metadata.getString(WorkflowDocumentBuilder.WORKFLOW_NAME);
        String docKind = metadata.getString(WorkflowDocumentBuilder.DOC_KIND);
        if (setId == null || workflowName == null) {
            return null;
        }

        double score = match.score() != null ? match.score() : 0.0;
        double distance = 1.0 - score;

        if (WorkflowDocumentBuilder.WORKFLOW_KIND.equals(docKind)) {
            return SearchCandidate.forWorkflow(setId, workflowName, distance);
        }
        ComponentKind componentKind = componentKindOf(docKind);
        if (componentKind == null) {
            return null;
        }
        return SearchCandidate.forComponent(setId, workflowName,
            metadata.getString(WorkflowDocumentBuilder.COMPONENT_NAME), componentKind, distance);
    }

    private ComponentKind componentKindOf(String tag) {
        for (ComponentKind kind : ComponentKind.values()) {
            if (kind.tag().equals(tag)) {
                return kind;
            }
        }
        return null;
    }

    private record Generation(InMemoryEmbeddingStore<TextSegment> store, int documentCount) {
    }
}
