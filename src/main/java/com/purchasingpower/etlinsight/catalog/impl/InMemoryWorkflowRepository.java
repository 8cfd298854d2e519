package com.purchasingpower.etlinsight.catalog.impl;

import com.purchasingpower.etlinsight.catalog.CatalogSnapshot;
import com.purchasingpower.etlinsight.catalog.WorkflowRepository;
import com.purchasingpower.etlinsight.core.WorkflowRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Snapshot-swapping in-memory implementation of WorkflowRepository.
 *
 * <p>Every write derives a new {@link CatalogSnapshot} from the current one and
 * publishes it with a compare-and-set, so concurrent readers never observe a
 * partially replaced set.
 *
 * @since 1.0.0
 */
@Slf4j
@Repository
public class InMemoryWorkflowRepository implements WorkflowRepository {

    private final AtomicReference<CatalogSnapshot> current = new AtomicReference<>(CatalogSnapshot.empty());

    @Override
    public void replace(String setId, List<WorkflowRecord> records) {
        CatalogSnapshot published = current.updateAndGet(snapshot -> snapshot.withSet(setId, records));
        log.info("Replaced set {} with {} workflows (catalog now {} workflows in {} sets)",
            setId, records.size(), published.recordCount(), published.setCount());
    }

    @Override
    public void replaceAll(Map<String, List<WorkflowRecord>> recordsBySet) {
        CatalogSnapshot next = CatalogSnapshot.of(recordsBySet);
        current.set(next);
        log.info("Replaced catalog: {} workflows in {} sets", next.recordCount(), next.setCount());
    }

    @Override
    public boolean exists(String setId, String name) {
        return current.get().exists(setId, name);
    }

    @Override
    public Optional<WorkflowRecord> lookup(String setId, String name) {
        return current.get().lookup(setId, name);
    }

    @Override
    public List<WorkflowRecord> findByNameIgnoreCase(String name) {
        if (name == null) {
            return List.of();
        }
        String wanted = name.trim();
        return current.get().records().stream()
            .filter(r -> r.getName().equalsIgnoreCase(wanted))
            .toList();
    }

    @Override
    public List<String> allSets() {
        return current.get().setIds();
    }

    @Override
    public List<WorkflowRecord> allRecords() {
        return current.get().records();
    }

    @Override
    public int recordCount() {
        return current.get().recordCount();
    }

    @Override
    public CatalogSnapshot snapshot() {
        return current.get();
    }

    @Override
    public void clear() {
        current.set(CatalogSnapshot.empty());
        log.info("Workflow catalog cleared");
    }
}
