package com.lookup.matching.store;

import com.lookup.matching.core.model.DatasetMetadata;
import com.lookup.matching.core.model.ReferenceDataset;
import com.lookup.matching.core.model.ReferenceRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link ReferenceDatasetStore}.
 * Safe for concurrent use; datasets themselves are immutable.
 */
public class InMemoryReferenceDatasetStore implements ReferenceDatasetStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryReferenceDatasetStore.class);

    private final ConcurrentMap<String, ReferenceDataset> datasets = new ConcurrentHashMap<>();
    private final List<DatasetChangeListener> listeners = new CopyOnWriteArrayList<>();

    @Override
    public List<ReferenceRow> getRows(String datasetId) {
        ReferenceDataset dataset = get(datasetId);
        return dataset != null ? dataset.getRows() : null;
    }

    @Override
    public DatasetMetadata getMetadata(String datasetId) {
        ReferenceDataset dataset = get(datasetId);
        return dataset != null ? dataset.metadata() : null;
    }

    @Override
    public ReferenceDataset get(String datasetId) {
        return datasetId == null ? null : datasets.get(datasetId);
    }

    @Override
    public ReferenceDataset save(ReferenceDataset dataset) {
        Objects.requireNonNull(dataset, "dataset is required");
        ReferenceDataset previous = datasets.put(dataset.getId(), dataset);
        log.debug("Saved reference dataset {} ({} rows, {} columns, replaced={})",
                dataset.getId(), dataset.size(), dataset.getColumns().size(), previous != null);
        notifyChanged(dataset.getId());
        return dataset;
    }

    @Override
    public boolean delete(String datasetId) {
        if (datasetId == null || datasets.remove(datasetId) == null) {
            return false;
        }
        log.debug("Deleted reference dataset {}", datasetId);
        notifyChanged(datasetId);
        return true;
    }

    @Override
    public boolean exists(String datasetId) {
        return datasetId != null && datasets.containsKey(datasetId);
    }

    @Override
    public List<DatasetMetadata> list() {
        List<DatasetMetadata> result = new ArrayList<>();
        for (ReferenceDataset dataset : datasets.values()) {
            result.add(dataset.metadata());
        }
        result.sort(Comparator.comparing(DatasetMetadata::datasetId));
        return result;
    }

    @Override
    public void clear() {
        List<String> ids = new ArrayList<>(datasets.keySet());
        datasets.clear();
        ids.forEach(this::notifyChanged);
        log.debug("Cleared {} reference datasets", ids.size());
    }

    @Override
    public void addChangeListener(DatasetChangeListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener is required"));
    }

    private void notifyChanged(String datasetId) {
        for (DatasetChangeListener listener : listeners) {
            try {
                listener.onDatasetChanged(datasetId);
            } catch (RuntimeException e) {
                log.warn("Dataset change listener failed for {}: {}", datasetId, e.getMessage());
            }
        }
    }
}
