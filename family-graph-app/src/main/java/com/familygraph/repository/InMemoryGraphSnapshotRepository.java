package com.familygraph.repository;

import com.familygraph.model.GraphSnapshot;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps the latest snapshot in memory. Used when durable storage is switched off.
 */
public class InMemoryGraphSnapshotRepository implements GraphSnapshotRepository {

    private final AtomicReference<GraphSnapshot> latest = new AtomicReference<>();

    @Override
    public Optional<GraphSnapshot> load() {
        return Optional.ofNullable(latest.get());
    }

    @Override
    public void save(GraphSnapshot snapshot) {
        latest.set(snapshot);
    }
}
