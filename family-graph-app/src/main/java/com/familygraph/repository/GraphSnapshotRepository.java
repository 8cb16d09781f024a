package com.familygraph.repository;

import com.familygraph.model.GraphSnapshot;

import java.util.Optional;

/**
 * Where a graph's full {people, relationships} snapshot is kept between runs.
 */
public interface GraphSnapshotRepository {

    /** The last saved snapshot, or empty when nothing has been saved yet. */
    Optional<GraphSnapshot> load();

    /** Replaces the stored snapshot. Failures surface as runtime exceptions. */
    void save(GraphSnapshot snapshot);
}
