package com.familygraph.graph;

/**
 * The in-memory mutation committed but writing the snapshot to storage failed.
 * The graph is not rolled back; {@link #getCommitted()} holds what the mutation returned.
 */
public class SnapshotPersistenceException extends FamilyGraphException {

    private final transient Object committed;
    private final long version;

    public SnapshotPersistenceException(long version, Object committed, Throwable cause) {
        super("Committed version " + version + " in memory but could not persist it: " + cause.getMessage(), cause);
        this.version = version;
        this.committed = committed;
    }

    public Object getCommitted() {
        return committed;
    }

    public long getVersion() {
        return version;
    }
}
