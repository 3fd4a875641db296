package io.flowscan.scc;

/**
 * Outcome of an incremental cache update.
 */
public enum UpdateResult {
    /**
     * The partition is unchanged; the version stays the same.
     */
    NO_CHANGE,

    /**
     * The partition changed and was repaired locally.
     */
    UPDATED,

    /**
     * The partition changed and was recomputed from the full edge list.
     */
    FULL_RECOMPUTE;

    public boolean changed() {
        return this != NO_CHANGE;
    }
}
