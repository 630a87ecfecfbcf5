package com.libragraph.odfpack.types;

/**
 * Lifecycle state of one part inside a container's part store.
 */
public enum PartState {
    /** Never fetched from the backend, or unknown to the container. */
    ABSENT,
    /** Bytes read from the backend and cached. */
    LOADED,
    /** Bytes set explicitly in memory; never revalidated against the backend. */
    ASSIGNED,
    /** Explicitly removed; reads must fail. */
    DELETED;

    public boolean hasBytes() {
        return this == LOADED || this == ASSIGNED;
    }
}
