package com.libragraph.odfpack.container.store;

import com.libragraph.odfpack.types.PartState;

import java.util.Objects;

/**
 * One tracked part: its state, its bytes when it has any, and the on-disk
 * modification time (whole seconds) the bytes were read at.
 *
 * <p>{@link PartState#ABSENT} is never stored; an untracked path is absent.
 */
public record PartEntry(PartState state, byte[] data, long timestamp) {

    /** Timestamp of entries that were not read from a folder. */
    public static final long NO_TIMESTAMP = -1;

    private static final PartEntry DELETED = new PartEntry(PartState.DELETED, null, NO_TIMESTAMP);

    public PartEntry {
        Objects.requireNonNull(state, "Part state cannot be null");
        if (state == PartState.ABSENT) {
            throw new IllegalArgumentException("Absent parts are not stored");
        }
        if (state.hasBytes() != (data != null)) {
            throw new IllegalArgumentException("Part in state " + state + (data == null ? " needs" : " cannot have") + " data");
        }
    }

    /** Bytes fetched from a backend. */
    public static PartEntry loaded(byte[] data, long timestamp) {
        return new PartEntry(PartState.LOADED, data, timestamp);
    }

    /** Bytes set in memory; they win over whatever the backend holds. */
    public static PartEntry assigned(byte[] data) {
        return new PartEntry(PartState.ASSIGNED, data, NO_TIMESTAMP);
    }

    /** Bytes made up by the container itself, stamped with the time they were made. */
    public static PartEntry synthesized(byte[] data, long timestamp) {
        return new PartEntry(PartState.ASSIGNED, data, timestamp);
    }

    public static PartEntry deleted() {
        return DELETED;
    }

    public boolean isDeleted() {
        return state == PartState.DELETED;
    }

    public boolean hasTimestamp() {
        return timestamp != NO_TIMESTAMP;
    }

    /** Structural copy; the byte array is duplicated. */
    public PartEntry copy() {
        return data == null ? this : new PartEntry(state, data.clone(), timestamp);
    }
}
