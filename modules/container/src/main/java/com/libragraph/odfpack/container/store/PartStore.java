package com.libragraph.odfpack.container.store;

import com.libragraph.odfpack.types.PartState;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory map from part path to {@link PartEntry}, in insertion order.
 *
 * <p>Not thread-safe. Paths are stored as given; callers normalize them.
 */
public final class PartStore {

    private final Map<String, PartEntry> entries = new LinkedHashMap<>();

    public PartState state(String path) {
        PartEntry entry = entries.get(path);
        return entry == null ? PartState.ABSENT : entry.state();
    }

    public Optional<PartEntry> get(String path) {
        return Optional.ofNullable(entries.get(path));
    }

    public boolean contains(String path) {
        return entries.containsKey(path);
    }

    public void put(String path, PartEntry entry) {
        entries.put(path, entry);
    }

    public void markDeleted(String path) {
        entries.put(path, PartEntry.deleted());
    }

    /** Forgets a path entirely, making it absent again. */
    public void forget(String path) {
        entries.remove(path);
    }

    /** Live, unmodifiable view of the tracked paths, deleted ones included. */
    public Set<String> paths() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    /** Live, unmodifiable view of all entries. */
    public Map<String, PartEntry> entries() {
        return Collections.unmodifiableMap(entries);
    }

    public int size() {
        return entries.size();
    }

    /** Deep copy: every entry's bytes are duplicated. */
    public PartStore copy() {
        PartStore copy = new PartStore();
        entries.forEach((path, entry) -> copy.entries.put(path, entry.copy()));
        return copy;
    }
}
