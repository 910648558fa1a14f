package com.fightstats.domain.model;

import java.util.Collection;
import java.util.Set;

/**
 * Primary ids already present in a dataset, loaded once before the phase that writes to it.
 */
public final class PersistedIds {

    private static final PersistedIds EMPTY = new PersistedIds(Set.of());

    private final Set<String> ids;

    private PersistedIds(Set<String> ids) {
        this.ids = ids;
    }

    public static PersistedIds of(Collection<String> ids) {
        return new PersistedIds(Set.copyOf(ids));
    }

    public static PersistedIds empty() {
        return EMPTY;
    }

    public boolean alreadyHas(String id) {
        return id != null && ids.contains(id);
    }

    public int size() {
        return ids.size();
    }

    public Set<String> asSet() {
        return ids;
    }
}
