package io.eventrelay.offset;

import java.util.OptionalLong;

/** Committed read positions of durable pollers, keyed by type, namespace and name. */
public interface OffsetStore {
    OptionalLong fetch(OffsetType type, String namespace, String name);
    void commit(OffsetType type, String namespace, String name, long offset);
}
