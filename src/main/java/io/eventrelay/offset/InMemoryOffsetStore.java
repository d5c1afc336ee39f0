package io.eventrelay.offset;

import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/*
 * Process-local OffsetStore.
 *
 * type -> namespace -> name -> offset, so lookups never build composite string keys.
 */
@Slf4j
public final class InMemoryOffsetStore implements OffsetStore {

    private static final class NamespaceOffsets {
        final ConcurrentMap<String, Long> byName = new ConcurrentHashMap<>();
    }

    private final ConcurrentMap<OffsetType, ConcurrentMap<String, NamespaceOffsets>> offsets =
            new ConcurrentHashMap<>();

    private NamespaceOffsets namespaceOffsets(final OffsetType type, final String namespace) {
        return offsets
                .computeIfAbsent(type, t -> new ConcurrentHashMap<>())
                .computeIfAbsent(namespace, ns -> new NamespaceOffsets());
    }

    @Override
    public OptionalLong fetch(final OffsetType type, final String namespace, final String name) {
        final ConcurrentMap<String, NamespaceOffsets> byNamespace = offsets.get(type);
        if (byNamespace == null) return OptionalLong.empty();
        final NamespaceOffsets ns = byNamespace.get(namespace);
        if (ns == null) return OptionalLong.empty();
        final Long offset = ns.byName.get(name);
        return offset == null ? OptionalLong.empty() : OptionalLong.of(offset);
    }

    @Override
    public void commit(final OffsetType type, final String namespace, final String name, final long offset) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(name, "name");

        final Long previous = namespaceOffsets(type, namespace).byName.put(name, offset);
        log.debug("Committed offset {}/{}:{} {} -> {}", type, namespace, name, previous, offset);
    }
}
