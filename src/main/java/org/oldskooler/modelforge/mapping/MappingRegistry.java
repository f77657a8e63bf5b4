package org.oldskooler.modelforge.mapping;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fluent mappings by entity type. Consulted before annotations when a {@link TableMeta} is built.
 */
public final class MappingRegistry {
    private final Map<Class<?>, EntityMapping<?>> byType = new ConcurrentHashMap<>();

    public <T> MappingRegistry register(EntityMapping<T> m) {
        byType.put(m.type, m);
        return this;
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<EntityMapping<T>> find(Class<T> type) {
        return Optional.ofNullable((EntityMapping<T>) byType.get(type));
    }

    public boolean contains(Class<?> type) {
        return byType.containsKey(type);
    }
}
