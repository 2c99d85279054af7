package org.glossa.workspace.storage;

import org.glossa.workspace.api.storage.IKeyValueStore;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Volatile {@link IKeyValueStore} that copies every mapping it saves or returns.
 * Contents are lost when the process exits.
 *
 * @param <V> the value type of the mapping; values are expected to be immutable
 */
public class InMemoryKeyValueStore<V> implements IKeyValueStore<V> {

    private final String storeName;
    private final Map<String, Map<String, V>> namespaces = new ConcurrentHashMap<>();

    public InMemoryKeyValueStore(final String storeName) {
        this.storeName = storeName;
    }

    @Override
    public String getStoreName() {
        return storeName;
    }

    @Override
    public void createNamespace(final String namespace) {
        namespaces.putIfAbsent(namespace, new LinkedHashMap<>());
    }

    @Override
    public Map<String, V> load(final String namespace) {
        final Map<String, V> mapping = namespaces.get(namespace);
        return mapping != null ? new LinkedHashMap<>(mapping) : new LinkedHashMap<>();
    }

    @Override
    public void save(final String namespace, final Map<String, V> mapping) {
        namespaces.put(namespace, new LinkedHashMap<>(mapping));
    }
}
