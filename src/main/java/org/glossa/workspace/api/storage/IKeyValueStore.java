package org.glossa.workspace.api.storage;

import java.io.IOException;
import java.util.Map;

/**
 * A flat key-value mapping persisted once per namespace.
 * <p>
 * Each store instance holds one kind of value (documents, annotation lists, labels, credentials).
 * A namespace is an opaque, filesystem-safe identifier produced by
 * {@link org.glossa.workspace.NamespaceResolver}.
 * <p>
 * <strong>Load leniency:</strong> a namespace without a backing object, or with one that cannot be
 * parsed, loads as an empty mapping. A corrupt object is therefore overwritten by the next save.
 * <p>
 * <strong>Crash consistency:</strong> {@link #save(String, Map)} must never leave a torn object
 * visible to a subsequent {@link #load(String)}.
 * <p>
 * Implementations do not coordinate concurrent read-modify-write cycles; callers serialize
 * them per namespace (see {@link org.glossa.workspace.storage.NamespaceLocks}).
 *
 * @param <V> the value type of the mapping
 */
public interface IKeyValueStore<V> {

    /**
     * Returns the logical name of this store (e.g. "annotations").
     *
     * @return the store name
     */
    String getStoreName();

    /**
     * Makes sure the backing location for a namespace exists. Idempotent and safe to call
     * concurrently for the same namespace.
     *
     * @param namespace the namespace identifier
     * @throws IOException if the location cannot be created
     */
    void createNamespace(String namespace) throws IOException;

    /**
     * Loads the full mapping of a namespace.
     *
     * @param namespace the namespace identifier
     * @return a mutable copy of the mapping in insertion order, empty if missing or unreadable
     * @throws IOException if the backing object exists but cannot be read at all
     */
    Map<String, V> load(String namespace) throws IOException;

    /**
     * Replaces the full mapping of a namespace.
     *
     * @param namespace the namespace identifier
     * @param mapping   the new mapping
     * @throws IOException if the mapping cannot be persisted; the prior mapping stays intact
     */
    void save(String namespace, Map<String, V> mapping) throws IOException;
}
