package org.glossa.workspace.labels;

import org.glossa.workspace.api.errors.InvalidArgumentException;
import org.glossa.workspace.api.errors.NotFoundException;
import org.glossa.workspace.api.storage.IKeyValueStore;
import org.glossa.workspace.storage.NamespaceLocks;

import java.io.IOException;
import java.util.Map;

/**
 * The label palette of each namespace: label name to display color. Colors are opaque strings.
 */
public class LabelStore {

    private final IKeyValueStore<String> labels;
    private final NamespaceLocks locks;

    public LabelStore(final IKeyValueStore<String> labels, final NamespaceLocks locks) {
        this.labels = labels;
        this.locks = locks;
    }

    public void set(final String namespace, final String name, final String color) throws IOException {
        if (name == null || name.isBlank()) {
            throw new InvalidArgumentException("Label name must not be empty");
        }
        if (color == null) {
            throw new InvalidArgumentException("Label color must be provided");
        }
        locks.withLock(namespace, labels.getStoreName(), () -> {
            final Map<String, String> all = labels.load(namespace);
            all.put(name, color);
            labels.save(namespace, all);
            return null;
        });
    }

    public void remove(final String namespace, final String name) throws IOException {
        locks.withLock(namespace, labels.getStoreName(), () -> {
            final Map<String, String> all = labels.load(namespace);
            if (all.remove(name) == null) {
                throw new NotFoundException("Label not found: " + name);
            }
            labels.save(namespace, all);
            return null;
        });
    }

    public Map<String, String> list(final String namespace) throws IOException {
        return labels.load(namespace);
    }
}
