package org.glossa.workspace.annotations;

import org.glossa.workspace.api.errors.InvalidArgumentException;
import org.glossa.workspace.api.errors.NotFoundException;
import org.glossa.workspace.api.model.Annotation;
import org.glossa.workspace.api.storage.IKeyValueStore;
import org.glossa.workspace.storage.NamespaceLocks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Annotation lists of each namespace, keyed by docId.
 * <p>
 * Every stored list is sorted by start and free of overlapping spans. Both properties are
 * established on write by {@link SpanReconciler}. Writes to a namespace run under its
 * {@link NamespaceLocks} lock, so a save or delete always reconciles against the latest list and
 * concurrent writers cannot lose each other's results.
 */
public class AnnotationStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(AnnotationStore.class);

    private final IKeyValueStore<List<Annotation>> annotations;
    private final NamespaceLocks locks;

    public AnnotationStore(final IKeyValueStore<List<Annotation>> annotations, final NamespaceLocks locks) {
        this.annotations = annotations;
        this.locks = locks;
    }

    /**
     * Saves a span, discarding every stored span of the document that overlaps it.
     *
     * @param namespace the caller's namespace
     * @param docId     the document key; the document itself need not exist
     * @param candidate the span to save
     * @return the document's list after reconciliation
     * @throws InvalidArgumentException if the span is empty, reversed or negative, the label
     *                                  or docId is blank, or the text is missing
     * @throws IOException              if the store cannot be read or written
     */
    public List<Annotation> save(final String namespace, final String docId, final Annotation candidate) throws IOException {
        validate(docId, candidate);

        final List<Annotation> reconciled = locks.withLock(namespace, annotations.getStoreName(), () -> {
            final Map<String, List<Annotation>> all = annotations.load(namespace);
            final List<Annotation> current = all.getOrDefault(docId, List.of());
            final List<Annotation> next = SpanReconciler.reconcile(current, candidate);
            all.put(docId, next);
            annotations.save(namespace, all);

            final int replaced = current.size() + 1 - next.size();
            if (replaced > 0) {
                LOGGER.debug("Annotation [{}, {}) on '{}' replaced {} overlapping span(s)",
                    candidate.start(), candidate.end(), docId, replaced);
            }
            return next;
        });
        return List.copyOf(reconciled);
    }

    /**
     * @param namespace the caller's namespace
     * @param docId     the document key
     * @return the stored list sorted by start, empty if the document has none
     * @throws IOException if the store cannot be read
     */
    public List<Annotation> list(final String namespace, final String docId) throws IOException {
        final List<Annotation> stored = annotations.load(namespace).get(docId);
        return stored != null ? List.copyOf(stored) : List.of();
    }

    /**
     * Removes the annotation at a position of a document's list. The remaining annotations keep
     * their relative order.
     *
     * @param namespace the caller's namespace
     * @param docId     the document key
     * @param index     zero-based position in the stored list
     * @return the removed annotation
     * @throws NotFoundException if the document has no list or the index is outside it
     * @throws IOException       if the store cannot be read or written
     */
    public Annotation deleteAt(final String namespace, final String docId, final int index) throws IOException {
        return locks.withLock(namespace, annotations.getStoreName(), () -> {
            final Map<String, List<Annotation>> all = annotations.load(namespace);
            final List<Annotation> current = all.get(docId);
            if (current == null || index < 0 || index >= current.size()) {
                throw new NotFoundException("Annotation not found: " + docId + "[" + index + "]");
            }
            final List<Annotation> next = new ArrayList<>(current);
            final Annotation removed = next.remove(index);
            all.put(docId, next);
            annotations.save(namespace, all);
            return removed;
        });
    }

    private static void validate(final String docId, final Annotation candidate) {
        if (docId == null || docId.isBlank()) {
            throw new InvalidArgumentException("docId must not be empty");
        }
        if (candidate.start() < 0) {
            throw new InvalidArgumentException("start must not be negative: " + candidate.start());
        }
        if (candidate.end() <= candidate.start()) {
            throw new InvalidArgumentException(
                "end must be greater than start: [" + candidate.start() + ", " + candidate.end() + ")");
        }
        if (candidate.label() == null || candidate.label().isBlank()) {
            throw new InvalidArgumentException("label must not be empty");
        }
        if (candidate.text() == null) {
            throw new InvalidArgumentException("text is required");
        }
    }
}
