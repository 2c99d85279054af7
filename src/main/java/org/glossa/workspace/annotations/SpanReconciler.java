package org.glossa.workspace.annotations;

import org.glossa.workspace.api.model.Annotation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * The write-time reconciliation applied to a document's annotation list.
 * <p>
 * A new span replaces every stored span it overlaps, whole: overlapped spans are dropped, never
 * split or merged. The result is ordered by ascending start. The sort is stable, so spans with
 * equal starts keep insertion order, and the candidate, appended last, follows any survivor that
 * shares its start.
 * <p>
 * Given an input list without overlaps, the output has no overlaps either, since every span that
 * could conflict with the candidate has been removed before it is added.
 */
public final class SpanReconciler {

    private static final Comparator<Annotation> BY_START = Comparator.comparingInt(Annotation::start);

    private SpanReconciler() {
        // Utility class - prevent instantiation
    }

    /**
     * Computes the list that results from saving a candidate span.
     *
     * @param current   the stored list, left untouched
     * @param candidate the span being saved
     * @return a new list: survivors plus candidate, sorted by start
     */
    public static List<Annotation> reconcile(final List<Annotation> current, final Annotation candidate) {
        final List<Annotation> result = new ArrayList<>(current.size() + 1);
        for (final Annotation existing : current) {
            if (!existing.overlaps(candidate)) {
                result.add(existing);
            }
        }
        result.add(candidate);
        result.sort(BY_START);
        return result;
    }
}
