package org.glossa.workspace.api.model;

/**
 * A labeled span over a document's text.
 * <p>
 * The interval {@code [start, end)} is half-open and zero-indexed. {@code text} is the covered
 * substring as sent by the client; it is stored as given and never recomputed from the document.
 *
 * @param start inclusive start offset
 * @param end   exclusive end offset
 * @param text  the annotated substring
 * @param label free-text label name
 * @param rank  optional ordering hint, may be {@code null}
 */
public record Annotation(
    int start,
    int end,
    String text,
    String label,
    String rank
) {

    /**
     * Checks whether this span shares at least one character position with another.
     * Spans that only touch at an endpoint do not overlap.
     *
     * @param otherStart inclusive start of the other span
     * @param otherEnd   exclusive end of the other span
     * @return true if the two intervals intersect
     */
    public boolean overlaps(final int otherStart, final int otherEnd) {
        return start < otherEnd && otherStart < end;
    }

    /**
     * Checks whether this span overlaps another annotation.
     *
     * @param other the annotation to compare against
     * @return true if the two intervals intersect
     */
    public boolean overlaps(final Annotation other) {
        return overlaps(other.start(), other.end());
    }
}
