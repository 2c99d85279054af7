package org.glossa.workspace.documents;

/**
 * Builds the short document previews shown in listings.
 */
public final class Previews {

    /**
     * Default number of characters kept in a preview.
     */
    public static final int DEFAULT_LENGTH = 120;

    private static final String ELLIPSIS = "...";
    private static final int NEXT_LINE = 0x85;

    private Previews() {
        // Utility class - prevent instantiation
    }

    /**
     * Collapses all whitespace runs (newlines and Unicode spaces such as U+00A0 included) to
     * single spaces, trims, and truncates to {@code maxLength} code points, appending
     * {@code "..."} when truncated.
     *
     * @param text      the full document text
     * @param maxLength number of code points to keep
     * @return the preview
     */
    public static String of(final String text, final int maxLength) {
        final String normalized = collapseWhitespace(text);
        if (normalized.codePointCount(0, normalized.length()) <= maxLength) {
            return normalized;
        }
        return normalized.substring(0, normalized.offsetByCodePoints(0, maxLength)) + ELLIPSIS;
    }

    private static String collapseWhitespace(final String text) {
        final StringBuilder result = new StringBuilder(text.length());
        boolean pendingSpace = false;
        int i = 0;
        while (i < text.length()) {
            final int codePoint = text.codePointAt(i);
            i += Character.charCount(codePoint);
            if (isWhitespace(codePoint)) {
                pendingSpace = result.length() > 0;
                continue;
            }
            if (pendingSpace) {
                result.append(' ');
                pendingSpace = false;
            }
            result.appendCodePoint(codePoint);
        }
        return result.toString();
    }

    // Character.isWhitespace excludes no-break spaces and NEL, isSpaceChar excludes tabs and line breaks
    private static boolean isWhitespace(final int codePoint) {
        return Character.isWhitespace(codePoint) || Character.isSpaceChar(codePoint) || codePoint == NEXT_LINE;
    }
}
