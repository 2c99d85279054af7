package org.glossa.workspace.export;

final class ExportFilenames {

    private ExportFilenames() {
        // Utility class - prevent instantiation
    }

    /**
     * Builds {@code <name>_annotations.<extension>} from the last path segment of a docId, since
     * archive uploads produce docIds such as {@code folder/notes.txt}.
     */
    static String of(final String docId, final String extension) {
        final String normalized = docId.replace('\\', '/');
        final String baseName = normalized.substring(normalized.lastIndexOf('/') + 1);
        return baseName + "_annotations." + extension;
    }
}
