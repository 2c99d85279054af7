package org.glossa.utils;

/**
 * Expands {@code ${VAR}} references in configured paths.
 * <p>
 * A reference resolves to the Java system property of that name if set, otherwise to the
 * environment variable. This lets the data directory be configured as e.g.
 * {@code ${user.home}/glossa-data} or {@code ${GLOSSA_DATA_DIR}}.
 */
public final class PathExpansion {

    private PathExpansion() {
        // Utility class - prevent instantiation
    }

    /**
     * Replaces every {@code ${VAR}} in the path with its value.
     * <pre>
     * expandPath("${user.home}/data")  → "/home/alice/data"
     * expandPath("/var/lib/glossa")    → "/var/lib/glossa"
     * </pre>
     *
     * @param path the configured path, may be null
     * @return the expanded path, or the input unchanged if it holds no reference
     * @throws IllegalArgumentException if a reference is unclosed or names an undefined variable
     */
    public static String expandPath(final String path) {
        if (path == null || !path.contains("${")) {
            return path;
        }

        final StringBuilder result = new StringBuilder();
        int pos = 0;
        while (pos < path.length()) {
            final int startVar = path.indexOf("${", pos);
            if (startVar == -1) {
                result.append(path, pos, path.length());
                break;
            }
            result.append(path, pos, startVar);

            final int endVar = path.indexOf('}', startVar + 2);
            if (endVar == -1) {
                throw new IllegalArgumentException("Unclosed variable in path: " + path);
            }

            final String varName = path.substring(startVar + 2, endVar);
            final String value = resolveVariable(varName);
            if (value == null) {
                throw new IllegalArgumentException("Undefined variable '${" + varName + "}' in path: " + path);
            }
            result.append(value);
            pos = endVar + 1;
        }
        return result.toString();
    }

    private static String resolveVariable(final String varName) {
        final String value = System.getProperty(varName);
        return value != null ? value : System.getenv(varName);
    }
}
