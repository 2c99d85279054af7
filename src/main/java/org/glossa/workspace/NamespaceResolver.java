package org.glossa.workspace;

import org.glossa.workspace.api.storage.IKeyValueStore;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;

/**
 * Maps an authenticated username to the storage namespace that isolates its documents,
 * annotations and labels.
 * <p>
 * The namespace is the lowercase hex SHA-256 digest of the UTF-8 username. It is deterministic,
 * fixed-length and safe as a directory name regardless of what characters the username holds.
 * Credentials live in {@link #SYSTEM_NAMESPACE}, which is not a valid hex digest and therefore
 * never collides with a user namespace.
 */
public final class NamespaceResolver {

    /**
     * Namespace reserved for process-wide data such as credentials.
     */
    public static final String SYSTEM_NAMESPACE = "_system";

    private final List<IKeyValueStore<?>> stores;

    /**
     * Creates a resolver that materializes namespaces in the given stores.
     *
     * @param stores the per-user stores whose namespace locations must exist
     */
    public NamespaceResolver(final List<IKeyValueStore<?>> stores) {
        this.stores = List.copyOf(stores);
    }

    /**
     * Resolves the namespace of a user, creating its backing locations if absent.
     * Safe to call concurrently for the same user.
     *
     * @param username the authenticated principal
     * @return the namespace identifier
     * @throws IOException if a backing location cannot be created
     */
    public String resolveNamespace(final String username) throws IOException {
        final String namespace = namespaceOf(username);
        for (final IKeyValueStore<?> store : stores) {
            store.createNamespace(namespace);
        }
        return namespace;
    }

    /**
     * Computes the namespace identifier of a user without touching storage.
     *
     * @param username the user name
     * @return the lowercase hex SHA-256 of the UTF-8 username
     */
    public static String namespaceOf(final String username) {
        Objects.requireNonNull(username, "username");
        return HexFormat.of().formatHex(sha256(username.getBytes(StandardCharsets.UTF_8)));
    }

    private static byte[] sha256(final byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (final NoSuchAlgorithmException e) {
            // Every JRE is required to ship SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
