package org.glossa.workspace.auth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Salted SHA-256 password digests. Salts and digests are exchanged as Base64 strings.
 */
final class PasswordHasher {

    private static final int SALT_BYTES = 16;

    private final SecureRandom random;

    PasswordHasher(final SecureRandom random) {
        this.random = random;
    }

    String newSalt() {
        final byte[] salt = new byte[SALT_BYTES];
        random.nextBytes(salt);
        return Base64.getEncoder().encodeToString(salt);
    }

    String hash(final String salt, final String password) {
        final MessageDigest digest = sha256();
        digest.update(Base64.getDecoder().decode(salt));
        digest.update(password.getBytes(StandardCharsets.UTF_8));
        return Base64.getEncoder().encodeToString(digest.digest());
    }

    boolean matches(final String salt, final String password, final String expectedHash) {
        final byte[] expected;
        try {
            expected = Base64.getDecoder().decode(expectedHash);
        } catch (final IllegalArgumentException e) {
            return false;
        }
        final byte[] actual = Base64.getDecoder().decode(hash(salt, password));
        return MessageDigest.isEqual(expected, actual);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (final NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
