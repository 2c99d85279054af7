package org.glossa.workspace.auth;

import org.glossa.workspace.api.errors.UnauthorizedException;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide table of live sessions, mapping opaque bearer tokens to usernames.
 * <p>
 * The table is owned by the {@link org.glossa.workspace.Workspace} and lives exactly as long as
 * the process: it is never persisted and sessions never expire, so a restart invalidates every
 * token. Tokens carry 256 bits from {@link SecureRandom}.
 */
public class SessionRegistry {

    private static final int TOKEN_BYTES = 32;

    private final Map<String, String> sessions = new ConcurrentHashMap<>();
    private final SecureRandom random;

    public SessionRegistry() {
        this(new SecureRandom());
    }

    SessionRegistry(final SecureRandom random) {
        this.random = random;
    }

    /**
     * Opens a session for an authenticated user.
     *
     * @param username the principal
     * @return a fresh bearer token
     */
    public String createSession(final String username) {
        while (true) {
            final String token = newToken();
            if (sessions.putIfAbsent(token, username) == null) {
                return token;
            }
        }
    }

    /**
     * Resolves a bearer token to its principal.
     *
     * @param token the bearer token, may be null
     * @return the bound username
     * @throws UnauthorizedException if the token is absent, blank or unknown
     */
    public String resolve(final String token) {
        if (token == null || token.isBlank()) {
            throw new UnauthorizedException("Missing session token");
        }
        final String username = sessions.get(token);
        if (username == null) {
            throw new UnauthorizedException("Invalid or expired session token");
        }
        return username;
    }

    /**
     * Closes a session. Unknown tokens are ignored.
     *
     * @param token the bearer token
     */
    public void revoke(final String token) {
        if (token != null) {
            sessions.remove(token);
        }
    }

    /**
     * @return the number of live sessions
     */
    public int activeSessions() {
        return sessions.size();
    }

    private String newToken() {
        final byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
