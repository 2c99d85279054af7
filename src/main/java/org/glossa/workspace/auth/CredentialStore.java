package org.glossa.workspace.auth;

import org.glossa.workspace.NamespaceResolver;
import org.glossa.workspace.api.errors.ConflictException;
import org.glossa.workspace.api.errors.UnauthorizedException;
import org.glossa.workspace.api.model.UserCredential;
import org.glossa.workspace.api.storage.IKeyValueStore;
import org.glossa.workspace.storage.NamespaceLocks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.security.SecureRandom;
import java.util.Map;

/**
 * Persists registered users and verifies their passwords.
 * <p>
 * All users live in {@link NamespaceResolver#SYSTEM_NAMESPACE}. Registration is serialized
 * through {@link NamespaceLocks} so two concurrent registrations of the same name cannot both
 * succeed.
 */
public class CredentialStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(CredentialStore.class);

    private final IKeyValueStore<UserCredential> users;
    private final NamespaceLocks locks;
    private final PasswordHasher hasher;

    public CredentialStore(final IKeyValueStore<UserCredential> users, final NamespaceLocks locks) {
        this(users, locks, new SecureRandom());
    }

    CredentialStore(final IKeyValueStore<UserCredential> users, final NamespaceLocks locks, final SecureRandom random) {
        this.users = users;
        this.locks = locks;
        this.hasher = new PasswordHasher(random);
    }

    /**
     * Registers a new user.
     *
     * @param username the requested user name
     * @param password the plain password
     * @throws ConflictException if the name is taken or either field is blank
     * @throws IOException       if the credential store cannot be written
     */
    public void register(final String username, final String password) throws IOException {
        if (isBlank(username) || isBlank(password)) {
            throw new ConflictException("Username and password must not be empty");
        }

        locks.withLock(NamespaceResolver.SYSTEM_NAMESPACE, users.getStoreName(), () -> {
            final Map<String, UserCredential> all = users.load(NamespaceResolver.SYSTEM_NAMESPACE);
            if (all.containsKey(username)) {
                throw new ConflictException("User already exists: " + username);
            }
            final String salt = hasher.newSalt();
            all.put(username, new UserCredential(username, salt, hasher.hash(salt, password)));
            users.save(NamespaceResolver.SYSTEM_NAMESPACE, all);
            return null;
        });
        LOGGER.info("Registered user '{}'", username);
    }

    /**
     * Verifies a username and password.
     *
     * @param username the user name
     * @param password the plain password
     * @return the authenticated principal
     * @throws UnauthorizedException if the user is unknown or the password does not match
     * @throws IOException           if the credential store cannot be read
     */
    public String verify(final String username, final String password) throws IOException {
        if (username == null || password == null) {
            throw new UnauthorizedException("Invalid username or password");
        }
        final UserCredential credential = users.load(NamespaceResolver.SYSTEM_NAMESPACE).get(username);
        if (credential == null || !hasher.matches(credential.salt(), password, credential.passwordHash())) {
            LOGGER.debug("Rejected login for '{}'", username);
            throw new UnauthorizedException("Invalid username or password");
        }
        return credential.username();
    }

    private static boolean isBlank(final String value) {
        return value == null || value.isBlank();
    }
}
