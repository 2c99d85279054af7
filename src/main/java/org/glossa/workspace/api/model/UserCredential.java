package org.glossa.workspace.api.model;

/**
 * A registered user. Salt and hash are Base64 encoded.
 *
 * @param username     unique user name
 * @param salt         random per-user salt
 * @param passwordHash digest of salt followed by the password
 */
public record UserCredential(
    String username,
    String salt,
    String passwordHash
) {}
