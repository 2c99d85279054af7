package org.glossa.node.processes.http.api.auth.dto;

/**
 * Body of register and login requests.
 *
 * @param username the account name
 * @param password the plain-text password
 */
public record CredentialsRequestDto(
    String username,
    String password
) {
    @Override
    public String toString() {
        return "CredentialsRequestDto[username=" + username + ", password=***]";
    }
}
