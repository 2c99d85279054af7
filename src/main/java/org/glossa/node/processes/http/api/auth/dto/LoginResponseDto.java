package org.glossa.node.processes.http.api.auth.dto;

/**
 * @param token    opaque bearer token for subsequent requests
 * @param username the authenticated user
 */
public record LoginResponseDto(
    String token,
    String username
) {}
