package org.glossa.node.processes.http.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpResponseException;
import io.javalin.http.HttpStatus;
import org.glossa.node.processes.http.AbstractController;
import org.glossa.node.processes.http.api.dto.ErrorResponseDto;
import org.glossa.node.spi.ServiceRegistry;
import org.glossa.workspace.Workspace;
import org.glossa.workspace.api.errors.ConflictException;
import org.glossa.workspace.api.errors.InvalidArgumentException;
import org.glossa.workspace.api.errors.NotFoundException;
import org.glossa.workspace.api.errors.UnauthorizedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Locale;

/**
 * Base class for the annotation service API controllers.
 * <p>
 * Provides bearer-token authentication against the workspace's session table, namespace
 * resolution for the authenticated principal, request body parsing (JSON or form fields), and
 * the mapping from workspace errors to HTTP responses:
 * <ul>
 *   <li>{@link UnauthorizedException} → 401 Unauthorized</li>
 *   <li>{@link InvalidArgumentException} → 400 Bad Request</li>
 *   <li>{@link NotFoundException} → 404 Not Found</li>
 *   <li>{@link ConflictException} → 409 Conflict</li>
 *   <li>{@link IOException} and anything else → 500 Internal Server Error</li>
 * </ul>
 */
public abstract class WorkspaceApiController extends AbstractController {

    private static final Logger LOGGER = LoggerFactory.getLogger(WorkspaceApiController.class);
    private static final String BEARER_PREFIX = "bearer ";
    private static final ObjectMapper BODY_MAPPER = new ObjectMapper()
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    protected final Workspace workspace;

    protected WorkspaceApiController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
        this.workspace = registry.get(Workspace.class);
    }

    /**
     * Registers the error mapping. Javalin exception handlers are global, so registering them
     * from several controllers replaces identical handlers.
     *
     * @param app the Javalin application
     */
    protected void setupExceptionHandlers(final Javalin app) {
        app.exception(UnauthorizedException.class, (e, ctx) -> {
            LOGGER.warn("Unauthorized request {} {}: {}", ctx.method(), ctx.path(), e.getMessage());
            respondError(ctx, HttpStatus.UNAUTHORIZED, e.getMessage());
        });
        app.exception(InvalidArgumentException.class, (e, ctx) -> {
            LOGGER.warn("Invalid request {} {}: {}", ctx.method(), ctx.path(), e.getMessage());
            respondError(ctx, HttpStatus.BAD_REQUEST, e.getMessage());
        });
        app.exception(NotFoundException.class, (e, ctx) -> {
            LOGGER.warn("Not found for request {} {}: {}", ctx.method(), ctx.path(), e.getMessage());
            respondError(ctx, HttpStatus.NOT_FOUND, e.getMessage());
        });
        app.exception(ConflictException.class, (e, ctx) -> {
            LOGGER.warn("Conflict for request {} {}: {}", ctx.method(), ctx.path(), e.getMessage());
            respondError(ctx, HttpStatus.CONFLICT, e.getMessage());
        });
        app.exception(HttpResponseException.class, (e, ctx) -> {
            final HttpStatus status = HttpStatus.forStatus(e.getStatus());
            LOGGER.warn("Request {} {} rejected with {}: {}", ctx.method(), ctx.path(), e.getStatus(), e.getMessage());
            respondError(ctx, status, e.getMessage());
        });
        app.exception(IOException.class, (e, ctx) -> {
            LOGGER.error("Storage failure for request {} {}", ctx.method(), ctx.path(), e);
            respondError(ctx, HttpStatus.INTERNAL_SERVER_ERROR, "A storage error occurred");
        });
        app.exception(Exception.class, (e, ctx) -> {
            LOGGER.error("Unhandled exception for request {} {}", ctx.method(), ctx.path(), e);
            respondError(ctx, HttpStatus.INTERNAL_SERVER_ERROR, "An internal server error occurred");
        });
    }

    /**
     * Joins a controller base path and a route suffix, collapsing duplicate slashes.
     *
     * @param basePath the mount point of the controller
     * @param suffix   the route below it, may be empty
     * @return the full route path without a trailing slash
     */
    protected static String route(final String basePath, final String suffix) {
        final String path = (basePath + "/" + suffix).replaceAll("/{2,}", "/");
        return path.length() > 1 && path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    }

    /**
     * Resolves the principal of a request from its {@code Authorization: Bearer} header.
     *
     * @param ctx the request context
     * @return the authenticated username
     * @throws UnauthorizedException if the header is missing or the token is unknown
     */
    protected String requirePrincipal(final Context ctx) {
        return workspace.sessions().resolve(bearerToken(ctx));
    }

    /**
     * Resolves the storage namespace of the authenticated principal.
     *
     * @param ctx the request context
     * @return the namespace identifier
     * @throws UnauthorizedException if the request is not authenticated
     * @throws IOException           if the namespace cannot be created
     */
    protected String requireNamespace(final Context ctx) throws IOException {
        return workspace.namespaces().resolveNamespace(requirePrincipal(ctx));
    }

    /**
     * Extracts the bearer token of a request.
     *
     * @param ctx the request context
     * @return the token, or null if the header is missing or not a bearer credential
     */
    protected static String bearerToken(final Context ctx) {
        final String header = ctx.header("Authorization");
        if (header == null || !header.toLowerCase(Locale.ROOT).startsWith(BEARER_PREFIX)) {
            return null;
        }
        return header.substring(BEARER_PREFIX.length()).trim();
    }

    /**
     * Parses a JSON request body.
     *
     * @param ctx  the request context
     * @param type the request DTO type
     * @param <T>  the DTO type
     * @return the parsed body
     * @throws InvalidArgumentException if the body is missing or not valid JSON for the type
     */
    protected static <T> T parseJsonBody(final Context ctx, final Class<T> type) {
        final byte[] body = ctx.bodyAsBytes();
        if (body.length == 0) {
            throw new InvalidArgumentException("Request body is empty");
        }
        try {
            return BODY_MAPPER.readValue(body, type);
        } catch (final JsonProcessingException e) {
            throw new InvalidArgumentException("Malformed request body: " + e.getOriginalMessage());
        } catch (final IOException e) {
            throw new InvalidArgumentException("Unreadable request body: " + e.getMessage());
        }
    }

    /**
     * @param ctx the request context
     * @return true if the request carries a JSON body rather than form fields
     */
    protected static boolean isJsonRequest(final Context ctx) {
        final String contentType = ctx.contentType();
        return contentType != null && contentType.toLowerCase(Locale.ROOT).startsWith("application/json");
    }

    private static void respondError(final Context ctx, final HttpStatus status, final String message) {
        ctx.status(status).json(ErrorResponseDto.of(status.getCode(), status.getMessage(), message));
    }
}
