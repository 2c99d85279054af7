package org.glossa.node.processes.http.api.auth;

import com.typesafe.config.Config;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import org.glossa.node.processes.http.api.WorkspaceApiController;
import org.glossa.node.processes.http.api.auth.dto.CredentialsRequestDto;
import org.glossa.node.processes.http.api.auth.dto.LoginResponseDto;
import org.glossa.node.processes.http.api.dto.StatusResponseDto;
import org.glossa.node.spi.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Account registration, login and logout.
 * <p>
 * Routes below the base path:
 * <ul>
 *   <li>{@code POST register} → 201, 409 if the name is taken or a field is blank</li>
 *   <li>{@code POST login} → 200 with a bearer token, 401 on bad credentials</li>
 *   <li>{@code POST logout} → 200, 401 without a valid token</li>
 * </ul>
 * Credentials are accepted as a JSON body or as form fields.
 */
public class AuthController extends WorkspaceApiController {

    private static final Logger LOGGER = LoggerFactory.getLogger(AuthController.class);

    public AuthController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        app.post(route(basePath, "register"), this::register);
        app.post(route(basePath, "login"), this::login);
        app.post(route(basePath, "logout"), this::logout);

        setupExceptionHandlers(app);
    }

    void register(final Context ctx) throws IOException {
        final CredentialsRequestDto request = readCredentials(ctx);
        workspace.credentials().register(request.username(), request.password());
        ctx.status(HttpStatus.CREATED).json(new StatusResponseDto("registered"));
    }

    void login(final Context ctx) throws IOException {
        final CredentialsRequestDto request = readCredentials(ctx);
        final String username = workspace.credentials().verify(request.username(), request.password());
        final String token = workspace.sessions().createSession(username);
        LOGGER.info("User '{}' logged in ({} active sessions)", username, workspace.sessions().activeSessions());
        ctx.status(HttpStatus.OK).json(new LoginResponseDto(token, username));
    }

    void logout(final Context ctx) {
        final String username = requirePrincipal(ctx);
        workspace.sessions().revoke(bearerToken(ctx));
        LOGGER.info("User '{}' logged out", username);
        ctx.status(HttpStatus.OK).json(new StatusResponseDto("logged out"));
    }

    private static CredentialsRequestDto readCredentials(final Context ctx) {
        if (isJsonRequest(ctx)) {
            return parseJsonBody(ctx, CredentialsRequestDto.class);
        }
        return new CredentialsRequestDto(ctx.formParam("username"), ctx.formParam("password"));
    }
}
