package org.glossa.node.processes.http.api.labels;

import com.typesafe.config.Config;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import org.glossa.node.processes.http.api.WorkspaceApiController;
import org.glossa.node.processes.http.api.dto.StatusResponseDto;
import org.glossa.node.processes.http.api.labels.dto.LabelRequestDto;
import org.glossa.node.spi.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * The authenticated user's label palette: {@code GET} and {@code POST} on the base path,
 * {@code DELETE {name}} below it.
 */
public class LabelController extends WorkspaceApiController {

    private static final Logger LOGGER = LoggerFactory.getLogger(LabelController.class);

    public LabelController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        app.get(route(basePath, ""), this::listLabels);
        app.post(route(basePath, ""), this::saveLabel);
        app.delete(route(basePath, "{name}"), this::deleteLabel);

        setupExceptionHandlers(app);
    }

    void listLabels(final Context ctx) throws IOException {
        final String namespace = requireNamespace(ctx);
        ctx.status(HttpStatus.OK).json(workspace.labels().list(namespace));
    }

    void saveLabel(final Context ctx) throws IOException {
        final String namespace = requireNamespace(ctx);
        final LabelRequestDto request = isJsonRequest(ctx)
            ? parseJsonBody(ctx, LabelRequestDto.class)
            : new LabelRequestDto(ctx.formParam("name"), ctx.formParam("color"));
        workspace.labels().set(namespace, request.name(), request.color());
        LOGGER.debug("Saved label '{}'", request.name());
        ctx.status(HttpStatus.OK).json(new StatusResponseDto("label saved"));
    }

    void deleteLabel(final Context ctx) throws IOException {
        final String namespace = requireNamespace(ctx);
        final String name = ctx.pathParam("name");
        workspace.labels().remove(namespace, name);
        LOGGER.debug("Deleted label '{}'", name);
        ctx.status(HttpStatus.OK).json(new StatusResponseDto("label deleted"));
    }
}
