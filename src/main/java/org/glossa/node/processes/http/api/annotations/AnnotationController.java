package org.glossa.node.processes.http.api.annotations;

import com.typesafe.config.Config;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import org.glossa.node.processes.http.api.WorkspaceApiController;
import org.glossa.node.processes.http.api.annotations.dto.SaveAnnotationRequestDto;
import org.glossa.node.processes.http.api.annotations.dto.SaveAnnotationResponseDto;
import org.glossa.node.processes.http.api.dto.StatusResponseDto;
import org.glossa.node.spi.ServiceRegistry;
import org.glossa.workspace.api.errors.InvalidArgumentException;
import org.glossa.workspace.api.model.Annotation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Span annotations of the authenticated user's documents.
 * <p>
 * Routes below the base path:
 * <ul>
 *   <li>{@code POST} (base path itself) → save one span, replacing every span it overlaps</li>
 *   <li>{@code GET <docId>} → the stored span list, empty for unknown documents</li>
 *   <li>{@code DELETE <docId>/{index}} → remove the span at a list position, 404 if out of range</li>
 * </ul>
 */
public class AnnotationController extends WorkspaceApiController {

    private static final Logger LOGGER = LoggerFactory.getLogger(AnnotationController.class);

    public AnnotationController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        app.post(route(basePath, ""), this::saveAnnotation);
        app.delete(route(basePath, "<docId>/{index}"), this::deleteAnnotation);
        app.get(route(basePath, "<docId>"), this::listAnnotations);

        setupExceptionHandlers(app);
    }

    void saveAnnotation(final Context ctx) throws IOException {
        final String namespace = requireNamespace(ctx);
        final SaveAnnotationRequestDto request = isJsonRequest(ctx)
            ? parseJsonBody(ctx, SaveAnnotationRequestDto.class)
            : readForm(ctx);
        if (request.start() == null || request.end() == null) {
            throw new InvalidArgumentException("Both 'start' and 'end' are required");
        }

        final Annotation candidate = new Annotation(request.start(), request.end(), request.text(),
            request.label(), request.rank());
        final List<Annotation> annotations = workspace.annotations().save(namespace, request.docId(), candidate);
        LOGGER.debug("Saved annotation [{}, {}) '{}' on '{}'", candidate.start(), candidate.end(),
            candidate.label(), request.docId());
        ctx.status(HttpStatus.OK).json(new SaveAnnotationResponseDto("saved", annotations));
    }

    void listAnnotations(final Context ctx) throws IOException {
        final String namespace = requireNamespace(ctx);
        ctx.status(HttpStatus.OK).json(workspace.annotations().list(namespace, ctx.pathParam("docId")));
    }

    void deleteAnnotation(final Context ctx) throws IOException {
        final String namespace = requireNamespace(ctx);
        final String docId = ctx.pathParam("docId");
        final int index = parseInteger("index", ctx.pathParam("index"));
        final Annotation removed = workspace.annotations().deleteAt(namespace, docId, index);
        LOGGER.debug("Deleted annotation {} [{}, {}) on '{}'", index, removed.start(), removed.end(), docId);
        ctx.status(HttpStatus.OK).json(new StatusResponseDto("annotation deleted"));
    }

    private static SaveAnnotationRequestDto readForm(final Context ctx) {
        final String docId = ctx.formParam("docId") != null ? ctx.formParam("docId") : ctx.formParam("doc_id");
        return new SaveAnnotationRequestDto(
            docId,
            parseOptionalInteger("start", ctx.formParam("start")),
            parseOptionalInteger("end", ctx.formParam("end")),
            ctx.formParam("text"),
            ctx.formParam("label"),
            ctx.formParam("rank"));
    }

    private static Integer parseOptionalInteger(final String name, final String value) {
        return value == null || value.isBlank() ? null : parseInteger(name, value);
    }

    private static int parseInteger(final String name, final String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (final NumberFormatException e) {
            throw new InvalidArgumentException("Parameter '" + name + "' must be an integer, got: " + value);
        }
    }
}
