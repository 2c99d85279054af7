package org.glossa.node.processes.http.api.export;

import com.typesafe.config.Config;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import org.glossa.node.processes.http.api.WorkspaceApiController;
import org.glossa.node.spi.ServiceRegistry;
import org.glossa.workspace.api.model.ExportArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Annotation downloads. {@code GET json/<docId>} returns the stored list as a pretty-printed
 * JSON file, {@code GET word/<docId>} a {@code .docx} report (404 for unknown documents).
 */
public class ExportController extends WorkspaceApiController {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExportController.class);

    public ExportController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        app.get(route(basePath, "json/<docId>"), this::exportJson);
        app.get(route(basePath, "word/<docId>"), this::exportWord);

        setupExceptionHandlers(app);
    }

    void exportJson(final Context ctx) throws IOException {
        final String namespace = requireNamespace(ctx);
        sendAttachment(ctx, workspace.jsonExporter().export(namespace, ctx.pathParam("docId")));
    }

    void exportWord(final Context ctx) throws IOException {
        final String namespace = requireNamespace(ctx);
        sendAttachment(ctx, workspace.wordExporter().export(namespace, ctx.pathParam("docId")));
    }

    private static void sendAttachment(final Context ctx, final ExportArtifact artifact) {
        LOGGER.debug("Sending export '{}' ({} bytes)", artifact.filename(), artifact.content().length);
        ctx.status(HttpStatus.OK)
            .header("Content-Disposition", contentDisposition(artifact.filename()))
            .contentType(artifact.contentType())
            .result(artifact.content());
    }

    /**
     * Builds an attachment header (RFC 6266) that survives any filename: an ASCII
     * {@code filename} with quotes and backslashes escaped and other characters replaced by
     * {@code _}, followed by the exact name as an RFC 5987 {@code filename*} parameter.
     *
     * @param filename the download name
     * @return the {@code Content-Disposition} header value
     */
    static String contentDisposition(final String filename) {
        final StringBuilder fallback = new StringBuilder(filename.length());
        for (int i = 0; i < filename.length(); i++) {
            final char c = filename.charAt(i);
            if (c == '"' || c == '\\') {
                fallback.append('\\').append(c);
            } else if (c < 0x20 || c > 0x7E) {
                fallback.append('_');
            } else {
                fallback.append(c);
            }
        }
        return "attachment; filename=\"" + fallback + "\"; filename*=UTF-8''" + encodeExtValue(filename);
    }

    private static String encodeExtValue(final String value) {
        final StringBuilder encoded = new StringBuilder();
        for (final byte b : value.getBytes(StandardCharsets.UTF_8)) {
            final int c = b & 0xFF;
            if (isAttrChar(c)) {
                encoded.append((char) c);
            } else {
                encoded.append('%').append(Character.toUpperCase(Character.forDigit(c >> 4, 16)))
                    .append(Character.toUpperCase(Character.forDigit(c & 0xF, 16)));
            }
        }
        return encoded.toString();
    }

    private static boolean isAttrChar(final int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
            || "!#$&+-.^_`|~".indexOf(c) >= 0;
    }
}
