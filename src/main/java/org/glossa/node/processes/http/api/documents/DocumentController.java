package org.glossa.node.processes.http.api.documents;

import com.typesafe.config.Config;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import io.javalin.http.UploadedFile;
import org.glossa.node.processes.http.api.WorkspaceApiController;
import org.glossa.node.processes.http.api.documents.dto.BatchUploadResponseDto;
import org.glossa.node.processes.http.api.documents.dto.DocumentSummaryDto;
import org.glossa.node.processes.http.api.documents.dto.DocumentTextDto;
import org.glossa.node.processes.http.api.documents.dto.UploadResponseDto;
import org.glossa.node.spi.ServiceRegistry;
import org.glossa.workspace.api.errors.InvalidArgumentException;
import org.glossa.workspace.api.model.Document;
import org.glossa.workspace.api.model.TextEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Document upload and retrieval for the authenticated user.
 * <p>
 * Routes below the base path:
 * <ul>
 *   <li>{@code GET} (base path itself) → summaries of all documents</li>
 *   <li>{@code GET <docId>} → full text, 404 if unknown</li>
 *   <li>{@code POST upload} → multipart part {@code file}</li>
 *   <li>{@code POST upload-zip} → multipart part {@code file} holding a zip archive</li>
 *   <li>{@code POST upload-folder} → multipart parts {@code files}</li>
 * </ul>
 */
public class DocumentController extends WorkspaceApiController {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentController.class);
    private static final String UPLOADED = "uploaded";

    public DocumentController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        app.post(route(basePath, "upload"), this::upload);
        app.post(route(basePath, "upload-zip"), this::uploadZip);
        app.post(route(basePath, "upload-folder"), this::uploadFolder);
        app.get(route(basePath, ""), this::listDocuments);
        app.get(route(basePath, "<docId>"), this::getDocument);

        setupExceptionHandlers(app);
    }

    void upload(final Context ctx) throws IOException {
        final String namespace = requireNamespace(ctx);
        final UploadedFile file = requireFile(ctx, "file");
        final Document document = workspace.documents().put(namespace, toEntry(file));
        LOGGER.info("Uploaded document '{}' ({} chars)", document.docId(), document.text().length());
        ctx.status(HttpStatus.OK).json(new UploadResponseDto(UPLOADED, document.docId()));
    }

    void uploadZip(final Context ctx) throws IOException {
        final String namespace = requireNamespace(ctx);
        final UploadedFile archive = requireFile(ctx, "file");
        final List<Document> documents = workspace.documents().importArchive(namespace, readContent(archive));
        LOGGER.info("Imported {} document(s) from archive '{}'", documents.size(), archive.filename());
        ctx.status(HttpStatus.OK).json(new BatchUploadResponseDto(UPLOADED, docIds(documents)));
    }

    void uploadFolder(final Context ctx) throws IOException {
        final String namespace = requireNamespace(ctx);
        final List<UploadedFile> files = ctx.uploadedFiles("files");
        if (files.isEmpty()) {
            throw new InvalidArgumentException("Missing multipart part 'files'");
        }
        final List<TextEntry> entries = new ArrayList<>(files.size());
        for (final UploadedFile file : files) {
            entries.add(toEntry(file));
        }
        final List<Document> documents = workspace.documents().putAll(namespace, entries);
        LOGGER.info("Uploaded {} document(s) from folder", documents.size());
        ctx.status(HttpStatus.OK).json(new BatchUploadResponseDto(UPLOADED, docIds(documents)));
    }

    void listDocuments(final Context ctx) throws IOException {
        final String namespace = requireNamespace(ctx);
        final List<DocumentSummaryDto> summaries = workspace.documents().list(namespace).stream()
            .map(DocumentSummaryDto::from)
            .collect(Collectors.toList());
        ctx.status(HttpStatus.OK).json(summaries);
    }

    void getDocument(final Context ctx) throws IOException {
        final String namespace = requireNamespace(ctx);
        final String docId = ctx.pathParam("docId");
        ctx.status(HttpStatus.OK).json(new DocumentTextDto(docId, workspace.documents().getText(namespace, docId)));
    }

    private static UploadedFile requireFile(final Context ctx, final String partName) {
        final UploadedFile file = ctx.uploadedFile(partName);
        if (file == null) {
            throw new InvalidArgumentException("Missing multipart part '" + partName + "'");
        }
        return file;
    }

    private static TextEntry toEntry(final UploadedFile file) throws IOException {
        return new TextEntry(file.filename(), readContent(file));
    }

    private static byte[] readContent(final UploadedFile file) throws IOException {
        try (InputStream in = file.content()) {
            return in.readAllBytes();
        }
    }

    private static List<String> docIds(final List<Document> documents) {
        return documents.stream().map(Document::docId).collect(Collectors.toList());
    }
}
