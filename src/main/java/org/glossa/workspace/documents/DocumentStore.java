package org.glossa.workspace.documents;

import org.glossa.workspace.api.errors.InvalidArgumentException;
import org.glossa.workspace.api.errors.NotFoundException;
import org.glossa.workspace.api.model.Document;
import org.glossa.workspace.api.model.TextEntry;
import org.glossa.workspace.api.storage.IKeyValueStore;
import org.glossa.workspace.storage.NamespaceLocks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Uploaded documents of each namespace, keyed by docId (the uploaded filename).
 * <p>
 * Uploads overwrite a document with the same docId as a whole; documents are never partially
 * updated. Raw bytes are decoded as UTF-8 and malformed sequences are dropped.
 */
public class DocumentStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentStore.class);

    private final IKeyValueStore<Document> documents;
    private final NamespaceLocks locks;
    private final ArchiveReader archiveReader;
    private final int previewLength;

    public DocumentStore(final IKeyValueStore<Document> documents, final NamespaceLocks locks,
                         final ArchiveReader archiveReader, final int previewLength) {
        this.documents = documents;
        this.locks = locks;
        this.archiveReader = archiveReader;
        this.previewLength = previewLength;
    }

    /**
     * Stores a single uploaded file.
     *
     * @param namespace the caller's namespace
     * @param entry     filename and raw content
     * @return the stored document
     * @throws IOException if the store cannot be written
     */
    public Document put(final String namespace, final TextEntry entry) throws IOException {
        return putAll(namespace, List.of(entry)).get(0);
    }

    /**
     * Stores several files with a single write. Later entries win over earlier ones with the
     * same name.
     *
     * @param namespace the caller's namespace
     * @param entries   filenames and raw contents
     * @return the stored documents, in input order
     * @throws IOException if the store cannot be written
     */
    public List<Document> putAll(final String namespace, final List<TextEntry> entries) throws IOException {
        final List<Document> created = new ArrayList<>(entries.size());
        for (final TextEntry entry : entries) {
            created.add(toDocument(entry));
        }
        if (created.isEmpty()) {
            return created;
        }

        locks.withLock(namespace, documents.getStoreName(), () -> {
            final Map<String, Document> all = documents.load(namespace);
            for (final Document document : created) {
                all.put(document.docId(), document);
            }
            documents.save(namespace, all);
            return null;
        });
        LOGGER.debug("Stored {} document(s) in namespace {}", created.size(), namespace);
        return created;
    }

    /**
     * Imports every plain-text entry of a zip archive as its own document.
     *
     * @param namespace the caller's namespace
     * @param archive   raw zip bytes
     * @return the imported documents
     * @throws InvalidArgumentException if the payload is not a zip archive
     * @throws IOException              if the store cannot be written
     */
    public List<Document> importArchive(final String namespace, final byte[] archive) throws IOException {
        return putAll(namespace, archiveReader.readTextEntries(archive));
    }

    /**
     * @param namespace the caller's namespace
     * @return all documents in insertion order
     * @throws IOException if the store cannot be read
     */
    public List<Document> list(final String namespace) throws IOException {
        return new ArrayList<>(documents.load(namespace).values());
    }

    /**
     * @param namespace the caller's namespace
     * @param docId     the document key
     * @return the document
     * @throws NotFoundException if the document does not exist
     * @throws IOException       if the store cannot be read
     */
    public Document get(final String namespace, final String docId) throws IOException {
        final Document document = documents.load(namespace).get(docId);
        if (document == null) {
            throw new NotFoundException("Document not found: " + docId);
        }
        return document;
    }

    /**
     * @param namespace the caller's namespace
     * @param docId     the document key
     * @return the full text of the document
     * @throws NotFoundException if the document does not exist
     * @throws IOException       if the store cannot be read
     */
    public String getText(final String namespace, final String docId) throws IOException {
        return get(namespace, docId).text();
    }

    /**
     * Checks whether a document exists.
     *
     * @param namespace the caller's namespace
     * @param docId     the document key
     * @return true if present
     * @throws IOException if the store cannot be read
     */
    public boolean exists(final String namespace, final String docId) throws IOException {
        return documents.load(namespace).containsKey(docId);
    }

    private Document toDocument(final TextEntry entry) {
        if (entry.name() == null || entry.name().isBlank()) {
            throw new InvalidArgumentException("Uploaded file has no name");
        }
        final String text = decodeLenient(entry.content());
        return new Document(entry.name(), entry.name(), text, Previews.of(text, previewLength));
    }

    static String decodeLenient(final byte[] content) {
        final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.IGNORE)
            .onUnmappableCharacter(CodingErrorAction.IGNORE);
        try {
            return decoder.decode(ByteBuffer.wrap(content)).toString();
        } catch (final CharacterCodingException e) {
            // Unreachable with IGNORE actions
            throw new IllegalStateException("UTF-8 decoding failed", e);
        }
    }
}
