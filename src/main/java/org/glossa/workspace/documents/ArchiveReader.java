package org.glossa.workspace.documents;

import org.glossa.workspace.api.errors.InvalidArgumentException;
import org.glossa.workspace.api.model.TextEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipInputStream;

/**
 * Enumerates the plain-text entries of a zip archive.
 * <p>
 * An entry counts as plain text when it is not a directory and its name ends with one of the
 * configured extensions (case-insensitive). Everything else is skipped without error.
 */
public class ArchiveReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(ArchiveReader.class);

    private final List<String> textExtensions;

    /**
     * @param textExtensions accepted name suffixes, e.g. {@code ".txt"}
     */
    public ArchiveReader(final List<String> textExtensions) {
        this.textExtensions = textExtensions.stream()
            .map(ext -> ext.toLowerCase(Locale.ROOT))
            .toList();
    }

    /**
     * Reads all plain-text entries from an archive.
     *
     * @param archive the raw zip bytes
     * @return the text entries, in archive order, keyed by their full path inside the archive
     * @throws InvalidArgumentException if the payload is not a readable zip archive
     */
    public List<TextEntry> readTextEntries(final byte[] archive) {
        final List<TextEntry> entries = new ArrayList<>();
        int skipped = 0;
        boolean sawEntry = false;

        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(archive))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                sawEntry = true;
                if (!entry.isDirectory() && isTextEntry(entry.getName())) {
                    entries.add(new TextEntry(entry.getName(), zip.readAllBytes()));
                } else {
                    skipped++;
                }
                zip.closeEntry();
            }
        } catch (final ZipException e) {
            throw new InvalidArgumentException("Uploaded file is not a valid zip archive: " + e.getMessage());
        } catch (final IOException e) {
            // In-memory stream: only a malformed archive can fail here
            throw new InvalidArgumentException("Uploaded archive could not be read: " + e.getMessage());
        }

        if (!sawEntry && archive.length > 0 && !looksLikeEmptyZip(archive)) {
            throw new InvalidArgumentException("Uploaded file is not a valid zip archive");
        }

        LOGGER.debug("Archive contained {} text entries, skipped {}", entries.size(), skipped);
        return entries;
    }

    boolean isTextEntry(final String name) {
        final String lower = name.toLowerCase(Locale.ROOT);
        for (final String extension : textExtensions) {
            if (lower.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }

    // An archive without entries consists only of the end-of-central-directory record "PK\5\6".
    private static boolean looksLikeEmptyZip(final byte[] archive) {
        return archive.length >= 4 && archive[0] == 'P' && archive[1] == 'K' && archive[2] == 5 && archive[3] == 6;
    }
}
