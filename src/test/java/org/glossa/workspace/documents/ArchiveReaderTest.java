package org.glossa.workspace.documents;

import org.glossa.workspace.api.errors.InvalidArgumentException;
import org.glossa.workspace.api.model.TextEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ArchiveReaderTest {

    private final ArchiveReader reader = new ArchiveReader(List.of(".txt"));

    static byte[] zip(final String... namesAndContents) throws IOException {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(out)) {
            for (int i = 0; i < namesAndContents.length; i += 2) {
                zip.putNextEntry(new ZipEntry(namesAndContents[i]));
                if (namesAndContents[i + 1] != null) {
                    zip.write(namesAndContents[i + 1].getBytes(StandardCharsets.UTF_8));
                }
                zip.closeEntry();
            }
        }
        return out.toByteArray();
    }

    @Test
    @DisplayName("Should import only text entries, keyed by their full path")
    void readTextEntries_shouldFilterByExtension() throws IOException {
        final byte[] archive = zip(
            "a.txt", "alpha",
            "folder/", null,
            "folder/b.TXT", "beta",
            "image.png", "binary",
            "notes.md", "markdown");

        final List<TextEntry> entries = reader.readTextEntries(archive);

        assertThat(entries).extracting(TextEntry::name).containsExactly("a.txt", "folder/b.TXT");
        assertThat(new String(entries.get(1).content(), StandardCharsets.UTF_8)).isEqualTo("beta");
    }

    @Test
    @DisplayName("Should accept an archive without entries")
    void readTextEntries_shouldAcceptEmptyArchive() throws IOException {
        assertThat(reader.readTextEntries(zip())).isEmpty();
    }

    @Test
    @DisplayName("Should reject data that is not a zip archive")
    void readTextEntries_shouldRejectNonZip() {
        final byte[] notAZip = "just some text".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> reader.readTextEntries(notAZip)).isInstanceOf(InvalidArgumentException.class);
    }

    @Test
    void isTextEntry_shouldHonorConfiguredExtensions() {
        final ArchiveReader custom = new ArchiveReader(List.of(".TXT", ".md"));

        assertThat(custom.isTextEntry("README.MD")).isTrue();
        assertThat(custom.isTextEntry("a.txt")).isTrue();
        assertThat(custom.isTextEntry("a.txt.gz")).isFalse();
    }
}
