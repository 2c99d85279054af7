package org.glossa.workspace;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.glossa.workspace.storage.JsonFileKeyValueStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class NamespaceResolverTest {

    @Test
    @DisplayName("Should map a username to the hex SHA-256 of its UTF-8 bytes")
    void namespaceOf_shouldBeHexSha256() {
        // sha256("abc")
        assertThat(NamespaceResolver.namespaceOf("abc"))
            .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    @DisplayName("Should produce distinct, path-safe namespaces for hostile usernames")
    void namespaceOf_shouldBePathSafe() {
        final String traversal = NamespaceResolver.namespaceOf("../../etc");
        final String unicode = NamespaceResolver.namespaceOf("Zoë/ü");

        assertThat(traversal).matches("[0-9a-f]{64}");
        assertThat(unicode).matches("[0-9a-f]{64}");
        assertThat(traversal).isNotEqualTo(unicode);
        assertThat(NamespaceResolver.namespaceOf("alice")).isNotEqualTo(NamespaceResolver.namespaceOf("Alice"));
        assertThat(NamespaceResolver.namespaceOf("alice")).isNotEqualTo(NamespaceResolver.SYSTEM_NAMESPACE);
    }

    @Test
    @DisplayName("Should create the namespace directory idempotently")
    void resolveNamespace_shouldCreateBackingDirectory(@TempDir final Path root) throws Exception {
        final ObjectMapper mapper = new ObjectMapper();
        final JsonFileKeyValueStore<String> labels = new JsonFileKeyValueStore<>(root, "labels", mapper,
            mapper.getTypeFactory().constructType(String.class));
        final NamespaceResolver resolver = new NamespaceResolver(List.of(labels));

        final String first = resolver.resolveNamespace("alice");
        final String second = resolver.resolveNamespace("alice");

        assertThat(first).isEqualTo(second);
        assertThat(Files.isDirectory(root.resolve(first))).isTrue();
    }
}
