package org.glossa.workspace.labels;

import org.glossa.workspace.api.errors.InvalidArgumentException;
import org.glossa.workspace.api.errors.NotFoundException;
import org.glossa.workspace.storage.InMemoryKeyValueStore;
import org.glossa.workspace.storage.NamespaceLocks;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

@Tag("unit")
class LabelStoreTest {

    private final LabelStore store = new LabelStore(new InMemoryKeyValueStore<>("labels"), new NamespaceLocks());

    @Test
    void set_shouldUpsertColors() throws Exception {
        store.set("ns", "PER", "#ff0000");
        store.set("ns", "LOC", "green");
        store.set("ns", "PER", "#0000ff");

        assertThat(store.list("ns")).containsExactly(entry("PER", "#0000ff"), entry("LOC", "green"));
    }

    @Test
    void set_shouldRejectBlankNameOrMissingColor() {
        assertThatThrownBy(() -> store.set("ns", "", "red")).isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> store.set("ns", "PER", null)).isInstanceOf(InvalidArgumentException.class);
    }

    @Test
    void remove_shouldDeleteExistingLabel() throws Exception {
        store.set("ns", "PER", "red");

        store.remove("ns", "PER");

        assertThat(store.list("ns")).isEmpty();
    }

    @Test
    void remove_shouldFailForUnknownLabel() {
        assertThatThrownBy(() -> store.remove("ns", "PER")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void list_shouldBeScopedToNamespace() throws Exception {
        store.set("alice", "PER", "red");

        assertThat(store.list("bob")).isEmpty();
    }
}
