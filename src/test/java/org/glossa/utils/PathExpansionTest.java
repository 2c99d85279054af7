package org.glossa.utils;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class PathExpansionTest {

    @AfterEach
    void tearDown() {
        System.clearProperty("glossa.test.dir");
    }

    @Test
    void expandPath_shouldReturnPlainPathsUnchanged() {
        assertThat(PathExpansion.expandPath("/var/lib/glossa")).isEqualTo("/var/lib/glossa");
        assertThat(PathExpansion.expandPath(null)).isNull();
    }

    @Test
    void expandPath_shouldResolveSystemProperties() {
        System.setProperty("glossa.test.dir", "/tmp/glossa");

        assertThat(PathExpansion.expandPath("${glossa.test.dir}/data/${glossa.test.dir}"))
            .isEqualTo("/tmp/glossa/data//tmp/glossa");
    }

    @Test
    void expandPath_shouldRejectUndefinedVariables() {
        assertThatThrownBy(() -> PathExpansion.expandPath("${glossa.undefined.variable}/data"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("glossa.undefined.variable");
    }

    @Test
    void expandPath_shouldRejectUnclosedVariables() {
        assertThatThrownBy(() -> PathExpansion.expandPath("${user.home/data"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unclosed");
    }
}
