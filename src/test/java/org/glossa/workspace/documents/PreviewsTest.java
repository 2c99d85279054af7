package org.glossa.workspace.documents;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class PreviewsTest {

    @Test
    void of_shouldCollapseWhitespace() {
        assertThat(Previews.of("  first\n\nsecond\t third  ", 120)).isEqualTo("first second third");
    }

    @Test
    void of_shouldTruncateAndMarkLongText() {
        final String text = "x".repeat(130);

        assertThat(Previews.of(text, 120)).isEqualTo("x".repeat(120) + "...");
    }

    @Test
    void of_shouldKeepTextOfExactlyMaxLength() {
        final String text = "y".repeat(120);

        assertThat(Previews.of(text, 120)).isEqualTo(text);
    }

    @Test
    void of_shouldCollapseUnicodeWhitespace() {
        assertThat(Previews.of("\u2003 a\u00a0\u00a0b\u2003\u2003c\u0085d\u202f", 120)).isEqualTo("a b c d");
    }

    @Test
    void of_shouldNotSplitSurrogatePairsWhenTruncating() {
        final String text = "a".repeat(119) + "\uD83D\uDE00 tail";

        final String preview = Previews.of(text, 120);

        assertThat(preview).isEqualTo("a".repeat(119) + "\uD83D\uDE00...");
    }

    @Test
    void of_shouldCountCodePointsAgainstMaxLength() {
        final String text = "\uD83D\uDE00".repeat(120);

        assertThat(Previews.of(text, 120)).isEqualTo(text);
    }
}
