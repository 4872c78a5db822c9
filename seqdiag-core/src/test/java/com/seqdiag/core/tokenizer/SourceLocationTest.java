package com.seqdiag.core.tokenizer;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SourceLocation}.
 */
class SourceLocationTest {

    @Test
    void of_firstCharacter_isLineOneColumnOne() {
        assertThat(SourceLocation.of("abc", 0)).isEqualTo(new SourceLocation(1, 1));
    }

    @Test
    void of_offsetAfterNewlines_countsLinesAndColumns() {
        String source = "actor A\ncomponent B\n-> C";

        assertThat(SourceLocation.of(source, source.indexOf("C"))).isEqualTo(new SourceLocation(3, 4));
    }

    @Test
    void of_offsetPastEnd_isClampedToEnd() {
        assertThat(SourceLocation.of("ab\n", 99)).isEqualTo(new SourceLocation(2, 1));
    }

    @Test
    void toString_isLineColonColumn() {
        assertThat(new SourceLocation(4, 7)).hasToString("4:7");
    }
}
