package org.minilang.lexer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class SourceCursorTest {

    @Test
    void peekDoesNotConsume() {
        SourceCursor cursor = new SourceCursor("ab");

        assertThat(cursor.peek()).isEqualTo('a');
        assertThat(cursor.peek()).isEqualTo('a');
        assertThat(cursor.position()).isEqualTo(SourcePosition.START);
    }

    @Test
    void matchConsumesOnlyOnHit() {
        SourceCursor cursor = new SourceCursor(":=");
        cursor.advance();

        assertThat(cursor.match('>')).isFalse();
        assertThat(cursor.peek()).isEqualTo('=');
        assertThat(cursor.match('=')).isTrue();
        assertThat(cursor.isAtEnd()).isTrue();
        assertThat(cursor.peek()).isEqualTo(SourceCursor.EOF);
    }

    @Test
    void newlineMovesToFirstColumnOfNextLine() {
        SourceCursor cursor = new SourceCursor("a\n\tb");
        cursor.advance();
        cursor.advance();

        assertThat(cursor.position()).isEqualTo(new SourcePosition(2, 2, 1));
        cursor.advance();
        assertThat(cursor.position()).isEqualTo(new SourcePosition(3, 2, 2));
    }

    @Test
    void supplementaryCodePointIsOneStep() {
        SourceCursor cursor = new SourceCursor("😀!");
        int mark = cursor.mark();

        assertThat(cursor.advance()).isEqualTo(0x1F600);
        assertThat(cursor.textSince(mark)).isEqualTo("😀");
        assertThat(cursor.position()).isEqualTo(new SourcePosition(1, 1, 2));
        assertThat(cursor.peek()).isEqualTo('!');
    }

    @Test
    void advancePastEndFails() {
        SourceCursor cursor = new SourceCursor("");

        assertThatThrownBy(cursor::advance).isInstanceOf(IllegalStateException.class);
    }
}
