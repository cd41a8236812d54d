package io.eventsource.core;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class FieldParserTest {

    @Test
    void commentHasEmptyKey() {
        Field f = parse(":bar");
        assertThat(f.name()).isEqualTo(Field.Name.COMMENT);
        assertThat(f.key()).isEmpty();
        assertThat(f.value()).isEqualTo("bar");
    }

    @Test
    void onlyOneLeadingSpaceIsStripped() {
        Field f = parse("foo:  bar");
        assertThat(f.key()).isEqualTo("foo");
        assertThat(f.value()).isEqualTo(" bar");
    }

    @Test
    void valueWithAndWithoutSpace() {
        assertThat(parse("foo: bar").value()).isEqualTo("bar");
        assertThat(parse("foo:bar").value()).isEqualTo("bar");
    }

    @Test
    void emptyValues() {
        Field spaced = parse("foo: ");
        assertThat(spaced.hasValue()).isTrue();
        assertThat(spaced.value()).isEmpty();

        Field bare = parse("foo:");
        assertThat(bare.hasValue()).isTrue();
        assertThat(bare.value()).isEmpty();
    }

    @Test
    void lineWithoutColonIsAllKey() {
        Field f = parse("foo");
        assertThat(f.key()).isEqualTo("foo");
        assertThat(f.hasValue()).isFalse();
        assertThat(f.value()).isNull();
        assertThat(f.valueLength()).isZero();
    }

    @Test
    void splitsOnFirstColonOnly() {
        Field f = parse("data: a:b: c");
        assertThat(f.name()).isEqualTo(Field.Name.DATA);
        assertThat(f.value()).isEqualTo("a:b: c");
    }

    @Test
    void classifiesKnownKeys() {
        assertThat(parse("id: 1").name()).isEqualTo(Field.Name.ID);
        assertThat(parse("event: x").name()).isEqualTo(Field.Name.EVENT);
        assertThat(parse("data: x").name()).isEqualTo(Field.Name.DATA);
        assertThat(parse("retry: 10").name()).isEqualTo(Field.Name.RETRY);
        assertThat(parse("data").name()).isEqualTo(Field.Name.DATA);
    }

    @Test
    void keysAreCaseSensitive() {
        assertThat(parse("Data: x").name()).isEqualTo(Field.Name.UNKNOWN);
        assertThat(parse("ids: x").name()).isEqualTo(Field.Name.UNKNOWN);
        assertThat(parse(" data: x").name()).isEqualTo(Field.Name.UNKNOWN);
    }

    @Test
    void parsesWithinLargerArray() {
        byte[] bytes = "xxid: 7yy".getBytes(StandardCharsets.UTF_8);
        Field f = FieldParser.parse(bytes, 2, 5, new Field());
        assertThat(f.name()).isEqualTo(Field.Name.ID);
        assertThat(f.value()).isEqualTo("7");
    }

    private static Field parse(String line) {
        byte[] bytes = line.getBytes(StandardCharsets.UTF_8);
        return FieldParser.parse(bytes, 0, bytes.length, new Field());
    }
}
