package com.serialgen.generator.parser;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for FieldTagParser.
 */
class FieldTagParserTest {

    private final FieldTagParser parser = new FieldTagParser();

    @Test
    void testParseNameAndOptions() {
        FieldTag tag = parser.parse("`msg:\"thing1,omitempty,allownil\"`");

        assertThat(tag.isPresent()).isTrue();
        assertThat(tag.getName()).isEqualTo("thing1");
        assertThat(tag.getParts()).containsExactly("thing1", "omitempty", "allownil");
        assertThat(tag.hasOption("omitempty")).isTrue();
        assertThat(tag.hasOption("thing1")).isFalse();
    }

    @Test
    void testPicksKeyAmongSeveral() {
        FieldTag tag = parser.parse("`json:\"other\" msg:\"body\" yaml:\"x\"`");

        assertThat(tag.getName()).isEqualTo("body");
    }

    @Test
    void testMissingKey() {
        FieldTag tag = parser.parse("`json:\"other\"`");

        assertThat(tag.isPresent()).isFalse();
        assertThat(tag.getName()).isEmpty();
        assertThat(tag.getParts()).isEmpty();
    }

    @Test
    void testNullTag() {
        assertThat(parser.parse(null)).isEqualTo(FieldTag.ABSENT);
    }

    @Test
    void testIgnoredField() {
        assertThat(parser.parse("`msg:\"-\"`").isIgnored()).isTrue();
        assertThat(parser.parse("`msg:\"-,omitempty\"`").isIgnored()).isTrue();
        assertThat(parser.parse("`msg:\"a\"`").isIgnored()).isFalse();
    }

    @Test
    void testEmptyNameKeepsOptions() {
        FieldTag tag = parser.parse("`msg:\",omitempty\"`");

        assertThat(tag.getName()).isEmpty();
        assertThat(tag.hasOption("omitempty")).isTrue();
    }

    @Test
    void testEscapedQuote() {
        FieldTag tag = parser.parse("`msg:\"a\\\"b\"`");

        assertThat(tag.getName()).isEqualTo("a\"b");
    }

    @Test
    void testMalformedTag() {
        assertThat(parser.parse("`msg`").isPresent()).isFalse();
        assertThat(parser.parse("`msg:\"open`").isPresent()).isFalse();
    }

    @Test
    void testCustomKey() {
        FieldTag tag = new FieldTagParser("codec").parse("`msg:\"a\" codec:\"b\"`");

        assertThat(tag.getName()).isEqualTo("b");
    }
}
