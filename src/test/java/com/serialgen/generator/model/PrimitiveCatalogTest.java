package com.serialgen.generator.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for PrimitiveCatalog classification and the builtin whitelist.
 */
class PrimitiveCatalogTest {

    @ParameterizedTest
    @CsvSource({
        "[]byte, BYTES",
        "string, STRING",
        "float32, FLOAT32",
        "float64, FLOAT64",
        "complex128, COMPLEX128",
        "uint16, UINT16",
        "byte, BYTE",
        "rune, INT32",
        "int, INT",
        "bool, BOOL",
        "interface{}, INTERFACE",
        "any, INTERFACE",
        "time.Time, TIME",
        "time.Duration, DURATION",
        "msgp.Extension, EXTENSION",
        "json.Number, JSON_NUMBER",
        "pkg.Foo, IDENT",
        "Float64, IDENT"
    })
    void testClassify(String spelling, String expected) {
        assertThat(PrimitiveCatalog.classify(spelling)).isEqualTo(Primitive.valueOf(expected));
    }

    @Test
    void testWhitelist() {
        assertThat(PrimitiveCatalog.isWhitelisted("msgp.Raw")).isTrue();
        assertThat(PrimitiveCatalog.isWhitelisted("msgp.Number")).isTrue();
        assertThat(PrimitiveCatalog.isWhitelisted("pkg.Foo")).isFalse();
        assertThat(PrimitiveCatalog.isWhitelisted(null)).isFalse();
    }

    @Test
    void testFloat64Ident() {
        BaseElem elem = PrimitiveCatalog.ident("float64");

        assertThat(elem.getValue()).isEqualTo(Primitive.FLOAT64);
        assertThat(elem.typeName()).isEqualTo("float64");
        assertThat(elem.zeroExpr()).isEqualTo("0");
        assertThat(elem.isConvert()).isFalse();
    }

    @Test
    void testBytesIdent() {
        BaseElem elem = PrimitiveCatalog.ident("[]byte");

        assertThat(elem.getValue()).isEqualTo(Primitive.BYTES);
        assertThat(elem.allowsNil()).isTrue();
        assertThat(elem.zeroExpr()).isEqualTo("nil");
    }

    @Test
    void testQualifiedUnknownIdent() {
        BaseElem elem = PrimitiveCatalog.ident("pkg.Foo");

        assertThat(elem.getValue()).isEqualTo(Primitive.IDENT);
        assertThat(elem.getDeclaredAlias()).isEqualTo("pkg.Foo");
        assertThat(elem.typeName()).isEqualTo("pkg.Foo");
        assertThat(elem.isMustInline()).isTrue();
        assertThat(elem.isConvert()).isFalse();
        assertThat(elem.resolved()).isFalse();
    }

    @Test
    void testWhitelistedIdentIsResolved() {
        BaseElem elem = PrimitiveCatalog.ident("msgp.Raw");

        assertThat(elem.getValue()).isEqualTo(Primitive.IDENT);
        assertThat(elem.resolved()).isTrue();
    }

    @Test
    void testLocalIdentIsPrintable() {
        BaseElem elem = PrimitiveCatalog.ident("Thing");

        assertThat(elem.isMustInline()).isFalse();
        assertThat(elem.complexity()).isEqualTo(1);
        assertThat(elem.resolved()).isFalse();
    }
}
