package com.serialgen.generator.parser;

import com.serialgen.generator.model.ArrayElem;
import com.serialgen.generator.model.BaseElem;
import com.serialgen.generator.model.Elem;
import com.serialgen.generator.model.MapElem;
import com.serialgen.generator.model.Primitive;
import com.serialgen.generator.model.PtrElem;
import com.serialgen.generator.model.SliceElem;
import com.serialgen.generator.model.StructElem;
import com.serialgen.generator.model.StructField;
import com.serialgen.generator.parser.exception.TypeExpressionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TypeExprTokenizer and TypeExpressionParser.
 */
class TypeExpressionParserTest {

    @Test
    void testParseNestedContainers() {
        Elem elem = TypeExpressionParser.parse("map[string][]*float64");

        assertThat(elem).isInstanceOf(MapElem.class);
        Elem slice = ((MapElem) elem).getValue();
        assertThat(slice).isInstanceOf(SliceElem.class);
        Elem ptr = ((SliceElem) slice).getElem();
        assertThat(ptr).isInstanceOf(PtrElem.class);
        Elem leaf = ((PtrElem) ptr).getValue();
        assertThat(leaf).isInstanceOf(BaseElem.class);
        assertThat(((BaseElem) leaf).getValue()).isEqualTo(Primitive.FLOAT64);
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "float64",
        "*string",
        "[]byte",
        "[][]byte",
        "[16]uint8",
        "[N]int",
        "map[string]*pkg.Thing",
        "[]map[string][]time.Duration",
        "interface{}",
        "*json.Number"
    })
    void testTypeNameMatchesSpelling(String expression) {
        assertThat(TypeExpressionParser.parse(expression).typeName()).isEqualTo(expression);
    }

    @Test
    void testByteSliceIsPrimitive() {
        Elem bytes = TypeExpressionParser.parse("[]byte");
        Elem slices = TypeExpressionParser.parse("[][]byte");

        assertThat(bytes).isInstanceOf(BaseElem.class);
        assertThat(((BaseElem) bytes).getValue()).isEqualTo(Primitive.BYTES);
        assertThat(slices).isInstanceOf(SliceElem.class);
        assertThat(((SliceElem) slices).getElem()).isInstanceOf(BaseElem.class);
    }

    @Test
    void testArraySize() {
        Elem elem = TypeExpressionParser.parse("[MaxItems]string");

        assertThat(elem).isInstanceOf(ArrayElem.class);
        assertThat(((ArrayElem) elem).getSize()).isEqualTo("MaxItems");
    }

    @Test
    void testAnyIsInterface() {
        Elem elem = TypeExpressionParser.parse("any");

        assertThat(((BaseElem) elem).getValue()).isEqualTo(Primitive.INTERFACE);
        assertThat(elem.typeName()).isEqualTo("interface{}");
    }

    @Test
    void testStructWithTags() {
        String source = """
                struct {
                    Thing1 *float64 `msg:"thing1"`
                    Body   []byte   `msg:"body,omitempty"`
                    Secret string   `msg:"-"`
                    Plain  int
                }
                """;

        Elem elem = TypeExpressionParser.parse(source);

        assertThat(elem).isInstanceOf(StructElem.class);
        StructElem struct = (StructElem) elem;
        assertThat(struct.getFields()).extracting(StructField::getFieldName)
                .containsExactly("Thing1", "Body", "Plain");

        StructField body = struct.getFields().get(1);
        assertThat(body.getTag()).isEqualTo("body");
        assertThat(body.getRawTag()).isEqualTo("`msg:\"body,omitempty\"`");
        assertThat(body.hasTagOption("omitempty")).isTrue();

        StructField plain = struct.getFields().get(2);
        assertThat(plain.getTag()).isEqualTo("Plain");
        assertThat(plain.getTagParts()).isEmpty();
        assertThat(plain.getRawTag()).isNull();

        assertThat(struct.countFieldsWithTagOption("omitempty")).isEqualTo(1);
    }

    @Test
    void testEmptyTagNameFallsBackToFieldName() {
        StructElem struct = (StructElem) TypeExpressionParser.parse("struct{ Count int `msg:\",omitempty\"` }");

        assertThat(struct.getFields().get(0).getTag()).isEqualTo("Count");
        assertThat(struct.hasTagOption("omitempty")).isTrue();
    }

    @Test
    void testAllowNilOption() {
        StructElem struct = (StructElem) TypeExpressionParser.parse(
                "struct{ Name string `msg:\"name,allownil\"`; Tags []string `msg:\"tags\"`; P *int `msg:\"p,allownil\"` }");

        assertThat(struct.getFields().get(0).getElem().allowsNil()).isTrue();
        assertThat(struct.getFields().get(1).getElem().allowsNil()).isTrue();
        assertThat(struct.getFields().get(2).getElem().allowsNil()).isFalse();
    }

    @Test
    void testZeroCopyOption() {
        StructElem struct = (StructElem) TypeExpressionParser.parse(
                "struct{ Body []byte `msg:\"body,zerocopy\"`; Name string `msg:\"name,zerocopy\"` }");

        assertThat(((BaseElem) struct.getFields().get(0).getElem()).isZeroCopy()).isTrue();
        assertThat(((BaseElem) struct.getFields().get(1).getElem()).isZeroCopy()).isFalse();
    }

    @Test
    void testNonStringMapKeyRejected() {
        assertThatThrownBy(() -> TypeExpressionParser.parse("map[int]string"))
                .isInstanceOf(TypeExpressionException.class)
                .hasMessageContaining("Map keys must be string");
    }

    @Test
    void testErrorPosition() {
        TypeExpressionException e = catchThrowableOfType(
                () -> TypeExpressionParser.parse("struct {\n  A int\n  B ]\n}"),
                TypeExpressionException.class);

        assertThat(e.getLine()).isEqualTo(3);
        assertThat(e.getColumn()).isEqualTo(5);
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "",
        "   ",
        "*",
        "[]",
        "map[string]",
        "float64 extra",
        "struct{ A int",
        "struct{ A int B int }",
        "struct{ pkg.Embedded }",
        "struct{ A int `msg:\"a\" }",
        "interface",
        "[3.5]int"
    })
    void testMalformedExpressions(String expression) {
        assertThatThrownBy(() -> TypeExpressionParser.parse(expression))
                .isInstanceOf(TypeExpressionException.class);
    }

    @Test
    void testUnresolvedIdentifierIsKept() {
        BaseElem elem = (BaseElem) TypeExpressionParser.parse("pkg.Foo");

        assertThat(elem.getValue()).isEqualTo(Primitive.IDENT);
        assertThat(elem.resolved()).isFalse();
    }
}
