package com.serialgen.generator.model;

import java.util.List;

import com.serialgen.generator.naming.IdentifierGenerator;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for PtrElem dereference rules.
 */
class PtrElemTest {

    private final IdentifierGenerator ids = new IdentifierGenerator();

    @Test
    void testPointerToPrimitiveDereferences() {
        BaseElem value = PrimitiveCatalog.ident("float64");
        PtrElem ptr = new PtrElem(value);

        ptr.bindName("z.Thing1", ids);

        assertThat(ptr.getVarname()).isEqualTo("z.Thing1");
        assertThat(value.getVarname()).isEqualTo("*z.Thing1");
        assertThat(ptr.typeName()).isEqualTo("*float64");
        assertThat(ptr.complexity()).isEqualTo(2);
        assertThat(ptr.zeroExpr()).isEqualTo("nil");
        assertThat(ptr.ifZeroExpr()).isEqualTo("z.Thing1 == nil");
        assertThat(ptr.needsInit()).isTrue();
        assertThat(ptr.allowsNil()).isFalse();
    }

    @Test
    void testPointerToStructIsAutomaticallyDereferenced() {
        BaseElem field = PrimitiveCatalog.ident("string");
        StructElem struct = new StructElem(List.of(
                StructField.builder().tag("name").fieldName("Name").elem(field).build()));
        PtrElem ptr = new PtrElem(struct);

        ptr.bindName("z", ids);

        assertThat(struct.getVarname()).isEqualTo("z");
        assertThat(field.getVarname()).isEqualTo("z.Name");
    }

    @Test
    void testPointerToIdentifierKeepsPath() {
        BaseElem value = PrimitiveCatalog.ident("Thing");
        PtrElem ptr = new PtrElem(value);

        ptr.bindName("z.T", ids);

        assertThat(value.getVarname()).isEqualTo("z.T");
        assertThat(ptr.typeName()).isEqualTo("*Thing");
    }

    @Test
    void testPointerToReplacedIdentifierDropsReference() {
        BaseElem value = PrimitiveCatalog.ident("Thing");
        value.setConvert(true);
        value.setNeedsReference(true);
        PtrElem ptr = new PtrElem(value);

        assertThat(ptr.needsInit()).isFalse();

        ptr.bindName("z.T", ids);

        assertThat(value.isNeedsReference()).isFalse();
        assertThat(value.getVarname()).isEqualTo("z.T");
        assertThat(ptr.needsInit()).isTrue();
    }

    @Test
    void testPointerToUnconvertedIdentifierKeepsReference() {
        BaseElem value = PrimitiveCatalog.ident("Thing");
        value.setNeedsReference(true);
        PtrElem ptr = new PtrElem(value);

        ptr.bindName("z.T", ids);

        assertThat(value.isNeedsReference()).isTrue();
        assertThat(value.getVarname()).isEqualTo("&z.T");
    }

    @Test
    void testPointerToExtensionCancelsOut() {
        BaseElem value = PrimitiveCatalog.ident("msgp.Extension");
        PtrElem ptr = new PtrElem(value);

        ptr.bindName("z.E", ids);

        assertThat(value.getVarname()).isEqualTo("z.E");
    }

    @Test
    void testPointerToSliceParenthesizesBeforeIndexing() {
        BaseElem element = PrimitiveCatalog.ident("string");
        SliceElem slice = new SliceElem(element);
        PtrElem ptr = new PtrElem(slice);

        ptr.bindName("z.Tags", ids);

        assertThat(slice.getVarname()).isEqualTo("*z.Tags");
        assertThat(element.getVarname()).isEqualTo("(*z.Tags)[za0001]");
    }

    @Test
    void testNilOverrideIsIneffective() {
        PtrElem ptr = new PtrElem(PrimitiveCatalog.ident("int"));

        assertThat(ptr.setAllowsNil(true)).isFalse();
        assertThat(ptr.allowsNil()).isFalse();
    }

    @Test
    void testDeepCopyDoesNotShareChild() {
        BaseElem value = PrimitiveCatalog.ident("int");
        PtrElem original = new PtrElem(value);
        original.bindName("z.A", ids);

        PtrElem copy = (PtrElem) original.deepCopy();
        copy.bindName("y.B", ids);

        assertThat(copy.getValue()).isNotSameAs(value);
        assertThat(value.getVarname()).isEqualTo("*z.A");
        assertThat(copy.getValue().getVarname()).isEqualTo("*y.B");
    }
}
