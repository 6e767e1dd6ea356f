package com.serialgen.generator.model;

import java.util.Objects;

import com.serialgen.generator.naming.IdentifierGenerator;

import lombok.Getter;

/**
 * Pointer to another element.
 */
@Getter
public final class PtrElem extends Elem {

    private final Elem value;

    public PtrElem(Elem value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    private PtrElem(PtrElem other) {
        super(other);
        this.value = other.value.deepCopy();
    }

    @Override
    public void bindName(String path, IdentifierGenerator identifiers) {
        setVarname(path);

        if (value instanceof StructElem struct) {
            // struct fields are dereferenced automatically
            struct.bindName(path, identifiers);
            return;
        }
        if (value instanceof BaseElem base && base.getValue() == Primitive.IDENT) {
            // a replaced identifier already sits behind this pointer, no extra address-of
            if (base.isConvert()) {
                base.setNeedsReference(false);
            }
            base.bindName(path, identifiers);
            return;
        }
        value.bindName("*" + path, identifiers);
    }

    @Override
    protected String computeTypeName() {
        return "*" + value.typeName();
    }

    @Override
    public Elem deepCopy() {
        return new PtrElem(this);
    }

    @Override
    public int complexity() {
        return 1 + value.complexity();
    }

    /**
     * Whether the pointee must be allocated before decoding into it.
     */
    public boolean needsInit() {
        return !(value instanceof BaseElem base && base.isNeedsReference());
    }

    @Override
    public String zeroExpr() {
        return "nil";
    }

    @Override
    public <R> R accept(ElemVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
