package com.serialgen.generator.model;

import java.util.Objects;

import com.serialgen.generator.naming.IdentifierGenerator;

import lombok.Getter;

/**
 * Resizable sequence, {@code []T}.
 */
@Getter
public final class SliceElem extends Elem {

    private String index;

    private final Elem elem;

    public SliceElem(Elem elem) {
        this.elem = Objects.requireNonNull(elem, "elem");
    }

    private SliceElem(SliceElem other) {
        super(other);
        this.index = other.index;
        this.elem = other.elem.deepCopy();
    }

    @Override
    public void bindName(String path, IdentifierGenerator identifiers) {
        setVarname(path);
        index = identifiers.next();
        String base = path;
        if (base.startsWith("*")) {
            // pointer-to-slice needs parentheses before indexing
            base = "(" + base + ")";
        }
        elem.bindName(base + "[" + index + "]", identifiers);
    }

    @Override
    protected String computeTypeName() {
        return "[]" + elem.typeName();
    }

    @Override
    public Elem deepCopy() {
        return new SliceElem(this);
    }

    @Override
    public int complexity() {
        return 2;
    }

    @Override
    public String zeroExpr() {
        return "nil";
    }

    @Override
    public boolean allowsNil() {
        Boolean override = getAllowNilOverride();
        return override == null || override;
    }

    @Override
    public boolean setAllowsNil(boolean allow) {
        return applyAllowNilOverride(allow);
    }

    @Override
    public <R> R accept(ElemVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
