package com.serialgen.generator.model;

import java.util.Objects;

import com.serialgen.generator.naming.IdentifierGenerator;

import lombok.Getter;

/**
 * Fixed-size array, {@code [size]T}.
 */
@Getter
public final class ArrayElem extends Elem {

    /** Size expression, a literal or a constant name. */
    private final String size;

    /** Index variable name, set by the naming pass. */
    private String index;

    private final Elem elem;

    public ArrayElem(String size, Elem elem) {
        this.size = Objects.requireNonNull(size, "size");
        this.elem = Objects.requireNonNull(elem, "elem");
    }

    private ArrayElem(ArrayElem other) {
        super(other);
        this.size = other.size;
        this.index = other.index;
        this.elem = other.elem.deepCopy();
    }

    @Override
    public void bindName(String path, IdentifierGenerator identifiers) {
        setVarname(path);
        // avoid reusing an index of an enclosing container
        index = identifiers.nextDisjointFrom(path);
        elem.bindName(path + "[" + index + "]", identifiers);
    }

    @Override
    protected String computeTypeName() {
        return "[" + size + "]" + elem.typeName();
    }

    @Override
    public Elem deepCopy() {
        return new ArrayElem(this);
    }

    /**
     * Constant; nesting cost is left to the element.
     */
    @Override
    public int complexity() {
        return 2;
    }

    @Override
    public String zeroExpr() {
        return "";
    }

    @Override
    public <R> R accept(ElemVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
