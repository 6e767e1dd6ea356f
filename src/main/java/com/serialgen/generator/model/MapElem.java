package com.serialgen.generator.model;

import java.util.Objects;

import com.serialgen.generator.naming.IdentifierGenerator;

import lombok.Getter;

/**
 * String-keyed map, {@code map[string]T}. Key types other than string are
 * rejected by the front end.
 */
@Getter
public final class MapElem extends Elem {

    private String keyIndex;
    private String valueIndex;

    private final Elem value;

    public MapElem(Elem value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    private MapElem(MapElem other) {
        super(other);
        this.keyIndex = other.keyIndex;
        this.valueIndex = other.valueIndex;
        this.value = other.value.deepCopy();
    }

    @Override
    public void bindName(String path, IdentifierGenerator identifiers) {
        setVarname(path);
        String[] pair = identifiers.nextPair();
        keyIndex = pair[0];
        valueIndex = pair[1];
        value.bindName(valueIndex, identifiers);
    }

    @Override
    protected String computeTypeName() {
        return "map[string]" + value.typeName();
    }

    @Override
    public Elem deepCopy() {
        return new MapElem(this);
    }

    @Override
    public int complexity() {
        return 3;
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
