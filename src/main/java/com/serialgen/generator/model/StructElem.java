package com.serialgen.generator.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.serialgen.generator.naming.IdentifierGenerator;

import lombok.Getter;
import lombok.Setter;

/**
 * A record with an ordered list of named, tagged fields.
 */
public final class StructElem extends Elem {

    private final List<StructField> fields;

    /** Encode as an array (tuple) instead of a map. */
    @Getter
    @Setter
    private boolean asTuple;

    public StructElem(List<StructField> fields) {
        this.fields = new ArrayList<>(fields);
    }

    private StructElem(StructElem other) {
        super(other);
        this.asTuple = other.asTuple;
        this.fields = new ArrayList<>(other.fields.size());
        for (StructField field : other.fields) {
            this.fields.add(field.deepCopy());
        }
    }

    public List<StructField> getFields() {
        return Collections.unmodifiableList(fields);
    }

    @Override
    public void bindName(String path, IdentifierGenerator identifiers) {
        setVarname(path);
        for (StructField field : fields) {
            field.getElem().bindName(path + "." + field.getFieldName(), identifiers);
        }
    }

    @Override
    protected String computeTypeName() {
        StringBuilder sb = new StringBuilder("struct{\n");
        for (StructField field : fields) {
            sb.append(field.getFieldName())
              .append(' ')
              .append(field.getElem().typeName())
              .append(' ')
              .append(field.getRawTag() == null ? "" : field.getRawTag())
              .append(";\n");
        }
        sb.append('}');
        return sb.toString();
    }

    @Override
    public Elem deepCopy() {
        return new StructElem(this);
    }

    @Override
    public int complexity() {
        int c = 1;
        for (StructField field : fields) {
            c += field.getElem().complexity();
        }
        return c;
    }

    /**
     * Only named structs have a zero literal.
     */
    @Override
    public String zeroExpr() {
        if (!hasDeclaredAlias()) {
            return "";
        }
        return "(" + typeName() + "{})";
    }

    public boolean hasTagOption(String option) {
        for (StructField field : fields) {
            if (field.hasTagOption(option)) {
                return true;
            }
        }
        return false;
    }

    public int countFieldsWithTagOption(String option) {
        int n = 0;
        for (StructField field : fields) {
            if (field.hasTagOption(option)) {
                n++;
            }
        }
        return n;
    }

    @Override
    public <R> R accept(ElemVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
