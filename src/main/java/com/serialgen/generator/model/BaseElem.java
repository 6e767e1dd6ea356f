package com.serialgen.generator.model;

import com.serialgen.generator.naming.IdentifierGenerator;

import lombok.Getter;
import lombok.Setter;

/**
 * An element represented by a primitive runtime type, possibly through a
 * conversion shim, or an identifier that is not decomposed further.
 */
@Getter
public final class BaseElem extends Elem {

    private final Primitive value;

    /** Method used to shim. */
    @Setter
    private ShimMode shimMode = ShimMode.CAST;

    /** Conversion to the base type, or {@code null}. */
    @Setter
    private String shimToBase;

    /** Conversion from the base type, or {@code null}. */
    @Setter
    private String shimFromBase;

    /** Explicit conversion required around reads and writes. */
    @Setter
    private boolean convert;

    /** Allow zero-copy byte slices when decoding. */
    @Setter
    private boolean zeroCopy;

    /** Not printable as a standalone step; must be inlined. */
    private boolean mustInline;

    /** Address must be taken before access. */
    @Setter
    private boolean needsReference;

    public BaseElem(Primitive value) {
        this.value = value;
    }

    private BaseElem(BaseElem other) {
        super(other);
        this.value = other.value;
        this.shimMode = other.shimMode;
        this.shimToBase = other.shimToBase;
        this.shimFromBase = other.shimFromBase;
        this.convert = other.convert;
        this.zeroCopy = other.zeroCopy;
        this.mustInline = other.mustInline;
        this.needsReference = other.needsReference;
    }

    public boolean isPrintable() {
        return !mustInline;
    }

    @Override
    public void setAlias(String typeName) {
        super.setAlias(typeName);
        if (value != Primitive.IDENT) {
            convert = true;
        }
        if (typeName != null && typeName.contains(".")) {
            mustInline = true;
        }
    }

    @Override
    public void bindName(String path, IdentifierGenerator identifiers) {
        // extensions whose parents are not pointers need to be explicitly referenced
        if (value == Primitive.EXTENSION || needsReference) {
            if (path.startsWith("*")) {
                setVarname(path.substring(1));
            } else {
                setVarname("&" + path);
            }
            return;
        }
        setVarname(path);
    }

    @Override
    protected String computeTypeName() {
        return baseType();
    }

    /**
     * Used if {@code convert} is set: {@code tmp = toBase(varname)}.
     */
    public String toBase() {
        if (shimToBase != null && !shimToBase.isEmpty()) {
            return shimToBase;
        }
        return baseType();
    }

    /**
     * Used if {@code convert} is set: {@code varname = fromBase(tmp)}.
     */
    public String fromBase() {
        if (shimFromBase != null && !shimFromBase.isEmpty()) {
            return shimFromBase;
        }
        return typeName();
    }

    /**
     * Name of the runtime read/write method suffix, e.g. {@code Float64}.
     */
    public String baseName() {
        return value.getBaseName();
    }

    /**
     * Type spelling of the primitive, ignoring any declared alias except for
     * identifiers, whose alias is their only spelling.
     */
    public String baseType() {
        if (value == Primitive.IDENT) {
            if (!hasDeclaredAlias()) {
                throw new IllegalStateException("Identifier element has no type name");
            }
            return getDeclaredAlias();
        }
        return value.getTypeSpelling();
    }

    @Override
    public Elem deepCopy() {
        return new BaseElem(this);
    }

    @Override
    public int complexity() {
        if (convert && !mustInline) {
            return 2;
        }
        // non-printable elements report 1 so that they get inlined
        return 1;
    }

    /**
     * Whether this is a primitive or a builtin type already providing the
     * serialization methods.
     */
    public boolean resolved() {
        if (value == Primitive.IDENT) {
            return PrimitiveCatalog.isWhitelisted(typeName());
        }
        return true;
    }

    @Override
    public String zeroExpr() {
        if (value.isNumeric()) {
            return "0";
        }
        return switch (value) {
            case BYTES, INTERFACE -> "nil";
            case STRING, JSON_NUMBER -> "\"\"";
            case COMPLEX64, COMPLEX128 -> "complex(0,0)";
            case BOOL -> "false";
            case TIME -> "(time.Time{})";
            default -> "";
        };
    }

    @Override
    public boolean allowsNil() {
        Boolean override = getAllowNilOverride();
        if (override == null) {
            return value == Primitive.BYTES;
        }
        return override;
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
