package com.serialgen.generator.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.serialgen.generator.naming.IdentifierGenerator;

/**
 * A node of the type declaration tree.
 *
 * Consider the declaration
 * <pre>
 * type Marshaler struct {
 *     Thing1 *float64 `msg:"thing1"`
 *     Body   []byte   `msg:"body"`
 * }
 * </pre>
 * A front end builds a {@link PtrElem} around a {@link StructElem} with two
 * fields: a {@code PtrElem} wrapping a {@code FLOAT64} {@link BaseElem} and a
 * {@code BYTES} {@code BaseElem}. Binding the root to {@code z} names the
 * leaves {@code *z.Thing1} and {@code z.Body}.
 *
 * The variant set is closed; behaviour that differs per variant outside this
 * package goes through {@link ElemVisitor}.
 */
public abstract sealed class Elem permits BaseElem, PtrElem, StructElem, ArrayElem, SliceElem, MapElem {
    private static final Logger log = LoggerFactory.getLogger(Elem.class);

    private String varname;
    private String declaredAlias;
    private String cachedTypeName;
    private boolean alwaysPointerReceiver;
    private Boolean allowNilOverride;

    protected Elem() {
    }

    protected Elem(Elem other) {
        this.varname = other.varname;
        this.declaredAlias = other.declaredAlias;
        this.cachedTypeName = other.cachedTypeName;
        this.alwaysPointerReceiver = other.alwaysPointerReceiver;
        this.allowNilOverride = other.allowNilOverride;
    }

    /**
     * Set this node's access path and recursively name every child.
     * Should only be called on the root of a tree.
     */
    public abstract void bindName(String path, IdentifierGenerator identifiers);

    /**
     * Access path of this node, or {@code null} before the naming pass.
     */
    public String getVarname() {
        return varname;
    }

    protected void setVarname(String varname) {
        this.varname = varname;
    }

    /**
     * Declare the type name of this node, overriding the computed one.
     */
    public void setAlias(String typeName) {
        this.declaredAlias = typeName;
    }

    public String getDeclaredAlias() {
        return declaredAlias;
    }

    public boolean hasDeclaredAlias() {
        return declaredAlias != null && !declaredAlias.isEmpty();
    }

    /**
     * Canonical type name, e.g. {@code map[string]float64}, or the declared
     * alias. Computed once and cached.
     */
    public final String typeName() {
        if (hasDeclaredAlias()) {
            return declaredAlias;
        }
        if (cachedTypeName == null) {
            cachedTypeName = computeTypeName();
        }
        return cachedTypeName;
    }

    protected abstract String computeTypeName();

    /**
     * Fully independent copy of this subtree.
     */
    public abstract Elem deepCopy();

    /**
     * Relative cost hint, always at least 1.
     */
    public abstract int complexity();

    /**
     * Zero value expression usable for assignment, or {@code ""} when this
     * node has none.
     */
    public abstract String zeroExpr();

    /**
     * Expression testing this node against its zero value for {@code omitempty},
     * or {@code ""} when unsupported.
     */
    public String ifZeroExpr() {
        String zero = zeroExpr();
        if (zero.isEmpty()) {
            return "";
        }
        return varname + " == " + zero;
    }

    /**
     * Whether the value may be nil without being checked automatically.
     */
    public boolean allowsNil() {
        return false;
    }

    /**
     * Override {@link #allowsNil()} from a field option.
     *
     * @return {@code false} if this variant has no nil override
     */
    public boolean setAllowsNil(boolean allow) {
        log.debug("Ignoring allownil={} on {}", allow, getClass().getSimpleName());
        return false;
    }

    protected boolean applyAllowNilOverride(boolean allow) {
        if (allowNilOverride != null) {
            throw new IllegalStateException("allownil already set to " + allowNilOverride
                    + " on " + getClass().getSimpleName());
        }
        allowNilOverride = allow;
        return true;
    }

    protected Boolean getAllowNilOverride() {
        return allowNilOverride;
    }

    public boolean isAlwaysPointerReceiver() {
        return alwaysPointerReceiver;
    }

    public void setAlwaysPointerReceiver(boolean alwaysPointerReceiver) {
        this.alwaysPointerReceiver = alwaysPointerReceiver;
    }

    public abstract <R> R accept(ElemVisitor<R> visitor);
}
