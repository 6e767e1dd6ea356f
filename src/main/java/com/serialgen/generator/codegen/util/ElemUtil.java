package com.serialgen.generator.codegen.util;

import com.serialgen.generator.model.BaseElem;
import com.serialgen.generator.model.Elem;

import lombok.experimental.UtilityClass;

/**
 * Helpers the emitter applies to elements.
 */
@UtilityClass
public class ElemUtil {

    /**
     * Wrap an array size in {@code uint32(...)}.
     *
     * Array headers on the wire are 32-bit unsigned, while a declared array
     * length may be a constant of any integer width; the cast keeps the
     * comparison between the two well-typed.
     */
    public String coerceArraySize(String size) {
        return "uint32(" + size + ")";
    }

    /**
     * False only for base elements that must be inlined.
     */
    public boolean isPrintable(Elem elem) {
        return !(elem instanceof BaseElem base) || base.isPrintable();
    }

    /**
     * Apply an {@code allownil} option, if the element supports it.
     *
     * @return whether the element accepted the override
     */
    public boolean setAllowsNil(Elem elem, boolean allow) {
        return elem.setAllowsNil(allow);
    }
}
