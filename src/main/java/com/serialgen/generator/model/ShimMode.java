package com.serialgen.generator.model;

/**
 * How a declared type is converted to and from its primitive base.
 */
public enum ShimMode {
    /**
     * Plain type conversion, {@code base(x)}.
     */
    CAST,

    /**
     * Call to a user conversion function that may fail.
     */
    CONVERT
}
