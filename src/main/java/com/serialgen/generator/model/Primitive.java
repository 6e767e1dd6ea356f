package com.serialgen.generator.model;

import java.util.Locale;

/**
 * Primitive kinds the serialization runtime can read and write directly.
 * This is effectively the list of available {@code ReadXxx} / {@code WriteXxx}
 * methods.
 */
public enum Primitive {
    INVALID("INVALID", null),
    BYTES("Bytes", "[]byte"),
    STRING("String", null),
    FLOAT32("Float32", null),
    FLOAT64("Float64", null),
    COMPLEX64("Complex64", null),
    COMPLEX128("Complex128", null),
    UINT("Uint", null),
    UINT8("Uint8", null),
    UINT16("Uint16", null),
    UINT32("Uint32", null),
    UINT64("Uint64", null),
    BYTE("Byte", null),
    INT("Int", null),
    INT8("Int8", null),
    INT16("Int16", null),
    INT32("Int32", null),
    INT64("Int64", null),
    BOOL("Bool", null),
    INTERFACE("Intf", "interface{}"),
    TIME("Time", "time.Time"),
    DURATION("Duration", "time.Duration"),
    EXTENSION("Extension", "msgp.Extension"),
    JSON_NUMBER("JSONNumber", "json.Number"),

    /**
     * An identifier that is not a known primitive.
     */
    IDENT("Ident", null);

    private final String baseName;
    private final String spelling;

    Primitive(String baseName, String spelling) {
        this.baseName = baseName;
        this.spelling = spelling;
    }

    /**
     * Suffix of the runtime read/write method, e.g. {@code Float64} or {@code Intf}.
     */
    public String getBaseName() {
        return baseName;
    }

    /**
     * Target-language type spelling. {@code IDENT} has none of its own.
     */
    public String getTypeSpelling() {
        if (this == IDENT) {
            return null;
        }
        if (spelling != null) {
            return spelling;
        }
        return baseName.toLowerCase(Locale.ROOT);
    }

    /**
     * Integer, float and duration kinds whose zero value is {@code 0}.
     */
    public boolean isNumeric() {
        return switch (this) {
            case FLOAT32, FLOAT64, UINT, UINT8, UINT16, UINT32, UINT64, BYTE,
                 INT, INT8, INT16, INT32, INT64, DURATION -> true;
            default -> false;
        };
    }
}
