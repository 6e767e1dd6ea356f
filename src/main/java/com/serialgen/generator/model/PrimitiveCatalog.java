package com.serialgen.generator.model;

import java.util.Map;
import java.util.Set;

/**
 * Recognized type spellings and the external types that already implement
 * the generated serialization methods.
 */
public final class PrimitiveCatalog {

    private static final Map<String, Primitive> PRIMITIVES = Map.ofEntries(
        Map.entry("[]byte", Primitive.BYTES),
        Map.entry("string", Primitive.STRING),
        Map.entry("float32", Primitive.FLOAT32),
        Map.entry("float64", Primitive.FLOAT64),
        Map.entry("complex64", Primitive.COMPLEX64),
        Map.entry("complex128", Primitive.COMPLEX128),
        Map.entry("uint", Primitive.UINT),
        Map.entry("uint8", Primitive.UINT8),
        Map.entry("uint16", Primitive.UINT16),
        Map.entry("uint32", Primitive.UINT32),
        Map.entry("uint64", Primitive.UINT64),
        Map.entry("byte", Primitive.BYTE),
        Map.entry("rune", Primitive.INT32),
        Map.entry("int", Primitive.INT),
        Map.entry("int8", Primitive.INT8),
        Map.entry("int16", Primitive.INT16),
        Map.entry("int32", Primitive.INT32),
        Map.entry("int64", Primitive.INT64),
        Map.entry("bool", Primitive.BOOL),
        Map.entry("interface{}", Primitive.INTERFACE),
        Map.entry("any", Primitive.INTERFACE),
        Map.entry("time.Time", Primitive.TIME),
        Map.entry("time.Duration", Primitive.DURATION),
        Map.entry("msgp.Extension", Primitive.EXTENSION),
        Map.entry("json.Number", Primitive.JSON_NUMBER)
    );

    private static final Set<String> BUILTINS = Set.of(
        "msgp.Raw",
        "msgp.Number"
    );

    private PrimitiveCatalog() {
        // Utility class
    }

    /**
     * Exact-match lookup; anything unknown is {@link Primitive#IDENT}.
     */
    public static Primitive classify(String spelling) {
        if (spelling == null) {
            return Primitive.IDENT;
        }
        return PRIMITIVES.getOrDefault(spelling, Primitive.IDENT);
    }

    public static boolean isWhitelisted(String spelling) {
        return spelling != null && BUILTINS.contains(spelling);
    }

    /**
     * Build the leaf element for an identifier spelling.
     */
    public static BaseElem ident(String spelling) {
        Primitive primitive = classify(spelling);
        BaseElem elem = new BaseElem(primitive);
        if (primitive == Primitive.IDENT) {
            elem.setAlias(spelling);
        }
        return elem;
    }
}
