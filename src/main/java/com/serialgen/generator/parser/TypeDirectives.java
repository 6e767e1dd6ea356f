package com.serialgen.generator.parser;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.serialgen.generator.model.BaseElem;
import com.serialgen.generator.model.Elem;
import com.serialgen.generator.model.Primitive;
import com.serialgen.generator.model.PrimitiveCatalog;
import com.serialgen.generator.model.ShimMode;

import lombok.NonNull;
import lombok.Value;

/**
 * Per-run registrations that change how a named type is represented:
 * {@code shim} maps it onto a primitive through conversion functions,
 * {@code replace} serializes it as another type expression.
 */
public class TypeDirectives {
    private static final Logger log = LoggerFactory.getLogger(TypeDirectives.class);

    private final Map<String, Shim> shims = new LinkedHashMap<>();
    private final Map<String, Replace> replacements = new LinkedHashMap<>();

    public static TypeDirectives none() {
        return new TypeDirectives();
    }

    @Value
    public static class Shim {
        @NonNull String typeName;
        @NonNull String baseSpelling;
        String toBase;
        String fromBase;
        @NonNull ShimMode mode;
    }

    @Value
    public static class Replace {
        @NonNull String typeName;
        @NonNull String replacement;
    }

    public TypeDirectives shim(String typeName, String baseSpelling, String toBase, String fromBase, ShimMode mode) {
        if (PrimitiveCatalog.classify(baseSpelling) == Primitive.IDENT) {
            throw new IllegalArgumentException("Shim base '" + baseSpelling + "' of " + typeName + " is not a primitive");
        }
        replacements.remove(typeName);
        shims.put(typeName, new Shim(typeName, baseSpelling, toBase, fromBase, mode));
        log.debug("Registered shim {} -> {} (mode {})", typeName, baseSpelling, mode);
        return this;
    }

    public TypeDirectives replace(String typeName, String replacement) {
        shims.remove(typeName);
        replacements.put(typeName, new Replace(typeName, replacement));
        log.debug("Registered replacement {} -> {}", typeName, replacement);
        return this;
    }

    public boolean isEmpty() {
        return shims.isEmpty() && replacements.isEmpty();
    }

    /**
     * The element a directive produces for {@code identifier}, if any.
     */
    public Optional<Elem> resolve(String identifier) {
        Shim shim = shims.get(identifier);
        if (shim != null) {
            return Optional.of(applyShim(shim));
        }
        Replace replace = replacements.get(identifier);
        if (replace != null) {
            return Optional.of(applyReplace(replace));
        }
        return Optional.empty();
    }

    private Elem applyShim(Shim shim) {
        BaseElem elem = PrimitiveCatalog.ident(shim.getBaseSpelling());
        elem.setAlias(shim.getTypeName());
        elem.setShimToBase(shim.getToBase());
        elem.setShimFromBase(shim.getFromBase());
        elem.setShimMode(shim.getMode());
        return elem;
    }

    private Elem applyReplace(Replace replace) {
        // replacements are parsed without directives so they cannot recurse
        Elem elem = TypeExpressionParser.parse(replace.getReplacement());
        elem.setAlwaysPointerReceiver(true);
        if (elem instanceof BaseElem base) {
            boolean identifier = base.getValue() == Primitive.IDENT;
            base.setConvert(true);
            base.setAlias(replace.getTypeName());
            if (identifier) {
                base.setShimToBase("(*" + replace.getReplacement() + ")");
                base.setNeedsReference(true);
            }
        }
        return elem;
    }
}
