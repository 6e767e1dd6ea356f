package com.serialgen.generator.parser;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * The parsed value of one key inside a field annotation.
 */
@Value
@Builder
public class FieldTag {

    /** Tag name; empty when the annotation names no key. */
    String name;

    /** Comma-separated parts, first one being the name. */
    @Singular
    List<String> parts;

    /** Whether the annotation was present at all. */
    boolean present;

    public static final FieldTag ABSENT = FieldTag.builder().name("").present(false).build();

    /**
     * {@code msg:"-"} excludes the field.
     */
    public boolean isIgnored() {
        return present && "-".equals(name);
    }

    public boolean hasOption(String option) {
        return parts.size() > 1 && parts.subList(1, parts.size()).contains(option);
    }
}
