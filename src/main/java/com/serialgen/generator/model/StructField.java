package com.serialgen.generator.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * One field of a {@link StructElem}.
 */
@Value
@Builder(toBuilder = true)
public class StructField {

    /**
     * Tag name: the annotation value up to the first comma.
     */
    String tag;

    /**
     * The annotation value split by commas; the first entry is the tag name.
     */
    @Singular
    List<String> tagParts;

    /**
     * Full raw annotation text, e.g. {@code `msg:"name,omitempty"`}.
     */
    String rawTag;

    @NonNull
    String fieldName;

    @NonNull
    Elem elem;

    /**
     * Whether the option is present after the tag name.
     */
    public boolean hasTagOption(String option) {
        if (tagParts.size() < 2) {
            return false;
        }
        return tagParts.subList(1, tagParts.size()).contains(option);
    }

    StructField deepCopy() {
        return toBuilder().elem(elem.deepCopy()).build();
    }
}
