package com.serialgen.generator.config;

import com.serialgen.generator.naming.IdentifierGenerator;

import lombok.Builder;
import lombok.Data;

/**
 * Settings for one naming pass over an element tree.
 */
@Data
@Builder
public class GeneratorConfig {

    /**
     * Prefix of generated index, key and value identifiers.
     */
    @Builder.Default
    private String identPrefix = IdentifierGenerator.DEFAULT_PREFIX;

    /**
     * Receiver expression the root element is bound to.
     */
    @Builder.Default
    private String rootVarname = "z";

    /**
     * Upper bound on retries when a fresh identifier collides.
     */
    @Builder.Default
    private int maxIdentAttempts = IdentifierGenerator.DEFAULT_MAX_ATTEMPTS;

    /**
     * Whether verbose logging is enabled.
     */
    private boolean verbose;

    public static GeneratorConfig defaults() {
        return GeneratorConfig.builder().build();
    }
}
