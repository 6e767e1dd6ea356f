package com.serialgen.generator.naming;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.serialgen.generator.config.GeneratorConfig;

/**
 * Produces the synthetic binding names (loop indexes, map keys and values)
 * used by one naming pass.
 *
 * Names are {@code prefix + zero-padded counter}, e.g. {@code za0001}. One
 * instance belongs to one generation run; it is not safe for concurrent use.
 * Call {@link #reset(String)} between independently compared runs so that the
 * produced names stay deterministic.
 */
public class IdentifierGenerator {
    private static final Logger log = LoggerFactory.getLogger(IdentifierGenerator.class);

    public static final String DEFAULT_PREFIX = "za";
    public static final int DEFAULT_MAX_ATTEMPTS = 10_000;

    private String prefix;
    private int counter;
    private final int maxAttempts;

    public IdentifierGenerator() {
        this(DEFAULT_PREFIX, DEFAULT_MAX_ATTEMPTS);
    }

    public IdentifierGenerator(String prefix) {
        this(prefix, DEFAULT_MAX_ATTEMPTS);
    }

    public IdentifierGenerator(String prefix, int maxAttempts) {
        if (prefix == null || prefix.isEmpty()) {
            throw new IllegalArgumentException("Identifier prefix must not be empty");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
        }
        this.prefix = prefix;
        this.maxAttempts = maxAttempts;
    }

    public static IdentifierGenerator fromConfig(GeneratorConfig config) {
        return new IdentifierGenerator(config.getIdentPrefix(), config.getMaxIdentAttempts());
    }

    /**
     * Restart numbering from zero with the given prefix.
     */
    public void reset(String newPrefix) {
        if (newPrefix == null || newPrefix.isEmpty()) {
            throw new IllegalArgumentException("Identifier prefix must not be empty");
        }
        log.debug("Resetting identifiers: prefix '{}' -> '{}' after {} names", prefix, newPrefix, counter);
        this.prefix = newPrefix;
        this.counter = 0;
    }

    /**
     * Allocate the next identifier.
     */
    public String next() {
        if (counter == Integer.MAX_VALUE) {
            throw new IdentifierSpaceExhaustedException(prefix, counter, "counter overflow");
        }
        counter++;
        return String.format("%s%04d", prefix, counter);
    }

    /**
     * Allocate an identifier that does not occur inside {@code path}.
     *
     * Candidates are strictly increasing, so every rejected candidate is a
     * distinct substring of {@code path}; a finite path can only reject
     * finitely many. {@code maxAttempts} caps the search for pathological
     * inputs.
     */
    public String nextDisjointFrom(String path) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String candidate = next();
            if (path == null || !path.contains(candidate)) {
                return candidate;
            }
            log.debug("Identifier {} collides with path '{}', retrying", candidate, path);
        }
        throw new IdentifierSpaceExhaustedException(prefix, maxAttempts, "disjoint from '" + path + "'");
    }

    /**
     * Allocate two distinct identifiers, {@code [key, value]}.
     */
    public String[] nextPair() {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String key = next();
            String value = next();
            if (!key.equals(value)) {
                return new String[] {key, value};
            }
        }
        throw new IdentifierSpaceExhaustedException(prefix, maxAttempts, "distinct key/value pair");
    }

    public String getPrefix() {
        return prefix;
    }

    /**
     * Number of identifiers allocated since the last reset.
     */
    public int getAllocated() {
        return counter;
    }
}
