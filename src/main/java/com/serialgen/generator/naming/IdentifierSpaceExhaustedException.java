package com.serialgen.generator.naming;

/**
 * Thrown when a naming pass cannot produce a fresh binding identifier
 * within its attempt bound.
 */
public class IdentifierSpaceExhaustedException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final String prefix;
    private final int attempts;

    public IdentifierSpaceExhaustedException(String prefix, int attempts, String context) {
        super("Could not allocate a fresh identifier with prefix '" + prefix + "' after "
                + attempts + " attempts (" + context + ")");
        this.prefix = prefix;
        this.attempts = attempts;
    }

    public String getPrefix() {
        return prefix;
    }

    public int getAttempts() {
        return attempts;
    }
}
