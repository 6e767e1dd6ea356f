package com.serialgen.generator.parser.exception;

/**
 * A type expression could not be parsed into an element tree.
 */
public class TypeExpressionException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final int line;
    private final int column;

    public TypeExpressionException(String message, int line, int column) {
        super(message + " at line " + line + ", column " + column);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
