package com.serialgen.generator.parser;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Represents a token of a type expression.
 */
@Data
@AllArgsConstructor
public class TypeExprToken {
    private TokenType type;
    private String value;
    private int line;
    private int column;

    public enum TokenType {
        STAR,
        LBRACKET,
        RBRACKET,
        LBRACE,
        RBRACE,
        SEMICOLON,
        MAP,
        STRUCT,
        INTERFACE,
        IDENTIFIER,
        NUMBER,
        RAW_TAG,
        EOF,
        UNKNOWN
    }

    public boolean isSeparator() {
        return type == TokenType.SEMICOLON;
    }
}
