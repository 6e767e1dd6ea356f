package com.serialgen.generator.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.serialgen.generator.parser.TypeExprToken.TokenType;
import com.serialgen.generator.parser.exception.TypeExpressionException;

/**
 * Tokenizer for type expressions such as {@code map[string][]*float64}.
 * Newlines are reported as {@link TokenType#SEMICOLON} so that struct fields
 * may be written one per line.
 */
public class TypeExprTokenizer {

    private static final Map<String, TokenType> KEYWORDS = Map.of(
        "map", TokenType.MAP,
        "struct", TokenType.STRUCT,
        "interface", TokenType.INTERFACE
    );

    private final String source;
    private int pos = 0;
    private int line = 1;
    private int column = 1;

    public TypeExprTokenizer(String source) {
        this.source = source == null ? "" : source;
    }

    public List<TypeExprToken> tokenize() {
        List<TypeExprToken> tokens = new ArrayList<>();

        while (pos < source.length()) {
            skipBlanks();
            if (pos >= source.length()) {
                break;
            }
            tokens.add(nextToken());
        }

        tokens.add(new TypeExprToken(TokenType.EOF, "", line, column));
        return tokens;
    }

    private void skipBlanks() {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c != '\n' && Character.isWhitespace(c)) {
                pos++;
                column++;
            } else {
                break;
            }
        }
    }

    private TypeExprToken nextToken() {
        char c = source.charAt(pos);
        int startLine = line;
        int startCol = column;

        switch (c) {
            case '\n' -> {
                pos++;
                line++;
                column = 1;
                return new TypeExprToken(TokenType.SEMICOLON, "\n", startLine, startCol);
            }
            case ';' -> {
                return single(TokenType.SEMICOLON, c, startLine, startCol);
            }
            case '*' -> {
                return single(TokenType.STAR, c, startLine, startCol);
            }
            case '[' -> {
                return single(TokenType.LBRACKET, c, startLine, startCol);
            }
            case ']' -> {
                return single(TokenType.RBRACKET, c, startLine, startCol);
            }
            case '{' -> {
                return single(TokenType.LBRACE, c, startLine, startCol);
            }
            case '}' -> {
                return single(TokenType.RBRACE, c, startLine, startCol);
            }
            case '`' -> {
                return readRawTag(startLine, startCol);
            }
            default -> {
                // handled below
            }
        }

        if (Character.isDigit(c)) {
            return readWhile(TokenType.NUMBER, Character::isDigit, startLine, startCol);
        }
        if (Character.isLetter(c) || c == '_') {
            TypeExprToken token = readWhile(TokenType.IDENTIFIER,
                    ch -> Character.isLetterOrDigit(ch) || ch == '_' || ch == '.', startLine, startCol);
            TokenType keyword = KEYWORDS.get(token.getValue());
            if (keyword != null) {
                token.setType(keyword);
            }
            return token;
        }

        return single(TokenType.UNKNOWN, c, startLine, startCol);
    }

    private TypeExprToken single(TokenType type, char c, int startLine, int startCol) {
        pos++;
        column++;
        return new TypeExprToken(type, String.valueOf(c), startLine, startCol);
    }

    private TypeExprToken readWhile(TokenType type, CharPredicate accept, int startLine, int startCol) {
        int start = pos;
        while (pos < source.length() && accept.test(source.charAt(pos))) {
            pos++;
            column++;
        }
        return new TypeExprToken(type, source.substring(start, pos), startLine, startCol);
    }

    private TypeExprToken readRawTag(int startLine, int startCol) {
        int start = pos;
        pos++; // opening backtick
        column++;
        while (pos < source.length() && source.charAt(pos) != '`') {
            if (source.charAt(pos) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
            pos++;
        }
        if (pos >= source.length()) {
            throw new TypeExpressionException("Unterminated field tag", startLine, startCol);
        }
        pos++; // closing backtick
        column++;
        return new TypeExprToken(TokenType.RAW_TAG, source.substring(start, pos), startLine, startCol);
    }

    @FunctionalInterface
    private interface CharPredicate {
        boolean test(char c);
    }
}
