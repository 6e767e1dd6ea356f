package com.serialgen.generator.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.serialgen.generator.model.ArrayElem;
import com.serialgen.generator.model.BaseElem;
import com.serialgen.generator.model.Elem;
import com.serialgen.generator.model.MapElem;
import com.serialgen.generator.model.Primitive;
import com.serialgen.generator.model.PrimitiveCatalog;
import com.serialgen.generator.model.PtrElem;
import com.serialgen.generator.model.SliceElem;
import com.serialgen.generator.model.StructElem;
import com.serialgen.generator.model.StructField;
import com.serialgen.generator.parser.TypeExprToken.TokenType;
import com.serialgen.generator.parser.exception.TypeExpressionException;

/**
 * Builds an element tree from one type expression.
 *
 * <pre>
 * type   := '*' type | '[' ']' type | '[' size ']' type
 *         | 'map' '[' 'string' ']' type | struct | 'interface' '{' '}' | ident
 * struct := 'struct' '{' (Name type [tag] (';' | newline))* '}'
 * </pre>
 *
 * {@code []byte} is the bytes primitive, not a slice. Fields tagged
 * {@code msg:"-"} are dropped.
 */
public class TypeExpressionParser {
    private static final Logger log = LoggerFactory.getLogger(TypeExpressionParser.class);

    private final List<TypeExprToken> tokens;
    private final TypeDirectives directives;
    private final FieldTagParser tagParser;
    private int pos = 0;

    public TypeExpressionParser(List<TypeExprToken> tokens, TypeDirectives directives, FieldTagParser tagParser) {
        this.tokens = tokens;
        this.directives = directives;
        this.tagParser = tagParser;
    }

    public static Elem parse(String source) {
        return parse(source, TypeDirectives.none());
    }

    public static Elem parse(String source, TypeDirectives directives) {
        List<TypeExprToken> tokens = new TypeExprTokenizer(source).tokenize();
        return new TypeExpressionParser(tokens, directives, new FieldTagParser()).parse();
    }

    public Elem parse() {
        skipSeparators();
        if (isAtEnd()) {
            TypeExprToken token = peek();
            throw new TypeExpressionException("Empty type expression", token.getLine(), token.getColumn());
        }
        Elem elem = parseType();
        skipSeparators();
        if (!isAtEnd()) {
            throw error("Unexpected '" + peek().getValue() + "' after type");
        }
        return elem;
    }

    private Elem parseType() {
        TypeExprToken token = peek();

        switch (token.getType()) {
            case STAR -> {
                advance();
                return new PtrElem(parseType());
            }
            case LBRACKET -> {
                return parseBracketed();
            }
            case MAP -> {
                return parseMap();
            }
            case STRUCT -> {
                return parseStruct();
            }
            case INTERFACE -> {
                advance();
                expect(TokenType.LBRACE, "'{'");
                expect(TokenType.RBRACE, "'}'");
                return PrimitiveCatalog.ident("interface{}");
            }
            case IDENTIFIER -> {
                advance();
                return resolveIdentifier(token.getValue());
            }
            default -> throw error("Expected a type but found '" + token.getValue() + "'");
        }
    }

    private Elem parseBracketed() {
        expect(TokenType.LBRACKET, "'['");

        if (check(TokenType.RBRACKET)) {
            advance();
            if (check(TokenType.IDENTIFIER) && "byte".equals(peek().getValue())) {
                advance();
                return PrimitiveCatalog.ident("[]byte");
            }
            return new SliceElem(parseType());
        }

        if (!check(TokenType.NUMBER) && !check(TokenType.IDENTIFIER)) {
            throw error("Expected array size but found '" + peek().getValue() + "'");
        }
        String size = advance().getValue();
        expect(TokenType.RBRACKET, "']'");
        return new ArrayElem(size, parseType());
    }

    private Elem parseMap() {
        expect(TokenType.MAP, "'map'");
        expect(TokenType.LBRACKET, "'['");
        TypeExprToken key = peek();
        if (key.getType() != TokenType.IDENTIFIER || !"string".equals(key.getValue())) {
            throw error("Map keys must be string, found '" + key.getValue() + "'");
        }
        advance();
        expect(TokenType.RBRACKET, "']'");
        return new MapElem(parseType());
    }

    private Elem parseStruct() {
        expect(TokenType.STRUCT, "'struct'");
        expect(TokenType.LBRACE, "'{'");

        List<StructField> fields = new ArrayList<>();
        skipSeparators();
        while (!check(TokenType.RBRACE)) {
            if (isAtEnd()) {
                throw error("Unterminated struct");
            }
            parseField().ifPresent(fields::add);
            if (!check(TokenType.RBRACE)) {
                if (!peek().isSeparator()) {
                    throw error("Expected ';' or newline after field but found '" + peek().getValue() + "'");
                }
                skipSeparators();
            }
        }
        expect(TokenType.RBRACE, "'}'");
        return new StructElem(fields);
    }

    private Optional<StructField> parseField() {
        TypeExprToken nameToken = expect(TokenType.IDENTIFIER, "field name");
        String fieldName = nameToken.getValue();
        if (fieldName.contains(".")) {
            throw new TypeExpressionException("Embedded field '" + fieldName + "' is not supported",
                    nameToken.getLine(), nameToken.getColumn());
        }

        Elem elem = parseType();
        String rawTag = check(TokenType.RAW_TAG) ? advance().getValue() : null;

        FieldTag tag = tagParser.parse(rawTag);
        if (tag.isIgnored()) {
            log.debug("Skipping ignored field {}", fieldName);
            return Optional.empty();
        }
        applyOptions(fieldName, elem, tag);

        String tagName = tag.getName().isEmpty() ? fieldName : tag.getName();
        log.debug("Parsed field {} ({}) as {}", fieldName, tagName, elem.getClass().getSimpleName());
        return Optional.of(StructField.builder()
                .tag(tagName)
                .tagParts(tag.getParts())
                .rawTag(rawTag)
                .fieldName(fieldName)
                .elem(elem)
                .build());
    }

    private void applyOptions(String fieldName, Elem elem, FieldTag tag) {
        if (tag.hasOption(FieldTagParser.OPTION_ALLOW_NIL) && !elem.setAllowsNil(true)) {
            log.warn("Option allownil has no effect on field {} of type {}", fieldName, elem.typeName());
        }
        if (tag.hasOption(FieldTagParser.OPTION_ZERO_COPY)) {
            if (elem instanceof BaseElem base && base.getValue() == Primitive.BYTES) {
                base.setZeroCopy(true);
            } else {
                log.warn("Option zerocopy has no effect on field {} of type {}", fieldName, elem.typeName());
            }
        }
    }

    private Elem resolveIdentifier(String identifier) {
        Optional<Elem> directed = directives.resolve(identifier);
        if (directed.isPresent()) {
            log.debug("Identifier {} resolved through a directive", identifier);
            return directed.get();
        }
        BaseElem elem = PrimitiveCatalog.ident(identifier);
        if (!elem.resolved()) {
            log.debug("Identifier {} left unresolved", identifier);
        }
        return elem;
    }

    private void skipSeparators() {
        while (peek().isSeparator()) {
            advance();
        }
    }

    private TypeExprToken expect(TokenType type, String what) {
        if (!check(type)) {
            throw error("Expected " + what + " but found '" + peek().getValue() + "'");
        }
        return advance();
    }

    private TypeExpressionException error(String message) {
        TypeExprToken token = peek();
        return new TypeExpressionException(message, token.getLine(), token.getColumn());
    }

    private boolean isAtEnd() {
        return peek().getType() == TokenType.EOF;
    }

    private TypeExprToken peek() {
        return tokens.get(pos);
    }

    private TypeExprToken previous() {
        return tokens.get(pos - 1);
    }

    private boolean check(TokenType type) {
        return peek().getType() == type;
    }

    private TypeExprToken advance() {
        if (!isAtEnd()) pos++;
        return previous();
    }
}
