package com.serialgen.generator.parser;

import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads one key out of a raw field annotation such as
 * {@code `msg:"thing1,omitempty" json:"thing1"`}, with the usual
 * {@code key:"value"} pair syntax.
 */
public class FieldTagParser {
    private static final Logger log = LoggerFactory.getLogger(FieldTagParser.class);

    public static final String DEFAULT_KEY = "msg";

    public static final String OPTION_ALLOW_NIL = "allownil";
    public static final String OPTION_ZERO_COPY = "zerocopy";
    public static final String OPTION_OMIT_EMPTY = "omitempty";
    public static final String OPTION_EXTENSION = "extension";

    private final String key;

    public FieldTagParser() {
        this(DEFAULT_KEY);
    }

    public FieldTagParser(String key) {
        this.key = key;
    }

    public FieldTag parse(String rawTag) {
        String value = lookup(rawTag);
        if (value == null) {
            return FieldTag.ABSENT;
        }
        String[] parts = value.split(",", -1);
        return FieldTag.builder()
                .name(parts[0])
                .parts(Arrays.asList(parts))
                .present(true)
                .build();
    }

    /**
     * Value of {@code key} in the annotation, or {@code null} when absent or
     * malformed.
     */
    String lookup(String rawTag) {
        if (rawTag == null) {
            return null;
        }
        String tag = rawTag.strip();
        if (tag.length() >= 2 && tag.startsWith("`") && tag.endsWith("`")) {
            tag = tag.substring(1, tag.length() - 1);
        }

        int i = 0;
        while (i < tag.length()) {
            while (i < tag.length() && tag.charAt(i) == ' ') {
                i++;
            }
            if (i >= tag.length()) {
                break;
            }

            int nameStart = i;
            while (i < tag.length() && tag.charAt(i) > ' ' && tag.charAt(i) != ':' && tag.charAt(i) != '"') {
                i++;
            }
            if (i == nameStart || i + 1 >= tag.length() || tag.charAt(i) != ':' || tag.charAt(i + 1) != '"') {
                log.debug("Malformed field tag: {}", rawTag);
                return null;
            }
            String name = tag.substring(nameStart, i);
            i += 2;

            StringBuilder value = new StringBuilder();
            boolean closed = false;
            while (i < tag.length()) {
                char c = tag.charAt(i);
                if (c == '\\' && i + 1 < tag.length()) {
                    value.append(tag.charAt(i + 1));
                    i += 2;
                } else if (c == '"') {
                    i++;
                    closed = true;
                    break;
                } else {
                    value.append(c);
                    i++;
                }
            }
            if (!closed) {
                log.debug("Unterminated value in field tag: {}", rawTag);
                return null;
            }
            if (name.equals(key)) {
                return value.toString();
            }
        }
        return null;
    }
}
