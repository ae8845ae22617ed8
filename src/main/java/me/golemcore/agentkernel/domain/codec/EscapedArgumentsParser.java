package me.golemcore.agentkernel.domain.codec;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agentkernel.domain.grammar.JsonScanner;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes the relaxed argument notation of FunctionGemma, where
 * keys are bare and string values are wrapped in {@code <escape>} tokens:
 * {@code {location:<escape>London<escape>,days:3}}. Plain JSON is accepted
 * too.
 */
final class EscapedArgumentsParser {

    static final String ESCAPE = "<escape>";

    private final String text;
    private final ObjectMapper objectMapper;
    private int pos;

    EscapedArgumentsParser(String text, int start, ObjectMapper objectMapper) {
        this.text = text;
        this.pos = start;
        this.objectMapper = objectMapper;
    }

    int position() {
        return pos;
    }

    Map<String, Object> readObject() {
        expect('{');
        Map<String, Object> object = new LinkedHashMap<>();
        skipWhitespace();
        if (peek() == '}') {
            pos++;
            return object;
        }
        while (true) {
            String key = readKey();
            skipWhitespace();
            expect(':');
            object.put(key, readValue());
            skipWhitespace();
            char c = next();
            if (c == '}') {
                return object;
            }
            if (c != ',') {
                throw error("expected ',' or '}'");
            }
        }
    }

    private List<Object> readArray() {
        expect('[');
        List<Object> array = new ArrayList<>();
        skipWhitespace();
        if (peek() == ']') {
            pos++;
            return array;
        }
        while (true) {
            array.add(readValue());
            skipWhitespace();
            char c = next();
            if (c == ']') {
                return array;
            }
            if (c != ',') {
                throw error("expected ',' or ']'");
            }
        }
    }

    private String readKey() {
        skipWhitespace();
        if (text.startsWith(ESCAPE, pos)) {
            return readEscaped();
        }
        if (peek() == '"') {
            return readJsonString();
        }
        int colon = text.indexOf(':', pos);
        if (colon < 0) {
            throw error("expected a key");
        }
        String key = text.substring(pos, colon).trim();
        if (key.isEmpty()) {
            throw error("empty key");
        }
        pos = colon;
        return key;
    }

    private Object readValue() {
        skipWhitespace();
        if (text.startsWith(ESCAPE, pos)) {
            return readEscaped();
        }
        char c = peek();
        if (c == '{') {
            return readObject();
        }
        if (c == '[') {
            return readArray();
        }
        if (c == '"') {
            return readJsonString();
        }
        int start = pos;
        while (pos < text.length() && ",}]".indexOf(text.charAt(pos)) < 0) {
            pos++;
        }
        return literal(text.substring(start, pos).trim());
    }

    private String readEscaped() {
        pos += ESCAPE.length();
        int end = text.indexOf(ESCAPE, pos);
        if (end < 0) {
            throw error("unterminated " + ESCAPE + " value");
        }
        String value = text.substring(pos, end);
        pos = end + ESCAPE.length();
        return value;
    }

    private String readJsonString() {
        int end = JsonScanner.findValueEnd(text, pos);
        if (end < 0) {
            throw error("unterminated string");
        }
        try {
            String value = objectMapper.readValue(text.substring(pos, end), String.class);
            pos = end;
            return value;
        } catch (JsonProcessingException e) {
            throw error("invalid string literal");
        }
    }

    private Object literal(String token) {
        if (token.isEmpty()) {
            throw error("missing value");
        }
        switch (token) {
        case "true":
            return Boolean.TRUE;
        case "false":
            return Boolean.FALSE;
        case "null":
            return null;
        default:
            break;
        }
        try {
            return Long.parseLong(token);
        } catch (NumberFormatException notLong) {
            try {
                return Double.parseDouble(token);
            } catch (NumberFormatException notNumber) {
                return token;
            }
        }
    }

    private void skipWhitespace() {
        pos = JsonScanner.skipWhitespace(text, pos);
    }

    private char peek() {
        if (pos >= text.length()) {
            throw error("unexpected end of input");
        }
        return text.charAt(pos);
    }

    private char next() {
        char c = peek();
        pos++;
        return c;
    }

    private void expect(char expected) {
        if (next() != expected) {
            throw error("expected '" + expected + "'");
        }
    }

    private IllegalArgumentException error(String message) {
        return new IllegalArgumentException(message + " at position " + pos);
    }

    static String render(Object value) {
        StringBuilder sb = new StringBuilder();
        renderValue(value, sb);
        return sb.toString();
    }

    private static void renderValue(Object value, StringBuilder sb) {
        if (value == null) {
            sb.append("null");
        } else if (value instanceof Map<?, ?> map) {
            sb.append('{');
            boolean first = true;
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!first) {
                    sb.append(',');
                }
                first = false;
                sb.append(entry.getKey()).append(':');
                renderValue(entry.getValue(), sb);
            }
            sb.append('}');
        } else if (value instanceof Collection<?> items) {
            sb.append('[');
            boolean first = true;
            for (Object item : items) {
                if (!first) {
                    sb.append(',');
                }
                first = false;
                renderValue(item, sb);
            }
            sb.append(']');
        } else if (value instanceof Number || value instanceof Boolean) {
            sb.append(value);
        } else {
            sb.append(ESCAPE).append(value).append(ESCAPE);
        }
    }
}
