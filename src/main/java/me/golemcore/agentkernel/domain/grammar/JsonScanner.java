package me.golemcore.agentkernel.domain.grammar;

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

/**
 * Locates the boundaries of JSON values embedded in free text without
 * decoding them. String contents are skipped so braces inside strings do not
 * affect nesting.
 */
public final class JsonScanner {

    private static final String LITERAL_DELIMITERS = ",}] \t\r\n";

    private JsonScanner() {
    }

    /**
     * Returns the exclusive end index of the JSON value starting at
     * {@code start}, or -1 when the value is not terminated.
     */
    public static int findValueEnd(CharSequence text, int start) {
        if (start < 0 || start >= text.length()) {
            return -1;
        }
        char first = text.charAt(start);
        if (first == '{' || first == '[') {
            return findContainerEnd(text, start);
        }
        if (first == '"') {
            return findStringEnd(text, start);
        }
        int i = start;
        while (i < text.length() && LITERAL_DELIMITERS.indexOf(text.charAt(i)) < 0) {
            i++;
        }
        return i > start ? i : -1;
    }

    /**
     * Returns the index of the first object or array opening bracket, or -1.
     */
    public static int findFirstContainerStart(CharSequence text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '{' || c == '[') {
                return i;
            }
        }
        return -1;
    }

    public static int skipWhitespace(CharSequence text, int index) {
        int i = index;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    private static int findContainerEnd(CharSequence text, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{' || c == '[') {
                depth++;
            } else if (c == '}' || c == ']') {
                depth--;
                if (depth == 0) {
                    return i + 1;
                }
            }
        }
        return -1;
    }

    private static int findStringEnd(CharSequence text, int start) {
        boolean escaped = false;
        for (int i = start + 1; i < text.length(); i++) {
            char c = text.charAt(i);
            if (escaped) {
                escaped = false;
            } else if (c == '\\') {
                escaped = true;
            } else if (c == '"') {
                return i + 1;
            }
        }
        return -1;
    }
}
