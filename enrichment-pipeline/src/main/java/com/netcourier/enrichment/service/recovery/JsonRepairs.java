package com.netcourier.enrichment.service.recovery;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

final class JsonRepairs {

    private static final char LEFT_DOUBLE_QUOTE = '“';
    private static final char RIGHT_DOUBLE_QUOTE = '”';
    private static final char LOW_DOUBLE_QUOTE = '„';

    private JsonRepairs() {
    }

    static String stripCodeFences(String text) {
        String trimmed = text.strip();
        int fence = trimmed.indexOf("```");
        if (fence < 0) {
            return trimmed;
        }
        int bodyStart = trimmed.indexOf('\n', fence);
        if (bodyStart < 0) {
            return trimmed;
        }
        int closing = trimmed.indexOf("```", bodyStart);
        String body = closing < 0 ? trimmed.substring(bodyStart + 1) : trimmed.substring(bodyStart + 1, closing);
        return body.strip();
    }

    /**
     * Balanced {@code {...}}/{@code [...]} substrings plus, when the text is truncated, the
     * unbalanced tail starting at the first unclosed opener. Longest first.
     */
    static List<String> candidates(String text) {
        List<String> found = new ArrayList<>();
        boolean truncatedSeen = false;
        int index = 0;
        while (index < text.length()) {
            int start = nextOpener(text, index);
            if (start < 0) {
                break;
            }
            int end = balancedEnd(text, start);
            if (end < 0) {
                if (!truncatedSeen) {
                    found.add(text.substring(start).stripTrailing());
                    truncatedSeen = true;
                }
                index = start + 1;
            } else {
                found.add(text.substring(start, end + 1));
                index = end + 1;
            }
        }
        found.sort(Comparator.comparingInt(String::length).reversed());
        return found;
    }

    /**
     * Escapes quotes that cannot close a string, control characters inside strings, and turns
     * typographic quotes used as delimiters into ASCII quotes.
     */
    static String normaliseQuotes(String text) {
        StringBuilder out = new StringBuilder(text.length() + 16);
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!inString) {
                if (c == '"' || c == LEFT_DOUBLE_QUOTE || c == RIGHT_DOUBLE_QUOTE || c == LOW_DOUBLE_QUOTE) {
                    out.append('"');
                    inString = true;
                } else {
                    out.append(c);
                }
                continue;
            }
            if (escaped) {
                out.append(c);
                escaped = false;
            } else if (c == '\\') {
                out.append(c);
                escaped = true;
            } else if (c == '\n') {
                out.append("\\n");
            } else if (c == '\r') {
                out.append("\\r");
            } else if (c == '\t') {
                out.append("\\t");
            } else if (c == '"' || c == RIGHT_DOUBLE_QUOTE) {
                if (closesString(text, i + 1)) {
                    out.append('"');
                    inString = false;
                } else if (c == '"') {
                    out.append("\\\"");
                } else {
                    out.append(c);
                }
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    static String removeTrailingCommas(String text) {
        StringBuilder out = new StringBuilder(text.length());
        Scanner scanner = new Scanner();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            boolean structural = scanner.accept(c);
            if (structural && c == ',') {
                char next = nextNonWhitespace(text, i + 1);
                if (next == '}' || next == ']') {
                    continue;
                }
            }
            out.append(c);
        }
        return out.toString();
    }

    static String insertMissingCommas(String text) {
        StringBuilder out = new StringBuilder(text.length() + 8);
        Scanner scanner = new Scanner();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            boolean wasInString = scanner.inString;
            boolean structural = scanner.accept(c);
            out.append(c);
            boolean closedValue = (wasInString && !scanner.inString) || (structural && (c == '}' || c == ']'));
            if (closedValue) {
                int j = i + 1;
                while (j < text.length() && Character.isWhitespace(text.charAt(j))) {
                    j++;
                }
                if (j > i + 1 && j < text.length()) {
                    char next = text.charAt(j);
                    if (next == '"' || next == '{' || next == '[') {
                        out.append(',');
                    }
                }
            }
        }
        return out.toString();
    }

    /**
     * Appends the closers of every structure left open. Returns {@code null} when the text ends
     * inside a string literal or after a dangling key, which cannot be completed faithfully.
     */
    static String closeOpenStructures(String text) {
        Deque<Character> expected = new ArrayDeque<>();
        Scanner scanner = new Scanner();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!scanner.accept(c)) {
                continue;
            }
            if (c == '{') {
                expected.push('}');
            } else if (c == '[') {
                expected.push(']');
            } else if ((c == '}' || c == ']') && !expected.isEmpty() && expected.peek() == c) {
                expected.pop();
            }
        }
        if (scanner.inString) {
            return null;
        }
        String body = text.stripTrailing();
        while (body.endsWith(",")) {
            body = body.substring(0, body.length() - 1).stripTrailing();
        }
        if (body.endsWith(":")) {
            return null;
        }
        StringBuilder out = new StringBuilder(body);
        while (!expected.isEmpty()) {
            out.append(expected.pop());
        }
        return out.toString();
    }

    private static int nextOpener(String text, int from) {
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '{' || c == '[') {
                return i;
            }
        }
        return -1;
    }

    private static int balancedEnd(String text, int start) {
        Deque<Character> expected = new ArrayDeque<>();
        Scanner scanner = new Scanner();
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!scanner.accept(c)) {
                continue;
            }
            if (c == '{') {
                expected.push('}');
            } else if (c == '[') {
                expected.push(']');
            } else if (c == '}' || c == ']') {
                if (expected.isEmpty() || expected.peek() != c) {
                    return -1;
                }
                expected.pop();
                if (expected.isEmpty()) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * A quote closes the literal when structure follows it. The start of another value counts only
     * when whitespace separates it, so that a missing comma between two values is left for
     * {@link #insertMissingCommas(String)} instead of merging both values into one string.
     */
    private static boolean closesString(String text, int from) {
        char next = nextNonWhitespace(text, from);
        if (next == 0 || next == ',' || next == ':' || next == '}' || next == ']') {
            return true;
        }
        boolean separated = from < text.length() && Character.isWhitespace(text.charAt(from));
        return separated && (next == '"' || next == '{' || next == '[');
    }

    private static char nextNonWhitespace(String text, int from) {
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!Character.isWhitespace(c)) {
                return c;
            }
        }
        return 0;
    }

    private static final class Scanner {

        private boolean inString;
        private boolean escaped;

        boolean accept(char c) {
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                return false;
            }
            if (c == '"') {
                inString = true;
                return false;
            }
            return true;
        }
    }
}
