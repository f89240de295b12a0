package com.deepsearch.research.service.analysis;

import java.util.Optional;

/**
 * Locates the first balanced JSON object inside free-form model output.
 * Braces inside string literals are ignored.
 */
public final class JsonBlockExtractor {

    private JsonBlockExtractor() {
    }

    public static Optional<String> extractFirstObject(String text) {
        if (text == null) {
            return Optional.empty();
        }

        int start = text.indexOf('{');
        while (start >= 0) {
            int end = findClosingBrace(text, start);
            if (end > start) {
                return Optional.of(text.substring(start, end + 1));
            }
            start = text.indexOf('{', start + 1);
        }
        return Optional.empty();
    }

    private static int findClosingBrace(String text, int start) {
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

            switch (c) {
                case '"' -> inString = true;
                case '{' -> depth++;
                case '}' -> {
                    depth--;
                    if (depth == 0) {
                        return i;
                    }
                }
                default -> {
                }
            }
        }
        return -1;
    }
}
