package com.docintegrity.analysis.service.text;

import java.util.ArrayList;
import java.util.List;

public final class SentenceSplitter {

    private SentenceSplitter() {
    }

    public static List<Span> split(String text) {
        List<Span> spans = new ArrayList<>();
        int n = text.length();
        int i = 0;
        while (i < n) {
            while (i < n && Character.isWhitespace(text.charAt(i))) {
                i++;
            }
            if (i >= n) {
                break;
            }
            int start = i;
            int end = n;
            while (i < n) {
                char c = text.charAt(i);
                if (c == '\n' && i + 1 < n && text.charAt(i + 1) == '\n') {
                    end = i;
                    break;
                }
                if (isTerminator(c)) {
                    int j = i;
                    while (j < n && isTerminator(text.charAt(j))) {
                        j++;
                    }
                    while (j < n && isCloser(text.charAt(j))) {
                        j++;
                    }
                    i = j;
                    if (j >= n || Character.isWhitespace(text.charAt(j))) {
                        end = j;
                        break;
                    }
                    continue;
                }
                i++;
            }
            int trimmedEnd = end;
            while (trimmedEnd > start && Character.isWhitespace(text.charAt(trimmedEnd - 1))) {
                trimmedEnd--;
            }
            spans.add(new Span(start, trimmedEnd));
            i = Math.max(i, end);
        }
        return spans;
    }

    public static List<String> sentences(String text) {
        return split(text).stream().map(span -> span.of(text)).toList();
    }

    private static boolean isTerminator(char c) {
        return c == '.' || c == '!' || c == '?';
    }

    private static boolean isCloser(char c) {
        return c == '"' || c == '\'' || c == ')' || c == ']' || c == '”' || c == '’';
    }

    public record Span(int start, int end) {

        public String of(String text) {
            return text.substring(start, end);
        }
    }
}
