package io.github.jsxpatch.classes;

import io.github.jsxpatch.parse.SourceSpan;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * Bracket and literal matching over a bounded region of script text. Used to take apart the expression of a
 * class attribute: call arguments, object literal entries, string and template literals.
 */
final class ExpressionScanner {
    private final String src;
    private final int limit;

    ExpressionScanner(String src, int limit) {
        this.src = src;
        this.limit = Math.min(limit, src.length());
    }

    /**
     * Returns the offset just past the string or template literal starting at {@code start}.
     */
    int skipLiteral(int start) {
        char quote = src.charAt(start);
        int p = start + 1;
        while (p < limit) {
            char c = src.charAt(p);
            if (c == '\\') {
                p += 2;
                continue;
            }
            if (c == quote) {
                return p + 1;
            }
            if (quote == '`' && c == '$' && p + 1 < limit && src.charAt(p + 1) == '{') {
                p = findClosing(p + 1) + 1;
                continue;
            }
            p++;
        }
        throw new MalformedExpressionException("Unterminated " + (quote == '`' ? "template" : "string") + " literal",
                                               start);
    }

    /**
     * Returns the offset of the bracket closing the one at {@code openPos}.
     */
    int findClosing(int openPos) {
        char open = src.charAt(openPos);
        var stack = new ArrayDeque<Character>();
        stack.push(closerFor(open));
        int p = openPos + 1;
        while (p < limit) {
            char c = src.charAt(p);
            if (c == '"' || c == '\'' || c == '`') {
                p = skipLiteral(p);
                continue;
            }
            if (isCommentStart(p)) {
                p = skipComment(p);
                continue;
            }
            if (c == '(' || c == '[' || c == '{') {
                stack.push(closerFor(c));
            } else if (c == ')' || c == ']' || c == '}') {
                char expected = stack.pop();
                if (c != expected) {
                    throw new MalformedExpressionException("Expected '" + expected + "' but found '" + c + "'", p);
                }
                if (stack.isEmpty()) {
                    return p;
                }
            }
            p++;
        }
        throw new MalformedExpressionException("No matching '" + closerFor(open) + "' for '" + open + "'", openPos);
    }

    /**
     * Splits {@code [from, to)} at top-level occurrences of {@code separator}, returning each part trimmed of
     * surrounding whitespace and comments. Empty parts (a trailing comma) are dropped.
     */
    List<SourceSpan> splitTopLevel(int from, int to, char separator) {
        var parts = new ArrayList<SourceSpan>();
        int partStart = from;
        int p = from;
        while (p < to) {
            char c = src.charAt(p);
            if (isCommentStart(p)) {
                p = skipComment(p);
            } else if (c == '"' || c == '\'' || c == '`') {
                p = skipLiteral(p);
            } else if (c == '(' || c == '[' || c == '{') {
                p = findClosing(p) + 1;
            } else if (c == separator) {
                addTrimmed(parts, partStart, p);
                p++;
                partStart = p;
            } else {
                p++;
            }
        }
        addTrimmed(parts, partStart, to);
        return parts;
    }

    /**
     * Offset of the first top-level {@code target} in {@code [from, to)}, or -1.
     */
    int indexOfTopLevel(int from, int to, char target) {
        int p = from;
        while (p < to) {
            char c = src.charAt(p);
            if (isCommentStart(p)) {
                p = skipComment(p);
                continue;
            }
            if (c == target) {
                return p;
            }
            if (c == '"' || c == '\'' || c == '`') {
                p = skipLiteral(p);
            } else if (c == '(' || c == '[' || c == '{') {
                p = findClosing(p) + 1;
            } else {
                p++;
            }
        }
        return -1;
    }

    boolean isCommentStart(int p) {
        if (p + 1 >= limit || src.charAt(p) != '/') {
            return false;
        }
        char next = src.charAt(p + 1);
        return next == '/' || next == '*';
    }

    /**
     * Returns the offset just past the line or block comment starting at {@code start}. A line comment ends before
     * its newline.
     */
    int skipComment(int start) {
        if (src.charAt(start + 1) == '*') {
            int end = src.indexOf("*/", start + 2);
            if (end < 0 || end + 2 > limit) {
                throw new MalformedExpressionException("Unterminated comment", start);
            }
            return end + 2;
        }
        int p = start;
        while (p < limit && src.charAt(p) != '\n') {
            p++;
        }
        return p;
    }

    /**
     * Narrows {@code [from, to)} to the code it holds, dropping surrounding whitespace and comments.
     */
    SourceSpan trim(int from, int to) {
        int start = -1;
        int end = from;
        int p = from;
        while (p < to) {
            char c = src.charAt(p);
            if (Character.isWhitespace(c)) {
                p++;
                continue;
            }
            if (isCommentStart(p)) {
                p = skipComment(p);
                continue;
            }
            if (start < 0) {
                start = p;
            }
            if (c == '"' || c == '\'' || c == '`') {
                p = skipLiteral(p);
            } else if (c == '(' || c == '[' || c == '{') {
                p = findClosing(p) + 1;
            } else {
                p++;
            }
            end = p;
        }
        return start < 0 ? new SourceSpan(from, from) : new SourceSpan(start, Math.min(end, to));
    }

    private void addTrimmed(List<SourceSpan> parts, int from, int to) {
        var span = trim(from, to);
        if (span.length() > 0) {
            parts.add(span);
        }
    }

    private static char closerFor(char open) {
        return switch (open) {
            case '(' -> ')';
            case '[' -> ']';
            case '{' -> '}';
            default -> throw new IllegalArgumentException("Not an opening bracket: " + open);
        };
    }
}
