package io.github.jsxpatch.parse;

import io.github.jsxpatch.VisualEditException;

/**
 * The source text could not be turned into a JSX tree. No partial tree is produced.
 */
public class ParseException extends VisualEditException {
    private final int offset;
    private final int line;
    private final int column;

    private ParseException(String message, int offset, int line, int column) {
        super("%s at line %d, column %d".formatted(message, line, column));
        this.offset = offset;
        this.line = line;
        this.column = column;
    }

    static ParseException at(String source, int offset, String message) {
        int clamped = Math.max(0, Math.min(offset, source.length()));
        int line = 1;
        int lineStart = 0;
        for (int i = 0; i < clamped; i++) {
            if (source.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        return new ParseException(message, clamped, line, clamped - lineStart);
    }

    public int offset() {
        return offset;
    }

    /** 1-based. */
    public int line() {
        return line;
    }

    /** 0-based character offset within the line. */
    public int column() {
        return column;
    }
}
