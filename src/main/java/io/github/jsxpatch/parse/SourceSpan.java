package io.github.jsxpatch.parse;

/**
 * Half-open range of character offsets into a source text.
 *
 * Offsets are 0-based indices into the original source string; {@code end} is exclusive.
 */
public record SourceSpan(int start, int end) {
    public SourceSpan {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [%d, %d)".formatted(start, end));
        }
    }

    public int length() {
        return end - start;
    }

    public boolean contains(int offset) {
        return offset >= start && offset < end;
    }

    public boolean encloses(SourceSpan other) {
        return other.start >= start && other.end <= end;
    }

    public String text(String source) {
        return source.substring(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
