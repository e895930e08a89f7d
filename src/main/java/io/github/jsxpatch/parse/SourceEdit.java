package io.github.jsxpatch.parse;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * A replacement of one span of the source text. An insertion is an edit whose span is empty.
 */
public record SourceEdit(SourceSpan span, String replacement) {

    public static SourceEdit replace(SourceSpan span, String replacement) {
        return new SourceEdit(span, replacement);
    }

    public static SourceEdit insert(int offset, String text) {
        return new SourceEdit(new SourceSpan(offset, offset), text);
    }

    /**
     * Re-emits the source with every edit applied. Edits must not overlap; they may be given in any order.
     * Text outside the edited spans is copied through unchanged.
     */
    public static String applyAll(String source, List<SourceEdit> edits) {
        if (edits.isEmpty()) {
            return source;
        }
        var sorted = new ArrayList<>(edits);
        sorted.sort(Comparator.comparingInt((SourceEdit e) -> e.span().start())
                              .thenComparingInt(e -> e.span().end()));

        var sb = new StringBuilder(source.length() + 64);
        int cursor = 0;
        for (var edit : sorted) {
            var span = edit.span();
            if (span.start() < cursor) {
                throw new IllegalArgumentException("Overlapping edits at offset " + span.start());
            }
            if (span.end() > source.length()) {
                throw new IllegalArgumentException("Edit %s extends past end of source (%d chars)"
                                                           .formatted(span, source.length()));
            }
            sb.append(source, cursor, span.start());
            sb.append(edit.replacement());
            cursor = span.end();
        }
        sb.append(source, cursor, source.length());
        return sb.toString();
    }
}
