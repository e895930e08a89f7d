package io.github.jsxpatch.classes;

import io.github.jsxpatch.parse.SourceSpan;

import java.util.List;

/**
 * One argument of a class-merging call, classified by how its classes can be read and rewritten.
 */
public sealed interface CallArgument {
    SourceSpan span();

    /** {@code 'btn btn-primary'} */
    record StringArgument(SourceSpan span, char quote, String value) implements CallArgument {
    }

    /** {@code `btn-${size}`} */
    record TemplateArgument(SourceSpan span, String raw) implements CallArgument {
    }

    /** {@code { 'btn-active': isActive }}; {@code keys} are the property names with quotes removed. */
    record ObjectArgument(SourceSpan span, String raw, List<String> keys) implements CallArgument {
        public ObjectArgument {
            keys = List.copyOf(keys);
        }
    }

    /** Conditionals, identifiers, nested calls and anything else copied through untouched. */
    record OtherArgument(SourceSpan span, String raw) implements CallArgument {
    }
}
