package io.github.jsxpatch.classes;

import io.github.jsxpatch.parse.SourceSpan;

import java.util.List;

/**
 * The value of a class attribute, as one of the authoring shapes the rewriter understands.
 * Extraction ({@link ClassTokenExtractor}) and rewriting ({@link ClassListRewriter}) each handle every variant.
 */
public sealed interface ClassValue {

    /** {@code className="a b"}; {@code span} includes the quotes. */
    record PlainLiteral(SourceSpan span, char quote, String value) implements ClassValue {
    }

    /** {@code className={"a b"}}; {@code span} is the string literal inside the braces. */
    record WrappedLiteral(SourceSpan span, char quote, String value) implements ClassValue {
    }

    /** {@code className={`card card-${size}`}}; {@code span} is the template literal. */
    record Interpolated(SourceSpan span, String raw) implements ClassValue {
    }

    /**
     * {@code className={cn("a", cond && "b", { c: flag })}}.
     *
     * @param span          the whole call expression
     * @param callee        the text before the argument list, e.g. {@code cn} or {@code utils.cn}
     * @param argumentsSpan the characters between the parentheses
     */
    record MergeCall(SourceSpan span, String callee, SourceSpan argumentsSpan, List<CallArgument> arguments)
            implements ClassValue
    {
        public MergeCall {
            arguments = List.copyOf(arguments);
        }
    }

    /** Anything else: an identifier, a ternary, a call to some other helper. {@code span} is the expression. */
    record Unknown(SourceSpan span, String raw) implements ClassValue {
    }
}
