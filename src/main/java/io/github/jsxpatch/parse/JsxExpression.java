package io.github.jsxpatch.parse;

import java.util.List;

/**
 * A brace-delimited expression container, either a body child such as {@code {items.map(...)}} or a comment,
 * or an attribute value such as {@code className={cn(...)}}. JSX found inside the expression is exposed as children.
 */
public final class JsxExpression extends JsxNode {
    private final SourceSpan innerSpan;
    private final List<JsxNode> nested;

    JsxExpression(SourceSpan span, List<JsxNode> nested) {
        super(span);
        this.innerSpan = new SourceSpan(span.start() + 1, span.end() - 1);
        this.nested = List.copyOf(nested);
        adopt(this.nested);
    }

    @Override
    public Kind kind() {
        return Kind.EXPRESSION;
    }

    /**
     * The characters between the braces.
     */
    public SourceSpan innerSpan() {
        return innerSpan;
    }

    /**
     * Trimmed span of the expression itself, without surrounding whitespace.
     */
    public SourceSpan expressionSpan(String source) {
        int start = innerSpan.start();
        int end = innerSpan.end();
        while (start < end && Character.isWhitespace(source.charAt(start))) {
            start++;
        }
        while (end > start && Character.isWhitespace(source.charAt(end - 1))) {
            end--;
        }
        return new SourceSpan(start, end);
    }

    public boolean isComment(String source) {
        var body = expressionSpan(source).text(source);
        return body.startsWith("/*") && body.endsWith("*/")
               || body.startsWith("//");
    }

    @Override
    public List<JsxNode> childNodes() {
        return nested;
    }
}
