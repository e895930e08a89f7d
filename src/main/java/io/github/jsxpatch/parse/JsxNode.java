package io.github.jsxpatch.parse;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A node of the JSX tree found in a source file. Only JSX constructs are modelled; the surrounding
 * TypeScript/JavaScript is skipped by the parser, except for JSX nested inside it, which becomes a
 * child of the enclosing {@link JsxExpression} (or a root of the {@link JsxDocument}).
 */
public abstract sealed class JsxNode permits JsxElement, JsxFragment, JsxExpression, JsxText {

    public enum Kind {
        ELEMENT,
        SELF_CLOSING_ELEMENT,
        FRAGMENT,
        EXPRESSION,
        TEXT;

        public boolean isElementLike() {
            return this == ELEMENT || this == SELF_CLOSING_ELEMENT || this == FRAGMENT;
        }
    }

    private final SourceSpan span;
    private @Nullable JsxNode parent;

    protected JsxNode(SourceSpan span) {
        this.span = span;
    }

    public abstract Kind kind();

    /**
     * Nodes directly below this one, in source order. For elements this is the attribute value expressions
     * followed by the body children.
     */
    public abstract List<JsxNode> childNodes();

    public SourceSpan span() {
        return span;
    }

    public @Nullable JsxNode parent() {
        return parent;
    }

    public String text(String source) {
        return span.text(source);
    }

    void adopt(List<? extends JsxNode> nodes) {
        for (var node : nodes) {
            node.parent = this;
        }
    }

    @Override
    public String toString() {
        return kind() + span.toString();
    }
}
