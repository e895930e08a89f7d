package io.github.jsxpatch.parse;

import java.util.List;

/**
 * An anonymous grouping wrapper, {@code <>...</>}.
 */
public final class JsxFragment extends JsxNode {
    private final SourceSpan openingSpan;
    private final SourceSpan closingSpan;
    private final List<JsxNode> children;

    JsxFragment(SourceSpan span, SourceSpan openingSpan, SourceSpan closingSpan, List<JsxNode> children) {
        super(span);
        this.openingSpan = openingSpan;
        this.closingSpan = closingSpan;
        this.children = List.copyOf(children);
        adopt(this.children);
    }

    @Override
    public Kind kind() {
        return Kind.FRAGMENT;
    }

    public SourceSpan openingSpan() {
        return openingSpan;
    }

    public SourceSpan closingSpan() {
        return closingSpan;
    }

    public SourceSpan innerSpan() {
        return new SourceSpan(openingSpan.end(), closingSpan.start());
    }

    public List<JsxNode> children() {
        return children;
    }

    @Override
    public List<JsxNode> childNodes() {
        return children;
    }
}
