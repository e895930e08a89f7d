package io.github.jsxpatch.parse;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A named element, either with a body ({@code <div>...</div>}) or self-closing ({@code <Icon />}).
 */
public final class JsxElement extends JsxNode {
    private final String tagName;
    private final SourceSpan tagNameSpan;
    private final int attributesStart;
    private final SourceSpan openingSpan;
    private final List<JsxAttribute> attributes;
    private final List<JsxNode> children;
    private final @Nullable SourceSpan closingSpan;

    JsxElement(SourceSpan span,
               String tagName,
               SourceSpan tagNameSpan,
               int attributesStart,
               SourceSpan openingSpan,
               List<JsxAttribute> attributes,
               List<JsxNode> children,
               @Nullable SourceSpan closingSpan)
    {
        super(span);
        this.tagName = tagName;
        this.tagNameSpan = tagNameSpan;
        this.attributesStart = attributesStart;
        this.openingSpan = openingSpan;
        this.attributes = List.copyOf(attributes);
        this.children = List.copyOf(children);
        this.closingSpan = closingSpan;

        var valueNodes = this.attributes.stream()
                                        .map(JsxAttribute::valueNode)
                                        .filter(n -> n != null)
                                        .toList();
        adopt(valueNodes);
        adopt(this.children);
    }

    @Override
    public Kind kind() {
        return closingSpan == null ? Kind.SELF_CLOSING_ELEMENT : Kind.ELEMENT;
    }

    public boolean isSelfClosing() {
        return closingSpan == null;
    }

    public String tagName() {
        return tagName;
    }

    public SourceSpan tagNameSpan() {
        return tagNameSpan;
    }

    /**
     * Offset right after the tag name and any type arguments, i.e. where a first attribute can be inserted.
     */
    public int attributesStart() {
        return attributesStart;
    }

    /**
     * The opening marker, {@code <} through the closing {@code >} (or {@code />} when self-closing).
     */
    public SourceSpan openingSpan() {
        return openingSpan;
    }

    public @Nullable SourceSpan closingSpan() {
        return closingSpan;
    }

    /**
     * The body between the opening and closing markers.
     */
    public Optional<SourceSpan> innerSpan() {
        if (closingSpan == null) {
            return Optional.empty();
        }
        return Optional.of(new SourceSpan(openingSpan.end(), closingSpan.start()));
    }

    public List<JsxAttribute> attributes() {
        return attributes;
    }

    public Optional<JsxAttribute> attribute(String name) {
        return attributes.stream().filter(a -> a.isNamed(name)).findFirst();
    }

    /**
     * Body children: text, expression containers and nested elements.
     */
    public List<JsxNode> children() {
        return children;
    }

    @Override
    public List<JsxNode> childNodes() {
        var result = new ArrayList<JsxNode>();
        for (var attribute : attributes) {
            var valueNode = attribute.valueNode();
            if (valueNode != null) {
                result.add(valueNode);
            }
        }
        result.addAll(children);
        return result;
    }

    @Override
    public String toString() {
        return "<" + tagName + ">" + span();
    }
}
