package io.github.jsxpatch.text;

import io.github.jsxpatch.UnsupportedTargetException;
import io.github.jsxpatch.parse.JsxElement;
import io.github.jsxpatch.parse.JsxFragment;
import io.github.jsxpatch.parse.JsxNode;
import io.github.jsxpatch.parse.JsxText;
import io.github.jsxpatch.parse.SourceEdit;
import io.github.jsxpatch.parse.SourceSpan;
import io.github.jsxpatch.util.Json;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Replaces the literal text of an element's body while leaving nested elements, fragments and expression
 * containers where they are.
 * <p>
 * The first text run that is not pure whitespace takes the new text, padded with one space on each side; every
 * other text run is dropped. When the body has no such run the new text is put in front of the markup.
 */
public final class TextContentRewriter {
    private static final Logger logger = LogManager.getLogger(TextContentRewriter.class);

    public enum SegmentKind {
        TEXT,
        MARKUP
    }

    public record Segment(SegmentKind kind, SourceSpan span) {
        public String text(String source) {
            return span.text(source);
        }
    }

    /**
     * @throws UnsupportedTargetException when the target is self-closing and so has no body to hold text
     */
    public SourceEdit rewrite(String source, JsxNode target, String newText) {
        var inner = innerSpan(target);
        var segments = segments(target);

        var sb = new StringBuilder();
        var replacement = render(newText);
        boolean placed = false;
        for (var segment : segments) {
            if (segment.kind() == SegmentKind.MARKUP) {
                sb.append(segment.text(source));
            } else if (!placed && !segment.text(source).isBlank()) {
                sb.append(replacement);
                placed = true;
            } else {
                logger.debug("Dropping text segment {}", segment.span());
            }
        }
        if (!placed) {
            sb.insert(0, replacement);
        }
        return SourceEdit.replace(inner, sb.toString());
    }

    /**
     * The body of {@code target} split into text runs and markup, in source order.
     */
    public List<Segment> segments(JsxNode target) {
        var children = bodyChildren(target);
        var segments = new ArrayList<Segment>(children.size());
        for (var child : children) {
            var kind = child instanceof JsxText ? SegmentKind.TEXT : SegmentKind.MARKUP;
            segments.add(new Segment(kind, child.span()));
        }
        return segments;
    }

    private static SourceSpan innerSpan(JsxNode target) {
        if (target instanceof JsxElement element) {
            return element.innerSpan().orElseThrow(() -> selfClosing(element));
        }
        if (target instanceof JsxFragment fragment) {
            return fragment.innerSpan();
        }
        throw new UnsupportedTargetException("Cannot update text content of a JSX " + target.kind(), target.kind());
    }

    private static List<JsxNode> bodyChildren(JsxNode target) {
        if (target instanceof JsxElement element) {
            if (element.isSelfClosing()) {
                throw selfClosing(element);
            }
            return element.children();
        }
        if (target instanceof JsxFragment fragment) {
            return fragment.children();
        }
        throw new UnsupportedTargetException("Cannot update text content of a JSX " + target.kind(), target.kind());
    }

    private static UnsupportedTargetException selfClosing(JsxElement element) {
        return new UnsupportedTargetException("Cannot update text content: element <" + element.tagName()
                                              + "> is self-closing.", element.kind());
    }

    /**
     * Padded JSX for {@code text}; characters JSX text cannot hold put it in a string expression.
     */
    static String render(String text) {
        if (text.isBlank()) {
            return "";
        }
        if (text.chars().anyMatch(c -> c == '{' || c == '}' || c == '<' || c == '>')) {
            return " {" + Json.toJson(text) + "} ";
        }
        return " " + text + " ";
    }
}
