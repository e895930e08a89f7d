package io.github.jsxpatch.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The JSX tree of one source file. Built for a single rewrite and discarded afterwards.
 */
public final class JsxDocument {
    private final String source;
    private final List<JsxNode> roots;

    JsxDocument(String source, List<JsxNode> roots) {
        this.source = source;
        this.roots = List.copyOf(roots);
    }

    public String source() {
        return source;
    }

    /**
     * Outermost JSX nodes, i.e. those not nested inside another JSX node.
     */
    public List<JsxNode> roots() {
        return roots;
    }

    /**
     * Every node in document order (pre-order, attribute values before body children).
     */
    public List<JsxNode> allNodes() {
        var result = new ArrayList<JsxNode>();
        for (var root : roots) {
            collect(root, result);
        }
        return result;
    }

    /**
     * Every named element, with or without a body, in document order.
     */
    public List<JsxElement> elements() {
        var result = new ArrayList<JsxElement>();
        for (var node : allNodes()) {
            if (node instanceof JsxElement element) {
                result.add(element);
            }
        }
        return result;
    }

    /**
     * The innermost node whose span contains {@code offset}.
     */
    public Optional<JsxNode> deepestAt(int offset) {
        List<JsxNode> candidates = roots;
        JsxNode found = null;
        boolean descended = true;
        while (descended) {
            descended = false;
            for (var candidate : candidates) {
                if (candidate.span().contains(offset)) {
                    found = candidate;
                    candidates = candidate.childNodes();
                    descended = true;
                    break;
                }
            }
        }
        return Optional.ofNullable(found);
    }

    private static void collect(JsxNode node, List<JsxNode> out) {
        out.add(node);
        for (var child : node.childNodes()) {
            collect(child, out);
        }
    }
}
