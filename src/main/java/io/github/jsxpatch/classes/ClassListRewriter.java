package io.github.jsxpatch.classes;

import io.github.jsxpatch.UnsupportedTargetException;
import io.github.jsxpatch.config.EditorConfig;
import io.github.jsxpatch.parse.JsxAttribute;
import io.github.jsxpatch.parse.JsxElement;
import io.github.jsxpatch.parse.JsxNode;
import io.github.jsxpatch.parse.SourceEdit;
import io.github.jsxpatch.parse.SourceSpan;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies a {@link ClassUpdate} to the class attribute of one element, producing edits confined to that
 * element's opening tag.
 * <p>
 * Per shape of the current value:
 * <ul>
 *   <li>no attribute: a new {@code className="..."} is inserted right after the tag name;</li>
 *   <li>plain or wrapped literal: tokens are filtered and the missing additions appended, keeping the shape;</li>
 *   <li>merge call: every string argument is filtered, the first one left non-empty receives the additions,
 *       emptied ones are dropped, and all other arguments are copied through byte for byte. When no string
 *       argument survives, the additions become a new first argument;</li>
 *   <li>template literal or any other expression: wrapped as the first argument of a new merge call whose
 *       second argument holds the additions. Removals cannot be applied to dynamic content and are skipped.</li>
 * </ul>
 */
public final class ClassListRewriter {
    private static final Logger logger = LogManager.getLogger(ClassListRewriter.class);

    private final EditorConfig config;
    private final ClassValueParser valueParser;

    public ClassListRewriter(EditorConfig config) {
        this.config = config;
        this.valueParser = new ClassValueParser(config);
    }

    /**
     * Returns the edits applying {@code update} to {@code target}; empty when the class list would not change.
     *
     * @throws UnsupportedTargetException when the target is a fragment, which has no attributes
     */
    public List<SourceEdit> rewrite(String source, JsxNode target, ClassUpdate update) {
        if (!(target instanceof JsxElement element)) {
            throw new UnsupportedTargetException("Cannot update class names on a JSX fragment", target.kind());
        }

        var existing = element.attribute(config.classAttribute());
        if (existing.isEmpty()) {
            return insertAttribute(element, update);
        }

        var attribute = existing.get();
        if (attribute.valueKind() == JsxAttribute.ValueKind.NONE) {
            if (update.classesToAdd().isEmpty()) {
                return List.of();
            }
            return List.of(SourceEdit.replace(attribute.span(),
                                              config.classAttribute() + "=" + quote(join(update.classesToAdd()), '"')));
        }

        var value = valueParser.parse(source, attribute);
        logger.debug("Class attribute of <{}> has shape {}", element.tagName(), value.getClass().getSimpleName());
        if (attribute.valueKind() == JsxAttribute.ValueKind.ELEMENT && value instanceof ClassValue.Unknown unknown) {
            return wrapInMergeCall(unknown.span(), unknown.raw(), update, true);
        }
        return rewriteValue(source, value, update);
    }

    List<SourceEdit> rewriteValue(String source, ClassValue value, ClassUpdate update) {
        if (value instanceof ClassValue.PlainLiteral plain) {
            return rewriteLiteral(plain.span(), plain.quote(), plain.value(), update);
        }
        if (value instanceof ClassValue.WrappedLiteral wrapped) {
            return rewriteLiteral(wrapped.span(), wrapped.quote(), wrapped.value(), update);
        }
        if (value instanceof ClassValue.MergeCall call) {
            return rewriteMergeCall(source, call, update);
        }
        if (value instanceof ClassValue.Interpolated interpolated) {
            return wrapInMergeCall(interpolated.span(), interpolated.raw(), update, false);
        }
        if (value instanceof ClassValue.Unknown unknown) {
            return wrapInMergeCall(unknown.span(), unknown.raw(), update, false);
        }
        throw new IllegalStateException("Unhandled class value " + value);
    }

    private List<SourceEdit> insertAttribute(JsxElement element, ClassUpdate update) {
        if (update.classesToAdd().isEmpty()) {
            logger.debug("<{}> has no {} and nothing is added", element.tagName(), config.classAttribute());
            return List.of();
        }
        var attribute = " " + config.classAttribute() + "=" + quote(join(update.classesToAdd()), '"');
        return List.of(SourceEdit.insert(element.attributesStart(), attribute));
    }

    private static List<SourceEdit> rewriteLiteral(SourceSpan span, char quote, String value, ClassUpdate update) {
        var tokens = ClassTokenExtractor.splitClasses(value);
        var updated = update.applyTo(tokens);
        if (updated.equals(tokens)) {
            return List.of();
        }
        return List.of(SourceEdit.replace(span, quote(join(updated), quote)));
    }

    private List<SourceEdit> rewriteMergeCall(String source, ClassValue.MergeCall call, ClassUpdate update) {
        var arguments = call.arguments();
        var argumentsSpan = call.argumentsSpan();
        char defaultQuote = '"';
        boolean quoteChosen = false;

        var keptTexts = new ArrayList<String>();
        var keptIndexes = new ArrayList<Integer>();
        boolean added = false;
        for (int i = 0; i < arguments.size(); i++) {
            var argument = arguments.get(i);
            if (!(argument instanceof CallArgument.StringArgument string)) {
                keptTexts.add(argument.span().text(source));
                keptIndexes.add(i);
                continue;
            }
            if (!quoteChosen) {
                // a synthesized argument follows the quoting of the call's first string
                defaultQuote = string.quote();
                quoteChosen = true;
            }

            var tokens = ClassTokenExtractor.splitClasses(string.value());
            var filtered = update.filter(tokens);
            if (filtered.isEmpty()) {
                logger.debug("Dropping {} argument {} emptied by removal", call.callee(), argument.span().text(source));
                continue;
            }
            var updated = added ? filtered : update.withAdditions(filtered);
            added = true;
            keptTexts.add(updated.equals(tokens) ? argument.span().text(source) : quote(join(updated), string.quote()));
            keptIndexes.add(i);
        }

        boolean insertFirst = !added && !update.classesToAdd().isEmpty();
        var sb = new StringBuilder();
        if (arguments.isEmpty()) {
            if (!insertFirst) {
                return List.of();
            }
            sb.append(quote(join(update.classesToAdd()), defaultQuote));
        } else {
            boolean empty = keptTexts.isEmpty() && !insertFirst;
            if (!empty) {
                sb.append(source, argumentsSpan.start(), arguments.get(0).span().start());
            }
            if (insertFirst) {
                sb.append(quote(join(update.classesToAdd()), defaultQuote));
                if (!keptTexts.isEmpty()) {
                    sb.append(", ");
                }
            }
            for (int j = 0; j < keptTexts.size(); j++) {
                sb.append(keptTexts.get(j));
                if (j < keptTexts.size() - 1) {
                    sb.append(separatorAfter(source, arguments, keptIndexes.get(j)));
                }
            }
            if (!empty) {
                sb.append(source, arguments.get(arguments.size() - 1).span().end(), argumentsSpan.end());
            }
        }

        var replacement = sb.toString();
        if (replacement.equals(argumentsSpan.text(source))) {
            return List.of();
        }
        return List.of(SourceEdit.replace(argumentsSpan, replacement));
    }

    private List<SourceEdit> wrapInMergeCall(SourceSpan span, String raw, ClassUpdate update, boolean braces) {
        if (!update.classesToRemove().isEmpty()) {
            logger.warn("Class value {} is dynamic; removal patterns {} are not applied to it",
                        raw, update.classesToRemove());
        }
        if (update.classesToAdd().isEmpty()) {
            return List.of();
        }
        var call = config.primaryMergeFunction() + "(" + raw + ", " + quote(join(update.classesToAdd()), '"') + ")";
        return List.of(SourceEdit.replace(span, braces ? "{" + call + "}" : call));
    }

    private static String separatorAfter(String source, List<CallArgument> arguments, int index) {
        if (index < arguments.size() - 1) {
            return source.substring(arguments.get(index).span().end(), arguments.get(index + 1).span().start());
        }
        return ", ";
    }

    private static String join(List<String> tokens) {
        return String.join(" ", tokens);
    }

    /**
     * Quotes {@code text} with {@code preferred}, switching to the other quote when the text contains it.
     */
    static String quote(String text, char preferred) {
        char q = preferred == '\'' ? '\'' : '"';
        if (text.indexOf(q) >= 0) {
            q = q == '"' ? '\'' : '"';
        }
        return q + text + q;
    }
}
