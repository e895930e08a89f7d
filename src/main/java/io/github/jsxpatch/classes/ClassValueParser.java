package io.github.jsxpatch.classes;

import io.github.jsxpatch.config.EditorConfig;
import io.github.jsxpatch.parse.JsxAttribute;
import io.github.jsxpatch.parse.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Classifies a class attribute's value into one of the {@link ClassValue} shapes.
 */
public final class ClassValueParser {
    private static final Pattern CALLEE =
            Pattern.compile("[A-Za-z_$][\\w$]*(?:\\s*\\.\\s*[A-Za-z_$][\\w$]*)*");

    private final EditorConfig config;

    public ClassValueParser(EditorConfig config) {
        this.config = config;
    }

    public ClassValue parse(String source, JsxAttribute attribute) {
        return switch (attribute.valueKind()) {
            case STRING -> {
                var span = attribute.valueSpan();
                assert span != null;
                yield new ClassValue.PlainLiteral(span, source.charAt(span.start()), attribute.stringContent(source));
            }
            case EXPRESSION -> {
                var expression = attribute.expression();
                assert expression != null;
                yield parseExpression(source, expression.expressionSpan(source));
            }
            case ELEMENT, SPREAD -> {
                var span = attribute.valueSpan();
                assert span != null;
                yield new ClassValue.Unknown(span, span.text(source));
            }
            case NONE -> new ClassValue.Unknown(attribute.span(), "");
        };
    }

    ClassValue parseExpression(String source, SourceSpan expr) {
        if (expr.length() == 0) {
            return new ClassValue.Unknown(expr, "");
        }
        var scanner = new ExpressionScanner(source, expr.end());
        int start = expr.start();
        char first = source.charAt(start);

        if (first == '"' || first == '\'') {
            if (scanner.skipLiteral(start) == expr.end()) {
                return new ClassValue.WrappedLiteral(expr, first, source.substring(start + 1, expr.end() - 1));
            }
        } else if (first == '`') {
            if (scanner.skipLiteral(start) == expr.end()) {
                return new ClassValue.Interpolated(expr, expr.text(source));
            }
        } else {
            var matcher = CALLEE.matcher(source).region(start, expr.end());
            if (matcher.lookingAt()) {
                int p = matcher.end();
                while (p < expr.end() && Character.isWhitespace(source.charAt(p))) {
                    p++;
                }
                if (p < expr.end() && source.charAt(p) == '(') {
                    int close = scanner.findClosing(p);
                    var callee = matcher.group().replaceAll("\\s+", "");
                    if (close == expr.end() - 1 && config.isMergeFunction(callee)) {
                        var argumentsSpan = new SourceSpan(p + 1, close);
                        return new ClassValue.MergeCall(expr, callee, argumentsSpan,
                                                        parseArguments(source, scanner, argumentsSpan));
                    }
                }
            }
        }
        return new ClassValue.Unknown(expr, expr.text(source));
    }

    private static List<CallArgument> parseArguments(String source, ExpressionScanner scanner, SourceSpan arguments) {
        var result = new ArrayList<CallArgument>();
        for (var span : scanner.splitTopLevel(arguments.start(), arguments.end(), ',')) {
            result.add(classifyArgument(source, scanner, span));
        }
        return result;
    }

    private static CallArgument classifyArgument(String source, ExpressionScanner scanner, SourceSpan span) {
        char first = source.charAt(span.start());
        var raw = span.text(source);
        if ((first == '"' || first == '\'') && scanner.skipLiteral(span.start()) == span.end()) {
            return new CallArgument.StringArgument(span, first, source.substring(span.start() + 1, span.end() - 1));
        }
        if (first == '`' && scanner.skipLiteral(span.start()) == span.end()) {
            return new CallArgument.TemplateArgument(span, raw);
        }
        if (first == '{' && scanner.findClosing(span.start()) == span.end() - 1) {
            return new CallArgument.ObjectArgument(span, raw, objectKeys(source, scanner, span));
        }
        return new CallArgument.OtherArgument(span, raw);
    }

    /**
     * Property names of an object literal, quotes stripped. Spreads, shorthand properties and computed keys are
     * skipped.
     */
    private static List<String> objectKeys(String source, ExpressionScanner scanner, SourceSpan object) {
        var keys = new ArrayList<String>();
        for (var entry : scanner.splitTopLevel(object.start() + 1, object.end() - 1, ',')) {
            var text = entry.text(source);
            if (text.startsWith("...")) {
                continue;
            }
            int colon = scanner.indexOfTopLevel(entry.start(), entry.end(), ':');
            if (colon < 0) {
                continue;
            }
            var key = scanner.trim(entry.start(), colon).text(source);
            if (key.startsWith("[")) {
                continue;
            }
            key = stripQuotes(key).strip();
            if (!key.isEmpty()) {
                keys.add(key);
            }
        }
        return keys;
    }

    private static String stripQuotes(String key) {
        if (key.length() >= 2) {
            char first = key.charAt(0);
            char last = key.charAt(key.length() - 1);
            if (first == last && (first == '"' || first == '\'' || first == '`')) {
                return key.substring(1, key.length() - 1);
            }
        }
        return key;
    }
}
