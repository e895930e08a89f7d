package io.github.jsxpatch.classes;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the set of class tokens a class attribute value carries, for every {@link ClassValue} shape.
 * <p>
 * Template literals are read by picking out identifier-like runs from the raw text, holes included, so
 * {@code `btn-${size}`} reports {@code btn-} and {@code size}. This over-reports on purpose: it is only used to
 * score candidates when locating an element.
 */
public final class ClassTokenExtractor {
    private static final Splitter WHITESPACE = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

    /** Identifier-like runs inside template literals. */
    static final Pattern TOKEN_RUN = Pattern.compile("[A-Za-z][A-Za-z0-9_-]*");

    /** Quoted substrings of an expression we cannot otherwise interpret. */
    static final Pattern QUOTED = Pattern.compile("[\"'`]([^\"'`]+)[\"'`]");

    private ClassTokenExtractor() {
        // Utility class
    }

    public static List<String> splitClasses(String classList) {
        return WHITESPACE.splitToList(classList);
    }

    public static List<String> extract(ClassValue value) {
        if (value instanceof ClassValue.PlainLiteral plain) {
            return splitClasses(plain.value());
        }
        if (value instanceof ClassValue.WrappedLiteral wrapped) {
            return splitClasses(wrapped.value());
        }
        if (value instanceof ClassValue.Interpolated interpolated) {
            return tokenRuns(interpolated.raw());
        }
        if (value instanceof ClassValue.MergeCall call) {
            return fromArguments(call.arguments());
        }
        if (value instanceof ClassValue.Unknown unknown) {
            return quotedTokens(unknown.raw());
        }
        throw new IllegalStateException("Unhandled class value " + value);
    }

    private static List<String> fromArguments(List<CallArgument> arguments) {
        var classes = new ArrayList<String>();
        for (var argument : arguments) {
            if (argument instanceof CallArgument.StringArgument string) {
                classes.addAll(splitClasses(string.value()));
            } else if (argument instanceof CallArgument.TemplateArgument template) {
                classes.addAll(tokenRuns(template.raw()));
            } else if (argument instanceof CallArgument.ObjectArgument object) {
                // each key is one conditional class name
                classes.addAll(object.keys());
            }
        }
        return classes;
    }

    static List<String> tokenRuns(String raw) {
        var tokens = new ArrayList<String>();
        Matcher m = TOKEN_RUN.matcher(raw);
        while (m.find()) {
            tokens.add(m.group());
        }
        return tokens;
    }

    static List<String> quotedTokens(String raw) {
        var tokens = new ArrayList<String>();
        Matcher m = QUOTED.matcher(raw);
        while (m.find()) {
            tokens.addAll(splitClasses(m.group(1)));
        }
        return tokens;
    }
}
