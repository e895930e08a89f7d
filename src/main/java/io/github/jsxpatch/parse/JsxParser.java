package io.github.jsxpatch.parse;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Parses a TSX/JSX source file into a {@link JsxDocument}.
 * <p>
 * The surrounding TypeScript is not modelled: the parser walks it only far enough to skip strings, template
 * literals, comments and regular expressions, to keep track of brace nesting, and to recognise where a JSX
 * element may start (expression position: after an operator, an opening bracket or a keyword such as
 * {@code return}). Everything inside a JSX element is parsed exactly, with source spans for every node and
 * attribute.
 * <p>
 * Parsing is strict about JSX structure: unterminated literals, unclosed tags and mismatched closing tags are
 * reported as a {@link ParseException}; no recovery is attempted.
 */
public final class JsxParser {
    private static final Logger logger = LogManager.getLogger(JsxParser.class);

    /**
     * Keywords after which an expression, and therefore JSX or a regular expression literal, may start.
     */
    private static final Set<String> EXPRESSION_KEYWORDS = Set.of(
            "return", "yield", "await", "case", "default", "typeof", "void", "delete",
            "in", "of", "new", "else", "do", "throw", "instanceof");

    private final String src;
    private final int length;
    private int pos;

    private JsxParser(String src) {
        this.src = src;
        this.length = src.length();
    }

    public static JsxDocument parse(String source) {
        var parser = new JsxParser(source);
        var roots = new ArrayList<JsxNode>();
        parser.scanCode(roots, false);
        logger.debug("Parsed {} chars into {} JSX root(s)", source.length(), roots.size());
        return new JsxDocument(source, roots);
    }

    /**
     * Walks script code, collecting any JSX found into {@code out}. When {@code untilClosingBrace} is set, stops
     * (without consuming it) at the {@code }} that closes the current expression container.
     */
    private void scanCode(List<JsxNode> out, boolean untilClosingBrace) {
        int braceDepth = 0;
        boolean expressionExpected = true;
        while (pos < length) {
            char c = src.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
                continue;
            }
            if (c == '/' && peek(1) == '/') {
                skipLineComment();
                continue;
            }
            if (c == '/' && peek(1) == '*') {
                skipBlockComment();
                continue;
            }

            switch (c) {
                case '"', '\'' -> {
                    skipString(c);
                    expressionExpected = false;
                }
                case '`' -> {
                    scanTemplate(out);
                    expressionExpected = false;
                }
                case '{' -> {
                    braceDepth++;
                    pos++;
                    expressionExpected = true;
                }
                case '}' -> {
                    if (braceDepth == 0) {
                        if (untilClosingBrace) {
                            return;
                        }
                        throw ParseException.at(src, pos, "Unbalanced '}'");
                    }
                    braceDepth--;
                    pos++;
                    expressionExpected = true;
                }
                case ')', ']' -> {
                    pos++;
                    expressionExpected = false;
                }
                case '/' -> {
                    if (expressionExpected && skipRegex()) {
                        expressionExpected = false;
                    } else {
                        pos++;
                        expressionExpected = true;
                    }
                }
                case '<' -> {
                    if (expressionExpected && looksLikeJsxStart()) {
                        out.add(parseJsx());
                        expressionExpected = false;
                    } else {
                        pos++;
                        expressionExpected = true;
                    }
                }
                default -> {
                    if (isIdentifierStart(c)) {
                        int start = pos;
                        while (pos < length && isIdentifierPart(src.charAt(pos))) {
                            pos++;
                        }
                        expressionExpected = EXPRESSION_KEYWORDS.contains(src.substring(start, pos));
                    } else if (Character.isDigit(c)) {
                        while (pos < length && (isIdentifierPart(src.charAt(pos)) || src.charAt(pos) == '.')) {
                            pos++;
                        }
                        expressionExpected = false;
                    } else {
                        // operators and remaining punctuation
                        pos++;
                        expressionExpected = true;
                    }
                }
            }
        }

        if (untilClosingBrace) {
            throw ParseException.at(src, pos, "Unterminated expression container");
        }
        if (braceDepth != 0) {
            throw ParseException.at(src, pos, "Unbalanced '{'");
        }
    }

    /**
     * Decides whether the {@code <} at the current position opens JSX rather than a TypeScript type parameter
     * list such as {@code <T,>(x: T) => x}, {@code <T extends Base>(...)}, {@code <T = string>} or the generic
     * function type {@code <T>(x: T) => T}.
     */
    private boolean looksLikeJsxStart() {
        char next = peek(1);
        if (next == '>') {
            return true;
        }
        if (!isIdentifierStart(next)) {
            return false;
        }
        int q = pos + 1;
        while (q < length && isTagNamePart(src.charAt(q))) {
            q++;
        }
        int r = q;
        while (r < length && Character.isWhitespace(src.charAt(r))) {
            r++;
        }
        if (r < length && (src.charAt(r) == ',' || src.charAt(r) == '=')) {
            return false;
        }
        if (r < length && src.charAt(r) == '>' && isArrowSignatureAt(r + 1)) {
            return false;
        }
        return !(r > q
                 && src.startsWith("extends", r)
                 && r + 7 < length
                 && Character.isWhitespace(src.charAt(r + 7)));
    }

    /**
     * Whether a parenthesized parameter list followed by {@code =>} starts at {@code p}, after optional whitespace.
     */
    private boolean isArrowSignatureAt(int p) {
        int r = p;
        while (r < length && Character.isWhitespace(src.charAt(r))) {
            r++;
        }
        if (r >= length || src.charAt(r) != '(') {
            return false;
        }
        int depth = 0;
        while (r < length) {
            char c = src.charAt(r);
            if (c == '(') {
                depth++;
            } else if (c == ')' && --depth == 0) {
                break;
            }
            r++;
        }
        r++;
        while (r < length && Character.isWhitespace(src.charAt(r))) {
            r++;
        }
        return src.startsWith("=>", r);
    }

    private JsxNode parseJsx() {
        int start = pos;
        pos++; // '<'

        if (peek(0) == '>') {
            pos++;
            var openingSpan = new SourceSpan(start, pos);
            var children = new ArrayList<JsxNode>();
            var closingSpan = parseChildren(children, "", start);
            return new JsxFragment(new SourceSpan(start, pos), openingSpan, closingSpan, children);
        }

        int nameStart = pos;
        while (pos < length && isTagNamePart(src.charAt(pos))) {
            pos++;
        }
        var tagName = src.substring(nameStart, pos);
        var tagNameSpan = new SourceSpan(nameStart, pos);
        if (peek(0) == '<') {
            skipTypeArguments();
        }
        int attributesStart = pos;

        var attributes = new ArrayList<JsxAttribute>();
        boolean selfClosing;
        while (true) {
            skipWhitespaceAndComments();
            if (pos >= length) {
                throw ParseException.at(src, start, "Unterminated opening tag <" + tagName + ">");
            }
            char c = src.charAt(pos);
            if (c == '/') {
                if (peek(1) != '>') {
                    throw ParseException.at(src, pos, "Expected '/>' in <" + tagName + ">");
                }
                pos += 2;
                selfClosing = true;
                break;
            }
            if (c == '>') {
                pos++;
                selfClosing = false;
                break;
            }
            if (c == '{') {
                var spread = parseExpressionContainer();
                attributes.add(new JsxAttribute(null, spread.span(), JsxAttribute.ValueKind.SPREAD,
                                                spread.span(), spread, null));
                continue;
            }
            if (isIdentifierStart(c)) {
                attributes.add(parseAttribute(tagName));
                continue;
            }
            throw ParseException.at(src, pos, "Unexpected '" + c + "' in <" + tagName + ">");
        }

        var openingSpan = new SourceSpan(start, pos);
        if (selfClosing) {
            return new JsxElement(openingSpan, tagName, tagNameSpan, attributesStart, openingSpan,
                                  attributes, List.of(), null);
        }

        var children = new ArrayList<JsxNode>();
        var closingSpan = parseChildren(children, tagName, start);
        return new JsxElement(new SourceSpan(start, pos), tagName, tagNameSpan, attributesStart, openingSpan,
                              attributes, children, closingSpan);
    }

    private JsxAttribute parseAttribute(String tagName) {
        int start = pos;
        while (pos < length && isAttributeNamePart(src.charAt(pos))) {
            pos++;
        }
        var name = src.substring(start, pos);
        int afterName = pos;

        skipWhitespaceAndComments();
        if (peek(0) != '=') {
            pos = afterName;
            return new JsxAttribute(name, new SourceSpan(start, afterName), JsxAttribute.ValueKind.NONE,
                                    null, null, null);
        }
        pos++;
        skipWhitespaceAndComments();

        char c = peek(0);
        if (c == '"' || c == '\'') {
            int valueStart = pos;
            pos++;
            while (pos < length && src.charAt(pos) != c) {
                pos++;
            }
            if (pos >= length) {
                throw ParseException.at(src, valueStart, "Unterminated string value for attribute " + name);
            }
            pos++;
            var valueSpan = new SourceSpan(valueStart, pos);
            return new JsxAttribute(name, new SourceSpan(start, pos), JsxAttribute.ValueKind.STRING,
                                    valueSpan, null, null);
        }
        if (c == '{') {
            var expression = parseExpressionContainer();
            return new JsxAttribute(name, new SourceSpan(start, pos), JsxAttribute.ValueKind.EXPRESSION,
                                    expression.span(), expression, null);
        }
        if (c == '<') {
            var element = parseJsx();
            return new JsxAttribute(name, new SourceSpan(start, pos), JsxAttribute.ValueKind.ELEMENT,
                                    element.span(), null, element);
        }
        throw ParseException.at(src, pos, "Expected a value for attribute " + name + " of <" + tagName + ">");
    }

    private JsxExpression parseExpressionContainer() {
        int start = pos;
        pos++; // '{'
        var nested = new ArrayList<JsxNode>();
        scanCode(nested, true);
        pos++; // '}'
        return new JsxExpression(new SourceSpan(start, pos), nested);
    }

    /**
     * Parses body children up to and including the closing tag, returning the closing tag's span.
     * An empty {@code tagName} denotes a fragment.
     */
    private SourceSpan parseChildren(List<JsxNode> children, String tagName, int openStart) {
        while (true) {
            if (pos >= length) {
                throw ParseException.at(src, openStart,
                                        tagName.isEmpty() ? "Unclosed fragment" : "Unclosed <" + tagName + ">");
            }
            char c = src.charAt(pos);
            if (c == '<') {
                if (peek(1) == '/') {
                    return parseClosingTag(tagName);
                }
                if (peek(1) != '>' && !isIdentifierStart(peek(1))) {
                    throw ParseException.at(src, pos, "Unexpected '<' in body of <" + tagName + ">");
                }
                children.add(parseJsx());
            } else if (c == '{') {
                children.add(parseExpressionContainer());
            } else {
                int textStart = pos;
                while (pos < length && src.charAt(pos) != '<' && src.charAt(pos) != '{') {
                    pos++;
                }
                children.add(new JsxText(new SourceSpan(textStart, pos)));
            }
        }
    }

    private SourceSpan parseClosingTag(String expectedName) {
        int start = pos;
        pos += 2; // '</'
        skipWhitespace();
        int nameStart = pos;
        while (pos < length && isTagNamePart(src.charAt(pos))) {
            pos++;
        }
        var closingName = src.substring(nameStart, pos);
        skipWhitespace();
        if (peek(0) != '>') {
            throw ParseException.at(src, start, "Malformed closing tag </" + closingName);
        }
        pos++;
        if (!closingName.equals(expectedName)) {
            throw ParseException.at(src, start, "Expected closing tag for <%s> but found </%s>"
                    .formatted(expectedName, closingName));
        }
        return new SourceSpan(start, pos);
    }

    private void scanTemplate(List<JsxNode> out) {
        int start = pos;
        pos++; // '`'
        while (pos < length) {
            char c = src.charAt(pos);
            if (c == '\\') {
                pos += 2;
            } else if (c == '`') {
                pos++;
                return;
            } else if (c == '$' && peek(1) == '{') {
                pos += 2;
                scanCode(out, true);
                pos++; // '}'
            } else {
                pos++;
            }
        }
        throw ParseException.at(src, start, "Unterminated template literal");
    }

    private void skipString(char quote) {
        int start = pos;
        pos++;
        while (pos < length) {
            char c = src.charAt(pos);
            if (c == '\\') {
                pos += 2;
                continue;
            }
            if (c == quote) {
                pos++;
                return;
            }
            if (c == '\n') {
                break;
            }
            pos++;
        }
        throw ParseException.at(src, start, "Unterminated string literal");
    }

    /**
     * Skips a regular expression literal. Returns false, leaving the position untouched, when the slash turns
     * out not to start one (no closing slash on the same line).
     */
    private boolean skipRegex() {
        int p = pos + 1;
        boolean inClass = false;
        while (p < length) {
            char c = src.charAt(p);
            if (c == '\n') {
                return false;
            }
            if (c == '\\') {
                p += 2;
                continue;
            }
            if (c == '[') {
                inClass = true;
            } else if (c == ']') {
                inClass = false;
            } else if (c == '/' && !inClass) {
                p++;
                while (p < length && Character.isLetter(src.charAt(p))) {
                    p++;
                }
                pos = p;
                return true;
            }
            p++;
        }
        return false;
    }

    private void skipTypeArguments() {
        int start = pos;
        int depth = 0;
        while (pos < length) {
            char c = src.charAt(pos++);
            if (c == '<') {
                depth++;
            } else if (c == '>') {
                depth--;
                if (depth == 0) {
                    return;
                }
            }
        }
        throw ParseException.at(src, start, "Unterminated type arguments");
    }

    private void skipLineComment() {
        while (pos < length && src.charAt(pos) != '\n') {
            pos++;
        }
    }

    private void skipBlockComment() {
        int end = src.indexOf("*/", pos + 2);
        if (end < 0) {
            throw ParseException.at(src, pos, "Unterminated comment");
        }
        pos = end + 2;
    }

    private void skipWhitespace() {
        while (pos < length && Character.isWhitespace(src.charAt(pos))) {
            pos++;
        }
    }

    private void skipWhitespaceAndComments() {
        while (pos < length) {
            char c = src.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '/' && peek(1) == '/') {
                skipLineComment();
            } else if (c == '/' && peek(1) == '*') {
                skipBlockComment();
            } else {
                return;
            }
        }
    }

    private char peek(int ahead) {
        int p = pos + ahead;
        return p < length ? src.charAt(p) : '\0';
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    private static boolean isTagNamePart(char c) {
        return isIdentifierPart(c) || c == '.' || c == ':' || c == '-';
    }

    private static boolean isAttributeNamePart(char c) {
        return isIdentifierPart(c) || c == ':' || c == '-';
    }
}
