package io.github.jsxpatch.locate;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.Optional;

/**
 * A parsed {@code fileTag:line:column} token. {@code line} is 1-based; {@code column} is the raw character offset
 * of the element's {@code <} within that line, tabs counting as one character.
 */
public record PositionToken(String fileTag, int line, int column) {
    private static final Logger logger = LogManager.getLogger(PositionToken.class);

    private static final Splitter COLON = Splitter.on(':');
    private static final CharMatcher DIGITS = CharMatcher.inRange('0', '9');

    public PositionToken {
        if (line < 1) {
            throw new IllegalArgumentException("line must be >= 1, got " + line);
        }
        if (column < 0) {
            throw new IllegalArgumentException("column must be >= 0, got " + column);
        }
    }

    /**
     * Parses a token, or returns empty when it is missing or does not have exactly three fields with a positive
     * line and a non-negative column.
     */
    public static Optional<PositionToken> parse(@Nullable String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        var parts = COLON.splitToList(token.strip());
        if (parts.size() != 3) {
            logger.warn("Ignoring position token '{}': expected fileTag:line:column", token);
            return Optional.empty();
        }
        var lineField = parts.get(1).strip();
        var columnField = parts.get(2).strip();
        if (!isNumber(lineField) || !isNumber(columnField)) {
            logger.warn("Ignoring position token '{}': line and column must be unsigned integers", token);
            return Optional.empty();
        }
        try {
            int line = Integer.parseInt(lineField);
            int column = Integer.parseInt(columnField);
            if (line < 1 || column < 0) {
                logger.warn("Ignoring position token '{}': line must be positive and column non-negative", token);
                return Optional.empty();
            }
            return Optional.of(new PositionToken(parts.get(0), line, column));
        } catch (NumberFormatException e) {
            logger.warn("Ignoring position token '{}': {}", token, e.getMessage());
            return Optional.empty();
        }
    }

    private static boolean isNumber(String field) {
        return !field.isEmpty() && DIGITS.matchesAllOf(field);
    }

    @Override
    public String toString() {
        return fileTag + ":" + line + ":" + column;
    }
}
