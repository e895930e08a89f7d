package io.github.jsxpatch.edit;

import io.github.jsxpatch.parse.JsxParser;
import io.github.jsxpatch.parse.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Post-rewrite checks. Mismatches are logged and reported, never thrown: the caller decides what is fatal.
 */
public final class EditVerifier {
    private static final Logger logger = LogManager.getLogger(EditVerifier.class);

    /**
     * @return the classes that do not occur anywhere in {@code content}
     */
    public List<String> missingClasses(String filePath, String content, List<String> expectedClasses) {
        var missing = expectedClasses.stream().filter(cls -> !content.contains(cls)).toList();
        if (!missing.isEmpty()) {
            logger.warn("Some new classes not found in updated {}: {}", filePath, missing);
        }
        return missing;
    }

    public boolean containsText(String filePath, String content, String expectedText) {
        if (content.contains(expectedText)) {
            return true;
        }
        logger.warn("New text content not found in updated {}: '{}'", filePath, expectedText);
        return false;
    }

    /**
     * Re-parses {@code content}; false (and a warning) when it no longer parses.
     */
    public boolean isWellFormed(String filePath, String content) {
        try {
            JsxParser.parse(content);
            return true;
        } catch (ParseException e) {
            logger.warn("Updated {} no longer parses: {}", filePath, e.getMessage());
            return false;
        }
    }
}
