package io.github.jsxpatch.locate;

import com.google.common.base.Splitter;
import io.github.jsxpatch.classes.ClassTokenExtractor;
import io.github.jsxpatch.classes.ClassValueParser;
import io.github.jsxpatch.config.EditorConfig;
import io.github.jsxpatch.model.ElementInfo;
import io.github.jsxpatch.parse.JsxDocument;
import io.github.jsxpatch.parse.JsxElement;
import io.github.jsxpatch.parse.JsxNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Resolves an {@link ElementInfo} to one element or fragment of a parsed document.
 * <p>
 * The position token is tried first. When it is absent, unparseable, out of range or lands outside any JSX, the
 * element whose class list best covers the observed classes is taken instead, provided it covers at least
 * {@link EditorConfig#fuzzyMatchThreshold()} of them.
 */
public final class ElementLocator {
    private static final Logger logger = LogManager.getLogger(ElementLocator.class);

    private static final Splitter LINES = Splitter.on('\n');

    private final EditorConfig config;
    private final ClassValueParser valueParser;

    public ElementLocator(EditorConfig config) {
        this.config = config;
        this.valueParser = new ClassValueParser(config);
    }

    /**
     * @throws LocatorException when neither strategy finds the element
     */
    public JsxNode locate(JsxDocument document, ElementInfo info) {
        var position = PositionToken.parse(info.shipperId());
        if (position.isPresent()) {
            logger.debug("Finding element by position {}", position.get());
            var found = locateByPosition(document, position.get());
            if (found.isPresent()) {
                logger.debug("Found {} by position", found.get());
                return found.get();
            }
        }

        var observed = info.observedClasses();
        if (!observed.isEmpty()) {
            logger.debug("Finding element by classes {}", observed);
            var found = locateByClasses(document, observed);
            if (found.isPresent()) {
                logger.debug("Found {} by classes", found.get());
                return found.get();
            }
        }

        if (observed.isEmpty() && !info.hasShipperId()) {
            throw LocatorException.noIdentifyingInformation();
        }
        throw LocatorException.structureChanged();
    }

    /**
     * The nearest element or fragment enclosing the character the token points at.
     */
    public Optional<JsxNode> locateByPosition(JsxDocument document, PositionToken position) {
        var offset = toOffset(document.source(), position.line(), position.column());
        if (offset.isEmpty()) {
            return Optional.empty();
        }

        JsxNode current = document.deepestAt(offset.getAsInt()).orElse(null);
        while (current != null && !current.kind().isElementLike()) {
            current = current.parent();
        }
        if (current == null) {
            logger.debug("Offset {} of {} is outside any JSX element", offset.getAsInt(), position);
        }
        return Optional.ofNullable(current);
    }

    /**
     * The element sharing the largest share of {@code observedClasses}. Ties go to the earliest element in
     * document order; a best share below the configured threshold yields nothing.
     */
    public Optional<JsxElement> locateByClasses(JsxDocument document, List<String> observedClasses) {
        var target = new LinkedHashSet<>(observedClasses);
        if (target.isEmpty()) {
            return Optional.empty();
        }

        JsxElement best = null;
        double bestRatio = 0.0;
        for (var element : document.elements()) {
            var attribute = element.attribute(config.classAttribute());
            if (attribute.isEmpty()) {
                continue;
            }
            var value = valueParser.parse(document.source(), attribute.get());
            var candidate = new HashSet<>(ClassTokenExtractor.extract(value));
            int matchCount = 0;
            for (var cls : target) {
                if (candidate.contains(cls)) {
                    matchCount++;
                }
            }
            if (matchCount == 0) {
                continue;
            }
            double ratio = (double) matchCount / target.size();
            if (ratio > bestRatio) {
                best = element;
                bestRatio = ratio;
            }
        }

        if (best == null) {
            return Optional.empty();
        }
        if (bestRatio < config.fuzzyMatchThreshold()) {
            logger.debug("Best class match {} covers only {} of {}", best, bestRatio, target);
            return Optional.empty();
        }
        return Optional.of(best);
    }

    /**
     * Absolute offset of {@code column} on 1-based {@code line}: the lengths of all previous lines, each plus one
     * for its newline, then the column. Empty when the line does not exist or the offset is past the end.
     */
    public static OptionalInt toOffset(String source, int line, int column) {
        var lines = LINES.splitToList(source);
        if (line < 1 || line > lines.size()) {
            logger.warn("Line number out of range: {} (file has {} lines)", line, lines.size());
            return OptionalInt.empty();
        }
        int offset = 0;
        for (int i = 0; i < line - 1; i++) {
            offset += lines.get(i).length() + 1;
        }
        offset += column;
        if (offset >= source.length()) {
            logger.warn("Column {} on line {} is past the end of the file", column, line);
            return OptionalInt.empty();
        }
        return OptionalInt.of(offset);
    }
}
