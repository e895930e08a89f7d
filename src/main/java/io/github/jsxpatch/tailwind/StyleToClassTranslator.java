package io.github.jsxpatch.tailwind;

import io.github.jsxpatch.classes.ClassUpdate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Map;

/**
 * Turns style edits from the preview into a {@link ClassUpdate} of Tailwind utility classes.
 */
public final class StyleToClassTranslator {
    private static final Logger logger = LogManager.getLogger(StyleToClassTranslator.class);

    /**
     * Translates every known property in {@code styleChanges}, in map order. Unknown properties and blank values
     * are skipped.
     */
    public ClassUpdate translate(Map<String, String> styleChanges) {
        var classesToAdd = new ArrayList<String>();
        var classesToRemove = new ArrayList<String>();

        for (var entry : styleChanges.entrySet()) {
            var property = StyleProperty.forName(entry.getKey());
            if (property.isEmpty()) {
                logger.warn("No Tailwind mapping for style property {}", entry.getKey());
                continue;
            }
            var value = entry.getValue();
            if (value == null || value.isBlank()) {
                logger.debug("Skipping blank value for {}", entry.getKey());
                continue;
            }
            var cls = property.get().toClass(value);
            logger.debug("{}: {} -> {}", property.get().cssName(), value, cls);
            classesToAdd.add(cls);
            classesToRemove.addAll(property.get().removalPatterns());
        }

        return ClassUpdate.of(classesToAdd, classesToRemove);
    }
}
