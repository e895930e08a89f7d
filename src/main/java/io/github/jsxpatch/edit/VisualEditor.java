package io.github.jsxpatch.edit;

import io.github.jsxpatch.classes.ClassListRewriter;
import io.github.jsxpatch.classes.ClassUpdate;
import io.github.jsxpatch.config.EditorConfig;
import io.github.jsxpatch.locate.ElementLocator;
import io.github.jsxpatch.model.ElementInfo;
import io.github.jsxpatch.model.StyleChangeRequest;
import io.github.jsxpatch.model.TextContentChangeRequest;
import io.github.jsxpatch.parse.JsxParser;
import io.github.jsxpatch.parse.SourceEdit;
import io.github.jsxpatch.tailwind.StyleToClassTranslator;
import io.github.jsxpatch.text.TextContentRewriter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Entry point of the rewrite engine: a pure function from the full text of a file, an identifying payload and a
 * change to the full new text of the file.
 * <p>
 * Every call parses the source afresh, locates one element, computes edits confined to that element and splices
 * them in. Nothing is kept between calls, so one instance may serve any number of files and threads.
 */
public final class VisualEditor {
    private static final Logger logger = LogManager.getLogger(VisualEditor.class);

    private final EditorConfig config;
    private final ElementLocator locator;
    private final ClassListRewriter classRewriter;
    private final TextContentRewriter textRewriter;
    private final StyleToClassTranslator translator;
    private final EditVerifier verifier;

    public VisualEditor() {
        this(EditorConfig.load());
    }

    public VisualEditor(EditorConfig config) {
        this.config = config;
        this.locator = new ElementLocator(config);
        this.classRewriter = new ClassListRewriter(config);
        this.textRewriter = new TextContentRewriter();
        this.translator = new StyleToClassTranslator();
        this.verifier = new EditVerifier();
    }

    public EditorConfig config() {
        return config;
    }

    /**
     * Adds and removes classes on the element {@code info} identifies.
     *
     * @param filePath only used for logging
     */
    public String updateClassNames(String source, String filePath, ElementInfo info, ClassUpdate update) {
        return rewrite(source, filePath, info, update, null);
    }

    /**
     * Replaces the literal text of the element {@code info} identifies, keeping its nested markup.
     */
    public String updateText(String source, String filePath, ElementInfo info, String newText) {
        return rewrite(source, filePath, info, ClassUpdate.of(List.of(), List.of()), newText);
    }

    /**
     * Translates the style changes into classes and applies them, together with the text change the request may
     * carry, to one located element.
     */
    public String applyStyleChange(String source, String filePath, StyleChangeRequest request) {
        var update = translator.translate(request.changes());
        logger.debug("Style changes {} translate to {}", request.changes(), update);
        return rewrite(source, filePath, request.elementInfo(), update, request.textContent());
    }

    public String applyTextChange(String source, String filePath, TextContentChangeRequest request) {
        return updateText(source, filePath, request.elementInfo(), request.textContent());
    }

    public ClassUpdate translate(Map<String, String> styleChanges) {
        return translator.translate(styleChanges);
    }

    private String rewrite(String source,
                           String filePath,
                           ElementInfo info,
                           ClassUpdate update,
                           @Nullable String newText)
    {
        if (update.isEmpty() && newText == null) {
            logger.debug("Nothing to change in {}", filePath);
            return source;
        }

        var document = JsxParser.parse(source);
        var target = locator.locate(document, info);

        var edits = new ArrayList<SourceEdit>();
        if (!update.isEmpty()) {
            logger.debug("Updating classes of {} in {}: add {} remove {}",
                         target, filePath, update.classesToAdd(), update.classesToRemove());
            edits.addAll(classRewriter.rewrite(source, target, update));
        }
        if (newText != null) {
            logger.debug("Updating text of {} in {} to '{}'", target, filePath, newText);
            edits.add(textRewriter.rewrite(source, target, newText));
        }

        var result = SourceEdit.applyAll(source, edits);
        logger.info("Applied {} edit(s) to {} in {}", edits.size(), target, filePath);

        verifier.missingClasses(filePath, result, update.classesToAdd());
        if (newText != null && !newText.isBlank()) {
            verifier.containsText(filePath, result, newText.strip());
        }
        if (config.verifyWellFormed()) {
            verifier.isWellFormed(filePath, result);
        }
        return result;
    }
}
