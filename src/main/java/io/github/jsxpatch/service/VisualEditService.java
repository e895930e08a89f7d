package io.github.jsxpatch.service;

import com.google.common.util.concurrent.MoreExecutors;
import io.github.jsxpatch.VisualEditException;
import io.github.jsxpatch.edit.JsxContentValidator;
import io.github.jsxpatch.edit.VisualEditor;
import io.github.jsxpatch.model.ElementInfo;
import io.github.jsxpatch.model.StyleChangeRequest;
import io.github.jsxpatch.model.VisualEdit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Applies visual edits to files in a {@link SourceStore}: read, rewrite, validate, write.
 * <p>
 * The rewrite itself is {@link VisualEditor}; this class owns the file boundary. Edits to one file are serialized
 * when submitted through {@link #submit}, and {@link #applyBatch} reads and writes each file once however many
 * edits target it.
 */
public class VisualEditService {
    private static final Logger logger = LogManager.getLogger(VisualEditService.class);

    private final SourceStore store;
    private final VisualEditor editor;
    private final JsxContentValidator validator;
    private final PerFileExecutor executor;

    public VisualEditService(SourceStore store, VisualEditor editor) {
        this(store, editor, MoreExecutors.newDirectExecutorService());
    }

    public VisualEditService(SourceStore store, VisualEditor editor, ExecutorService executorService) {
        this.store = store;
        this.editor = editor;
        this.validator = new JsxContentValidator(editor.config().classAttribute());
        this.executor = new PerFileExecutor(executorService);
    }

    /**
     * Strips the first configured workspace prefix {@code filePath} starts with, so preview paths address the
     * store's root.
     */
    public String normalizePath(String filePath) {
        for (var prefix : editor.config().workspacePrefixes()) {
            if (filePath.startsWith(prefix)) {
                return filePath.substring(prefix.length());
            }
        }
        return filePath;
    }

    /**
     * Applies one edit and writes the file.
     *
     * @throws UnchangedContentException  when the style change leaves the file as it was
     * @throws ContentValidationException when the rewritten file fails validation; nothing is written
     * @throws VisualEditException        for parse, locate and store failures
     */
    public EditResult apply(VisualEdit edit) {
        var filePath = normalizePath(edit.filePath());
        var before = store.read(filePath);
        var after = applyEdit(filePath, before, edit, true);
        validate(filePath, after);
        store.write(filePath, after);
        logger.info("Applied visual edit to {} ({} -> {} chars)", filePath, before.length(), after.length());
        return new EditResult(filePath, before.length(), after.length(), edit.elementInfo().repeated());
    }

    /**
     * Like {@link #apply} but run on the service's executor, after every edit previously submitted for the same file.
     */
    public CompletableFuture<EditResult> submit(VisualEdit edit) {
        return executor.submit(normalizePath(edit.filePath()), () -> apply(edit));
    }

    /**
     * Applies edits grouped by file, in the order each file first appears. A style edit the file already satisfies
     * is skipped. A file whose edits fail is left untouched and reported; the other files are still processed.
     */
    public List<FileEditResult> applyBatch(List<VisualEdit> edits) {
        var byFile = new LinkedHashMap<String, List<VisualEdit>>();
        for (var edit : edits) {
            byFile.computeIfAbsent(normalizePath(edit.filePath()), k -> new ArrayList<>()).add(edit);
        }

        var results = new ArrayList<FileEditResult>(byFile.size());
        for (var entry : byFile.entrySet()) {
            var filePath = entry.getKey();
            var fileEdits = entry.getValue();
            try {
                var content = store.read(filePath);
                for (var edit : fileEdits) {
                    content = applyEdit(filePath, content, edit, false);
                }
                validate(filePath, content);
                store.write(filePath, content);
                logger.info("Applied {} visual edit(s) to {}", fileEdits.size(), filePath);
                results.add(FileEditResult.success(filePath));
            } catch (VisualEditException e) {
                logger.error("Failed to apply {} visual edit(s) to {}", fileEdits.size(), filePath, e);
                results.add(FileEditResult.failure(filePath, e.getMessage()));
            }
        }

        long failed = results.stream().filter(r -> !r.success()).count();
        logger.info("Batch finished: {} file(s), {} failed", results.size(), failed);
        return results;
    }

    /**
     * @param requireStyleChange throw {@link UnchangedContentException} when the style changes leave the content as
     *                           it was, instead of skipping them
     */
    private String applyEdit(String filePath, String content, VisualEdit edit, boolean requireStyleChange) {
        var info = edit.elementInfo();
        logRepeated(filePath, info);

        if (!edit.hasStyleChanges()) {
            return edit.hasTextChanges() ? editor.updateText(content, filePath, info, edit.textChanges()) : content;
        }

        var styled = editor.applyStyleChange(content, filePath, new StyleChangeRequest(info, edit.styleChanges()));
        if (styled.equals(content)) {
            if (requireStyleChange) {
                throw new UnchangedContentException(filePath);
            }
            logger.info("Style changes {} already hold in {}, skipping them", edit.styleChanges(), filePath);
            return edit.hasTextChanges() ? editor.updateText(content, filePath, info, edit.textChanges()) : content;
        }
        if (!edit.hasTextChanges()) {
            return styled;
        }
        // styles and text against one parse, so the class change cannot hide the element from the class locator
        var combined = new StyleChangeRequest(info, edit.styleChanges(), false, edit.textChanges());
        return editor.applyStyleChange(content, filePath, combined);
    }

    private void validate(String filePath, String content) {
        var errors = validator.validate(content);
        if (!errors.isEmpty()) {
            throw new ContentValidationException(filePath, errors);
        }
    }

    private static void logRepeated(String filePath, ElementInfo info) {
        if (!info.repeated()) {
            return;
        }
        logger.info("Element in {} is instance {} of {} rendered from one source line; the edit changes all of them",
                    filePath, info.instanceIndex(), info.totalInstances());
    }
}
