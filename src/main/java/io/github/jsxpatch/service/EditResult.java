package io.github.jsxpatch.service;

/**
 * Outcome of one applied {@link io.github.jsxpatch.model.VisualEdit}.
 *
 * @param filePath       normalized path the edit was written to
 * @param lengthBefore   characters in the file before the edit
 * @param lengthAfter    characters in the file after the edit
 * @param sharedTemplate the element was one of several rendered from the same source, so every instance changed
 */
public record EditResult(String filePath, int lengthBefore, int lengthAfter, boolean sharedTemplate) {
}
