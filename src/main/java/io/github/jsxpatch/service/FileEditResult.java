package io.github.jsxpatch.service;

import org.jetbrains.annotations.Nullable;

/**
 * Per-file outcome of a batch: every edit for the file was applied and written, or none was.
 */
public record FileEditResult(String filePath, boolean success, @Nullable String error) {
    public static FileEditResult success(String filePath) {
        return new FileEditResult(filePath, true, null);
    }

    public static FileEditResult failure(String filePath, String error) {
        return new FileEditResult(filePath, false, error);
    }
}
