package io.github.jsxpatch.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One edit made in the visual editor, addressed to a file: style changes, a text change, or both.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VisualEdit(String filePath,
                         @Nullable String selector,
                         ElementInfo elementInfo,
                         Map<String, String> styleChanges,
                         @Nullable String textChanges)
{
    public VisualEdit {
        Objects.requireNonNull(filePath, "filePath");
        Objects.requireNonNull(elementInfo, "elementInfo");
        styleChanges = styleChanges == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(styleChanges));
    }

    public static VisualEdit styles(String filePath, ElementInfo elementInfo, Map<String, String> styleChanges) {
        return new VisualEdit(filePath, null, elementInfo, styleChanges, null);
    }

    public static VisualEdit text(String filePath, ElementInfo elementInfo, String textChanges) {
        return new VisualEdit(filePath, null, elementInfo, Map.of(), textChanges);
    }

    public boolean hasStyleChanges() {
        return !styleChanges.isEmpty();
    }

    public boolean hasTextChanges() {
        return textChanges != null;
    }
}
