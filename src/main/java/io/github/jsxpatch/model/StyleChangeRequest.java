package io.github.jsxpatch.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Request to change the styles of an element; each entry maps a camelCase CSS property to its new value.
 * {@code textContent}, when present, is applied to the same element after the styles.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StyleChangeRequest(ElementInfo elementInfo,
                                 Map<String, String> changes,
                                 @JsonProperty("isLive") boolean isLive,
                                 @Nullable String textContent)
{
    @JsonCreator
    public StyleChangeRequest {
        Objects.requireNonNull(elementInfo, "elementInfo");
        // insertion order decides the order of added classes
        changes = changes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(changes));
    }

    public StyleChangeRequest(ElementInfo elementInfo, Map<String, String> changes) {
        this(elementInfo, changes, false, null);
    }
}
