package io.github.jsxpatch.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Identifying payload for one element selected in the preview.
 *
 * @param shipperId       position token {@code fileTag:line:column} stamped on the element at build time
 * @param currentClasses  class tokens observed on the element
 * @param componentName   component or tag name
 * @param textContent     observed text, possibly truncated
 * @param currentStyles   computed/inline style snapshot; only {@code tailwindClasses} is consulted
 * @param position        bounding box in the preview
 * @param repeated        whether the element is one of several rendered from the same source line
 * @param instanceIndex   index within the repeated set
 * @param totalInstances  size of the repeated set
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ElementInfo(@JsonProperty("shipperId") @Nullable String shipperId,
                          @JsonProperty("currentClasses") List<String> currentClasses,
                          @JsonProperty("componentName") @Nullable String componentName,
                          @JsonProperty("textContent") @Nullable String textContent,
                          @JsonProperty("currentStyles") @Nullable CurrentStyles currentStyles,
                          @JsonProperty("position") @Nullable BoundingBox position,
                          @JsonProperty("isRepeated") boolean repeated,
                          @JsonProperty("instanceIndex") @Nullable Integer instanceIndex,
                          @JsonProperty("totalInstances") @Nullable Integer totalInstances)
{
    public ElementInfo {
        currentClasses = currentClasses == null
                         ? List.of()
                         : currentClasses.stream().filter(c -> c != null && !c.isBlank()).toList();
    }

    public static ElementInfo ofClasses(String... classes) {
        return new ElementInfo(null, Arrays.asList(classes), null, null, null, null, false, null, null);
    }

    public static ElementInfo ofPosition(String shipperId, String... classes) {
        return new ElementInfo(shipperId, Arrays.asList(classes), null, null, null, null, false, null, null);
    }

    /**
     * Class tokens to match against the source: {@code currentClasses}, or the detected utility classes of the
     * style snapshot when no class list was sent.
     */
    @JsonIgnore
    public List<String> observedClasses() {
        if (!currentClasses.isEmpty() || currentStyles == null) {
            return currentClasses;
        }
        return currentStyles.tailwindClasses();
    }

    @JsonIgnore
    public boolean hasShipperId() {
        return shipperId != null && !shipperId.isBlank();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CurrentStyles(@JsonProperty("computed") Map<String, String> computed,
                                @JsonProperty("tailwindClasses") List<String> tailwindClasses,
                                @JsonProperty("inlineStyles") Map<String, String> inlineStyles)
    {
        public CurrentStyles {
            computed = computed == null ? Map.of() : Map.copyOf(computed);
            tailwindClasses = tailwindClasses == null
                              ? List.of()
                              : tailwindClasses.stream().filter(c -> c != null && !c.isBlank()).toList();
            inlineStyles = inlineStyles == null ? Map.of() : Map.copyOf(inlineStyles);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BoundingBox(double x, double y, double width, double height) {
    }
}
