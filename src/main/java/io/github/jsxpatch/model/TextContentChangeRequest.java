package io.github.jsxpatch.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Request to replace the literal text of an element.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TextContentChangeRequest(ElementInfo elementInfo,
                                       String textContent,
                                       @JsonProperty("isLive") boolean isLive)
{
    @JsonCreator
    public TextContentChangeRequest {
        Objects.requireNonNull(elementInfo, "elementInfo");
        Objects.requireNonNull(textContent, "textContent");
    }

    public TextContentChangeRequest(ElementInfo elementInfo, String textContent) {
        this(elementInfo, textContent, false);
    }
}
