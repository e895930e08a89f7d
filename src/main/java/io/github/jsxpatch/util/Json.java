package io.github.jsxpatch.util;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;

/**
 * Single, centrally-configured Jackson {@link ObjectMapper} for overlay payloads and configuration.
 *
 * *  Registers the JDK 8 module so {@code Optional} fields bind
 * *  Ignores unknown properties: the preview overlay sends selector, xpath, attributes and more than the
 *    rewrite engine reads
 * *  Leaves absent values out when writing
 */
public final class Json {
    public static final ObjectMapper mapper;

    static {
        mapper = new ObjectMapper()
                .registerModule(new Jdk8Module())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .setSerializationInclusion(JsonInclude.Include.NON_ABSENT);
    }

    private Json() {}   // no instances

    /**
     * Binds {@code json} to {@code type}, reporting malformed input as an {@link IllegalArgumentException}.
     */
    public static <T> T fromJson(String json, Class<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot read " + type.getSimpleName() + " from JSON: "
                                               + e.getOriginalMessage(), e);
        }
    }

    public static String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot write " + value.getClass().getSimpleName() + " as JSON", e);
        }
    }
}
