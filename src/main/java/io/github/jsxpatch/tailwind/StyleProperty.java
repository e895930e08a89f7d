package io.github.jsxpatch.tailwind;

import com.google.common.base.CaseFormat;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The style properties the visual editor can change, each with the class family it maps to and the class
 * patterns it clears before adding its own.
 */
public enum StyleProperty {
    BACKGROUND_COLOR("backgroundColor", "bg-", List.of("bg-"), v -> TailwindScales.arbitrary("bg-", v)),
    BORDER_RADIUS("borderRadius", "rounded-", List.of("rounded-", "rounded"), TailwindScales::radius),
    OPACITY("opacity", "opacity-", List.of("opacity-"), TailwindScales::opacity),
    // the aggregate properties also clear every directional override
    PADDING("padding", "p-", List.of("p-", "pt-", "pb-", "pl-", "pr-"), v -> TailwindScales.spacing("p-", v)),
    PADDING_TOP("paddingTop", "pt-", List.of("pt-"), v -> TailwindScales.spacing("pt-", v)),
    PADDING_BOTTOM("paddingBottom", "pb-", List.of("pb-"), v -> TailwindScales.spacing("pb-", v)),
    PADDING_LEFT("paddingLeft", "pl-", List.of("pl-"), v -> TailwindScales.spacing("pl-", v)),
    PADDING_RIGHT("paddingRight", "pr-", List.of("pr-"), v -> TailwindScales.spacing("pr-", v)),
    MARGIN("margin", "m-", List.of("m-", "mt-", "mb-", "ml-", "mr-"), v -> TailwindScales.spacing("m-", v)),
    MARGIN_TOP("marginTop", "mt-", List.of("mt-"), v -> TailwindScales.spacing("mt-", v)),
    MARGIN_BOTTOM("marginBottom", "mb-", List.of("mb-"), v -> TailwindScales.spacing("mb-", v)),
    MARGIN_LEFT("marginLeft", "ml-", List.of("ml-"), v -> TailwindScales.spacing("ml-", v)),
    MARGIN_RIGHT("marginRight", "mr-", List.of("mr-"), v -> TailwindScales.spacing("mr-", v)),
    FONT_SIZE("fontSize", "text-",
              List.of("text-xs", "text-sm", "text-base", "text-lg", "text-xl", "text-2xl", "text-3xl", "text-4xl",
                      "text-5xl", "text-6xl", "text-7xl", "text-8xl", "text-9xl", "text-["),
              TailwindScales::fontSize),
    FONT_WEIGHT("fontWeight", "font-",
                List.of("font-thin", "font-extralight", "font-light", "font-normal", "font-medium", "font-semibold",
                        "font-bold", "font-extrabold", "font-black", "font-["),
                TailwindScales::fontWeight),
    COLOR("color", "text-", List.of("text-"), v -> TailwindScales.arbitrary("text-", v)),
    TEXT_ALIGN("textAlign", null, List.of("text-left", "text-center", "text-right", "text-justify"),
               TailwindScales::textAlign);

    private static final Map<String, StyleProperty> BY_NAME = Arrays.stream(values())
            .flatMap(p -> List.of(Map.entry(p.cssName, p), Map.entry(p.kebabName(), p)).stream())
            .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a));

    private final String cssName;
    private final @Nullable String classPrefix;
    private final List<String> removalPatterns;
    private final Function<String, String> converter;

    StyleProperty(String cssName,
                  @Nullable String classPrefix,
                  List<String> removalPatterns,
                  Function<String, String> converter)
    {
        this.cssName = cssName;
        this.classPrefix = classPrefix;
        this.removalPatterns = removalPatterns;
        this.converter = converter;
    }

    /**
     * Looks a property up by its camelCase name ({@code backgroundColor}) or its CSS name
     * ({@code background-color}).
     */
    public static Optional<StyleProperty> forName(String name) {
        return Optional.ofNullable(BY_NAME.get(name.strip()));
    }

    public String cssName() {
        return cssName;
    }

    public String kebabName() {
        return CaseFormat.LOWER_CAMEL.to(CaseFormat.LOWER_HYPHEN, cssName);
    }

    public List<String> removalPatterns() {
        return removalPatterns;
    }

    /**
     * The class for {@code value}. A value that already is a class of this property's family is returned as is.
     */
    public String toClass(String value) {
        var stripped = value.strip();
        if (classPrefix != null && stripped.startsWith(classPrefix)) {
            return stripped;
        }
        return converter.apply(stripped);
    }
}
