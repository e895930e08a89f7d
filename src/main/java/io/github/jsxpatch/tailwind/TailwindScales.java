package io.github.jsxpatch.tailwind;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Lookup tables from CSS values to Tailwind utility classes.
 */
final class TailwindScales {
    private static final Pattern PIXELS = Pattern.compile("(\\d+)(?:\\.\\d+)?(?:px)?");

    // inclusive upper bounds in px, parallel to RADIUS_CLASSES
    private static final int[] RADIUS_BOUNDS = {0, 4, 6, 8, 12, 16, 24, 32};
    private static final String[] RADIUS_CLASSES = {
            "rounded-none", "rounded-sm", "rounded", "rounded-md", "rounded-lg", "rounded-xl", "rounded-2xl", "rounded-3xl"
    };

    // {inclusive upper bound in px, step}
    private static final int[][] SPACING = {
            {0, 0}, {4, 1}, {8, 2}, {12, 3}, {16, 4}, {20, 5}, {24, 6}, {32, 8}, {40, 10}, {48, 12}
    };

    private static final int[] OPACITY = {0, 5, 10, 20, 25, 30, 40, 50, 60, 70, 75, 80, 90, 95, 100};

    private static final Map<Integer, String> FONT_SIZES = ImmutableMap.<Integer, String>builder()
            .put(12, "text-xs")
            .put(14, "text-sm")
            .put(16, "text-base")
            .put(18, "text-lg")
            .put(20, "text-xl")
            .put(24, "text-2xl")
            .put(30, "text-3xl")
            .put(36, "text-4xl")
            .put(48, "text-5xl")
            .put(60, "text-6xl")
            .put(72, "text-7xl")
            .put(96, "text-8xl")
            .put(128, "text-9xl")
            .build();

    private static final Map<String, String> FONT_WEIGHTS = ImmutableMap.<String, String>builder()
            .put("100", "font-thin")
            .put("200", "font-extralight")
            .put("300", "font-light")
            .put("400", "font-normal")
            .put("normal", "font-normal")
            .put("500", "font-medium")
            .put("600", "font-semibold")
            .put("700", "font-bold")
            .put("bold", "font-bold")
            .put("800", "font-extrabold")
            .put("900", "font-black")
            .build();

    private static final Map<String, String> TEXT_ALIGN = ImmutableMap.of(
            "left", "text-left",
            "center", "text-center",
            "right", "text-right",
            "justify", "text-justify");

    private TailwindScales() {
    }

    /**
     * Whole pixels of a unitless or {@code px} value, decimals truncated. Other units and negative values are
     * not on any scale.
     */
    static OptionalInt pixels(String value) {
        var m = PIXELS.matcher(value.strip());
        if (!m.matches()) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(m.group(1)));
        } catch (NumberFormatException e) {
            // too many digits to be on any scale
            return OptionalInt.empty();
        }
    }

    /**
     * {@code prefix-[value]}, with whitespace turned into underscores as Tailwind expects.
     */
    static String arbitrary(String prefix, String value) {
        return prefix + "[" + CharMatcher.whitespace().trimAndCollapseFrom(value, '_') + "]";
    }

    static String radius(String value) {
        if (value.equals("9999px") || value.equals("50%")) {
            return "rounded-full";
        }
        var px = pixels(value);
        if (px.isPresent()) {
            for (int i = 0; i < RADIUS_BOUNDS.length; i++) {
                if (px.getAsInt() <= RADIUS_BOUNDS[i]) {
                    return RADIUS_CLASSES[i];
                }
            }
        }
        return arbitrary("rounded-", value);
    }

    /**
     * @param prefix the family prefix including its hyphen, e.g. {@code p-} or {@code mt-}
     */
    static String spacing(String prefix, String value) {
        var px = pixels(value);
        if (px.isPresent()) {
            for (int[] step : SPACING) {
                if (px.getAsInt() <= step[0]) {
                    return prefix + step[1];
                }
            }
        }
        return arbitrary(prefix, value);
    }

    static String opacity(String value) {
        double fraction;
        try {
            fraction = Double.parseDouble(value.strip());
        } catch (NumberFormatException e) {
            return arbitrary("opacity-", value);
        }
        long percent = Math.round(fraction * 100);
        long snapped = Math.round(percent / 5.0) * 5;
        for (int step : OPACITY) {
            if (step == snapped) {
                return "opacity-" + step;
            }
        }
        return "opacity-[" + percent + "%]";
    }

    static String fontSize(String value) {
        var px = pixels(value);
        if (px.isPresent() && FONT_SIZES.containsKey(px.getAsInt())) {
            return FONT_SIZES.get(px.getAsInt());
        }
        return arbitrary("text-", value);
    }

    static String fontWeight(String value) {
        var mapped = FONT_WEIGHTS.get(value.strip());
        return mapped != null ? mapped : arbitrary("font-", value);
    }

    static String textAlign(String value) {
        return TEXT_ALIGN.getOrDefault(value.strip(), "text-left");
    }
}
