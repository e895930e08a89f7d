package io.github.jsxpatch.classes;

/**
 * Predicate selecting class tokens to drop. A token matches when it equals the pattern, starts with it, or
 * equals the pattern without its trailing hyphen; so {@code "text-"} clears {@code text-lg} and
 * {@code text-red-500}, and {@code "rounded-"} also clears plain {@code rounded}.
 */
public record RemovalPattern(String pattern) {
    public RemovalPattern {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("Removal pattern cannot be blank");
        }
    }

    public boolean matches(String token) {
        return token.equals(pattern)
               || token.startsWith(pattern)
               || (pattern.endsWith("-") && token.equals(pattern.substring(0, pattern.length() - 1)));
    }
}
