package io.github.jsxpatch.classes;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Classes to add (literal tokens, in output order) and patterns of classes to remove.
 */
public record ClassUpdate(List<String> classesToAdd, List<String> classesToRemove) {
    private static final Logger logger = LogManager.getLogger(ClassUpdate.class);

    public ClassUpdate {
        classesToAdd = classesToAdd == null ? List.of() : distinctNonBlank(classesToAdd);
        classesToRemove = classesToRemove == null ? List.of() : distinctNonBlank(classesToRemove);
    }

    public static ClassUpdate add(String... classes) {
        return new ClassUpdate(List.of(classes), List.of());
    }

    public static ClassUpdate of(List<String> classesToAdd, List<String> classesToRemove) {
        return new ClassUpdate(classesToAdd, classesToRemove);
    }

    public boolean isEmpty() {
        return classesToAdd.isEmpty() && classesToRemove.isEmpty();
    }

    public List<RemovalPattern> removalPatterns() {
        return classesToRemove.stream().map(RemovalPattern::new).toList();
    }

    public boolean shouldRemove(String token) {
        for (var pattern : removalPatterns()) {
            if (pattern.matches(token)) {
                logger.debug("Filtering out class '{}' (matches pattern '{}')", token, pattern.pattern());
                return true;
            }
        }
        return false;
    }

    /**
     * The tokens no removal pattern matches, in their original order.
     */
    public List<String> filter(List<String> tokens) {
        var kept = new ArrayList<String>(tokens.size());
        for (var token : tokens) {
            if (!shouldRemove(token)) {
                kept.add(token);
            }
        }
        return kept;
    }

    /**
     * {@code tokens} followed by every class to add that is not already among them.
     */
    public List<String> withAdditions(List<String> tokens) {
        var result = new ArrayList<>(tokens);
        var present = new HashSet<>(tokens);
        for (var cls : classesToAdd) {
            if (present.add(cls)) {
                result.add(cls);
            }
        }
        return result;
    }

    /**
     * Filters then appends: the full rewrite of one plain class list.
     */
    public List<String> applyTo(List<String> tokens) {
        return withAdditions(filter(tokens));
    }

    /**
     * Both updates' additions and removals, this one's first.
     */
    public ClassUpdate merge(ClassUpdate other) {
        var add = new ArrayList<>(classesToAdd);
        add.addAll(other.classesToAdd());
        var remove = new ArrayList<>(classesToRemove);
        remove.addAll(other.classesToRemove());
        return new ClassUpdate(add, remove);
    }

    private static List<String> distinctNonBlank(List<String> values) {
        return values.stream()
                     .filter(v -> v != null && !v.isBlank())
                     .map(String::strip)
                     .distinct()
                     .toList();
    }
}
