package io.github.jsxpatch.config;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.jsxpatch.util.Json;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings of the rewrite engine and the file-store layer.
 *
 * @param classAttribute      name of the attribute holding the class list
 * @param mergeFunctions      names of class-merging helpers; a callee {@code x.name} also matches {@code name}.
 *                            The first entry is used when a merge call has to be synthesized.
 * @param fuzzyMatchThreshold minimum share of observed classes an element must carry to be picked by the
 *                            class-overlap locator
 * @param workspacePrefixes   prefixes stripped from incoming file paths before they reach the store
 * @param verifyWellFormed    re-parse every rewritten file and log a warning when it no longer parses
 */
public record EditorConfig(String classAttribute,
                           List<String> mergeFunctions,
                           double fuzzyMatchThreshold,
                           List<String> workspacePrefixes,
                           boolean verifyWellFormed)
{
    private static final Logger logger = LogManager.getLogger(EditorConfig.class);

    public static final String RESOURCE = "/jsxpatch.json";

    private static final EditorConfig DEFAULTS = new EditorConfig(
            "className",
            List.of("cn"),
            0.70,
            List.of("/home/daytona/workspace/", "workspace/"),
            true);

    public EditorConfig {
        if (classAttribute == null || classAttribute.isBlank()) {
            throw new IllegalArgumentException("classAttribute cannot be null or blank");
        }
        if (mergeFunctions == null || mergeFunctions.isEmpty()) {
            throw new IllegalArgumentException("mergeFunctions must name at least one function");
        }
        if (fuzzyMatchThreshold <= 0.0 || fuzzyMatchThreshold > 1.0) {
            throw new IllegalArgumentException("fuzzyMatchThreshold must be in (0, 1], got " + fuzzyMatchThreshold);
        }
        mergeFunctions = List.copyOf(mergeFunctions);
        workspacePrefixes = workspacePrefixes == null ? List.of() : List.copyOf(workspacePrefixes);
    }

    public static EditorConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Loads {@value #RESOURCE} from the classpath on top of the defaults, or returns the defaults when the
     * resource is absent.
     */
    public static EditorConfig load() {
        try (InputStream in = EditorConfig.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                logger.debug("No {} on the classpath, using defaults", RESOURCE);
                return DEFAULTS;
            }
            return load(in);
        } catch (IOException e) {
            logger.warn("Failed to read {}, using defaults: {}", RESOURCE, e.getMessage());
            return DEFAULTS;
        }
    }

    /**
     * Reads a JSON object and merges it onto the defaults. Missing or invalid entries keep their default value.
     */
    public static EditorConfig load(InputStream in) throws IOException {
        JsonNode root = Json.mapper.readTree(in);
        if (root == null || !root.isObject()) {
            logger.warn("Editor configuration is not a JSON object, using defaults");
            return DEFAULTS;
        }
        return merge(DEFAULTS, root);
    }

    private static EditorConfig merge(EditorConfig base, JsonNode stored) {
        var classAttribute = textOrDefault(stored.get("classAttribute"), base.classAttribute());
        var mergeFunctions = listOrDefault(stored.get("mergeFunctions"), base.mergeFunctions());
        var workspacePrefixes = listOrDefault(stored.get("workspacePrefixes"), base.workspacePrefixes());

        double threshold = base.fuzzyMatchThreshold();
        var thresholdNode = stored.get("fuzzyMatchThreshold");
        if (thresholdNode != null) {
            double value = thresholdNode.asDouble(-1);
            if (value > 0.0 && value <= 1.0) {
                threshold = value;
            } else {
                logger.warn("Ignoring fuzzyMatchThreshold {}, keeping {}", thresholdNode, threshold);
            }
        }

        var verifyNode = stored.get("verifyWellFormed");
        boolean verify = verifyNode != null && verifyNode.isBoolean() ? verifyNode.asBoolean() : base.verifyWellFormed();

        return new EditorConfig(classAttribute, mergeFunctions, threshold, workspacePrefixes, verify);
    }

    private static String textOrDefault(@Nullable JsonNode node, String fallback) {
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            return fallback;
        }
        return node.asText().strip();
    }

    private static List<String> listOrDefault(@Nullable JsonNode node, List<String> fallback) {
        if (node == null || !node.isArray() || node.isEmpty()) {
            return fallback;
        }
        var values = new ArrayList<String>();
        for (var element : node) {
            if (element.isTextual() && !element.asText().isBlank()) {
                values.add(element.asText().strip());
            }
        }
        return values.isEmpty() ? fallback : values;
    }

    /**
     * Whether {@code callee} (the text before the argument list of a call) names a class-merging helper.
     */
    public boolean isMergeFunction(String callee) {
        for (var name : mergeFunctions) {
            if (callee.equals(name) || callee.endsWith("." + name)) {
                return true;
            }
        }
        return false;
    }

    public String primaryMergeFunction() {
        return mergeFunctions.get(0);
    }

    public EditorConfig withFuzzyMatchThreshold(double threshold) {
        return new EditorConfig(classAttribute, mergeFunctions, threshold, workspacePrefixes, verifyWellFormed);
    }
}
