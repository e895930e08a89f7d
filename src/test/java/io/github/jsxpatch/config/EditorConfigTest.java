package io.github.jsxpatch.config;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class EditorConfigTest {

    private static EditorConfig load(String json) throws IOException {
        return EditorConfig.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void testDefaults() {
        var config = EditorConfig.defaults();
        assertEquals("className", config.classAttribute());
        assertEquals(List.of("cn"), config.mergeFunctions());
        assertEquals(0.70, config.fuzzyMatchThreshold());
        assertEquals(List.of("/home/daytona/workspace/", "workspace/"), config.workspacePrefixes());
        assertTrue(config.verifyWellFormed());
    }

    @Test
    void testClasspathResourceIsLoaded() {
        var config = EditorConfig.load();
        assertEquals("className", config.classAttribute());
        assertEquals(0.70, config.fuzzyMatchThreshold());
    }

    @Test
    void testValuesMergeOntoDefaults() throws IOException {
        var config = load("""
                {
                  "mergeFunctions": ["cn", "clsx"],
                  "fuzzyMatchThreshold": 0.9,
                  "verifyWellFormed": false,
                  "somethingElse": 1
                }""");
        assertEquals("className", config.classAttribute());
        assertEquals(List.of("cn", "clsx"), config.mergeFunctions());
        assertEquals(0.9, config.fuzzyMatchThreshold());
        assertFalse(config.verifyWellFormed());
    }

    @Test
    void testInvalidValuesKeepDefaults() throws IOException {
        var config = load("""
                {
                  "classAttribute": " ",
                  "mergeFunctions": [],
                  "fuzzyMatchThreshold": 3,
                  "verifyWellFormed": "yes"
                }""");
        assertEquals(EditorConfig.defaults(), config);
        assertEquals(EditorConfig.defaults(), load("[1, 2]"));
    }

    @Test
    void testMergeFunctionMatching() {
        var config = EditorConfig.defaults();
        assertTrue(config.isMergeFunction("cn"));
        assertTrue(config.isMergeFunction("utils.cn"));
        assertFalse(config.isMergeFunction("clsx"));
        assertFalse(config.isMergeFunction("ucn"));
        assertEquals("cn", config.primaryMergeFunction());
    }

    @Test
    void testConstructorValidation() {
        assertThrows(IllegalArgumentException.class,
                     () -> new EditorConfig("", List.of("cn"), 0.7, List.of(), true));
        assertThrows(IllegalArgumentException.class,
                     () -> new EditorConfig("className", List.of(), 0.7, List.of(), true));
        assertThrows(IllegalArgumentException.class,
                     () -> EditorConfig.defaults().withFuzzyMatchThreshold(0));
    }
}
