package io.github.jsxpatch.edit;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class EditVerifierTest {

    private final EditVerifier verifier = new EditVerifier();

    @Test
    void testReportsMissingClassesWithoutThrowing() {
        var content = "<div className=\"a b\" />";
        assertEquals(List.of(), verifier.missingClasses("X.tsx", content, List.of("a", "b")));
        assertEquals(List.of("c"), verifier.missingClasses("X.tsx", content, List.of("a", "c")));
    }

    @Test
    void testText() {
        assertTrue(verifier.containsText("X.tsx", "<p> Hi </p>", "Hi"));
        assertFalse(verifier.containsText("X.tsx", "<p> Hi </p>", "Bye"));
    }

    @Test
    void testWellFormedness() {
        assertTrue(verifier.isWellFormed("X.tsx", "const a = <div>ok</div>;"));
        assertFalse(verifier.isWellFormed("X.tsx", "const a = <div>broken</span>;"));
    }
}
