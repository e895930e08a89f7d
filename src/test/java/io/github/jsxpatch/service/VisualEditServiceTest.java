package io.github.jsxpatch.service;

import io.github.jsxpatch.config.EditorConfig;
import io.github.jsxpatch.edit.VisualEditor;
import io.github.jsxpatch.locate.LocatorException;
import io.github.jsxpatch.model.ElementInfo;
import io.github.jsxpatch.model.VisualEdit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class VisualEditServiceTest {

    private static final String APP = """
            const App = () => (
              <div className="p-4">
                <h1 className="title">Hello</h1>
              </div>
            );
            """;

    @TempDir
    Path projectRoot;

    private VisualEditService service;

    @BeforeEach
    void setUp() throws IOException {
        Files.createDirectories(projectRoot.resolve("src"));
        Files.writeString(projectRoot.resolve("src/App.tsx"), APP);
        service = new VisualEditService(new FileSystemSourceStore(projectRoot), new VisualEditor(EditorConfig.defaults()));
    }

    private String readApp() throws IOException {
        return Files.readString(projectRoot.resolve("src/App.tsx"));
    }

    @Test
    void testNormalizePath() {
        assertEquals("src/App.tsx", service.normalizePath("/home/daytona/workspace/src/App.tsx"));
        assertEquals("src/App.tsx", service.normalizePath("workspace/src/App.tsx"));
        assertEquals("src/App.tsx", service.normalizePath("src/App.tsx"));
    }

    @Test
    void testApplyWritesFile() throws IOException {
        var edit = VisualEdit.styles("/home/daytona/workspace/src/App.tsx",
                                     ElementInfo.ofClasses("title"),
                                     Map.of("padding", "16px"));
        var result = service.apply(edit);

        assertEquals("src/App.tsx", result.filePath());
        assertEquals(APP.length(), result.lengthBefore());
        assertFalse(result.sharedTemplate());
        var written = readApp();
        assertTrue(written.contains("<h1 className=\"title p-4\">Hello</h1>"), written);
        assertEquals(written.length(), result.lengthAfter());
    }

    @Test
    void testTextEdit() throws IOException {
        service.apply(VisualEdit.text("src/App.tsx", ElementInfo.ofPosition("App:3:4"), "Welcome back"));
        assertTrue(readApp().contains("<h1 className=\"title\"> Welcome back </h1>"), readApp());
    }

    @Test
    void testUnchangedStyleIsReported() throws IOException {
        var edit = VisualEdit.styles("src/App.tsx", ElementInfo.ofClasses("p-4"), Map.of("padding", "16px"));
        var e = assertThrows(UnchangedContentException.class, () -> service.apply(edit));
        assertEquals("Style update produced no changes in src/App.tsx", e.getMessage());
        assertEquals(APP, readApp());
    }

    @Test
    void testLocateFailureLeavesFileUntouched() throws IOException {
        var edit = VisualEdit.styles("src/App.tsx", ElementInfo.ofClasses("nowhere"), Map.of("padding", "8px"));
        assertThrows(LocatorException.class, () -> service.apply(edit));
        assertEquals(APP, readApp());
    }

    @Test
    void testValidationFailurePreventsWrite() throws IOException {
        var source = """
                const docs = "see /usr>";
                const Page = () => <p className="lead">Docs</p>;
                """;
        Files.writeString(projectRoot.resolve("src/Page.tsx"), source);
        var edit = VisualEdit.styles("src/Page.tsx", ElementInfo.ofClasses("lead"), Map.of("padding", "8px"));

        var e = assertThrows(ContentValidationException.class, () -> service.apply(edit));
        assertEquals(1, e.errors().size());
        assertEquals("src/Page.tsx", e.filePath());
        assertEquals(source, Files.readString(projectRoot.resolve("src/Page.tsx")));
    }

    @Test
    void testPathEscapeIsRefused() {
        var edit = VisualEdit.styles("../outside.tsx", ElementInfo.ofClasses("a"), Map.of("padding", "8px"));
        var e = assertThrows(SourceStoreException.class, () -> service.apply(edit));
        assertEquals("../outside.tsx", e.filePath());
        assertFalse(Files.exists(projectRoot.getParent().resolve("outside.tsx")));
    }

    @Test
    void testStoreExists() {
        var store = new FileSystemSourceStore(projectRoot);
        assertTrue(store.exists("src/App.tsx"));
        assertFalse(store.exists("src/Nope.tsx"));
        assertThrows(SourceStoreException.class, () -> store.exists("../../etc/passwd"));
    }

    @Test
    void testBatchGroupsByFileAndIsolatesFailures() throws IOException {
        var other = "export const Other = () => <span className=\"badge\">New</span>;\n";
        Files.writeString(projectRoot.resolve("src/Other.tsx"), other);

        var results = service.applyBatch(List.of(
                VisualEdit.styles("workspace/src/App.tsx", ElementInfo.ofClasses("title"), Map.of("padding", "16px")),
                VisualEdit.styles("src/Missing.tsx", ElementInfo.ofClasses("x"), Map.of("padding", "8px")),
                VisualEdit.text("src/App.tsx", ElementInfo.ofClasses("title"), "Hi"),
                VisualEdit.styles("src/Other.tsx", ElementInfo.ofClasses("badge"), Map.of("fontWeight", "700"))));

        assertEquals(List.of("src/App.tsx", "src/Missing.tsx", "src/Other.tsx"),
                     results.stream().map(FileEditResult::filePath).toList());
        assertTrue(results.get(0).success());
        assertFalse(results.get(1).success());
        assertNotNull(results.get(1).error());
        assertTrue(results.get(2).success());

        assertTrue(readApp().contains("<h1 className=\"title p-4\"> Hi </h1>"), readApp());
        assertTrue(Files.readString(projectRoot.resolve("src/Other.tsx")).contains("className=\"badge font-bold\""));
    }

    @Test
    void testBatchSkipsStyleEditThatIsAlreadyApplied() throws IOException {
        var results = service.applyBatch(List.of(
                VisualEdit.styles("src/App.tsx", ElementInfo.ofClasses("title"), Map.of("fontWeight", "700")),
                VisualEdit.styles("src/App.tsx", ElementInfo.ofClasses("p-4"), Map.of("padding", "16px"))));

        assertEquals(List.of(FileEditResult.success("src/App.tsx")), results);
        assertTrue(readApp().contains("<h1 className=\"title font-bold\">Hello</h1>"), readApp());
        assertTrue(readApp().contains("<div className=\"p-4\">"), readApp());
    }

    @Test
    void testBatchAppliesTextWhenItsStylesAlreadyHold() throws IOException {
        var edit = new VisualEdit("src/App.tsx", null, ElementInfo.ofClasses("p-4"), Map.of("padding", "16px"), null);
        var withText = new VisualEdit("src/App.tsx", null, ElementInfo.ofClasses("title"),
                                      Map.of("fontWeight", "700"), "Hi");
        var unchanged = new VisualEdit("src/App.tsx", null, ElementInfo.ofPosition("App:3:4", "title", "font-bold"),
                                       Map.of("fontWeight", "bold"), "Welcome");

        var results = service.applyBatch(List.of(edit, withText, unchanged));

        assertTrue(results.get(0).success(), results.toString());
        assertTrue(readApp().contains("<h1 className=\"title font-bold\"> Welcome </h1>"), readApp());
    }

    @Test
    void testBatchFailureWritesNothingForThatFile() throws IOException {
        var results = service.applyBatch(List.of(
                VisualEdit.styles("src/App.tsx", ElementInfo.ofClasses("title"), Map.of("padding", "16px")),
                VisualEdit.styles("src/App.tsx", ElementInfo.ofClasses("missing"), Map.of("padding", "8px"))));

        assertEquals(1, results.size());
        assertFalse(results.get(0).success());
        assertEquals(APP, readApp());
    }

    @Test
    void testSubmittedEditsToOneFileRunInOrder() throws Exception {
        var pool = Executors.newFixedThreadPool(4);
        try {
            var concurrent = new VisualEditService(new FileSystemSourceStore(projectRoot),
                                                   new VisualEditor(EditorConfig.defaults()), pool);
            var first = concurrent.submit(
                    VisualEdit.styles("src/App.tsx", ElementInfo.ofClasses("title"), Map.of("padding", "16px")));
            var second = concurrent.submit(
                    VisualEdit.text("src/App.tsx", ElementInfo.ofClasses("title"), "Hi"));

            assertEquals("src/App.tsx", first.get(10, TimeUnit.SECONDS).filePath());
            second.get(10, TimeUnit.SECONDS);
            assertTrue(readApp().contains("<h1 className=\"title p-4\"> Hi </h1>"), readApp());
        } finally {
            pool.shutdownNow();
        }
    }
}
