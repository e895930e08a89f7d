package io.github.jsxpatch.locate;

import io.github.jsxpatch.config.EditorConfig;
import io.github.jsxpatch.model.ElementInfo;
import io.github.jsxpatch.parse.JsxElement;
import io.github.jsxpatch.parse.JsxFragment;
import io.github.jsxpatch.parse.JsxParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ElementLocatorTest {

    private static final String SIBLINGS = """
            function App() {
              return (
                <>
                  <div className="item">First</div>
                  <div className="item">Second</div>
                  <div className="item">Third</div>
                </>
              );
            }""";

    private final ElementLocator locator = new ElementLocator(EditorConfig.defaults());

    @Test
    void testPositionDistinguishesIdenticalSiblings() {
        var doc = JsxParser.parse(SIBLINGS);
        var node = locator.locate(doc, ElementInfo.ofPosition("App:5:7", "item"));
        var element = assertInstanceOf(JsxElement.class, node);
        assertTrue(element.text(SIBLINGS).contains("Second"));
    }

    @Test
    void testPositionOnTheOpeningBracketResolvesTheElement() {
        var doc = JsxParser.parse(SIBLINGS);
        var node = locator.locate(doc, ElementInfo.ofPosition("App:6:6"));
        assertTrue(node.text(SIBLINGS).contains("Third"));
    }

    @Test
    void testPositionInsideTextAscendsToEnclosingElement() {
        var doc = JsxParser.parse(SIBLINGS);
        int column = "      <div className=\"item\">Fi".length();
        var node = locator.locate(doc, ElementInfo.ofPosition("App:4:" + column));
        assertTrue(node.text(SIBLINGS).contains("First"));
    }

    @Test
    void testPositionInsideAttributeExpressionAscendsToElement() {
        var source = """
                <button onClick={() => save(id)} className="btn">Save</button>""";
        var doc = JsxParser.parse(source);
        var node = locator.locate(doc, ElementInfo.ofPosition("Btn:1:" + source.indexOf("save")));
        assertEquals("button", ((JsxElement) node).tagName());
    }

    @Test
    void testPositionCanResolveAFragment() {
        var doc = JsxParser.parse(SIBLINGS);
        var node = locator.locate(doc, ElementInfo.ofPosition("App:3:5"));
        assertInstanceOf(JsxFragment.class, node);
    }

    @Test
    void testOutOfRangeLineFallsBackToClasses() {
        var source = """
                <section>
                  <p className="lead text-lg">Intro</p>
                </section>""";
        var doc = JsxParser.parse(source);
        var node = locator.locate(doc, ElementInfo.ofPosition("Page:42:3", "lead", "text-lg"));
        assertEquals("p", ((JsxElement) node).tagName());
    }

    @Test
    void testToOffsetSumsLineLengths() {
        var source = "ab\ncde\nf";
        assertEquals(0, ElementLocator.toOffset(source, 1, 0).getAsInt());
        assertEquals(4, ElementLocator.toOffset(source, 2, 1).getAsInt());
        assertEquals(7, ElementLocator.toOffset(source, 3, 0).getAsInt());
        assertTrue(ElementLocator.toOffset(source, 4, 0).isEmpty());
        assertTrue(ElementLocator.toOffset(source, 3, 5).isEmpty());
    }

    @Test
    void testBestOverlapWinsAndTiesKeepDocumentOrder() {
        var source = """
                <>
                  <div className="btn">Partial</div>
                  <div className="btn btn-primary">Good</div>
                  <div className="btn btn-primary btn-lg">Best</div>
                  <div className="btn-lg btn btn-primary">Later</div>
                </>""";
        var doc = JsxParser.parse(source);
        var found = locator.locateByClasses(doc, List.of("btn", "btn-primary", "btn-lg")).orElseThrow();
        assertTrue(found.text(source).contains("Best"));
    }

    @Test
    void testFallbackRejectsTwoOfThree() {
        var source = """
                <>
                  <div className="a b">Two</div>
                  <div className="b c x">Also two</div>
                </>""";
        var doc = JsxParser.parse(source);
        assertTrue(locator.locateByClasses(doc, List.of("a", "b", "c")).isEmpty());

        var error = assertThrows(LocatorException.class,
                                 () -> locator.locate(doc, ElementInfo.ofClasses("a", "b", "c")));
        assertEquals(LocatorException.Reason.STRUCTURE_CHANGED, error.reason());
    }

    @Test
    void testFallbackAcceptsFullMatchAmongPartialOnes() {
        var source = """
                <>
                  <div className="a b">Two</div>
                  <div className="a b c">Three</div>
                  <div className="b c">Two again</div>
                </>""";
        var doc = JsxParser.parse(source);
        var found = locator.locateByClasses(doc, List.of("a", "b", "c")).orElseThrow();
        assertTrue(found.text(source).contains("Three"));
    }

    @Test
    void testFallbackReadsMergeCallsAndObjectKeys() {
        var source = """
                <span className={cn('badge', { 'badge-primary': variant === 'primary' }, isNew && 'badge-new')}>
                  Text
                </span>""";
        var doc = JsxParser.parse(source);
        var found = locator.locateByClasses(doc, List.of("badge", "badge-primary"));
        assertTrue(found.isPresent());
    }

    @Test
    void testThresholdComesFromConfig() {
        var source = """
                <div className="a b">Two</div>""";
        var doc = JsxParser.parse(source);
        var lenient = new ElementLocator(EditorConfig.defaults().withFuzzyMatchThreshold(0.5));
        assertTrue(lenient.locateByClasses(doc, List.of("a", "b", "c")).isPresent());
        assertTrue(locator.locateByClasses(doc, List.of("a", "b", "c")).isEmpty());
    }

    @Test
    void testNoIdentifyingInformation() {
        var doc = JsxParser.parse("<div className=\"a\" />");
        var error = assertThrows(LocatorException.class, () -> locator.locate(doc, ElementInfo.ofClasses()));
        assertEquals(LocatorException.Reason.NO_IDENTIFYING_INFORMATION, error.reason());
    }

    @Test
    void testUnmatchedPositionWithoutClassesReportsStructureChanged() {
        var doc = JsxParser.parse("<div className=\"a\" />");
        var error = assertThrows(LocatorException.class,
                                 () -> locator.locate(doc, ElementInfo.ofPosition("App:9:0")));
        assertEquals(LocatorException.Reason.STRUCTURE_CHANGED, error.reason());
    }

    @Test
    void testTailwindClassesAreUsedWhenNoClassListWasSent() {
        var source = "<h1 className=\"title font-bold\">Hi</h1>";
        var doc = JsxParser.parse(source);
        var styles = new ElementInfo.CurrentStyles(null, List.of("title", "font-bold"), null);
        var info = new ElementInfo(null, List.of(), "h1", null, styles, null, false, null, null);
        assertEquals("h1", ((JsxElement) locator.locate(doc, info)).tagName());
    }
}
