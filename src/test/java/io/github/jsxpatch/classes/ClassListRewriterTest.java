package io.github.jsxpatch.classes;

import io.github.jsxpatch.UnsupportedTargetException;
import io.github.jsxpatch.config.EditorConfig;
import io.github.jsxpatch.parse.JsxNode;
import io.github.jsxpatch.parse.JsxParser;
import io.github.jsxpatch.parse.SourceEdit;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ClassListRewriterTest {

    private final ClassListRewriter rewriter = new ClassListRewriter(EditorConfig.defaults());

    /** Rewrites the first element of {@code source}. */
    private String rewrite(String source, ClassUpdate update) {
        var doc = JsxParser.parse(source);
        JsxNode target = doc.elements().get(0);
        return SourceEdit.applyAll(source, rewriter.rewrite(source, target, update));
    }

    @Test
    void testPlainLiteral() {
        var result = rewrite("<div className=\"btn btn-primary btn-lg\">Button</div>",
                             ClassUpdate.of(List.of("btn-sm"), List.of("btn-lg")));
        assertEquals("<div className=\"btn btn-primary btn-sm\">Button</div>", result);
    }

    @Test
    void testFamilyRemovalLeavesOnlyTheNewColor() {
        var result = rewrite("<p className=\"text-red-500 text-lg\">Text</p>",
                             ClassUpdate.of(List.of("text-[#0000ff]"), List.of("text-")));
        assertEquals("<p className=\"text-[#0000ff]\">Text</p>", result);
    }

    @Test
    void testSingleQuotedLiteralKeepsItsQuotes() {
        var result = rewrite("<p className='a'>x</p>", ClassUpdate.add("b"));
        assertEquals("<p className='a b'>x</p>", result);
    }

    @Test
    void testWrappedLiteralKeepsBraces() {
        var result = rewrite("<div className={\"flex items-center\"}>x</div>", ClassUpdate.add("gap-2"));
        assertEquals("<div className={\"flex items-center gap-2\"}>x</div>", result);
    }

    @Test
    void testAddingPresentClassChangesNothing() {
        var source = "<div className=\"card shadow\">x</div>";
        var doc = JsxParser.parse(source);
        assertTrue(rewriter.rewrite(source, doc.elements().get(0), ClassUpdate.add("shadow")).isEmpty());
    }

    @Test
    void testMissingAttributeIsInsertedAfterTagName() {
        var result = rewrite("<div id=\"container\">Content</div>", ClassUpdate.add("bg-white", "rounded"));
        assertEquals("<div className=\"bg-white rounded\" id=\"container\">Content</div>", result);
    }

    @Test
    void testMissingAttributeOnSelfClosingElement() {
        var result = rewrite("<Icon/>", ClassUpdate.add("w-4"));
        assertEquals("<Icon className=\"w-4\"/>", result);
    }

    @Test
    void testMergeCallFiltersEveryLiteralAndAddsToFirst() {
        var result = rewrite("<button className={cn('btn', 'btn-primary')}>Click</button>",
                             ClassUpdate.of(List.of("btn-lg"), List.of("btn-primary")));
        assertEquals("<button className={cn('btn btn-lg')}>Click</button>", result);
    }

    @Test
    void testMergeCallPreservesNonStringArguments() {
        var source = "<div className={cn('card', isActive && 'card-active', 'card-shadow')}>Content</div>";
        var result = rewrite(source, ClassUpdate.of(List.of("card-bordered"), List.of("card-shadow")));
        assertEquals("<div className={cn('card card-bordered', isActive && 'card-active')}>Content</div>", result);
    }

    @Test
    void testMergeCallKeepsObjectAndTemplateArgumentsByteForByte() {
        var source = """
                <button className={cn(
                      'btn',
                      `btn-${size}`,
                      disabled && 'btn-disabled',
                      { 'btn-loading': isLoading }
                    )}>Go</button>""";
        var result = rewrite(source, ClassUpdate.add("btn-primary"));
        assertEquals(source.replace("'btn',", "'btn btn-primary',"), result);
        assertTrue(result.contains("`btn-${size}`"));
        assertTrue(result.contains("disabled && 'btn-disabled'"));
        assertTrue(result.contains("{ 'btn-loading': isLoading }"));
    }

    @Test
    void testMergeCallWithoutSurvivingLiteralGetsNewFirstArgument() {
        var source = "<div className={cn(`alert alert-${type}`, 'alert-dismissible')}>x</div>";
        var result = rewrite(source, ClassUpdate.of(List.of("alert-bordered"), List.of("alert-dismissible")));
        assertEquals("<div className={cn('alert-bordered', `alert alert-${type}`)}>x</div>", result);
    }

    @Test
    void testMergeCallWithNoLiteralAtAll() {
        var source = "<div className={cn(base, { on: isOn })}>x</div>";
        var result = rewrite(source, ClassUpdate.add("p-2"));
        assertEquals("<div className={cn(\"p-2\", base, { on: isOn })}>x</div>", result);
    }

    @Test
    void testMergeCallLaterLiteralsAreFilteredButNotExtended() {
        var source = "<div className={cn('p-2 flex', cond && x, 'p-4 grid')}>x</div>";
        var result = rewrite(source, ClassUpdate.of(List.of("p-6"), List.of("p-")));
        assertEquals("<div className={cn('flex p-6', cond && x, 'grid')}>x</div>", result);
    }

    @Test
    void testMergeCallWithEmptyArgumentList() {
        var result = rewrite("<div className={cn()}>x</div>", ClassUpdate.add("a"));
        assertEquals("<div className={cn(\"a\")}>x</div>", result);
    }

    @Test
    void testTemplateLiteralIsWrappedInMergeCall() {
        var source = "<div className={`card card-${size}`}>Content</div>";
        var result = rewrite(source, ClassUpdate.of(List.of("card-bordered"), List.of("card-")));
        assertEquals("<div className={cn(`card card-${size}`, \"card-bordered\")}>Content</div>", result);
    }

    @Test
    void testUnknownExpressionIsWrappedInMergeCall() {
        var source = "<div className={styles.root}>x</div>";
        var result = rewrite(source, ClassUpdate.add("mt-2"));
        assertEquals("<div className={cn(styles.root, \"mt-2\")}>x</div>", result);
    }

    @Test
    void testDynamicValueWithOnlyRemovalsIsLeftAlone() {
        var source = "<div className={`a ${b}`}>x</div>";
        var doc = JsxParser.parse(source);
        var edits = rewriter.rewrite(source, doc.elements().get(0), ClassUpdate.of(List.of(), List.of("a")));
        assertTrue(edits.isEmpty());
    }

    @Test
    void testValuelessAttributeIsReplaced() {
        var result = rewrite("<div className>x</div>", ClassUpdate.add("a"));
        assertEquals("<div className=\"a\">x</div>", result);
    }

    @Test
    void testQuoteSwitchesWhenClassContainsIt() {
        assertEquals("\"it's\"", ClassListRewriter.quote("it's", '\''));
        assertEquals("'a'", ClassListRewriter.quote("a", '\''));
        assertEquals("\"a\"", ClassListRewriter.quote("a", '`'));
    }

    @Test
    void testFragmentIsRejected() {
        var source = "<><p>x</p></>";
        var doc = JsxParser.parse(source);
        var error = assertThrows(UnsupportedTargetException.class,
                                 () -> rewriter.rewrite(source, doc.roots().get(0), ClassUpdate.add("a")));
        assertEquals(JsxNode.Kind.FRAGMENT, error.targetKind());
    }

    @Test
    void testMergeCallKeepsComments() {
        var source = """
                <span className={cn(
                  'badge', // don't touch
                  /* sizes, colors */ 'px-2',
                  isNew && 'badge-new'
                )}>x</span>""";
        var result = rewrite(source, ClassUpdate.of(List.of("px-4"), List.of("px-")));
        assertEquals("""
                <span className={cn(
                  'badge px-4', // don't touch
                  /* sizes, colors */ isNew && 'badge-new'
                )}>x</span>""", result);
    }
}
