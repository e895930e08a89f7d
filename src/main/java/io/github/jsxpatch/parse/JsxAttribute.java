package io.github.jsxpatch.parse;

import org.jetbrains.annotations.Nullable;

/**
 * One attribute of an opening tag.
 *
 * @param name       attribute name, or {@code null} for a spread attribute ({@code {...props}})
 * @param span       the whole attribute, name through end of value
 * @param valueKind  shape of the value
 * @param valueSpan  the value including its quotes or braces, {@code null} when there is no value
 * @param expression the value container when {@code valueKind} is {@link ValueKind#EXPRESSION} or
 *                   {@link ValueKind#SPREAD}
 * @param element    the value when {@code valueKind} is {@link ValueKind#ELEMENT}
 */
public record JsxAttribute(@Nullable String name,
                           SourceSpan span,
                           ValueKind valueKind,
                           @Nullable SourceSpan valueSpan,
                           @Nullable JsxExpression expression,
                           @Nullable JsxNode element)
{
    public enum ValueKind {
        /** {@code disabled} */
        NONE,
        /** {@code className="a b"} */
        STRING,
        /** {@code className={...}} */
        EXPRESSION,
        /** {@code icon=<Icon />} */
        ELEMENT,
        /** {@code {...props}} */
        SPREAD
    }

    public boolean isNamed(String attributeName) {
        return attributeName.equals(name);
    }

    /**
     * Returns the raw characters between the quotes of a string value.
     */
    public String stringContent(String source) {
        if (valueKind != ValueKind.STRING || valueSpan == null) {
            throw new IllegalStateException("Attribute " + name + " does not have a string value");
        }
        return source.substring(valueSpan.start() + 1, valueSpan.end() - 1);
    }

    public @Nullable JsxNode valueNode() {
        return expression != null ? expression : element;
    }
}
