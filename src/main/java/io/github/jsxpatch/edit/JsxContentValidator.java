package io.github.jsxpatch.edit;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Cheap textual checks for the two ways a rewritten file has been seen to break: a closing tag that lost its
 * {@code <}, and an opening tag that ended up with two class attributes.
 */
public final class JsxContentValidator {
    private static final Pattern MALFORMED_CLOSING_TAG = Pattern.compile("[\\s;,]/[a-zA-Z][a-zA-Z0-9]*>");

    private final Pattern duplicateClassAttribute;
    private final String classAttribute;

    public JsxContentValidator(String classAttribute) {
        this.classAttribute = classAttribute;
        var name = Pattern.quote(classAttribute);
        this.duplicateClassAttribute = Pattern.compile("<[a-zA-Z][^>]*\\s" + name + "\\s*=\\s*[^>]*\\s" + name + "\\s*=");
    }

    /**
     * @return one message per problem found; empty when the content looks sound
     */
    public List<String> validate(String content) {
        var errors = new ArrayList<String>();

        var malformed = new ArrayList<String>();
        var m = MALFORMED_CLOSING_TAG.matcher(content);
        while (m.find()) {
            if (m.start() > 0 && content.charAt(m.start() - 1) == '<') {
                continue;
            }
            malformed.add(m.group().strip());
        }
        if (!malformed.isEmpty()) {
            errors.add("Malformed closing tags detected (missing opening '<'): " + String.join(", ", malformed));
        }

        if (duplicateClassAttribute.matcher(content).find()) {
            errors.add("Duplicate " + classAttribute + " attribute detected in a single element");
        }
        return errors;
    }
}
