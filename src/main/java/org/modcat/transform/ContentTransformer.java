package org.modcat.transform;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Prepares a module's text for the flattened artifact.
 *
 * <ol>
 *   <li>Relative imports are neutralized: each {@code from .x import y} line is kept verbatim inside an
 *   inert string block tagged {@value #RELATIVE_IMPORT_TAG}, at the line's original indentation.</li>
 *   <li>The text is summarized with the rules of the requested level. At {@link SummaryLevel#NONE} this
 *   step returns its input unchanged.</li>
 * </ol>
 */
public final class ContentTransformer {

    public static final String RELATIVE_IMPORT_TAG = "RELATIVE_IMPORT";

    private static final Pattern RELATIVE_IMPORT_PATTERN = Pattern.compile(
            "^([ \\t]*)from[ \\t]+\\.[^\\n]*$", Pattern.MULTILINE);

    private final SummaryRules rules;
    private final boolean neutralizeRelativeImports;

    public ContentTransformer() {
        this(SummaryRules.defaults(), true);
    }

    public ContentTransformer(SummaryRules rules) {
        this(rules, true);
    }

    /**
     * @param rules                     The rule set used for summarization.
     * @param neutralizeRelativeImports Whether {@link #transform} wraps relative imports.
     */
    public ContentTransformer(SummaryRules rules, boolean neutralizeRelativeImports) {
        this.rules = Objects.requireNonNull(rules, "rules");
        this.neutralizeRelativeImports = neutralizeRelativeImports;
    }

    /**
     * Neutralizes relative imports (if enabled), then summarizes.
     *
     * @param content The module text.
     * @param level   The summarization level.
     * @return The transformed text.
     * @throws IllegalArgumentException If the content is binary data.
     */
    public String transform(String content, SummaryLevel level) {
        requireText(content);
        String result = neutralizeRelativeImports ? neutralizeRelativeImports(content) : content;
        return summarize(result, level);
    }

    /**
     * Wraps every relative-import line into an inert block:
     * <pre>
     *     """RELATIVE_IMPORT:
     *     from .sibling import thing
     *     """
     * </pre>
     */
    public String neutralizeRelativeImports(String content) {
        requireText(content);
        Matcher matcher = RELATIVE_IMPORT_PATTERN.matcher(content);
        StringBuilder out = new StringBuilder(content.length() + 64);
        while (matcher.find()) {
            String indent = matcher.group(1);
            String block = indent + "\"\"\"" + RELATIVE_IMPORT_TAG + ":\n" + matcher.group() + "\n" + indent + "\"\"\"";
            matcher.appendReplacement(out, Matcher.quoteReplacement(block));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    /**
     * Applies the rules of the given level in order. Identity at {@link SummaryLevel#NONE}.
     */
    public String summarize(String content, SummaryLevel level) {
        requireText(content);
        if (level == SummaryLevel.NONE) {
            return content;
        }
        String result = content;
        for (SummaryRule rule : rules.forLevel(level)) {
            result = rule.apply(result);
        }
        return result;
    }

    public SummaryRules rules() {
        return rules;
    }

    private static void requireText(String content) {
        Objects.requireNonNull(content, "content");
        if (content.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("Expected text content but got binary data (NUL character found)");
        }
    }
}
