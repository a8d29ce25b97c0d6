package org.modcat.transform;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A single text rewrite: every match of {@code pattern} is replaced by {@code replacement} followed by
 * {@code " # " + explanation} and a line break, so the elided spot names its own category.
 *
 * <p>Rules are pure functions over text. The replacement uses {@link Matcher} syntax ({@code $1} for
 * group 1).</p>
 *
 * @param pattern     The compiled pattern.
 * @param replacement The replacement template.
 * @param explanation The annotation appended to each replacement.
 * @param level       The lowest level at which the rule applies ({@link SummaryLevel#INTERFACE} or
 *                    {@link SummaryLevel#CORE}).
 */
public record SummaryRule(Pattern pattern, String replacement, String explanation, SummaryLevel level) {

    public SummaryRule {
        if (level == SummaryLevel.NONE) {
            throw new IllegalArgumentException("Rule '" + explanation + "' cannot apply at level none");
        }
    }

    /**
     * Compiles a rule with {@link Pattern#MULTILINE}, so {@code ^} anchors at every line start.
     */
    public static SummaryRule of(String regex, String replacement, String explanation, SummaryLevel level) {
        return new SummaryRule(Pattern.compile(regex, Pattern.MULTILINE), replacement, explanation, level);
    }

    public String apply(String text) {
        String template = replacement + Matcher.quoteReplacement(" # " + explanation + "\n");
        return pattern.matcher(text).replaceAll(template);
    }
}
