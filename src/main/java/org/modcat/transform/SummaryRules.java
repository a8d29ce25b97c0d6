package org.modcat.transform;

import java.util.ArrayList;
import java.util.List;

/**
 * An ordered rule set. Rules run in insertion order; at {@link SummaryLevel#CORE} all interface rules run
 * before any core rule.
 *
 * <p>The default rules share two boundary conditions:</p>
 * <ul>
 *   <li>A collapsed body ends before the next top-level declaration line ({@code class}, {@code def},
 *   {@code async def} or a decorator), so adjacent declarations are never merged.</li>
 *   <li>A header that is already followed by a {@code ... #} placeholder line is not matched again.</li>
 * </ul>
 * <p>Parameter and base-class lists may contain one level of nested parentheses. A header nested deeper
 * than that, such as {@code def f(x=g(h())):}, is not matched and its body stays unchanged.</p>
 */
public final class SummaryRules {

    public static final String CLASS_EXPLANATION = "Class interface preserved";
    public static final String FUNCTION_EXPLANATION = "Function signature preserved";
    public static final String GETTER_EXPLANATION = "Getter method summarized";
    public static final String INIT_EXPLANATION = "Standard initialization summarized";

    private static final String PLACEHOLDER_GUARD = "(?![ \\t]*\\n[ \\t]*\\.\\.\\. #)";
    private static final String TOP_LEVEL_BOUNDARY = "(?!class\\b|(?:async[ \\t]+)?def\\b|@)";
    private static final String ANY_LEVEL_BOUNDARY = "(?![ \\t]*(?:class\\b|(?:async[ \\t]+)?def\\b|@))";
    // One level of nested parentheses, e.g. default values like dict() or Optional(int)
    private static final String PARENTHESIZED = "\\((?:[^()]++|\\([^()]*+\\))*+\\)";
    private static final String PARAMETERS = "[ \\t]*" + PARENTHESIZED + "(?:[ \\t]*->[ \\t]*[^:\\n]+)?[ \\t]*";

    // Possessive quantifiers keep matching iterative on long bodies
    private static final String TOP_LEVEL_BODY = "[^\\n]*+(?:\\n" + TOP_LEVEL_BOUNDARY + "[^\\n]*+)*+";
    private static final String ANY_LEVEL_BODY = "[^\\n]*+(?:\\n" + ANY_LEVEL_BOUNDARY + "[^\\n]*+)*+";

    private final List<SummaryRule> interfaceRules;
    private final List<SummaryRule> coreRules;

    private SummaryRules(List<SummaryRule> interfaceRules, List<SummaryRule> coreRules) {
        this.interfaceRules = List.copyOf(interfaceRules);
        this.coreRules = List.copyOf(coreRules);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * The built-in rule set.
     */
    public static SummaryRules defaults() {
        return builder()
                .add(SummaryRule.of(
                        "^(class[ \\t]+\\w+[ \\t]*(?:" + PARENTHESIZED + ")?[ \\t]*):" + PLACEHOLDER_GUARD + TOP_LEVEL_BODY,
                        "$1:\n    ...",
                        CLASS_EXPLANATION,
                        SummaryLevel.INTERFACE))
                .add(SummaryRule.of(
                        "^((?:async[ \\t]+)?def[ \\t]+\\w+" + PARAMETERS + "):" + PLACEHOLDER_GUARD + TOP_LEVEL_BODY,
                        "$1:\n    ...",
                        FUNCTION_EXPLANATION,
                        SummaryLevel.INTERFACE))
                .add(SummaryRule.of(
                        "^([ \\t]*)((?:async[ \\t]+)?def[ \\t]+get_\\w+" + PARAMETERS + "):"
                                + "[ \\t]*(?:\\n[ \\t]*)?return\\b[^\\n]*(?:\\n|\\z)",
                        "$1$2:\n$1    ...",
                        GETTER_EXPLANATION,
                        SummaryLevel.CORE))
                .add(SummaryRule.of(
                        "^([ \\t]*)((?:async[ \\t]+)?def[ \\t]+__init__" + PARAMETERS + "):" + PLACEHOLDER_GUARD
                                + ANY_LEVEL_BODY,
                        "$1$2:\n$1    ...",
                        INIT_EXPLANATION,
                        SummaryLevel.CORE))
                .build();
    }

    /**
     * Returns the rules that run at the given level, in application order.
     */
    public List<SummaryRule> forLevel(SummaryLevel level) {
        return switch (level) {
            case INTERFACE -> interfaceRules;
            case CORE -> {
                List<SummaryRule> all = new ArrayList<>(interfaceRules);
                all.addAll(coreRules);
                yield List.copyOf(all);
            }
            case NONE -> List.of();
        };
    }

    public List<SummaryRule> interfaceRules() {
        return interfaceRules;
    }

    public List<SummaryRule> coreRules() {
        return coreRules;
    }

    public static final class Builder {

        private final List<SummaryRule> interfaceRules = new ArrayList<>();
        private final List<SummaryRule> coreRules = new ArrayList<>();

        private Builder() {}

        public Builder add(SummaryRule rule) {
            if (rule.level() == SummaryLevel.INTERFACE) {
                interfaceRules.add(rule);
            } else {
                coreRules.add(rule);
            }
            return this;
        }

        public SummaryRules build() {
            return new SummaryRules(interfaceRules, coreRules);
        }
    }
}
