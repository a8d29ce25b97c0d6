package org.modcat.scan;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Default {@link IDeclarationExtractor}: a lightweight line-oriented scan with regular expressions.
 *
 * <p>This is not a parser. Imports and declarations inside string literals are picked up like any other
 * line, and constructs spread over several lines are only recognized by their first line.</p>
 *
 * <p>Recognized forms:</p>
 * <ul>
 *   <li>{@code from <dotted-path> import <names>} captures {@code <dotted-path>} verbatim</li>
 *   <li>{@code import <a>, <b>} captures the first name, without an {@code as} alias</li>
 *   <li>{@code class <Name>} and {@code [async] def <name>} at any indentation</li>
 * </ul>
 */
public final class LinePatternExtractor implements IDeclarationExtractor {

    private static final Pattern IMPORT_PATTERN = Pattern.compile(
            "^(?:from\\s+(\\S+)\\s+)?import\\s+([^#]+)");
    private static final Pattern TYPE_PATTERN = Pattern.compile(
            "^class\\s+(\\w+)");
    private static final Pattern CALLABLE_PATTERN = Pattern.compile(
            "^(?:async\\s+)?def\\s+(\\w+)");

    @Override
    public Declarations extract(String content) {
        if (content == null || content.isEmpty()) {
            return Declarations.empty();
        }

        Set<String> imports = new LinkedHashSet<>();
        Set<String> types = new LinkedHashSet<>();
        Set<String> callables = new LinkedHashSet<>();

        for (String rawLine : content.split("\\r?\\n")) {
            String line = rawLine.strip();
            if (line.isEmpty() || line.startsWith("#")) continue;

            Matcher importMatcher = IMPORT_PATTERN.matcher(line);
            if (importMatcher.lookingAt()) {
                String imported = importMatcher.group(1) != null
                        ? importMatcher.group(1)
                        : firstImportedName(importMatcher.group(2));
                if (!imported.isEmpty()) {
                    imports.add(imported);
                }
                continue;
            }

            Matcher typeMatcher = TYPE_PATTERN.matcher(line);
            if (typeMatcher.lookingAt()) {
                types.add(typeMatcher.group(1));
                continue;
            }

            Matcher callableMatcher = CALLABLE_PATTERN.matcher(line);
            if (callableMatcher.lookingAt()) {
                callables.add(callableMatcher.group(1));
            }
        }

        return new Declarations(imports, types, callables);
    }

    /**
     * Takes the first comma-separated name of a plain import and drops an {@code as} alias.
     */
    private static String firstImportedName(String names) {
        String first = names.split(",")[0].strip();
        int space = first.indexOf(' ');
        return space < 0 ? first : first.substring(0, space);
    }
}
