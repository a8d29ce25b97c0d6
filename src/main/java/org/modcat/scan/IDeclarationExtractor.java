package org.modcat.scan;

import java.util.Set;

/**
 * Extracts imports and declarations from a module's text.
 * <p>
 * The scanner depends only on this interface, so a tokenizer-backed extractor can replace the default
 * {@link LinePatternExtractor} without touching graph building, ordering or transformation.
 */
public interface IDeclarationExtractor {

    /**
     * Extracts all recognizable imports and declarations from the given text.
     * Must never fail on malformed input; unrecognized lines are ignored.
     *
     * @param content The raw module text.
     * @return The extracted names, never {@code null}.
     */
    Declarations extract(String content);

    /**
     * Names found in a module.
     *
     * @param imports   Imported module paths as written (leading dots preserved).
     * @param types     Declared type names.
     * @param callables Declared function and method names.
     */
    record Declarations(Set<String> imports, Set<String> types, Set<String> callables) {

        public static Declarations empty() {
            return new Declarations(Set.of(), Set.of(), Set.of());
        }
    }
}
