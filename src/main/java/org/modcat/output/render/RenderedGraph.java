package org.modcat.output.render;

import org.modcat.scan.ModuleId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A pre-rendered dependency diagram.
 *
 * @param diagram The diagram text, using labels instead of module paths.
 * @param legend  Label to module, in label order.
 */
public record RenderedGraph(String diagram, Map<String, ModuleId> legend) {

    public RenderedGraph {
        legend = Collections.unmodifiableMap(new LinkedHashMap<>(legend));
    }

    public String legendText() {
        return "Legend:\n" + legend.entrySet().stream()
                .map(e -> e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining("\n"));
    }
}
