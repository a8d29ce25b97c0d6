package org.modcat.output.render;

import org.modcat.scan.ModuleId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Renders the directory layout below the scan root in the style of {@code tree --charset=ascii}.
 * Only discovered modules and the directories leading to them are shown; hidden entries and
 * {@code __pycache__} are skipped. If the root cannot be listed, the discovered module paths are
 * returned as a flat list instead.
 */
public final class DirectoryTreeRenderer {

    private static final Logger log = LoggerFactory.getLogger(DirectoryTreeRenderer.class);

    public String render(Path root, List<ModuleId> modules) {
        try {
            StringBuilder out = new StringBuilder(root.getFileName() != null ? root.getFileName().toString() : root.toString());
            out.append('\n');
            Set<String> paths = modules.stream().map(ModuleId::path).collect(Collectors.toSet());
            renderChildren(root, root, paths, "", out);
            return out.toString();
        } catch (IOException | UncheckedIOException e) {
            log.debug("Directory listing of {} unavailable, using flat listing: {}", root, e.getMessage());
            return flatListing(modules);
        }
    }

    /**
     * One module path per line.
     */
    public static String flatListing(List<ModuleId> modules) {
        return modules.stream().map(ModuleId::path).collect(Collectors.joining("\n", "", "\n"));
    }

    private void renderChildren(Path root, Path dir, Set<String> modules, String prefix, StringBuilder out)
            throws IOException {
        List<Path> children;
        try (Stream<Path> entries = Files.list(dir)) {
            children = entries
                    .filter(p -> !isSkipped(p) && leadsToModule(root, p, modules))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        }
        for (int i = 0; i < children.size(); i++) {
            Path child = children.get(i);
            boolean last = i == children.size() - 1;
            out.append(prefix).append(last ? "`-- " : "|-- ").append(child.getFileName()).append('\n');
            if (Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)) {
                renderChildren(root, child, modules, prefix + (last ? "    " : "|   "), out);
            }
        }
    }

    private static boolean leadsToModule(Path root, Path entry, Set<String> modules) {
        String relative = root.relativize(entry).toString().replace('\\', '/');
        if (modules.contains(relative)) {
            return true;
        }
        String directoryPrefix = relative + "/";
        return modules.stream().anyMatch(m -> m.startsWith(directoryPrefix));
    }

    private static boolean isSkipped(Path path) {
        String name = path.getFileName().toString();
        return name.startsWith(".") || name.equals("__pycache__");
    }
}
