package org.modcat.scan;

import java.nio.file.Path;

/**
 * Identifies a module by its path relative to the scan root, using {@code /} as separator.
 * Used as the key of the module table and as the node type of the dependency graph.
 *
 * @param path The normalized, root-relative path that uniquely identifies a module.
 */
public record ModuleId(String path) {

    /**
     * Creates the identity of a file below the given root.
     *
     * @param root The scan root.
     * @param file A file located below {@code root}.
     * @return The root-relative identity.
     */
    public static ModuleId of(Path root, Path file) {
        return new ModuleId(root.relativize(file).normalize().toString().replace('\\', '/'));
    }

    /**
     * Returns the directory part of the path, or an empty string for modules located directly in the root.
     */
    public String directory() {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? "" : path.substring(0, slash);
    }

    /**
     * Returns the number of directories between the scan root and this module.
     */
    public int depth() {
        String dir = directory();
        return dir.isEmpty() ? 0 : dir.split("/").length;
    }

    /**
     * Returns the first path segment with any file extension removed. For {@code pkg/util.py} this is
     * {@code pkg}, for {@code main.py} it is {@code main}.
     */
    public String topLevelName() {
        int slash = path.indexOf('/');
        String first = slash < 0 ? path : path.substring(0, slash);
        if (slash < 0) {
            int dot = first.lastIndexOf('.');
            if (dot > 0) {
                first = first.substring(0, dot);
            }
        }
        return first;
    }

    /**
     * Returns the file name of the module.
     */
    public String fileName() {
        return path.substring(path.lastIndexOf('/') + 1);
    }

    @Override
    public String toString() {
        return path;
    }
}
