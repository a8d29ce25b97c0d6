package org.modcat.scan;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * What to scan and what to leave out.
 *
 * @param root          The scan root; module identities are relative to it.
 * @param extensions    File name suffixes that mark a module (e.g. {@code .py}).
 * @param excludes      Substrings; a module whose root-relative path contains any of them is skipped.
 * @param excludedPaths Files skipped by identity, e.g. the tool's own script when it lives under the root.
 */
public record ScanOptions(Path root, List<String> extensions, List<String> excludes, Set<Path> excludedPaths) {

    public static final List<String> DEFAULT_EXTENSIONS = List.of(".py");

    public ScanOptions {
        root = root.toAbsolutePath().normalize();
        extensions = List.copyOf(extensions);
        excludes = List.copyOf(excludes);
        excludedPaths = excludedPaths.stream()
                .map(p -> p.toAbsolutePath().normalize())
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Options scanning {@code *.py} files below {@code root} without exclusions.
     */
    public static ScanOptions of(Path root) {
        return new ScanOptions(root, DEFAULT_EXTENSIONS, List.of(), Set.of());
    }

    public ScanOptions withExcludes(List<String> moreExcludes) {
        return new ScanOptions(root, extensions, moreExcludes, excludedPaths);
    }

    public ScanOptions withExcludedPaths(Set<Path> paths) {
        return new ScanOptions(root, extensions, excludes, paths);
    }

    /**
     * Checks whether the file name carries one of the module extensions.
     */
    public boolean isModuleFile(Path file) {
        String name = file.getFileName().toString();
        return extensions.stream().anyMatch(name::endsWith);
    }

    /**
     * Checks whether a file is excluded, either by identity or because its root-relative path
     * contains one of the exclusion substrings.
     */
    public boolean isExcluded(Path file) {
        Path normalized = file.toAbsolutePath().normalize();
        if (excludedPaths.contains(normalized)) {
            return true;
        }
        String relative = root.relativize(normalized).toString().replace('\\', '/');
        return excludes.stream().anyMatch(relative::contains);
    }
}
