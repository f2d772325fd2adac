package ai.flowir.scan;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Finds Java source roots under the given directories:
 * - <dir>/.../src/main/java
 * - <dir>/.../src/test/java
 * - <dir>/.../src/* /java  (generic - covers integrationTest, etc.)
 * A directory without any such root is treated as a source root itself.
 */
public final class SourceRootFinder {

    private static final Set<String> SKIPPED_DIRS = Set.of(
            ".git", ".idea", "build", "target", "out", "node_modules");

    private final List<Path> dirs;
    private final boolean includeTests;

    public SourceRootFinder(List<Path> dirs, boolean includeTests) {
        this.dirs = List.copyOf(Objects.requireNonNull(dirs, "dirs"));
        this.includeTests = includeTests;
    }

    public List<Path> findAllSourceRoots() throws IOException {
        final Set<Path> out = new LinkedHashSet<>();

        for (Path dir : dirs) {
            final Path start = dir.toAbsolutePath().normalize();
            if (!Files.isDirectory(start)) {
                System.err.println("WARN: source directory not found: " + start);
                continue;
            }

            final List<Path> roots = new ArrayList<>();
            final boolean[] sawJavaDir = {false};
            Files.walkFileTree(start, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path d, BasicFileAttributes attrs) {
                    final String name = d.getFileName() != null ? d.getFileName().toString() : "";
                    if (!d.equals(start) && SKIPPED_DIRS.contains(name)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    final String sourceSet = sourceSetOf(d);
                    if (sourceSet != null) {
                        sawJavaDir[0] = true;
                        if (includeTests || "main".equals(sourceSet)) {
                            roots.add(d);
                        }
                        return FileVisitResult.SKIP_SUBTREE; // SourceIndex walks the files
                    }
                    return FileVisitResult.CONTINUE;
                }
            });

            if (!sawJavaDir[0]) {
                out.add(start);
                continue;
            }
            roots.sort(null);
            out.addAll(roots);
        }

        return new ArrayList<>(out);
    }

    /**
     * @return "main", "test", ... for .../src/<set>/java, else null
     */
    private static String sourceSetOf(Path dir) {
        final int n = dir.getNameCount();
        if (n < 3) return null;
        final String last = dir.getName(n - 1).toString();
        final String mid = dir.getName(n - 2).toString();
        final String src = dir.getName(n - 3).toString();
        if (!"java".equals(last) || !"src".equals(src) || mid.isBlank()) return null;
        return mid;
    }
}
