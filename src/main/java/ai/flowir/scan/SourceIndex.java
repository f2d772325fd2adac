package ai.flowir.scan;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Range;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.PackageDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;

/**
 * Read-only index of Java declarations, used to describe workflow steps and schemas:
 * - types by fqcn
 * - methods by "<fqcn>#<method>" (first declaration wins for overloads)
 * <p>
 * Files that fail to parse are skipped and counted as parse warnings.
 */
public final class SourceIndex {

    private final Path baseDir;
    private final JavaParser parser;
    private final SymbolTable symbols = new SymbolTable();
    private final Map<String, CodeDefinition> types = new HashMap<>();
    private final Map<String, CodeDefinition> methods = new HashMap<>();
    private int parseWarnings;

    private SourceIndex(Path baseDir) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir").toAbsolutePath().normalize();
        this.parser = new JavaParser(new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
    }

    public static SourceIndex empty(Path baseDir) {
        return new SourceIndex(baseDir);
    }

    /**
     * Parses every .java file under the given source roots.
     *
     * @param baseDir     directory that reported file paths are relative to
     * @param sourceRoots roots to walk, in order
     */
    public static SourceIndex build(Path baseDir, List<Path> sourceRoots) throws IOException {
        Objects.requireNonNull(sourceRoots, "sourceRoots");
        final SourceIndex index = new SourceIndex(baseDir);
        for (Path root : sourceRoots) {
            index.scan(root);
        }
        index.symbols.finalizeIndex();
        return index;
    }

    private void scan(Path sourceRoot) throws IOException {
        try (var paths = Files.walk(sourceRoot)) {
            final var javaFiles = paths
                    .filter(Files::isRegularFile)
                    .filter(path -> {
                        final var name = path.getFileName() != null ? path.getFileName().toString() : "";
                        return name.endsWith(".java");
                    })
                    .sorted()
                    .toList();

            for (var file : javaFiles) {
                parseFile(file);
            }
        }
    }

    private void parseFile(Path file) {
        try {
            final String content = Files.readString(file, StandardCharsets.UTF_8);
            final var res = parser.parse(content);
            if (!res.getProblems().isEmpty()) {
                parseWarnings++;
                final String msg = safeMsg(res.getProblems().get(0).getMessage());
                System.err.println("WARN: parse problems in " + file + " -> " + msg);
            }
            final var cuOpt = res.getResult();
            if (cuOpt.isEmpty()) {
                return;
            }

            final var cu = cuOpt.get();
            final var pkg = cu.getPackageDeclaration()
                    .map(PackageDeclaration::getNameAsString)
                    .orElse("");
            final var fileRel = relativePath(file);
            final String[] lines = content.split("\r\n|\r|\n", -1);

            for (TypeDeclaration<?> td : cu.findAll(TypeDeclaration.class)) {
                final var fqcn = resolveFqcn(td, pkg);
                final var typeDef = definitionOf(td, fileRel, lines);
                if (typeDef == null) {
                    continue;
                }
                types.putIfAbsent(fqcn, typeDef);
                symbols.registerType(fqcn);

                for (MethodDeclaration md : td.getMethods()) {
                    final var methodDef = definitionOf(md, fileRel, lines);
                    if (methodDef != null) {
                        methods.putIfAbsent(fqcn + "#" + md.getNameAsString(), methodDef);
                    }
                }
            }

        } catch (Exception ex) {
            parseWarnings++;
            System.err.println("WARN: failed to parse " + file + " -> "
                    + ex.getClass().getSimpleName() + ": " + safeMsg(ex.getMessage()));
        }
    }

    /**
     * @param typeRef fqcn or unique simple name
     * @return the type's definition, or null when unknown
     */
    public CodeDefinition resolveType(String typeRef) {
        final String fqcn = symbols.resolveToFqcnIfPossible(typeRef);
        return fqcn == null ? null : types.get(fqcn);
    }

    /**
     * @param functionRef "<type>#<method>", type being a fqcn or unique simple name
     * @return the method's definition, or null when unknown
     */
    public CodeDefinition resolveFunction(String functionRef) {
        if (functionRef == null) {
            return null;
        }
        final int hash = functionRef.indexOf('#');
        if (hash <= 0 || hash == functionRef.length() - 1) {
            return null;
        }
        final String fqcn = symbols.resolveToFqcnIfPossible(functionRef.substring(0, hash));
        if (fqcn == null) {
            return null;
        }
        return methods.get(fqcn + "#" + functionRef.substring(hash + 1).trim());
    }

    public int typeCount() {
        return types.size();
    }

    public int methodCount() {
        return methods.size();
    }

    public int parseWarningCount() {
        return parseWarnings;
    }

    private String relativePath(Path file) {
        final Path abs = file.toAbsolutePath().normalize();
        final Path rel = abs.startsWith(baseDir) ? baseDir.relativize(abs) : abs;
        return rel.toString().replace('\\', '/');
    }

    private static CodeDefinition definitionOf(Node node, String fileRel, String[] lines) {
        final Range range = node.getRange().orElse(null);
        if (range == null) {
            return null;
        }
        final int first = range.begin.line;
        final int last = Math.min(range.end.line, lines.length);
        if (first < 1 || first > last) {
            return null;
        }
        final List<String> text = new ArrayList<>(last - first + 1);
        for (int i = first; i <= last; i++) {
            text.add(lines[i - 1]);
        }
        return new CodeDefinition(fileRel, first, String.join("\n", text));
    }

    private static String resolveFqcn(TypeDeclaration<?> td, String pkg) {
        final var direct = td.getFullyQualifiedName();
        if (direct.isPresent()) {
            return direct.get();
        }
        final String nested = nestedTypeName(td);
        if (pkg == null || pkg.isEmpty()) {
            return nested;
        }
        return pkg + "." + nested;
    }

    private static String nestedTypeName(TypeDeclaration<?> td) {
        final List<String> parts = new ArrayList<>();
        parts.add(td.getNameAsString());
        var parent = td.getParentNode().orElse(null);
        while (parent instanceof TypeDeclaration<?> outer) {
            parts.add(outer.getNameAsString());
            parent = outer.getParentNode().orElse(null);
        }
        Collections.reverse(parts);
        return String.join(".", parts);
    }

    private static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
