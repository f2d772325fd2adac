package ai.flowir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import ai.flowir.graph.Graph;
import ai.flowir.graph.GraphBuilder;
import ai.flowir.graph.GraphValidator;
import ai.flowir.io.GraphSerializer;
import ai.flowir.io.GraphWriter;
import ai.flowir.scan.SourceIndex;
import ai.flowir.scan.SourceRootFinder;
import ai.flowir.source.JsonWorkflowAdapter;

public final class Main {

    public static void main(String[] args) {
        final int code = run(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args) {
        Path workflowFile = null;
        Path outDir = null;
        Path sourceRootFile = null;
        String print = null;
        boolean includeTests = true;
        boolean validate = false;
        final List<Path> sourceDirs = new ArrayList<>();

        try {
            for (String arg : args) {
                if ("--help".equals(arg) || "-h".equals(arg)) {
                    printUsage();
                    return 0;
                }
                if (arg.startsWith("--outDir=")) {
                    outDir = Paths.get(arg.substring("--outDir=".length()));
                    continue;
                }
                if (arg.startsWith("--includeTests=")) {
                    includeTests = Boolean.parseBoolean(arg.substring("--includeTests=".length()));
                    continue;
                }
                if (arg.startsWith("--validate=")) {
                    validate = Boolean.parseBoolean(arg.substring("--validate=".length()));
                    continue;
                }
                if (arg.startsWith("--sourceRoots=")) {
                    final String list = arg.substring("--sourceRoots=".length()).trim();
                    if (!list.isEmpty()) {
                        Arrays.stream(list.split(","))
                                .map(String::trim)
                                .filter(s -> !s.isEmpty())
                                .map(Paths::get)
                                .forEach(sourceDirs::add);
                    }
                    continue;
                }
                if (arg.startsWith("--sourceRootFile=")) {
                    sourceRootFile = Paths.get(arg.substring("--sourceRootFile=".length()));
                    continue;
                }
                if (arg.startsWith("--print=")) {
                    print = arg.substring("--print=".length()).trim().toLowerCase(Locale.ROOT);
                    if (!"json".equals(print) && !"prompt".equals(print)) {
                        System.err.println("ERROR: --print must be json or prompt: " + print);
                        printUsage();
                        return 2;
                    }
                    continue;
                }
                if (arg.startsWith("--")) {
                    System.err.println("ERROR: unknown argument: " + arg);
                    printUsage();
                    return 2;
                }
                if (workflowFile == null) {
                    workflowFile = Paths.get(arg);
                    continue;
                }
                System.err.println("ERROR: unexpected argument: " + arg);
                printUsage();
                return 2;
            }

            if (workflowFile == null) {
                System.err.println("ERROR: missing workflow file");
                printUsage();
                return 2;
            }
            workflowFile = workflowFile.toAbsolutePath().normalize();
            if (!Files.isRegularFile(workflowFile)) {
                throw new java.io.IOException("Workflow file not found: " + workflowFile);
            }
            final Path workflowDir = workflowFile.getParent();

            if (sourceRootFile != null) {
                loadSourceDirsFromFile(resolve(workflowDir, sourceRootFile), sourceDirs);
            }
            final List<Path> dirs = new ArrayList<>();
            for (Path dir : sourceDirs) {
                dirs.add(resolve(workflowDir, dir));
            }
            if (dirs.isEmpty()) {
                dirs.add(workflowDir);
            }

            final var roots = new SourceRootFinder(dirs, includeTests).findAllSourceRoots();
            final SourceIndex index = SourceIndex.build(workflowDir, roots);
            final var adapter = JsonWorkflowAdapter.load(workflowFile, index);
            final Graph graph = new GraphBuilder(adapter).build();

            if (validate) {
                for (var ref : GraphValidator.findDanglingReferences(graph)) {
                    System.err.println("WARN: " + ref.describe());
                }
            }
            if (index.parseWarningCount() > 0) {
                System.err.println("WARN: parse warnings: " + index.parseWarningCount());
            }

            if (print != null) {
                final GraphSerializer serializer = new GraphSerializer();
                System.out.println("json".equals(print) ? serializer.toJson(graph) : serializer.toPrompt(graph));
                return 0;
            }

            outDir = outDir == null ? workflowDir.resolve(".flow-ir") : resolve(workflowDir, outDir);
            final GraphWriter writer = new GraphWriter(outDir);
            final var summary = writer.writeAll(graph, Instant.now().toString());

            System.out.println("Flow IR written to: " + outDir);
            System.out.println("Schema: " + GraphWriter.SCHEMA_VERSION);
            System.out.println("Nodes: " + summary.nodes()
                    + ", edges: " + summary.edges()
                    + " (static " + summary.staticEdges()
                    + ", routing " + summary.routingEdges()
                    + ", command " + summary.commandEdges() + ")");
            return 0;
        } catch (java.io.IOException ex) {
            System.err.println("ERROR: IO failure: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (Exception ex) {
            System.err.println("ERROR: failed to build graph: "
                    + ex.getClass().getSimpleName() + ": " + safeMsg(ex.getMessage()));
            return 1;
        }
    }

    private static Path resolve(Path base, Path p) {
        return p.isAbsolute() ? p.normalize() : base.resolve(p).normalize();
    }

    private static void loadSourceDirsFromFile(Path file, List<Path> sourceDirs) throws java.io.IOException {
        if (!Files.isRegularFile(file)) {
            throw new java.io.IOException("Source root file not found: " + file);
        }
        try (var br = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = br.readLine()) != null) {
                String trimmed = line.trim();
                final int hash = trimmed.indexOf('#');
                if (hash >= 0) {
                    trimmed = trimmed.substring(0, hash).trim();
                }
                if (trimmed.isEmpty()) {
                    continue;
                }
                for (String token : trimmed.split("[,\\s]+")) {
                    final String t = token.trim();
                    if (!t.isEmpty()) {
                        sourceDirs.add(Paths.get(t));
                    }
                }
            }
        }
    }

    private static void printUsage() {
        System.out.println("Usage: flow-ir <workflow.json> [options]");
        System.out.println("Options:");
        System.out.println("  --outDir=<path>          Output directory (default: <workflowDir>/.flow-ir)");
        System.out.println("  --sourceRoots=<d1,d2>    Directories searched for node and schema sources (default: <workflowDir>)");
        System.out.println("  --sourceRootFile=<path>  File listing source directories (one per line or comma-separated)");
        System.out.println("  --includeTests=<bool>    Include test source sets (default: true)");
        System.out.println("  --print=<json|prompt>    Print that form to stdout instead of writing files");
        System.out.println("  --validate=<bool>        Report edges to unknown nodes as warnings (default: false)");
        System.out.println("  --help, -h               Show this help");
    }

    private static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
