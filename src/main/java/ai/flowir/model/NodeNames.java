package ai.flowir.model;

import java.util.Objects;

public final class NodeNames {

    /** Entry pseudo node, present in every built graph. */
    public static final String START = "__special_start_node__";

    /** Termination pseudo node, present in every built graph. */
    public static final String END = "__special_end_node__";

    private NodeNames() {
    }

    public static boolean isPseudo(String name) {
        return START.equals(name) || END.equals(name);
    }

    public static String location(String file, int line) {
        Objects.requireNonNull(file, "file");
        return file + ":" + line;
    }
}
