package ai.flowir.model;

import java.util.Objects;

/**
 * One computation step of the workflow.
 * definedAt and definition are null when the step's code could not be located.
 */
public record Node(
        String name,
        String definedAt,   // <file>:<line>
        String definition   // full description of the defining code, prompt-only
) {
    public Node {
        Objects.requireNonNull(name, "name");
    }

    public static Node of(String name) {
        return new Node(name, null, null);
    }
}
