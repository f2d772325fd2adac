package ai.flowir.model;

import java.util.Objects;

/**
 * Unconditional transition to exactly one node.
 */
public record StaticEdge(String target) implements Edge {
    public StaticEdge {
        Objects.requireNonNull(target, "target");
    }
}
