package ai.flowir.model;

import java.util.List;
import java.util.Objects;

/**
 * Transition chosen by the originating node's own result, from a known candidate set.
 */
public record CommandEdge(List<String> possibleTargets) implements Edge {
    public CommandEdge {
        Objects.requireNonNull(possibleTargets, "possibleTargets");
        possibleTargets = List.copyOf(possibleTargets);
    }
}
