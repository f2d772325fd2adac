package ai.flowir.model;

import java.util.List;
import java.util.Objects;

/**
 * Conditional transition decided at run time by a named routing function.
 * possibleTargets is null when the targets cannot be enumerated statically.
 */
public record RoutingEdge(String routingFn, List<String> possibleTargets) implements Edge {
    public RoutingEdge {
        Objects.requireNonNull(routingFn, "routingFn");
        possibleTargets = possibleTargets == null ? null : List.copyOf(possibleTargets);
    }
}
