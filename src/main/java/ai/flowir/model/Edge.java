package ai.flowir.model;

/**
 * Outgoing transition of a node. The set of variants is closed.
 */
public sealed interface Edge permits StaticEdge, RoutingEdge, CommandEdge {
}
