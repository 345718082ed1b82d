package dev.pagegraph.knowledge;

import dev.pagegraph.domain.enums.EdgeKind;

import java.util.List;
import java.util.UUID;

/**
 * Neighborhood of a node, as found by breadth-first traversal.
 * {@code truncated} is set when the node cap stopped the walk early.
 */
public record GraphView(UUID rootId, int depth, List<Node> nodes, List<Edge> edges, boolean truncated) {

    public enum NodeType { CONCEPT, VISIT }

    /** {@code hops} is the distance from the root. */
    public record Node(UUID id, NodeType type, String label, int hops) {}

    public record Edge(UUID id, EdgeKind kind, UUID sourceId, UUID targetId, double weight, int evidenceCount) {}
}
