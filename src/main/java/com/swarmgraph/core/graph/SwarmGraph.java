package com.swarmgraph.core.graph;

import com.swarmgraph.core.nodes.NodeKind;
import com.swarmgraph.core.nodes.SwarmNode;
import com.swarmgraph.core.state.SwarmState;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Immutable swarm topology: nodes, the sequential edges implied by their upstream sets and
 * the single conditional edge leaving the assembler.
 * <p>
 * Execution rounds are computed once at build time. Round {@code n} holds every node whose
 * whole upstream set lies in earlier rounds, so a fan-in node is admitted only after the
 * last of its predecessors.
 */
public final class SwarmGraph {

    private final String name;
    private final Map<String, SwarmNode> nodes;
    private final List<List<String>> rounds;
    private final ConditionalEdge conditionalEdge;
    private final String assemblerId;

    private SwarmGraph(String name, Map<String, SwarmNode> nodes, List<List<String>> rounds,
                       ConditionalEdge conditionalEdge, String assemblerId) {
        this.name = name;
        this.nodes = nodes;
        this.rounds = rounds;
        this.conditionalEdge = conditionalEdge;
        this.assemblerId = assemblerId;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    /** Nodes in declaration order. */
    public Collection<SwarmNode> nodes() {
        return nodes.values();
    }

    public SwarmNode node(String id) {
        var node = nodes.get(id);
        if (node == null) {
            throw new IllegalArgumentException("No node '" + id + "' in swarm " + name);
        }
        return node;
    }

    public List<List<String>> rounds() {
        return rounds;
    }

    public List<String> entryNodeIds() {
        return rounds.get(0);
    }

    public String assemblerId() {
        return assemblerId;
    }

    public ConditionalEdge conditionalEdge() {
        return conditionalEdge;
    }

    /** Sequential edges in declaration order, followed by the conditional loop edges. */
    public List<Edge> edges() {
        var edges = new ArrayList<Edge>();
        for (var node : nodes.values()) {
            for (String upstream : node.descriptor().upstream()) {
                edges.add(new Edge(upstream, node.id(), EdgeKind.SEQUENTIAL));
            }
        }
        for (String target : conditionalEdge.loopTargets()) {
            edges.add(new Edge(conditionalEdge.from(), target, EdgeKind.CONDITIONAL));
        }
        edges.add(new Edge(conditionalEdge.from(), conditionalEdge.finalizeTarget(), EdgeKind.CONDITIONAL));
        return Collections.unmodifiableList(edges);
    }

    public static final class Builder {

        private final String name;
        private final Map<String, SwarmNode> nodes = new LinkedHashMap<>();
        private Predicate<SwarmState> loopPredicate;
        private ConditionalEdge conditionalEdge;

        private Builder(String name) {
            this.name = name;
        }

        /**
         * @throws GraphDefinitionException if a node with the same id was already added
         */
        public Builder node(SwarmNode node) {
            if (nodes.putIfAbsent(node.id(), node) != null) {
                throw new GraphDefinitionException("Duplicate node id '" + node.id() + "' in swarm " + name);
            }
            return this;
        }

        /** Replaces the default loop predicate; the iteration ceiling still applies. */
        public Builder loopWhen(Predicate<SwarmState> predicate) {
            this.loopPredicate = predicate;
            return this;
        }

        /** Declares the conditional edge explicitly instead of deriving it from the topology. */
        public Builder conditionalEdge(ConditionalEdge edge) {
            this.conditionalEdge = edge;
            return this;
        }

        public SwarmGraph build() {
            if (nodes.isEmpty()) {
                throw new GraphDefinitionException("Swarm " + name + " has no nodes");
            }
            checkUpstreamsExist();
            String assemblerId = singleAssembler();
            checkNothingDependsOn(assemblerId);
            var rounds = computeRounds();
            checkAllReach(assemblerId);

            var edge = conditionalEdge;
            if (edge == null) {
                edge = ConditionalEdge.iterateOrFinalize(assemblerId, rounds.get(0));
                if (loopPredicate != null) {
                    edge = new ConditionalEdge(assemblerId, loopPredicate, edge.loopTargets(), ConditionalEdge.END);
                }
            }
            checkConditionalEdge(edge, assemblerId, rounds.get(0));

            return new SwarmGraph(name, Collections.unmodifiableMap(new LinkedHashMap<>(nodes)),
                    rounds, edge, assemblerId);
        }

        private void checkUpstreamsExist() {
            for (var node : nodes.values()) {
                for (String upstream : node.descriptor().upstream()) {
                    if (!nodes.containsKey(upstream)) {
                        throw new GraphDefinitionException("Node '" + node.id()
                                + "' depends on unknown node '" + upstream + "'");
                    }
                }
            }
        }

        private String singleAssembler() {
            var assemblers = nodes.values().stream()
                    .filter(n -> n.kind() == NodeKind.ASSEMBLER)
                    .map(SwarmNode::id)
                    .toList();
            if (assemblers.size() != 1) {
                throw new GraphDefinitionException("Swarm " + name
                        + " must have exactly one assembler, found " + assemblers);
            }
            return assemblers.get(0);
        }

        private void checkNothingDependsOn(String assemblerId) {
            for (var node : nodes.values()) {
                if (node.descriptor().upstream().contains(assemblerId)) {
                    throw new GraphDefinitionException("Node '" + node.id()
                            + "' may not depend on the assembler; loop through the conditional edge instead");
                }
            }
        }

        /** Longest-path layering; fails on any cycle among sequential edges. */
        private List<List<String>> computeRounds() {
            var depth = new HashMap<String, Integer>();
            for (String id : nodes.keySet()) {
                depthOf(id, depth, new HashSet<>());
            }
            int maxDepth = depth.values().stream().mapToInt(Integer::intValue).max().orElse(0);
            var rounds = new ArrayList<List<String>>();
            for (int d = 0; d <= maxDepth; d++) {
                final int round = d;
                rounds.add(nodes.keySet().stream().filter(id -> depth.get(id) == round).toList());
            }
            return Collections.unmodifiableList(rounds);
        }

        private int depthOf(String id, Map<String, Integer> depth, Set<String> visiting) {
            Integer known = depth.get(id);
            if (known != null) {
                return known;
            }
            if (!visiting.add(id)) {
                throw new GraphDefinitionException("Cycle detected in swarm " + name + " through node '" + id + "'");
            }
            int d = 0;
            for (String upstream : nodes.get(id).descriptor().upstream()) {
                d = Math.max(d, depthOf(upstream, depth, visiting) + 1);
            }
            visiting.remove(id);
            depth.put(id, d);
            return d;
        }

        private void checkAllReach(String assemblerId) {
            var reached = new HashSet<String>();
            var queue = new ArrayDeque<String>();
            queue.add(assemblerId);
            while (!queue.isEmpty()) {
                String id = queue.poll();
                if (reached.add(id)) {
                    queue.addAll(nodes.get(id).descriptor().upstream());
                }
            }
            for (String id : nodes.keySet()) {
                if (!reached.contains(id)) {
                    throw new GraphDefinitionException("Node '" + id + "' does not feed the assembler in swarm " + name);
                }
            }
        }

        private void checkConditionalEdge(ConditionalEdge edge, String assemblerId, List<String> entryIds) {
            if (!assemblerId.equals(edge.from())) {
                throw new GraphDefinitionException("Conditional edge must leave the assembler '"
                        + assemblerId + "', not '" + edge.from() + "'");
            }
            if (edge.loopTargets().isEmpty()) {
                throw new GraphDefinitionException("Conditional edge of swarm " + name + " has no loop target");
            }
            for (String target : edge.loopTargets()) {
                if (!entryIds.contains(target)) {
                    throw new GraphDefinitionException("Loop target '" + target + "' is not an entry node of swarm " + name);
                }
            }
            if (!new HashSet<>(edge.loopTargets()).containsAll(entryIds)) {
                throw new GraphDefinitionException("Conditional edge of swarm " + name
                        + " must restart every entry node " + entryIds + ", got " + edge.loopTargets());
            }
        }
    }
}
