package io.gradeflow.core.workflow;

import io.gradeflow.core.run.RunState;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Fixed, ordered node table walked by the {@link WorkflowEngine}.
///
/// The next node is always the first one whose outputs are not all present in the state.
/// Because outputs are never overwritten, re-reading a checkpoint written after node `K`
/// selects node `K + 1`.
///
/// ### Contracts
/// - **Precondition**: node names are unique
/// - **Invariant**: a node only runs once all of its inputs exist
///
/// @implNote Immutable and thread-safe.
public final class WorkflowDefinition {

    private final List<NodeDescriptor> nodes;

    public WorkflowDefinition(List<NodeDescriptor> nodes) {
        Objects.requireNonNull(nodes, "nodes must not be null");
        if (nodes.isEmpty()) {
            throw new IllegalArgumentException("Workflow has no nodes");
        }
        Set<String> names = new HashSet<>();
        for (NodeDescriptor node : nodes) {
            if (!names.add(node.name())) {
                throw new IllegalArgumentException("Duplicate node name: " + node.name());
            }
        }
        this.nodes = List.copyOf(nodes);
    }

    public NodeDescriptor first() {
        return nodes.get(0);
    }

    /// Selects the node to execute next.
    ///
    /// @param state accumulated run state, not null
    /// @return the next node, or empty once every node's outputs exist
    /// @throws IllegalStateException if the next node's inputs are missing
    public Optional<NodeDescriptor> next(RunState state) {
        for (NodeDescriptor node : nodes) {
            if (state.hasAll(node.outputs())) {
                continue;
            }
            if (!state.hasAll(node.inputs())) {
                Set<String> missing = new HashSet<>(node.inputs());
                missing.removeAll(state.keys());
                throw new IllegalStateException(
                        "Node " + node.name() + " cannot run, missing inputs " + missing);
            }
            return Optional.of(node);
        }
        return Optional.empty();
    }

    public Optional<NodeDescriptor> node(String name) {
        return nodes.stream().filter(node -> node.name().equals(name)).findFirst();
    }

    public List<NodeDescriptor> nodes() {
        return nodes;
    }

    public List<String> nodeNames() {
        return nodes.stream().map(NodeDescriptor::name).toList();
    }
}
