package io.gradeflow.core.workflow;

import io.gradeflow.core.review.ReviewGate;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/// One row of the workflow's node table.
///
/// A node is runnable once every input field is present and is done once every output
/// field is present. Review gates carry a {@link ReviewGate} instead of a handler; their
/// only output is the gate's decision record.
///
/// @param name unique node name, not null
/// @param inputs fields that must exist before the node runs, not null
/// @param outputs fields the node adds, not empty
/// @param handler node body, null for gates
/// @param gate review gate, null for ordinary nodes
public record NodeDescriptor(
        String name, Set<String> inputs, Set<String> outputs, NodeHandler handler, ReviewGate<?> gate) {

    public NodeDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        inputs = inputs != null ? Set.copyOf(inputs) : Set.of();
        outputs = outputs != null ? Set.copyOf(outputs) : Set.of();
        if (outputs.isEmpty()) {
            throw new IllegalArgumentException("Node " + name + " declares no outputs");
        }
        if ((handler == null) == (gate == null)) {
            throw new IllegalArgumentException(
                    "Node " + name + " needs exactly one of handler or gate");
        }
    }

    public static NodeDescriptor node(
            String name, Set<String> inputs, Set<String> outputs, NodeHandler handler) {
        return new NodeDescriptor(name, inputs, outputs, handler, null);
    }

    /// Creates a gate node named after the gate.
    ///
    /// The reviewed field is always an input in addition to `inputs`.
    public static NodeDescriptor gate(ReviewGate<?> gate, Set<String> inputs) {
        Objects.requireNonNull(gate, "gate must not be null");
        Set<String> required = new HashSet<>(inputs);
        required.add(gate.reviewedKey().name());
        return new NodeDescriptor(
                gate.name(), required, Set.of(gate.recordKey().name()), null, gate);
    }

    public boolean isGate() {
        return gate != null;
    }
}
