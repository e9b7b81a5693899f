package io.gradeflow.core.workflow;

import io.gradeflow.core.run.StatePatch;

/// Body of a workflow node.
///
/// Handlers read their inputs from the context state and return only the fields they add.
/// Any exception escaping the handler fails the run.
@FunctionalInterface
public interface NodeHandler {

    /// Executes the node.
    ///
    /// @param context run-scoped inputs, not null
    /// @return the node's output fields, never null
    StatePatch execute(RunContext context);
}
