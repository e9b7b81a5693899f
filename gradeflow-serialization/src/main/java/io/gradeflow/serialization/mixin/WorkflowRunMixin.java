package io.gradeflow.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnore;

/// Jackson mixin that keeps derived status flags of `WorkflowRun` out of checkpoints.
///
/// Applied to `WorkflowRun.class` via `GradeflowJacksonModule.setupModule()`. Both flags
/// are computed from `status` and `errorDetail`, so persisting them would only allow a
/// checkpoint to disagree with itself.
///
/// @see io.gradeflow.serialization.GradeflowJacksonModule
public abstract class WorkflowRunMixin {

    @JsonIgnore
    public abstract boolean isTerminal();

    @JsonIgnore
    public abstract boolean isBlocked();
}
