package io.gradeflow.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnore;

/// Jackson mixin that drops the derived `partial` flag from `AggregatedResult`.
///
/// @see io.gradeflow.serialization.GradeflowJacksonModule
public abstract class AggregatedResultMixin {

    @JsonIgnore
    public abstract boolean isPartial();
}
