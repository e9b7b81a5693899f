package io.gradeflow.core.run;

import java.util.Objects;

/// Typed name of one field in the accumulated run state.
///
/// The type is kept at runtime so a persisted state can be rebuilt with the right value
/// classes and so edited review payloads can be checked before they are merged.
///
/// @param name field name, unique within a workflow, not null
/// @param type value class, not null
/// @param <T> value type
public record StateKey<T>(String name, Class<T> type) {

    public StateKey {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }

    public static <T> StateKey<T> of(String name, Class<T> type) {
        return new StateKey<>(name, type);
    }

    /// Casts a raw state value to this key's type.
    ///
    /// @param value the stored value, may be null
    /// @return the typed value, or null when `value` is null
    /// @throws ClassCastException if the value has another type
    public T cast(Object value) {
        return type.cast(value);
    }

    @Override
    public String toString() {
        return name;
    }
}
