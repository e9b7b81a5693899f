package io.gradeflow.core.run;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// The fields a node adds to the run state.
///
/// {@snippet :
/// StatePatch patch = StatePatch.of(GradingKeys.RUBRIC, rubric);
/// RunState next = state.merge(patch);
/// }
public final class StatePatch {

    private static final StatePatch EMPTY = new StatePatch(Map.of());

    private final Map<String, Object> values;

    private StatePatch(Map<String, Object> values) {
        this.values = values;
    }

    public static StatePatch empty() {
        return EMPTY;
    }

    public static <T> StatePatch of(StateKey<T> key, T value) {
        return EMPTY.and(key, value);
    }

    /// Returns a new patch that also carries `key`.
    ///
    /// @param key the field, not null
    /// @param value the value, not null
    /// @return a new patch, never null
    /// @throws IllegalArgumentException if the patch already carries `key`
    public <T> StatePatch and(StateKey<T> key, T value) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null for " + key.name());
        if (values.containsKey(key.name())) {
            throw new IllegalArgumentException("Patch already contains " + key.name());
        }
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(key.name(), value);
        return new StatePatch(Collections.unmodifiableMap(copy));
    }

    public Map<String, Object> values() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }
}
