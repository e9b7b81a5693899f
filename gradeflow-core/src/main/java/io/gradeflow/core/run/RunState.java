package io.gradeflow.core.run;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// Immutable accumulated state of a run: the union of every completed node's output.
///
/// Merging is additive. A key that is already present is never overwritten, so replaying a
/// node after a crash cannot change what an earlier checkpoint recorded.
///
/// ### Contracts
/// - **Postcondition**: `merge` returns a state whose key set is a superset of this one
/// - **Invariant**: values for existing keys are identical across merges
///
/// @implNote Thread-safe. Instances are immutable; insertion order of keys is preserved.
public final class RunState {

    private static final Logger logger = Logger.getLogger(RunState.class.getName());

    private static final RunState EMPTY = new RunState(Map.of());

    private final Map<String, Object> values;

    private RunState(Map<String, Object> values) {
        this.values = values;
    }

    public static RunState empty() {
        return EMPTY;
    }

    /// Rebuilds a state from raw values, typically read back from a checkpoint.
    ///
    /// @param values field values keyed by name, not null
    /// @return the state, never null
    public static RunState of(Map<String, Object> values) {
        Objects.requireNonNull(values, "values must not be null");
        return new RunState(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    public <T> Optional<T> get(StateKey<T> key) {
        return Optional.ofNullable(key.cast(values.get(key.name())));
    }

    /// Returns the value for `key`.
    ///
    /// @throws IllegalStateException if the field is absent
    public <T> T require(StateKey<T> key) {
        Object value = values.get(key.name());
        if (value == null) {
            throw new IllegalStateException("Run state has no value for " + key.name());
        }
        return key.cast(value);
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    public boolean hasAll(Set<String> names) {
        return values.keySet().containsAll(names);
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public Map<String, Object> values() {
        return values;
    }

    /// Returns a new state with the patch's fields added.
    ///
    /// Fields the state already holds are kept and the patch's value for them is ignored.
    ///
    /// @param patch node output, not null
    /// @return merged state, never null
    public RunState merge(StatePatch patch) {
        Objects.requireNonNull(patch, "patch must not be null");
        if (patch.isEmpty()) {
            return this;
        }
        Map<String, Object> merged = new LinkedHashMap<>(values);
        patch.values()
                .forEach(
                        (name, value) -> {
                            if (merged.putIfAbsent(name, value) != null) {
                                logger.warning(
                                        "Ignoring write to existing state field: " + name);
                            }
                        });
        return new RunState(Collections.unmodifiableMap(merged));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof RunState other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "RunState" + values.keySet();
    }
}
