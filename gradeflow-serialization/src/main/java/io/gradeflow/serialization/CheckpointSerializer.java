package io.gradeflow.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.gradeflow.core.progress.ProgressEvent;
import io.gradeflow.core.review.ReviewDecision;
import io.gradeflow.core.run.WorkflowRun;

/// Static facade for checkpoint, progress event and review decision JSON.
///
/// Every conversion shares one pre-configured `ObjectMapper` with
/// {@link GradeflowJacksonModule} and `JavaTimeModule` registered. Timestamps are written as
/// ISO-8601 strings; unknown properties are ignored so older readers tolerate newer
/// checkpoints.
///
/// @implNote Thread-safe. The shared mapper is configured once and never mutated.
/// @see GradeflowJacksonModule for the registered serializers and mixins
public final class CheckpointSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private CheckpointSerializer() {}

    /// Creates a new `ObjectMapper` configured for grading workflow types.
    ///
    /// Callers that embed checkpoints in larger documents can register further modules on
    /// the returned instance.
    ///
    /// @return a new mapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new GradeflowJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /// Serializes a run checkpoint.
    ///
    /// @param run the run to serialize, not null
    /// @return compact JSON, never null
    /// @throws CheckpointSerializationException if the run state holds an unserializable value
    public static String toJson(WorkflowRun run) {
        return write(run, "run " + run.runId());
    }

    /// Restores a run checkpoint.
    ///
    /// @param json checkpoint JSON, not null
    /// @return the run, never null
    /// @throws CheckpointSerializationException if the JSON is malformed
    public static WorkflowRun fromJson(String json) {
        return read(json, WorkflowRun.class, "checkpoint");
    }

    public static String eventToJson(ProgressEvent event) {
        return write(event, "event " + event.sequence() + " of run " + event.runId());
    }

    public static ProgressEvent eventFromJson(String json) {
        return read(json, ProgressEvent.class, "progress event");
    }

    public static String decisionToJson(ReviewDecision decision) {
        return write(decision, "decision for " + decision.gate());
    }

    /// Parses a reviewer's decision as received from a client.
    ///
    /// @param json decision JSON with a `"type"` of `approve`, `edit` or `reject`
    /// @return the decision, never null
    /// @throws CheckpointSerializationException if the JSON is malformed, the type is
    ///     unknown, or an edited value does not fit the gate's reviewed field
    public static ReviewDecision decisionFromJson(String json) {
        return read(json, ReviewDecision.class, "review decision");
    }

    private static String write(Object value, String what) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new CheckpointSerializationException("Failed to serialize " + what, e);
        }
    }

    private static <T> T read(String json, Class<T> type, String what) {
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new CheckpointSerializationException("Failed to deserialize " + what, e);
        }
    }
}
