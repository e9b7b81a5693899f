package io.gradeflow.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.gradeflow.core.review.ReviewDecision;
import io.gradeflow.core.run.StateKey;
import io.gradeflow.core.workflow.GradingKeys;
import io.gradeflow.core.workflow.GradingWorkflow;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Deserializes the {@link ReviewDecision} sealed hierarchy using a `"type"` discriminator.
///
/// The edited value of an `edit` decision is typed by the field its gate reviews:
/// a `RubricTree` at `rubric_review`, a `GradingReport` at `result_review`.
///
/// @implNote Package-private. Registered by {@link GradeflowJacksonModule}.
/// @see ReviewDecisionSerializer for the inverse operation
class ReviewDecisionDeserializer extends StdDeserializer<ReviewDecision> {

    @Serial private static final long serialVersionUID = -7760158822381706495L;

    private static final Map<String, StateKey<?>> REVIEWED_FIELDS =
            Map.of(
                    GradingWorkflow.RUBRIC_REVIEW_GATE, GradingKeys.RUBRIC,
                    GradingWorkflow.RESULT_REVIEW_GATE, GradingKeys.REPORT);

    ReviewDecisionDeserializer() {
        super(ReviewDecision.class);
    }

    @Override
    public ReviewDecision deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        String type = required(root, "type");
        String gate = required(root, "gate");
        String comment = root.hasNonNull("comment") ? root.get("comment").asText() : null;

        switch (type) {
            case "approve":
                return new ReviewDecision.Approve(gate, comment);
            case "reject":
                return new ReviewDecision.Reject(gate, required(root, "reason"));
            case "edit":
                StateKey<?> reviewed = REVIEWED_FIELDS.get(gate);
                if (reviewed == null) {
                    throw new IOException("Gate " + gate + " does not accept edits");
                }
                if (!root.hasNonNull("editedValue")) {
                    throw new IOException("Edit decision for " + gate + " has no editedValue");
                }
                Object value = mapper.treeToValue(root.get("editedValue"), reviewed.type());
                return new ReviewDecision.Edit(gate, value, comment);
            default:
                throw new IOException("Unknown ReviewDecision type: " + type);
        }
    }

    private static String required(JsonNode root, String field) throws IOException {
        JsonNode value = root.get(field);
        if (value == null || value.isNull()) {
            throw new IOException("Review decision is missing \"" + field + "\"");
        }
        return value.asText();
    }
}
