package io.gradeflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.gradeflow.core.review.ReviewDecision;
import java.io.IOException;
import java.io.Serial;

/// Serializes the {@link ReviewDecision} sealed hierarchy with a `"type"` discriminator.
///
/// Emitted JSON shape per subtype:
/// - **`Approve`**: `{"type":"approve","gate":"...","comment":"..."}`
/// - **`Edit`**: `{"type":"edit","gate":"...","editedValue":{...},"comment":"..."}`
/// - **`Reject`**: `{"type":"reject","gate":"...","reason":"..."}`
///
/// `comment` is omitted when null.
///
/// @implNote Package-private. Registered by {@link GradeflowJacksonModule}.
/// @see ReviewDecisionDeserializer for the inverse operation
class ReviewDecisionSerializer extends StdSerializer<ReviewDecision> {

    @Serial private static final long serialVersionUID = 2845091735526632918L;

    ReviewDecisionSerializer() {
        super(ReviewDecision.class);
    }

    @Override
    public void serialize(ReviewDecision decision, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        if (decision instanceof ReviewDecision.Approve approve) {
            gen.writeStringField("type", "approve");
            gen.writeStringField("gate", approve.gate());
            writeComment(gen, approve.comment());
        } else if (decision instanceof ReviewDecision.Edit edit) {
            gen.writeStringField("type", "edit");
            gen.writeStringField("gate", edit.gate());
            provider.defaultSerializeField("editedValue", edit.editedValue(), gen);
            writeComment(gen, edit.comment());
        } else if (decision instanceof ReviewDecision.Reject reject) {
            gen.writeStringField("type", "reject");
            gen.writeStringField("gate", reject.gate());
            gen.writeStringField("reason", reject.reason());
        }
        gen.writeEndObject();
    }

    private static void writeComment(JsonGenerator gen, String comment) throws IOException {
        if (comment != null) {
            gen.writeStringField("comment", comment);
        }
    }
}
