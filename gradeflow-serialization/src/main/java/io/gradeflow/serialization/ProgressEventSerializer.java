package io.gradeflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.gradeflow.core.progress.ProgressEvent;
import java.io.IOException;
import java.io.Serial;

/// Writes a {@link ProgressEvent} in its transport shape:
/// `{"runId":"...","type":"task_update","sequence":7,"timestamp":"...","payload":{...}}`.
///
/// @implNote Package-private. Registered by {@link GradeflowJacksonModule}.
/// @see ProgressEventDeserializer for the inverse operation
class ProgressEventSerializer extends StdSerializer<ProgressEvent> {

    @Serial private static final long serialVersionUID = -3304876154280347712L;

    ProgressEventSerializer() {
        super(ProgressEvent.class);
    }

    @Override
    public void serialize(ProgressEvent event, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("runId", event.runId());
        gen.writeStringField("type", event.type());
        gen.writeNumberField("sequence", event.sequence());
        provider.defaultSerializeField("timestamp", event.timestamp(), gen);
        provider.defaultSerializeField("payload", event.payload(), gen);
        gen.writeEndObject();
    }
}
