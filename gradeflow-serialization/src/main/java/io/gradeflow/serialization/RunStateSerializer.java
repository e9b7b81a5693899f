package io.gradeflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.gradeflow.core.run.RunState;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Writes a {@link RunState} as a JSON object with one field per state key.
///
/// Values are written with their runtime type's default serializer; the key name alone is
/// enough to restore the type on the way back.
///
/// @implNote Package-private. Registered by {@link GradeflowJacksonModule}.
/// @see RunStateDeserializer for the inverse operation
class RunStateSerializer extends StdSerializer<RunState> {

    @Serial private static final long serialVersionUID = 6610283194553023071L;

    RunStateSerializer() {
        super(RunState.class);
    }

    @Override
    public void serialize(RunState state, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        for (Map.Entry<String, Object> entry : state.values().entrySet()) {
            provider.defaultSerializeField(entry.getKey(), entry.getValue(), gen);
        }
        gen.writeEndObject();
    }
}
