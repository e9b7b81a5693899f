package io.gradeflow.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.gradeflow.core.run.RunState;
import io.gradeflow.core.run.StateKey;
import io.gradeflow.core.workflow.GradingKeys;
import java.io.IOException;
import java.io.Serial;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/// Rebuilds a {@link RunState}, typing each field by its {@link GradingKeys} entry.
///
/// Fields without a known key are kept as plain maps, lists and scalars so that a
/// checkpoint written by a newer node table still loads.
///
/// @implNote Package-private. Registered by {@link GradeflowJacksonModule}.
/// @see RunStateSerializer for the inverse operation
class RunStateDeserializer extends StdDeserializer<RunState> {

    @Serial private static final long serialVersionUID = -1935276802113496480L;

    RunStateDeserializer() {
        super(RunState.class);
    }

    @Override
    public RunState deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        if (!root.isObject()) {
            throw new IOException("Run state must be a JSON object, got " + root.getNodeType());
        }

        Map<String, Object> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isNull()) {
                continue;
            }
            Optional<StateKey<?>> key = GradingKeys.byName(field.getKey());
            Class<?> type = key.isPresent() ? key.get().type() : Object.class;
            values.put(field.getKey(), mapper.treeToValue(field.getValue(), type));
        }
        return RunState.of(values);
    }
}
