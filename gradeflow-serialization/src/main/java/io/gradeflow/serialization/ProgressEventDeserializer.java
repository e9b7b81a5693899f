package io.gradeflow.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.gradeflow.core.progress.ProgressEvent;
import io.gradeflow.core.progress.ProgressEventKind;
import java.io.IOException;
import java.io.Serial;
import java.time.Instant;
import java.util.Map;

/// Reads a {@link ProgressEvent} from its transport shape, matching `type` against
/// {@link ProgressEventKind#wireName()}.
///
/// @implNote Package-private. Registered by {@link GradeflowJacksonModule}.
/// @see ProgressEventSerializer for the inverse operation
class ProgressEventDeserializer extends StdDeserializer<ProgressEvent> {

    @Serial private static final long serialVersionUID = 1877370349010962583L;

    ProgressEventDeserializer() {
        super(ProgressEvent.class);
    }

    @Override
    public ProgressEvent deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        String type = root.path("type").asText();
        ProgressEventKind kind = null;
        for (ProgressEventKind candidate : ProgressEventKind.values()) {
            if (candidate.wireName().equals(type)) {
                kind = candidate;
            }
        }
        if (kind == null) {
            throw new IOException("Unknown progress event type: " + type);
        }
        Instant timestamp =
                root.hasNonNull("timestamp")
                        ? mapper.treeToValue(root.get("timestamp"), Instant.class)
                        : null;
        Map<String, Object> payload =
                root.hasNonNull("payload")
                        ? mapper.convertValue(root.get("payload"), new TypeReference<Map<String, Object>>() {})
                        : Map.of();
        return new ProgressEvent(
                root.path("runId").asText(), kind, root.path("sequence").asLong(), timestamp, payload);
    }
}
