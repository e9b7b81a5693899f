package io.gradeflow.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.gradeflow.core.aggregate.AggregatedResult;
import io.gradeflow.core.progress.ProgressEvent;
import io.gradeflow.core.review.ReviewDecision;
import io.gradeflow.core.run.RunState;
import io.gradeflow.core.run.WorkflowRun;
import io.gradeflow.serialization.mixin.AggregatedResultMixin;
import io.gradeflow.serialization.mixin.WorkflowRunMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all grading workflow serialization in one place.
///
/// **Custom serializer/deserializer pairs**:
/// - `RunState`: one JSON field per state key, typed back through `GradingKeys`
/// - `ReviewDecision`: sealed hierarchy, discriminator `"type"`
/// - `ProgressEvent`: transport shape with the kind's wire name as `"type"`
///
/// **Mixins** (derived accessors excluded from output):
/// - `WorkflowRun`
/// - `AggregatedResult`
///
/// Every other checkpointed type is a record and binds through its canonical constructor.
///
/// @see CheckpointSerializer for the convenience factory API
public class GradeflowJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 3057719384201185532L;

    public GradeflowJacksonModule() {
        super("GradeflowJacksonModule");

        addSerializer(RunState.class, new RunStateSerializer());
        addDeserializer(RunState.class, new RunStateDeserializer());

        addSerializer(ReviewDecision.class, new ReviewDecisionSerializer());
        addDeserializer(ReviewDecision.class, new ReviewDecisionDeserializer());

        addSerializer(ProgressEvent.class, new ProgressEventSerializer());
        addDeserializer(ProgressEvent.class, new ProgressEventDeserializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(WorkflowRun.class, WorkflowRunMixin.class);
        context.setMixInAnnotations(AggregatedResult.class, AggregatedResultMixin.class);
    }
}
