package io.gradeflow.core.rubric;

import java.util.List;

/// Output of one extraction call over a batch of rubric pages.
///
/// @param questions items found in the batch, in page order
/// @param declaredTotal total score printed in the batch, null if none was found
public record RubricExtraction(List<ExtractedQuestion> questions, Double declaredTotal) {

    public RubricExtraction {
        questions = questions != null ? List.copyOf(questions) : List.of();
    }
}
