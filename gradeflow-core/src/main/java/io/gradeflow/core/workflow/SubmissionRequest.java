package io.gradeflow.core.workflow;

import io.gradeflow.core.document.DocumentRef;
import java.util.ArrayList;
import java.util.List;

/// Inputs of one grading run.
///
/// @param title human-readable batch name, may be null
/// @param rubric grading-standard document, not null
/// @param answers scanned student submissions, not null
/// @param expectedTotal total points declared by the instructor, null if not declared
/// @param expectedAnswerPages page count of the answer scan, null if not declared
/// @param roster student names in scan order, may be empty
public record SubmissionRequest(
        String title,
        DocumentRef rubric,
        DocumentRef answers,
        Double expectedTotal,
        Integer expectedAnswerPages,
        List<String> roster) {

    public SubmissionRequest {
        roster = roster != null ? List.copyOf(roster) : List.of();
    }

    public static SubmissionRequest of(DocumentRef rubric, DocumentRef answers) {
        return new SubmissionRequest(null, rubric, answers, null, null, List.of());
    }

    /// Checks the request without touching the documents.
    ///
    /// @return the problems found, empty when the request can start a run
    public List<String> validate() {
        List<String> violations = new ArrayList<>();
        if (rubric == null) {
            violations.add("Rubric document is missing");
        }
        if (answers == null) {
            violations.add("Answer document is missing");
        }
        if (expectedTotal != null && (expectedTotal.isNaN() || expectedTotal <= 0)) {
            violations.add("Expected total must be positive, was " + expectedTotal);
        }
        if (expectedAnswerPages != null && expectedAnswerPages < 1) {
            violations.add("Expected answer page count must be >= 1, was " + expectedAnswerPages);
        }
        for (String name : roster) {
            if (name == null || name.isBlank()) {
                violations.add("Roster contains a blank name");
                break;
            }
        }
        return violations;
    }
}
