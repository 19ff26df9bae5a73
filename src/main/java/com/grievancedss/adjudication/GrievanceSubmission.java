package com.grievancedss.adjudication;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Map;

/**
 * Incoming grievance. {@code narrative} is the student's own account, kept
 * with the record but not evaluated. {@code requiresHumanReview} carries the
 * verdict of the upstream ambiguity check when one ran.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GrievanceSubmission(
    String studentId,
    String grievanceType,
    String narrative,
    Map<String, Object> parameters,
    Boolean requiresHumanReview
) {

    public boolean reviewRequested() {
        return Boolean.TRUE.equals(requiresHumanReview);
    }
}
