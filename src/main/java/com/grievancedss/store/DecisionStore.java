package com.grievancedss.store;

import com.grievancedss.adjudication.Adjudication;
import com.grievancedss.fairness.SimilarCase;

import java.util.List;
import java.util.Optional;

public interface DecisionStore {
    Adjudication save(Adjudication adjudication);

    Optional<Adjudication> findById(String grievanceId);

    /** Prior decisions for the same grievance type, oldest first, at most {@code limit}. */
    List<SimilarCase> findSimilar(String grievanceType, int limit);

    /** Adjudications filed by one student, in insertion order. */
    List<Adjudication> findByStudent(String studentId);

    List<Adjudication> findAll();
}
