package com.grievancedss.store;

import com.grievancedss.adjudication.Adjudication;
import com.grievancedss.fairness.SimilarCase;
import com.grievancedss.resolution.Decision;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

@Component
public class InMemoryDecisionStore implements DecisionStore {

    private final CopyOnWriteArrayList<Adjudication> adjudications = new CopyOnWriteArrayList<>();

    @Override
    public Adjudication save(Adjudication adjudication) {
        adjudications.add(adjudication);
        return adjudication;
    }

    @Override
    public Optional<Adjudication> findById(String grievanceId) {
        return adjudications.stream()
            .filter(a -> a.grievanceId().equals(grievanceId))
            .findFirst();
    }

    @Override
    public List<SimilarCase> findSimilar(String grievanceType, int limit) {
        if (limit <= 0 || grievanceType == null) {
            return Collections.emptyList();
        }

        return adjudications.stream()
            .filter(a -> grievanceType.equalsIgnoreCase(a.grievanceType()))
            .limit(limit)
            .map(InMemoryDecisionStore::toSimilarCase)
            .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public List<Adjudication> findByStudent(String studentId) {
        if (studentId == null) {
            return Collections.emptyList();
        }
        return adjudications.stream()
            .filter(a -> studentId.equals(a.studentId()))
            .toList();
    }

    @Override
    public List<Adjudication> findAll() {
        return List.copyOf(adjudications);
    }

    private static SimilarCase toSimilarCase(Adjudication adjudication) {
        Decision decision = adjudication.decision();
        return new SimilarCase(
            adjudication.grievanceId(),
            decision.outcome(),
            decision.applicableRuleId(),
            decision.authorityTier()
        );
    }
}
