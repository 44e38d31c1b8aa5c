package com.codeannotation.backend.repo;

import com.codeannotation.backend.domain.Assignment;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Component
public class InMemoryAssignmentRepository implements AssignmentRepository {

    private final InMemoryStore store;

    public InMemoryAssignmentRepository(InMemoryStore store) {
        this.store = store;
    }

    @Override
    public int countUserAssignment(int experimentId, int userId) {
        return (int) ofUser(experimentId, userId).count();
    }

    @Override
    public int countCompleteUserAssignment(int experimentId, int userId) {
        return (int) ofUser(experimentId, userId).filter(Assignment::isComplete).count();
    }

    @Override
    public List<Assignment> getAllByUserAndExperiment(int userId, int experimentId) {
        return ofUser(experimentId, userId)
                .sorted(Comparator.comparingInt(Assignment::id))
                .collect(Collectors.toList());
    }

    @Override
    public List<Assignment> getAllByExperiment(int experimentId) {
        return select(a -> a.experimentId() == experimentId)
                .sorted(Comparator.comparingInt(Assignment::id))
                .collect(Collectors.toList());
    }

    private Stream<Assignment> ofUser(int experimentId, int userId) {
        return select(a -> a.experimentId() == experimentId && a.userId() == userId);
    }

    private Stream<Assignment> select(Predicate<Assignment> p) {
        return store.assignments.values().stream().filter(p);
    }
}
