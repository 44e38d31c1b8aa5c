package com.codeannotation.backend.repo;

import com.codeannotation.backend.domain.Assignment;

import java.util.List;

/**
 * Assignment lookups. Every method may throw {@link StoreException}.
 */
public interface AssignmentRepository {

    int countUserAssignment(int experimentId, int userId);

    // assignments with an answer
    int countCompleteUserAssignment(int experimentId, int userId);

    List<Assignment> getAllByUserAndExperiment(int userId, int experimentId);

    List<Assignment> getAllByExperiment(int experimentId);
}
