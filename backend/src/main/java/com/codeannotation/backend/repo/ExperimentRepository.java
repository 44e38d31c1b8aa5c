package com.codeannotation.backend.repo;

import com.codeannotation.backend.domain.Experiment;

import java.util.List;
import java.util.Optional;

/**
 * Experiment persistence. Every method may throw {@link StoreException}.
 */
public interface ExperimentRepository {

    Optional<Experiment> getById(int id);

    List<Experiment> getAll();

    /**
     * Stores a new experiment and writes the assigned id back into it.
     */
    void create(Experiment experiment);

    void update(Experiment experiment);
}
