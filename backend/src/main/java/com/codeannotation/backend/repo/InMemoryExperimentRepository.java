package com.codeannotation.backend.repo;

import com.codeannotation.backend.domain.Experiment;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Keeps private copies so callers can only change stored state through {@link #update}.
 */
@Component
public class InMemoryExperimentRepository implements ExperimentRepository {

    private final InMemoryStore store;

    public InMemoryExperimentRepository(InMemoryStore store) {
        this.store = store;
    }

    @Override
    public Optional<Experiment> getById(int id) {
        Experiment e = store.experiments.get(id);
        return e == null ? Optional.empty() : Optional.of(e.copy());
    }

    @Override
    public List<Experiment> getAll() {
        return store.experiments.values().stream()
                .sorted(Comparator.comparingInt(Experiment::getId))
                .map(Experiment::copy)
                .collect(Collectors.toList());
    }

    @Override
    public void create(Experiment experiment) {
        int id = store.experimentSeq.incrementAndGet();
        experiment.setId(id);
        store.experiments.put(id, experiment.copy());
    }

    @Override
    public void update(Experiment experiment) {
        Experiment prev = store.experiments.computeIfPresent(experiment.getId(), (id, old) -> experiment.copy());
        if (prev == null) {
            throw new StoreException("experiment " + experiment.getId() + " does not exist");
        }
    }
}
