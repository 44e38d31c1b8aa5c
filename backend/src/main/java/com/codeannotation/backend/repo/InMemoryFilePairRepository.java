package com.codeannotation.backend.repo;

import com.codeannotation.backend.domain.FilePair;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

@Component
public class InMemoryFilePairRepository implements FilePairRepository {

    private final InMemoryStore store;

    public InMemoryFilePairRepository(InMemoryStore store) {
        this.store = store;
    }

    @Override
    public List<FilePair> getAllByExperiment(int experimentId) {
        return store.filePairs.values().stream()
                .filter(p -> p.experimentId() == experimentId)
                .sorted(Comparator.comparingInt(FilePair::id))
                .collect(Collectors.toList());
    }

    @Override
    public int countByExperiment(int experimentId) {
        return (int) store.filePairs.values().stream()
                .filter(p -> p.experimentId() == experimentId)
                .count();
    }
}
