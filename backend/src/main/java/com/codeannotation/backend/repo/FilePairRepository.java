package com.codeannotation.backend.repo;

import com.codeannotation.backend.domain.FilePair;

import java.util.List;

public interface FilePairRepository {

    List<FilePair> getAllByExperiment(int experimentId);

    int countByExperiment(int experimentId);
}
