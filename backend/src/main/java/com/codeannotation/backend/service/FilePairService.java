package com.codeannotation.backend.service;

import com.codeannotation.backend.api.response.ErrorKind;
import com.codeannotation.backend.api.response.Response;
import com.codeannotation.backend.api.response.Responses;
import com.codeannotation.backend.domain.FilePair;
import com.codeannotation.backend.repo.FilePairRepository;
import com.codeannotation.backend.repo.StoreException;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class FilePairService {

    private final ExperimentService experiments;
    private final FilePairRepository filePairs;

    public FilePairService(ExperimentService experiments, FilePairRepository filePairs) {
        this.experiments = experiments;
        this.filePairs = filePairs;
    }

    public Response list(int experimentId) {
        experiments.getExisting(experimentId);

        List<FilePair> pairs;
        try {
            pairs = filePairs.getAllByExperiment(experimentId);
        } catch (StoreException e) {
            throw ErrorKind.INTERNAL.wrap("error getting file pairs", e);
        }
        return Responses.newListFilePairsResponse(pairs);
    }

    public Response count(int experimentId) {
        experiments.getExisting(experimentId);

        try {
            return Responses.newCountResponse(filePairs.countByExperiment(experimentId));
        } catch (StoreException e) {
            throw ErrorKind.INTERNAL.wrap("error counting file pairs", e);
        }
    }
}
