package com.codeannotation.backend.service;

import com.codeannotation.backend.api.dto.ExperimentRequest;
import com.codeannotation.backend.api.response.ErrorKind;
import com.codeannotation.backend.api.response.Response;
import com.codeannotation.backend.api.response.Responses;
import com.codeannotation.backend.domain.Experiment;
import com.codeannotation.backend.repo.AssignmentRepository;
import com.codeannotation.backend.repo.ExperimentRepository;
import com.codeannotation.backend.repo.StoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Read, create and update of experiments, and the per-user progress shown with each of them.
 *
 * <p>Failures are thrown as {@link com.codeannotation.backend.api.response.ApiException};
 * store faults become {@link ErrorKind#INTERNAL}.
 */
@Service
public class ExperimentService {

    private final ExperimentRepository experiments;
    private final AssignmentRepository assignments;
    private final ObjectMapper om;

    public ExperimentService(ExperimentRepository experiments, AssignmentRepository assignments, ObjectMapper om) {
        this.experiments = experiments;
        this.assignments = assignments;
        this.om = om;
    }

    public Response getDetails(int userId, int experimentId) {
        Experiment experiment = getExisting(experimentId);
        float progress = experimentProgress(experiment.getId(), userId);
        return Responses.newExperimentResponse(experiment, progress);
    }

    public Response list(int userId) {
        List<Experiment> all;
        try {
            all = experiments.getAll();
        } catch (StoreException e) {
            throw ErrorKind.INTERNAL.wrap("error listing experiments", e);
        }

        // one count pair per experiment, in listing order
        List<Float> progresses = new ArrayList<>(all.size());
        for (Experiment e : all) {
            progresses.add(experimentProgress(e.getId(), userId));
        }
        return Responses.newExperimentsResponse(all, progresses);
    }

    public Response create(byte[] body) {
        ExperimentRequest req = readRequest(body);
        Experiment experiment = new Experiment(req.name(), req.description());

        try {
            experiments.create(experiment);
        } catch (StoreException e) {
            throw ErrorKind.INTERNAL.wrap("error creating experiment", e);
        }

        // nothing can be assigned yet
        return Responses.newExperimentResponse(experiment, 0);
    }

    public Response update(int userId, int experimentId, byte[] body) {
        Experiment experiment = getExisting(experimentId);
        ExperimentRequest req = readRequest(body);

        experiment.setName(req.name());
        experiment.setDescription(req.description());

        try {
            experiments.update(experiment);
        } catch (StoreException e) {
            throw ErrorKind.INTERNAL.wrap("error updating experiment", e);
        }

        float progress = experimentProgress(experiment.getId(), userId);
        return Responses.newExperimentResponse(experiment, progress);
    }

    /**
     * @throws com.codeannotation.backend.api.response.ApiException 404 when there is no such experiment
     */
    public Experiment getExisting(int experimentId) {
        try {
            return experiments.getById(experimentId)
                    .orElseThrow(() -> ErrorKind.NOT_FOUND.error("no experiment found"));
        } catch (StoreException e) {
            throw ErrorKind.INTERNAL.wrap("error getting experiment", e);
        }
    }

    /**
     * Percentage of the user's assignments in the experiment that have an answer,
     * 0 when the user has none.
     */
    public float experimentProgress(int experimentId, int userId) {
        int countAll;
        try {
            countAll = assignments.countUserAssignment(experimentId, userId);
        } catch (StoreException e) {
            throw ErrorKind.INTERNAL.wrap("error counting assignments", e);
        }

        int countComplete;
        try {
            countComplete = assignments.countCompleteUserAssignment(experimentId, userId);
        } catch (StoreException e) {
            throw ErrorKind.INTERNAL.wrap("error counting complete assignments", e);
        }

        if (countAll == 0) {
            return 0;
        }

        return 100f * countComplete / countAll;
    }

    private ExperimentRequest readRequest(byte[] body) {
        if (body == null || body.length == 0) {
            throw ErrorKind.BAD_REQUEST.error("request body is required");
        }

        ExperimentRequest req;
        try {
            req = om.readValue(body, ExperimentRequest.class);
        } catch (JsonProcessingException e) {
            throw ErrorKind.BAD_REQUEST.error("invalid request body").withDetails(e.getOriginalMessage());
        } catch (IOException e) {
            throw ErrorKind.BAD_REQUEST.error("could not read request body").withDetails(e.getMessage());
        }

        if (req == null) {
            throw ErrorKind.BAD_REQUEST.error("request body is required");
        }
        return req;
    }
}
