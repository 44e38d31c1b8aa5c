package com.codeannotation.backend.service;

import com.codeannotation.backend.api.dto.AnnotationSummary;
import com.codeannotation.backend.api.response.ErrorKind;
import com.codeannotation.backend.api.response.Response;
import com.codeannotation.backend.api.response.Responses;
import com.codeannotation.backend.domain.Answer;
import com.codeannotation.backend.domain.Assignment;
import com.codeannotation.backend.repo.AssignmentRepository;
import com.codeannotation.backend.repo.StoreException;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Service
public class AssignmentService {

    private final ExperimentService experiments;
    private final AssignmentRepository assignments;

    public AssignmentService(ExperimentService experiments, AssignmentRepository assignments) {
        this.experiments = experiments;
        this.assignments = assignments;
    }

    public Response listForUser(int userId, int experimentId) {
        experiments.getExisting(experimentId);

        List<Assignment> found;
        try {
            found = assignments.getAllByUserAndExperiment(userId, experimentId);
        } catch (StoreException e) {
            throw ErrorKind.INTERNAL.wrap("error getting assignments", e);
        }
        return Responses.newAssignmentsResponse(found);
    }

    public Response annotationSummary(int experimentId) {
        experiments.getExisting(experimentId);

        List<Assignment> all;
        try {
            all = assignments.getAllByExperiment(experimentId);
        } catch (StoreException e) {
            throw ErrorKind.INTERNAL.wrap("error getting assignments", e);
        }
        return Responses.newExpAnnotationsResponse(summarize(all));
    }

    /**
     * Unknown answer values only count toward the total.
     */
    static AnnotationSummary summarize(List<Assignment> all) {
        Map<Answer, Integer> counts = new EnumMap<>(Answer.class);
        int unanswered = 0;
        for (Assignment a : all) {
            if (a.answer().isEmpty()) {
                unanswered++;
                continue;
            }
            Answer.fromValue(a.answer().get()).ifPresent(k -> counts.merge(k, 1, Integer::sum));
        }

        return new AnnotationSummary(
                counts.getOrDefault(Answer.YES, 0),
                counts.getOrDefault(Answer.MAYBE, 0),
                counts.getOrDefault(Answer.NO, 0),
                counts.getOrDefault(Answer.SKIP, 0),
                unanswered,
                all.size()
        );
    }
}
