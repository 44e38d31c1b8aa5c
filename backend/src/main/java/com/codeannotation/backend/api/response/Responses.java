package com.codeannotation.backend.api.response;

import com.codeannotation.backend.api.dto.*;
import com.codeannotation.backend.domain.Assignment;
import com.codeannotation.backend.domain.Experiment;
import com.codeannotation.backend.domain.Feature;
import com.codeannotation.backend.domain.FilePair;
import com.codeannotation.backend.domain.User;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the envelopes returned by every endpoint.
 *
 * <p>The {@code new*Response} methods copy only the fields that belong to the wire contract
 * and expect entities the caller has already looked up. None of them can fail.
 */
public final class Responses {

    private Responses() {
    }

    /**
     * 204 without data when {@code payload} is null, 200 with it otherwise.
     */
    public static Response newResponse(Payload payload) {
        if (payload == null) {
            return new Response(HttpStatus.NO_CONTENT.value(), null, null);
        }
        return new Response(HttpStatus.OK.value(), payload, null);
    }

    public static Response newEmptyResponse() {
        return new Response(0, null, null);
    }

    public static ApiException newHttpError(int statusCode, String... messageParts) {
        return new ApiException(statusCode, String.join(" ", messageParts));
    }

    public static Response newExperimentResponse(Experiment e, float progress) {
        return newResponse(toView(e, progress));
    }

    public static Response newExperimentsResponse(List<Experiment> experiments, List<Float> progresses) {
        List<ExperimentView> result = new ArrayList<>(experiments.size());
        for (int i = 0; i < experiments.size(); i++) {
            result.add(toView(experiments.get(i), progresses.get(i)));
        }
        return newResponse(new ExperimentList(result));
    }

    public static Response newAssignmentsResponse(List<Assignment> as) {
        List<AssignmentView> result = as.stream()
                .map(a -> new AssignmentView(a.id(), a.userId(), a.pairId(), a.experimentId(),
                        a.answer(), a.duration()))
                .toList();
        return newResponse(new AssignmentList(result));
    }

    public static Response newExpAnnotationsResponse(AnnotationSummary summary) {
        return newResponse(summary);
    }

    public static Response newFilePairResponse(FilePair fp, String diff, int leftLoc, int rightLoc) {
        return newResponse(new FilePairDetail(
                fp.id(), diff, fp.score(), fp.left().blobId(), fp.right().blobId(), leftLoc, rightLoc));
    }

    public static Response newListFilePairsResponse(List<FilePair> fps) {
        List<FilePairEntry> result = fps.stream()
                .map(fp -> new FilePairEntry(fp.id(), fp.left().path(), fp.right().path()))
                .toList();
        return newResponse(new FilePairList(result));
    }

    public static Response newUserResponse(User u) {
        return newResponse(new UserView(u.id(), u.login(), u.username(), u.avatarUrl(), u.role().canonicalName()));
    }

    public static Response newFeaturesResponse(List<Feature> featuresA, List<Feature> featuresB, Feature score) {
        return newResponse(new FeaturePair(toViews(featuresA), toViews(featuresB), toView(score)));
    }

    public static Response newCountResponse(int count) {
        return newResponse(new CountView(count));
    }

    public static Response newVersionResponse(String version) {
        return newResponse(new VersionView(version));
    }

    public static Response newFilePairsUploadResponse(long success, long failures) {
        return newResponse(new UploadResult(success, failures));
    }

    public static Response newTokenResponse(String token) {
        return newResponse(new TokenView(token));
    }

    /**
     * Transport form of an envelope. The HTTP status follows the envelope; 204 and the
     * empty sentinel are sent without a body.
     */
    public static ResponseEntity<Response> toEntity(Response response) {
        if (response.isEmpty()) {
            return ResponseEntity.ok().build();
        }
        if (response.status() == HttpStatus.NO_CONTENT.value()) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.status(response.status()).body(response);
    }

    private static ExperimentView toView(Experiment e, float progress) {
        return new ExperimentView(e.getId(), e.getName(), e.getDescription(), progress);
    }

    private static List<FeatureView> toViews(List<Feature> fs) {
        return fs.stream().map(Responses::toView).toList();
    }

    private static FeatureView toView(Feature f) {
        return new FeatureView(f.name(), f.weight());
    }
}
