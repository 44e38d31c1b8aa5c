package com.codeannotation.backend.api.response;

import com.codeannotation.backend.api.dto.AnnotationSummary;
import com.codeannotation.backend.api.dto.AssignmentList;
import com.codeannotation.backend.api.dto.ExperimentList;
import com.codeannotation.backend.api.dto.ExperimentView;
import com.codeannotation.backend.api.dto.FilePairList;
import com.codeannotation.backend.config.JacksonConfig;
import com.codeannotation.backend.domain.*;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ResponsesTest {

    private final ObjectMapper om = new JacksonConfig().objectMapper();

    @Test
    @DisplayName("a null payload gives 204 without data")
    void newResponse_nullPayload() {
        Response r = Responses.newResponse(null);

        assertThat(r.status()).isEqualTo(204);
        assertThat(r.data()).isNull();
        assertThat(r.errors()).isNull();
        assertThat(om.valueToTree(r).has("data")).isFalse();
    }

    @Test
    @DisplayName("any present payload gives 200, including empty shapes")
    void newResponse_presentPayload() {
        assertThat(Responses.newResponse(new ExperimentList(List.of())).status()).isEqualTo(200);
        assertThat(Responses.newResponse(new AssignmentList(List.of())).status()).isEqualTo(200);
        assertThat(Responses.newResponse(new FilePairList(List.of())).status()).isEqualTo(200);
        assertThat(Responses.newResponse(new AnnotationSummary(0, 0, 0, 0, 0, 0)).status()).isEqualTo(200);
        assertThat(Responses.newCountResponse(0).status()).isEqualTo(200);
        assertThat(Responses.newVersionResponse("").status()).isEqualTo(200);
    }

    @Test
    @DisplayName("the empty sentinel carries neither status nor data")
    void newEmptyResponse() {
        Response r = Responses.newEmptyResponse();

        assertThat(r.status()).isZero();
        assertThat(r.data()).isNull();
        assertThat(r.isEmpty()).isTrue();
        assertThat(Responses.newResponse(null).isEmpty()).isFalse();
    }

    @Test
    void newExperimentResponse_projectsExactlyFourFields() {
        Experiment e = new Experiment(3, "A/B test", "compare styles");

        JsonNode data = om.valueToTree(Responses.newExperimentResponse(e, 25f)).get("data");

        List<String> names = new ArrayList<>();
        data.fieldNames().forEachRemaining(names::add);
        assertThat(names).containsExactlyInAnyOrder("id", "name", "description", "progress");
        assertThat(data.get("id").asInt()).isEqualTo(3);
        assertThat(data.get("name").asText()).isEqualTo("A/B test");
        assertThat(data.get("description").asText()).isEqualTo("compare styles");
        assertThat(data.get("progress").floatValue()).isEqualTo(25f);
    }

    @Test
    void newExperimentsResponse_keepsInputOrder() {
        List<Experiment> experiments = List.of(
                new Experiment(9, "late", ""),
                new Experiment(2, "early", ""));

        Response r = Responses.newExperimentsResponse(experiments, List.of(50f, 0f));

        List<ExperimentView> views = ((ExperimentList) r.data()).experiments();
        assertThat(views).extracting(ExperimentView::id).containsExactly(9, 2);
        assertThat(views).extracting(ExperimentView::progress).containsExactly(50f, 0f);
        assertThat(om.valueToTree(r).get("data").isArray()).isTrue();
    }

    @Test
    @DisplayName("an unanswered assignment is written as null, an empty answer as an empty string")
    void newAssignmentsResponse_answerNullability() {
        List<Assignment> as = List.of(
                new Assignment(1, 7, 11, 3, Optional.empty(), 0),
                new Assignment(2, 7, 12, 3, Optional.of(""), 4),
                new Assignment(3, 7, 13, 3, Optional.of("yes"), 9));

        JsonNode data = om.valueToTree(Responses.newAssignmentsResponse(as)).get("data");

        assertThat(data).hasSize(3);
        assertThat(data.get(0).has("answer")).isTrue();
        assertThat(data.get(0).get("answer").isNull()).isTrue();
        assertThat(data.get(1).get("answer").asText()).isEmpty();
        assertThat(data.get(2).get("answer").asText()).isEqualTo("yes");
        assertThat(data.get(2).get("userId").asInt()).isEqualTo(7);
        assertThat(data.get(2).get("pairId").asInt()).isEqualTo(13);
        assertThat(data.get(2).get("experimentId").asInt()).isEqualTo(3);
        assertThat(data.get(2).get("duration").asInt()).isEqualTo(9);
    }

    @Test
    void newFilePairResponse_flattensSides() {
        FilePair fp = new FilePair(4, 1,
                new FileSide("blob-l", "src/a.go", "package a"),
                new FileSide("blob-r", "src/b.go", "package b"),
                0.75);

        JsonNode data = om.valueToTree(Responses.newFilePairResponse(fp, "@@ -1 +1 @@", 10, 12)).get("data");

        assertThat(data.get("leftBlobId").asText()).isEqualTo("blob-l");
        assertThat(data.get("rightBlobId").asText()).isEqualTo("blob-r");
        assertThat(data.get("leftLoc").asInt()).isEqualTo(10);
        assertThat(data.get("rightLoc").asInt()).isEqualTo(12);
        assertThat(data.get("score").asDouble()).isEqualTo(0.75);
        assertThat(data.get("diff").asText()).isEqualTo("@@ -1 +1 @@");
        assertThat(data.has("content")).isFalse();
    }

    @Test
    void newListFilePairsResponse_onlyPaths() {
        FilePair fp = new FilePair(4, 1,
                new FileSide("blob-l", "src/a.go", "package a"),
                new FileSide("blob-r", "src/b.go", "package b"),
                0.75);

        JsonNode first = om.valueToTree(Responses.newListFilePairsResponse(List.of(fp))).get("data").get(0);

        List<String> names = new ArrayList<>();
        first.fieldNames().forEachRemaining(names::add);
        assertThat(names).containsExactlyInAnyOrder("id", "leftPath", "rightPath");
        assertThat(first.get("leftPath").asText()).isEqualTo("src/a.go");
    }

    @Test
    void newUserResponse_rendersRoleName() {
        User u = new User(7, "jdoe", "Jane Doe", "https://avatars.example/7", Role.REQUESTER);

        JsonNode data = om.valueToTree(Responses.newUserResponse(u)).get("data");

        assertThat(data.get("role").asText()).isEqualTo("requester");
        assertThat(data.get("avatarURL").asText()).isEqualTo("https://avatars.example/7");
        assertThat(data.has("avatarUrl")).isFalse();
    }

    @Test
    void newFeaturesResponse_shapesBothSidesAndScore() {
        List<Feature> a = List.of(new Feature("lines", 0.5));
        List<Feature> b = List.of(new Feature("lines", 0.25), new Feature("tokens", 1.0));

        JsonNode data = om.valueToTree(Responses.newFeaturesResponse(a, b, new Feature("score", 0.9))).get("data");

        assertThat(data.get("featuresA")).hasSize(1);
        assertThat(data.get("featuresB")).hasSize(2);
        assertThat(data.get("featuresB").get(1).get("name").asText()).isEqualTo("tokens");
        assertThat(data.get("score").get("weight").asDouble()).isEqualTo(0.9);
    }

    @Test
    void scalarResponses() {
        assertThat(om.valueToTree(Responses.newCountResponse(12)).get("data").get("count").asInt()).isEqualTo(12);
        assertThat(om.valueToTree(Responses.newTokenResponse("abc")).get("data").get("token").asText())
                .isEqualTo("abc");

        JsonNode upload = om.valueToTree(Responses.newFilePairsUploadResponse(8, 2)).get("data");
        assertThat(upload.get("success").asLong()).isEqualTo(8);
        assertThat(upload.get("failures").asLong()).isEqualTo(2);
    }

    @Test
    @DisplayName("an error envelope lists the error and has no data")
    void ofError_wireShape() {
        JsonNode json = om.valueToTree(Response.ofError(ErrorKind.NOT_FOUND.error("no experiment found")));

        assertThat(json.get("status").asInt()).isEqualTo(404);
        assertThat(json.has("data")).isFalse();
        assertThat(json.get("errors")).hasSize(1);
        assertThat(json.get("errors").get(0).get("title").asText()).isEqualTo("no experiment found");
        assertThat(json.get("errors").get(0).has("details")).isFalse();
    }

    @Test
    void toEntity_followsEnvelopeStatus() {
        ResponseEntity<Response> ok = Responses.toEntity(Responses.newCountResponse(1));
        ResponseEntity<Response> none = Responses.toEntity(Responses.newResponse(null));
        ResponseEntity<Response> failed = Responses.toEntity(Response.ofError(ErrorKind.BAD_REQUEST.error("x")));

        assertThat(ok.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(ok.getBody()).isNotNull();
        assertThat(none.getStatusCode()).isEqualTo(HttpStatus.NO_CONTENT);
        assertThat(none.getBody()).isNull();
        assertThat(failed.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(failed.getBody().errors()).hasSize(1);
    }
}
