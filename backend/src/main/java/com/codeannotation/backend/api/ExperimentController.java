package com.codeannotation.backend.api;

import com.codeannotation.backend.api.response.Response;
import com.codeannotation.backend.api.response.Responses;
import com.codeannotation.backend.service.ExperimentService;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/experiments")
public class ExperimentController {

    private final ExperimentService experiments;

    public ExperimentController(ExperimentService experiments) {
        this.experiments = experiments;
    }

    @GetMapping
    public ResponseEntity<Response> list(HttpServletRequest req) {
        int userId = RequestIdentity.getUserId(req);
        return Responses.toEntity(experiments.list(userId));
    }

    @PostMapping
    public ResponseEntity<Response> create(@RequestBody(required = false) byte[] body) {
        return Responses.toEntity(experiments.create(body));
    }

    @GetMapping("/{experimentId}")
    public ResponseEntity<Response> get(HttpServletRequest req, @PathVariable("experimentId") String experimentId) {
        int userId = RequestIdentity.getUserId(req);
        int id = UrlParams.intParam("experimentId", experimentId);
        return Responses.toEntity(experiments.getDetails(userId, id));
    }

    // body is read only after the experiment is found
    @PutMapping("/{experimentId}")
    public ResponseEntity<Response> update(HttpServletRequest req,
                                           @PathVariable("experimentId") String experimentId,
                                           @RequestBody(required = false) byte[] body) {
        int userId = RequestIdentity.getUserId(req);
        int id = UrlParams.intParam("experimentId", experimentId);
        return Responses.toEntity(experiments.update(userId, id, body));
    }
}
