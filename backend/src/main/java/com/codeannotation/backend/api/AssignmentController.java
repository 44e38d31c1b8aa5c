package com.codeannotation.backend.api;

import com.codeannotation.backend.api.response.Response;
import com.codeannotation.backend.api.response.Responses;
import com.codeannotation.backend.service.AssignmentService;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/experiments/{experimentId}")
public class AssignmentController {

    private final AssignmentService assignments;

    public AssignmentController(AssignmentService assignments) {
        this.assignments = assignments;
    }

    @GetMapping("/assignments")
    public ResponseEntity<Response> list(HttpServletRequest req, @PathVariable("experimentId") String experimentId) {
        int userId = RequestIdentity.getUserId(req);
        int id = UrlParams.intParam("experimentId", experimentId);
        return Responses.toEntity(assignments.listForUser(userId, id));
    }

    @GetMapping("/annotations")
    public ResponseEntity<Response> annotations(HttpServletRequest req,
                                                @PathVariable("experimentId") String experimentId) {
        RequestIdentity.getUserId(req);
        int id = UrlParams.intParam("experimentId", experimentId);
        return Responses.toEntity(assignments.annotationSummary(id));
    }
}
