package com.codeannotation.backend.api;

import com.codeannotation.backend.api.response.Response;
import com.codeannotation.backend.api.response.Responses;
import com.codeannotation.backend.service.FilePairService;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/experiments/{experimentId}/file-pairs")
public class FilePairController {

    private final FilePairService filePairs;

    public FilePairController(FilePairService filePairs) {
        this.filePairs = filePairs;
    }

    @GetMapping
    public ResponseEntity<Response> list(HttpServletRequest req, @PathVariable("experimentId") String experimentId) {
        RequestIdentity.getUserId(req);
        int id = UrlParams.intParam("experimentId", experimentId);
        return Responses.toEntity(filePairs.list(id));
    }

    @GetMapping("/count")
    public ResponseEntity<Response> count(HttpServletRequest req, @PathVariable("experimentId") String experimentId) {
        RequestIdentity.getUserId(req);
        int id = UrlParams.intParam("experimentId", experimentId);
        return Responses.toEntity(filePairs.count(id));
    }
}
