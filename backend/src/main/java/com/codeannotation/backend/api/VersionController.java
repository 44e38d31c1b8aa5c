package com.codeannotation.backend.api;

import com.codeannotation.backend.api.response.Response;
import com.codeannotation.backend.api.response.Responses;
import com.codeannotation.backend.config.AnnotationProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api")
public class VersionController {

    private final AnnotationProperties properties;

    public VersionController(AnnotationProperties properties) {
        this.properties = properties;
    }

    @GetMapping("/version")
    public ResponseEntity<Response> version() {
        return Responses.toEntity(Responses.newVersionResponse(properties.version()));
    }
}
