package com.codeannotation.backend.api;

import com.codeannotation.backend.api.response.Response;
import com.codeannotation.backend.api.response.Responses;
import com.codeannotation.backend.service.UserService;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api")
public class MeController {

    private final UserService users;

    public MeController(UserService users) {
        this.users = users;
    }

    @GetMapping("/me")
    public ResponseEntity<Response> me(HttpServletRequest req) {
        int userId = RequestIdentity.getUserId(req);
        return Responses.toEntity(users.getMe(userId));
    }
}
