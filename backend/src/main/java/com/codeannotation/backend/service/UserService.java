package com.codeannotation.backend.service;

import com.codeannotation.backend.api.response.ErrorKind;
import com.codeannotation.backend.api.response.Response;
import com.codeannotation.backend.api.response.Responses;
import com.codeannotation.backend.domain.User;
import com.codeannotation.backend.repo.StoreException;
import com.codeannotation.backend.repo.UserRepository;
import org.springframework.stereotype.Service;

@Service
public class UserService {

    private final UserRepository users;

    public UserService(UserRepository users) {
        this.users = users;
    }

    public Response getMe(int userId) {
        User user;
        try {
            user = users.getById(userId)
                    .orElseThrow(() -> ErrorKind.NOT_FOUND.error("no user found"));
        } catch (StoreException e) {
            throw ErrorKind.INTERNAL.wrap("error getting user", e);
        }
        return Responses.newUserResponse(user);
    }
}
