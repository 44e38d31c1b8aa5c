package com.codeannotation.backend.repo;

import com.codeannotation.backend.domain.User;

import java.util.Optional;

public interface UserRepository {

    Optional<User> getById(int id);
}
