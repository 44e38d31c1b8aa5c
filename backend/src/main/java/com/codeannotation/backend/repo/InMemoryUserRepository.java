package com.codeannotation.backend.repo;

import com.codeannotation.backend.domain.User;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class InMemoryUserRepository implements UserRepository {

    private final InMemoryStore store;

    public InMemoryUserRepository(InMemoryStore store) {
        this.store = store;
    }

    @Override
    public Optional<User> getById(int id) {
        return Optional.ofNullable(store.users.get(id));
    }
}
