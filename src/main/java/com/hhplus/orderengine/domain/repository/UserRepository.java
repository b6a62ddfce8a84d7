package com.hhplus.orderengine.domain.repository;

import com.hhplus.orderengine.domain.entity.User;

import java.util.Optional;

public interface UserRepository {
    User save(User user);

    Optional<User> findById(String id);

    boolean existsById(String id);
}
