package com.hhplus.orderengine.infrastructure.persistence;

import com.hhplus.orderengine.domain.entity.User;
import com.hhplus.orderengine.domain.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class UserRepositoryImpl implements UserRepository {

    private final UserJpaRepository userJpaRepository;

    @Override
    public User save(User user) {
        return userJpaRepository.save(user);
    }

    @Override
    public Optional<User> findById(String id) {
        return userJpaRepository.findById(id);
    }

    @Override
    public boolean existsById(String id) {
        return userJpaRepository.existsById(id);
    }
}
