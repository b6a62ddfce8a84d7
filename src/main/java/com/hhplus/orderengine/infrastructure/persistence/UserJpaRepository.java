package com.hhplus.orderengine.infrastructure.persistence;

import com.hhplus.orderengine.domain.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;

public interface UserJpaRepository extends JpaRepository<User, String> {
}
