package com.campus.lending.repository;

import com.campus.lending.entity.RoleName;
import com.campus.lending.entity.User;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.Optional;

public interface UserRepository extends JpaRepository<User, Long> {

    Optional<User> findByEmail(String email);

    boolean existsByEmail(String email);

    @Query("SELECT COUNT(u) > 0 FROM User u WHERE u.role.name = :role")
    boolean existsByRole(@Param("role") RoleName role);

    @Query("SELECT u FROM User u WHERE u.role.name IN :roles")
    Page<User> findAllByRoleNameIn(@Param("roles") Collection<RoleName> roles, Pageable pageable);
}
