package com.campus.lending.service;

import com.campus.lending.dto.request.RegisterUserRequest;
import com.campus.lending.dto.response.UserResponse;
import com.campus.lending.entity.Role;
import com.campus.lending.entity.RoleName;
import com.campus.lending.entity.User;
import com.campus.lending.entity.UserStatus;
import com.campus.lending.exception.DuplicateEmailException;
import com.campus.lending.exception.InsufficientPrivilegeException;
import com.campus.lending.exception.ResourceNotFoundException;
import com.campus.lending.mapper.UserMapper;
import com.campus.lending.repository.RoleRepository;
import com.campus.lending.repository.UserRepository;
import com.campus.lending.security.AccessPolicy;
import com.campus.lending.security.Actor;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

@Service
@RequiredArgsConstructor
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private static final int MIN_PASSWORD_LENGTH = 8;

    private static final Set<RoleName> STAFF_ROLES = EnumSet.of(RoleName.TECH_STAFF, RoleName.SYSTEM_ADMIN);

    private final UserRepository userRepository;
    private final RoleRepository roleRepository;
    private final PasswordEncoder passwordEncoder;

    public static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Self-registration creates students. Staff accounts can only be created by a system
     * administrator, passed as {@code caller}; {@code caller} is null for anonymous requests.
     */
    @Transactional
    public UserResponse register(RegisterUserRequest request, Actor caller) {
        RoleName roleName = request.role() != null ? request.role() : RoleName.STUDENT;
        if (roleName.isStaff() && (caller == null || !caller.isSystemAdmin())) {
            throw new InsufficientPrivilegeException("Only a system administrator may create staff accounts");
        }

        String email = normalizeEmail(request.email());
        if (userRepository.existsByEmail(email)) {
            throw new DuplicateEmailException(email);
        }

        User saved = createUser(email, request.fullName(), request.password(), roleName);
        log.info("Registered user {} with role {}", saved.getId(), roleName);
        return UserMapper.toResponse(saved);
    }

    /**
     * Creates the first system administrator. Does nothing once any administrator exists,
     * so it is safe to run on every startup.
     *
     * @return true if an account was created
     * @throws IllegalStateException if the password is shorter than 8 characters or the
     *         email already belongs to a non-administrator
     */
    @Transactional
    public boolean createInitialAdmin(String email, String password, String fullName) {
        if (userRepository.existsByRole(RoleName.SYSTEM_ADMIN)) {
            log.debug("System administrator already present, skipping bootstrap");
            return false;
        }
        if (password == null || password.length() < MIN_PASSWORD_LENGTH) {
            throw new IllegalStateException(
                "Bootstrap administrator password must be at least " + MIN_PASSWORD_LENGTH + " characters");
        }

        String normalized = normalizeEmail(email);
        if (userRepository.existsByEmail(normalized)) {
            throw new IllegalStateException(
                "Cannot bootstrap administrator: " + normalized + " is already registered with another role");
        }

        User saved = createUser(normalized, fullName, password, RoleName.SYSTEM_ADMIN);
        log.info("Created bootstrap system administrator {} ({})", saved.getId(), normalized);
        return true;
    }

    @Transactional(readOnly = true)
    public UserResponse findById(Long id) {
        return UserMapper.toResponse(getUser(id));
    }

    @Transactional(readOnly = true)
    public Page<UserResponse> findAll(Actor actor, boolean staffOnly, Pageable pageable) {
        AccessPolicy.requireStaff(actor, "list users");

        Page<User> users = staffOnly
            ? userRepository.findAllByRoleNameIn(STAFF_ROLES, pageable)
            : userRepository.findAll(pageable);
        return users.map(UserMapper::toResponse);
    }

    /** Deactivated users can no longer log in. Administrators cannot deactivate themselves. */
    @Transactional
    public UserResponse updateStatus(Actor actor, Long id, UserStatus status) {
        AccessPolicy.requireSystemAdmin(actor, "change account status");
        if (actor.is(id) && status == UserStatus.INACTIVE) {
            throw new IllegalArgumentException("You cannot deactivate your own account");
        }

        User user = getUser(id);
        if (user.getStatus() != status) {
            user.setStatus(status);
            user = userRepository.save(user);
            log.info("User {} set to {} by user {}", id, status, actor.userId());
        }
        return UserMapper.toResponse(user);
    }

    private User createUser(String email, String fullName, String password, RoleName roleName) {
        Role role = roleRepository.findByName(roleName)
            .orElseThrow(() -> new IllegalStateException("Role is not seeded: " + roleName));

        User user = new User();
        user.setEmail(email);
        user.setFullName(fullName.trim());
        user.setPasswordHash(passwordEncoder.encode(password));
        user.setRole(role);
        user.setStatus(UserStatus.ACTIVE);
        return userRepository.save(user);
    }

    private User getUser(Long id) {
        return userRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("User", id));
    }
}
