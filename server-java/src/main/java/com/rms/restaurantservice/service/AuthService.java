package com.rms.restaurantservice.service;

import com.rms.restaurantservice.dto.AuthResponse;
import com.rms.restaurantservice.dto.LoginRequest;
import com.rms.restaurantservice.dto.RegisterRequest;
import com.rms.restaurantservice.dto.UserDto;
import com.rms.restaurantservice.exception.AuthenticationFailedException;
import com.rms.restaurantservice.exception.ErrorCode;
import com.rms.restaurantservice.exception.ValidationException;
import com.rms.restaurantservice.model.Role;
import com.rms.restaurantservice.model.User;
import com.rms.restaurantservice.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AuthService {

    private static final Logger logger = LoggerFactory.getLogger(AuthService.class);

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtService jwtService;

    public AuthService(UserRepository userRepository, PasswordEncoder passwordEncoder, JwtService jwtService) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtService = jwtService;
    }

    @Transactional
    public User register(RegisterRequest request) {
        String username = request.getUsername().trim();
        String email = request.getEmail().trim().toLowerCase();
        if (userRepository.existsByUsername(username) || userRepository.existsByEmail(email)) {
            throw new ValidationException(ErrorCode.DUPLICATE_USER, "User already exists");
        }

        Role role = Role.CUSTOMER;
        if (request.getRole() != null && !request.getRole().isBlank()) {
            try {
                role = Role.from(request.getRole());
            } catch (IllegalArgumentException e) {
                throw new ValidationException("Invalid role. Must be admin, staff, or customer");
            }
        }

        User user = new User();
        user.setUsername(username);
        user.setEmail(email);
        user.setPassword(passwordEncoder.encode(request.getPassword()));
        user.setRole(role);
        User saved = userRepository.save(user);
        logger.info("Registered user #{} '{}' as {}", saved.getId(), saved.getUsername(), role.value());
        return saved;
    }

    @Transactional(readOnly = true)
    public AuthResponse login(LoginRequest request) {
        User user = userRepository.findByUsername(request.getUsername().trim())
                .orElseThrow(AuthenticationFailedException::new);
        if (!passwordEncoder.matches(request.getPassword(), user.getPassword())) {
            logger.warn("Failed login for '{}'", user.getUsername());
            throw new AuthenticationFailedException();
        }

        String token = jwtService.generateToken(user.getId(), user.getUsername(), user.getRole().name());
        return new AuthResponse(token, toDto(user));
    }

    public UserDto toDto(User user) {
        return new UserDto(user.getId(), user.getUsername(), user.getEmail(), user.getRole().value());
    }
}
