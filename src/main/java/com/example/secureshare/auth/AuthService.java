package com.example.secureshare.auth;

import com.example.secureshare.entity.UserEntity;
import com.example.secureshare.service.PersistenceGateway;
import com.example.secureshare.service.UserNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Account registration, login and password changes. Hashing happens here; the
 * gateway only ever sees hashes.
 */
@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final PersistenceGateway gateway;
    private final PasswordEncoder passwordEncoder;
    private final JwtService jwtService;

    public AuthService(PersistenceGateway gateway, PasswordEncoder passwordEncoder, JwtService jwtService) {
        this.gateway = gateway;
        this.passwordEncoder = passwordEncoder;
        this.jwtService = jwtService;
    }

    public UserEntity register(String name, String email, String password) {
        return gateway.createUser(name, email, passwordEncoder.encode(password));
    }

    public String login(String email, String password) {
        UserEntity user = gateway.findUserByEmail(email)
                .orElseThrow(() -> new InvalidCredentialsException("Email or password is wrong"));
        if (!passwordEncoder.matches(password, user.getPassword())) {
            log.debug("Failed login: userId={}", user.getId());
            throw new InvalidCredentialsException("Email or password is wrong");
        }
        log.info("User logged in: userId={}", user.getId());
        return jwtService.issueToken(user.getId());
    }

    public UserEntity changePassword(UUID userId, String oldPassword, String newPassword) {
        UserEntity user = gateway.findUserById(userId).orElseThrow(() -> new UserNotFoundException(userId));
        if (!passwordEncoder.matches(oldPassword, user.getPassword())) {
            throw new InvalidCredentialsException("Old password is incorrect");
        }
        return gateway.updateUserPassword(userId, passwordEncoder.encode(newPassword));
    }
}
