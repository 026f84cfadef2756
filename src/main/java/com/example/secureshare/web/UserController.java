package com.example.secureshare.web;

import com.example.secureshare.auth.AuthService;
import com.example.secureshare.service.PersistenceGateway;
import com.example.secureshare.service.UserNotFoundException;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.UUID;

@RestController
@RequestMapping("/api/users")
public class UserController {

    private final PersistenceGateway gateway;
    private final AuthService authService;
    private final BlockingCalls blockingCalls;

    public UserController(PersistenceGateway gateway, AuthService authService, BlockingCalls blockingCalls) {
        this.gateway = gateway;
        this.authService = authService;
        this.blockingCalls = blockingCalls;
    }

    // GET /api/users/me
    @GetMapping("/me")
    public Mono<UserResponse> me(@RequestAttribute(BearerTokenFilter.USER_ID_ATTRIBUTE) UUID userId) {
        return blockingCalls.call(() -> gateway.findUserById(userId).orElseThrow(() -> new UserNotFoundException(userId)))
                .map(UserResponse::success);
    }

    // PUT /api/users/name
    @PutMapping("/name")
    public Mono<UserResponse> updateName(@RequestAttribute(BearerTokenFilter.USER_ID_ATTRIBUTE) UUID userId,
                                         @Valid @RequestBody NameUpdateRequest request) {
        return blockingCalls.call(() -> gateway.updateUserName(userId, request.name()))
                .map(UserResponse::success);
    }

    // PUT /api/users/password
    @PutMapping("/password")
    public Mono<MessageResponse> updatePassword(@RequestAttribute(BearerTokenFilter.USER_ID_ATTRIBUTE) UUID userId,
                                                @Valid @RequestBody PasswordUpdateRequest request) {
        return blockingCalls.call(() -> authService.changePassword(userId, request.oldPassword(), request.newPassword()))
                .map(user -> MessageResponse.success("Password updated successfully"));
    }

    // PUT /api/users/public-key
    @PutMapping("/public-key")
    public Mono<MessageResponse> savePublicKey(@RequestAttribute(BearerTokenFilter.USER_ID_ATTRIBUTE) UUID userId,
                                               @Valid @RequestBody PublicKeyRequest request) {
        return blockingCalls.call(() -> {
                    gateway.setUserPublicKey(userId, request.publicKey());
                    return userId;
                })
                .map(id -> MessageResponse.success("Public key saved"));
    }

    // GET /api/users/search-emails?query=...
    @GetMapping("/search-emails")
    public Mono<EmailListResponse> searchEmails(@RequestAttribute(BearerTokenFilter.USER_ID_ATTRIBUTE) UUID userId,
                                                @RequestParam(required = false) String query) {
        if (query == null || query.isBlank()) {
            return Mono.error(HttpError.badRequest("Query is required"));
        }
        String pattern = "%" + escapeLike(query.trim()) + "%";
        return blockingCalls.call(() -> gateway.searchUsersByEmailPrefix(userId, pattern))
                .map(users -> new EmailListResponse("success",
                        users.stream().map(u -> new EmailDto(u.getEmail())).toList()));
    }

    /**
     * Backslash is the default LIKE escape character on both H2 and MySQL.
     */
    static String escapeLike(String value) {
        return value.replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
    }
}
