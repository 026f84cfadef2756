package com.example.secureshare.web;

import com.example.secureshare.auth.AuthService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/auth")
public class AuthController {

    private final AuthService authService;
    private final BlockingCalls blockingCalls;

    public AuthController(AuthService authService, BlockingCalls blockingCalls) {
        this.authService = authService;
        this.blockingCalls = blockingCalls;
    }

    // POST /api/auth/register
    @PostMapping("/register")
    public Mono<ResponseEntity<MessageResponse>> register(@Valid @RequestBody RegisterUserRequest request) {
        return blockingCalls.call(() -> authService.register(request.name(), request.email(), request.password()))
                .map(user -> ResponseEntity.status(HttpStatus.CREATED)
                        .body(MessageResponse.success("Registration successful!")));
    }

    // POST /api/auth/login
    @PostMapping("/login")
    public Mono<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        return blockingCalls.call(() -> authService.login(request.email(), request.password()))
                .map(token -> new LoginResponse("success", token));
    }
}
