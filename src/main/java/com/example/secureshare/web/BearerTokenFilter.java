package com.example.secureshare.web;

import com.example.secureshare.auth.JwtService;
import com.example.secureshare.service.PersistenceGateway;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.UUID;

/**
 * Authenticates API calls with a bearer token. The resolved caller id is stored as
 * the {@value #USER_ID_ATTRIBUTE} exchange attribute for the controllers.
 */
@Component
@Order(-100) // Run before other filters
public class BearerTokenFilter implements WebFilter {

    public static final String USER_ID_ATTRIBUTE = "secureShare.userId";

    private static final Logger log = LoggerFactory.getLogger(BearerTokenFilter.class);
    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtService jwtService;
    private final PersistenceGateway gateway;
    private final BlockingCalls blockingCalls;
    private final ObjectMapper objectMapper;

    public BearerTokenFilter(JwtService jwtService, PersistenceGateway gateway,
                             BlockingCalls blockingCalls, ObjectMapper objectMapper) {
        this.jwtService = jwtService;
        this.gateway = gateway;
        this.blockingCalls = blockingCalls;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().value();
        if (!requiresAuthentication(path)) {
            return chain.filter(exchange);
        }

        String authHeader = exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (authHeader == null || !authHeader.startsWith(BEARER_PREFIX)) {
            return reject(exchange, "You are not logged in, please provide a token");
        }

        Optional<UUID> userId = jwtService.verify(authHeader.substring(BEARER_PREFIX.length()).trim());
        if (userId.isEmpty()) {
            return reject(exchange, "Authentication token is invalid or expired");
        }

        return blockingCalls.call(() -> gateway.findUserById(userId.get()).isPresent())
                .flatMap(exists -> {
                    if (!exists) {
                        return reject(exchange, "User belonging to this token no longer exists");
                    }
                    exchange.getAttributes().put(USER_ID_ATTRIBUTE, userId.get());
                    return chain.filter(exchange);
                });
    }

    private boolean requiresAuthentication(String path) {
        return path.startsWith("/api/") && !path.startsWith("/api/auth/");
    }

    private Mono<Void> reject(ServerWebExchange exchange, String reason) {
        log.debug("Authentication failed for {}: {}", exchange.getRequest().getPath(), reason);

        exchange.getResponse().setStatusCode(HttpStatus.UNAUTHORIZED);
        exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);

        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(ErrorResponse.fail(reason));
        } catch (JsonProcessingException e) {
            bytes = ("{\"status\":\"fail\",\"message\":\"" + reason + "\"}").getBytes(StandardCharsets.UTF_8);
        }
        DataBuffer buffer = exchange.getResponse().bufferFactory().wrap(bytes);
        return exchange.getResponse().writeWith(Mono.just(buffer));
    }
}
