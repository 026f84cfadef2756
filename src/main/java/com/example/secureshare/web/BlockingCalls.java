package com.example.secureshare.web;

import com.example.secureshare.config.SecureShareProperties;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Runs blocking store calls off the event loop with the configured timeout. A
 * timed-out or cancelled call's result is discarded.
 */
@Component
public class BlockingCalls {

    private final Duration timeout;

    public BlockingCalls(SecureShareProperties properties) {
        this.timeout = properties.getRequestTimeout();
    }

    public <T> Mono<T> call(Callable<T> callable) {
        return Mono.fromCallable(callable)
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(timeout);
    }
}
