package com.example.secureshare.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.codec.ServerCodecConfigurer;
import org.springframework.web.reactive.config.WebFluxConfigurer;

/**
 * Raises the request body buffer limit so uploads carrying base64 ciphertext fit.
 */
@Configuration
public class CodecConfig implements WebFluxConfigurer {

    private static final Logger log = LoggerFactory.getLogger(CodecConfig.class);

    private final int maxInMemorySize;

    public CodecConfig(SecureShareProperties properties) {
        this.maxInMemorySize = Math.toIntExact(properties.getMaxUploadSize().toBytes());
    }

    @Override
    public void configureHttpMessageCodecs(ServerCodecConfigurer configurer) {
        log.info("Request bodies limited to {} bytes", maxInMemorySize);
        configurer.defaultCodecs().maxInMemorySize(maxInMemorySize);
    }
}
