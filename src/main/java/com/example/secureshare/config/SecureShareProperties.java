package com.example.secureshare.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Application settings bound from {@code secure-share.*}.
 *
 * <pre>
 * secure-share:
 *   jwt:
 *     secret: ...          # HMAC key, at least 32 bytes
 *     max-age: 60          # token lifetime in minutes
 *   reaper:
 *     enabled: true
 *     interval: PT1H
 *   pagination:
 *     default-page-size: 10
 *     max-page-size: 50
 *   request-timeout: PT30S
 *   max-upload-size: 16MB  # largest JSON request body, base64 included
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "secure-share")
public class SecureShareProperties {

    @Valid
    private final Jwt jwt = new Jwt();

    @Valid
    private final Reaper reaper = new Reaper();

    @Valid
    private final Pagination pagination = new Pagination();

    @NotNull
    private Duration requestTimeout = Duration.ofSeconds(30);

    @NotNull
    private DataSize maxUploadSize = DataSize.ofMegabytes(16);

    public Jwt getJwt() { return jwt; }

    public Reaper getReaper() { return reaper; }

    public Pagination getPagination() { return pagination; }

    public Duration getRequestTimeout() { return requestTimeout; }
    public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }

    public DataSize getMaxUploadSize() { return maxUploadSize; }
    public void setMaxUploadSize(DataSize maxUploadSize) { this.maxUploadSize = maxUploadSize; }

    public static class Jwt {

        @NotBlank(message = "secure-share.jwt.secret must be set")
        private String secret;

        @Min(1)
        private long maxAge = 60;

        public String getSecret() { return secret; }
        public void setSecret(String secret) { this.secret = secret; }

        public long getMaxAge() { return maxAge; }
        public void setMaxAge(long maxAge) { this.maxAge = maxAge; }
    }

    public static class Reaper {

        private boolean enabled = true;

        @NotNull
        private Duration interval = Duration.ofHours(1);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }
    }

    public static class Pagination {

        @Min(1)
        private int defaultPageSize = 10;

        @Min(1)
        private int maxPageSize = 50;

        public int getDefaultPageSize() { return defaultPageSize; }
        public void setDefaultPageSize(int defaultPageSize) { this.defaultPageSize = defaultPageSize; }

        public int getMaxPageSize() { return maxPageSize; }
        public void setMaxPageSize(int maxPageSize) { this.maxPageSize = maxPageSize; }
    }
}
