package com.aec.DriveSrv.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Component
@Validated
@ConfigurationProperties(prefix = "session")
@Getter @Setter
public class SessionProperties {
    /** Base64 HS256 secret, at least 32 bytes once decoded. */
    @NotBlank
    private String jwtSecret;
    private String cookieName = "session";
    // JWT lifetime and cookie max-age are the same value
    @Min(60)
    private long maxAgeSeconds = 3600;
    private String stateCookieName = "oauth_state";
    @Min(1)
    private long stateMaxAgeSeconds = 600;
    private boolean secureCookies = false;
    private String frontendUrl = "http://localhost:3000";
}
