package com.aec.DriveSrv.security;

import com.aec.DriveSrv.config.SessionProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

import java.time.Duration;

/** HttpOnly, SameSite=Lax cookies for the session JWT and the OAuth state value. */
@Component
@RequiredArgsConstructor
public class SessionCookies {

    private final SessionProperties props;

    public ResponseCookie session(String jwt) {
        return base(props.getCookieName(), jwt).maxAge(Duration.ofSeconds(props.getMaxAgeSeconds())).build();
    }

    public ResponseCookie clearedSession() {
        return base(props.getCookieName(), "").maxAge(Duration.ZERO).build();
    }

    public ResponseCookie state(String state) {
        return base(props.getStateCookieName(), state).maxAge(Duration.ofSeconds(props.getStateMaxAgeSeconds())).build();
    }

    public ResponseCookie clearedState() {
        return base(props.getStateCookieName(), "").maxAge(Duration.ZERO).build();
    }

    private ResponseCookie.ResponseCookieBuilder base(String name, String value) {
        return ResponseCookie.from(name, value)
                .httpOnly(true)
                .sameSite("Lax")
                .secure(props.isSecureCookies())
                .path("/");
    }
}
