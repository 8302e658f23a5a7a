package com.aec.DriveSrv.controller;

import com.aec.DriveSrv.config.SessionProperties;
import com.aec.DriveSrv.dto.UserProfileDto;
import com.aec.DriveSrv.exception.InvalidRequestException;
import com.aec.DriveSrv.model.UserAccount;
import com.aec.DriveSrv.security.SessionCookies;
import com.aec.DriveSrv.security.SessionTokenService;
import com.aec.DriveSrv.service.GoogleLoginService;
import com.aec.DriveSrv.service.GoogleOAuthClient;
import com.aec.DriveSrv.service.UserAccountService;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.util.WebUtils;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Map;

@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
public class AuthController {

    private static final SecureRandom RANDOM = new SecureRandom();

    private final GoogleOAuthClient oauth;
    private final GoogleLoginService login;
    private final UserAccountService users;
    private final SessionTokenService sessions;
    private final SessionCookies cookies;
    private final SessionProperties sessionProps;
    private final Logger log = LoggerFactory.getLogger(AuthController.class);

    /** Redirects to Google consent; the same random state goes into a short-lived cookie. */
    @GetMapping("/google/login")
    public ResponseEntity<Void> googleLogin() {
        byte[] bytes = new byte[32];
        RANDOM.nextBytes(bytes);
        String state = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);

        return ResponseEntity.status(HttpStatus.FOUND)
                .location(URI.create(oauth.buildAuthorizationUrl(state)))
                .header(HttpHeaders.SET_COOKIE, cookies.state(state).toString())
                .build();
    }

    @GetMapping("/google/callback")
    public ResponseEntity<Void> googleCallback(
            HttpServletRequest request,
            @RequestParam(value = "code", required = false) String code,
            @RequestParam(value = "state", required = false) String state,
            @RequestParam(value = "error", required = false) String error) {

        if (error != null) {
            throw new InvalidRequestException("OAuth error: " + error);
        }
        if (code == null || code.isBlank() || state == null || state.isBlank()) {
            throw new InvalidRequestException("Missing code or state");
        }
        Cookie stateCookie = WebUtils.getCookie(request, sessionProps.getStateCookieName());
        if (stateCookie == null || !MessageDigest.isEqual(
                state.getBytes(StandardCharsets.UTF_8),
                stateCookie.getValue().getBytes(StandardCharsets.UTF_8))) {
            throw new InvalidRequestException("Invalid or expired state; please try logging in again");
        }

        UserAccount user = login.completeLogin(code);
        log.info("callback -> session issued for user={}", user.getId());

        String frontend = sessionProps.getFrontendUrl().replaceAll("/+$", "");
        return ResponseEntity.status(HttpStatus.FOUND)
                .location(URI.create(frontend + "/login/success"))
                .header(HttpHeaders.SET_COOKIE, cookies.session(sessions.issue(user.getId())).toString())
                .header(HttpHeaders.SET_COOKIE, cookies.clearedState().toString())
                .build();
    }

    @GetMapping("/me")
    public UserProfileDto me(@AuthenticationPrincipal Jwt jwt) {
        UserAccount user = users.requireUser(jwt.getSubject());
        return new UserProfileDto(user.getId(), user.getEmail(), user.getName());
    }

    @PostMapping("/logout")
    public ResponseEntity<Map<String, Boolean>> logout() {
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, cookies.clearedSession().toString())
                .body(Map.of("ok", true));
    }
}
