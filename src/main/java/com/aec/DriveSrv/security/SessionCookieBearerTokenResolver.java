package com.aec.DriveSrv.security;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.security.oauth2.server.resource.web.BearerTokenResolver;
import org.springframework.security.oauth2.server.resource.web.DefaultBearerTokenResolver;
import org.springframework.util.StringUtils;
import org.springframework.web.util.WebUtils;

import java.util.List;

/**
 * Reads the session JWT from the session cookie, falling back to an
 * {@code Authorization: Bearer} header. Public paths resolve no token so a stale
 * cookie cannot block login, logout or health checks.
 */
public class SessionCookieBearerTokenResolver implements BearerTokenResolver {

    private final String cookieName;
    private final List<String> publicPaths;
    private final DefaultBearerTokenResolver headerResolver = new DefaultBearerTokenResolver();

    public SessionCookieBearerTokenResolver(String cookieName, List<String> publicPaths) {
        this.cookieName = cookieName;
        this.publicPaths = List.copyOf(publicPaths);
    }

    @Override
    public String resolve(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        if (publicPaths.contains(path)) {
            return null;
        }
        String header = headerResolver.resolve(request);
        if (StringUtils.hasText(header)) {
            return header;
        }
        Cookie cookie = WebUtils.getCookie(request, cookieName);
        return cookie != null && StringUtils.hasText(cookie.getValue()) ? cookie.getValue() : null;
    }
}
