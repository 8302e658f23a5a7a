package com.aec.DriveSrv.service;

import com.aec.DriveSrv.exception.DriveProviderException;
import com.aec.DriveSrv.exception.UnauthenticatedException;
import com.aec.DriveSrv.model.UserAccount;
import com.aec.DriveSrv.security.TokenVault;
import com.google.api.client.auth.oauth2.TokenResponseException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Hands out a currently valid Google access token for a user.
 *
 * <p>The stored token is returned as-is while it has more than {@link #REFRESH_MARGIN}
 * left. Otherwise, or when {@code forceRefresh} is set, the stored refresh token is
 * exchanged once and the new access token, expiry and (if rotated) refresh token
 * are committed together. The token endpoint is called outside any transaction;
 * only the column update runs in one. {@code forceRefresh} exists for the caller's
 * single retry after Drive answered 401 to a token we still believed valid; this
 * class never retries by itself.
 *
 * <p>Google answering with an OAuth error means the grant is gone and the user must
 * log in again. A timeout or an error response without an OAuth error body is a
 * provider failure and leaves the stored tokens alone.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccessTokenBroker {

    static final Duration REFRESH_MARGIN = Duration.ofMinutes(5);
    static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;

    private final UserAccountService users;
    private final TokenVault vault;
    private final GoogleOAuthClient oauth;
    private final Clock clock;

    public String obtain(UserAccount user) {
        return obtain(user, false);
    }

    public String obtain(UserAccount user, boolean forceRefresh) {
        Instant now = clock.instant();
        if (!forceRefresh && isStillValid(user, now)) {
            return vault.decrypt(user.getEncryptedAccessToken());
        }

        String refreshToken = vault.decrypt(user.getEncryptedRefreshToken());
        if (refreshToken == null || refreshToken.isBlank()) {
            log.info("No refresh token stored for user {}; re-consent required", user.getId());
            throw new UnauthenticatedException("Session expired; please log in again to grant Drive access");
        }

        TokenGrant grant;
        try {
            grant = oauth.refresh(refreshToken);
        } catch (TokenResponseException e) {
            if (e.getDetails() == null) {
                log.error("Token endpoint failed for user {}: status {}", user.getId(), e.getStatusCode());
                throw new DriveProviderException(e.getStatusCode(), "Google token endpoint failed", e);
            }
            log.warn("Token refresh rejected for user {}: {}", user.getId(), e.getDetails().getError());
            throw new UnauthenticatedException("Failed to refresh Google token; please log in again", e);
        } catch (IOException e) {
            log.error("Token endpoint unreachable for user {}: {}", user.getId(), e.getMessage());
            throw new DriveProviderException(DriveProviderException.NO_STATUS, "Google token endpoint unreachable", e);
        }
        if (grant.accessToken() == null || grant.accessToken().isBlank()) {
            log.warn("Token refresh for user {} returned no access_token", user.getId());
            throw new UnauthenticatedException("Failed to refresh Google token; please log in again");
        }

        long expiresIn = grant.expiresInSeconds() != null ? grant.expiresInSeconds() : DEFAULT_EXPIRES_IN_SECONDS;
        String encryptedAccess = vault.encrypt(grant.accessToken());
        String encryptedRefresh = hasText(grant.refreshToken()) ? vault.encrypt(grant.refreshToken()) : null;
        Instant expiresAt = now.plusSeconds(expiresIn);

        users.storeRefreshedTokens(user.getId(), encryptedAccess, encryptedRefresh, expiresAt);
        // keep the caller's copy in step with the row
        user.setEncryptedAccessToken(encryptedAccess);
        user.setAccessTokenExpiresAt(expiresAt);
        if (encryptedRefresh != null) {
            user.setEncryptedRefreshToken(encryptedRefresh);
        }

        log.info("Token refresh OK -> user={}, expiresAt={}, forced={}, refreshRotated={}",
                user.getId(), expiresAt, forceRefresh, encryptedRefresh != null);
        return grant.accessToken();
    }

    private static boolean isStillValid(UserAccount user, Instant now) {
        Instant expiresAt = user.getAccessTokenExpiresAt();
        // unknown expiry is treated as stale
        return hasText(user.getEncryptedAccessToken())
                && expiresAt != null
                && expiresAt.isAfter(now.plus(REFRESH_MARGIN));
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
