package com.aec.DriveSrv.service;

import com.aec.DriveSrv.Repository.UserAccountRepository;
import com.aec.DriveSrv.exception.UnauthenticatedException;
import com.aec.DriveSrv.model.UserAccount;
import com.aec.DriveSrv.security.TokenVault;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

@Service
@RequiredArgsConstructor
@Slf4j
public class UserAccountService {

    private final UserAccountRepository repo;
    private final TokenVault vault;
    private final Clock clock;

    /** Loads the user behind a session subject; an unknown subject is an auth failure. */
    @Transactional(readOnly = true)
    public UserAccount requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new UnauthenticatedException("Invalid session");
        }
        return repo.findById(userId)
                .orElseThrow(() -> new UnauthenticatedException("User not found"));
    }

    /**
     * Creates or updates the account after a successful consent. The refresh token is
     * only replaced when Google returned one.
     */
    @Transactional
    public UserAccount recordLogin(GoogleUserInfo info, TokenGrant grant) {
        long expiresIn = grant.expiresInSeconds() != null
                ? grant.expiresInSeconds()
                : AccessTokenBroker.DEFAULT_EXPIRES_IN_SECONDS;
        Instant expiresAt = clock.instant().plusSeconds(expiresIn);

        UserAccount user = repo.findById(info.getSub()).orElseGet(() -> UserAccount.builder()
                .id(info.getSub())
                .build());
        boolean created = user.getEncryptedAccessToken() == null;
        user.setEmail(info.getEmail());
        user.setName(info.getName());
        user.setEncryptedAccessToken(vault.encrypt(grant.accessToken()));
        if (grant.refreshToken() != null && !grant.refreshToken().isBlank()) {
            user.setEncryptedRefreshToken(vault.encrypt(grant.refreshToken()));
        }
        user.setAccessTokenExpiresAt(expiresAt);
        UserAccount saved = repo.saveAndFlush(user);

        log.info("Login stored -> user={}, created={}, hasRefreshToken={}",
                saved.getId(), created, saved.getEncryptedRefreshToken() != null);
        return saved;
    }

    /**
     * Writes the refreshed tokens to the row. Only the token columns are touched; a
     * {@code null} refresh token leaves the stored one in place.
     */
    @Transactional
    public void storeRefreshedTokens(String userId, String encryptedAccessToken,
                                     String encryptedRefreshToken, Instant expiresAt) {
        int updated = encryptedRefreshToken != null
                ? repo.updateTokens(userId, encryptedAccessToken, encryptedRefreshToken, expiresAt)
                : repo.updateAccessToken(userId, encryptedAccessToken, expiresAt);
        if (updated == 0) {
            throw new UnauthenticatedException("User not found");
        }
    }

    /** Sets only the root folder column and mirrors it on {@code user}. */
    @Transactional
    public UserAccount updateRootFolder(UserAccount user, String folderId) {
        if (repo.updateRootFolder(user.getId(), folderId) == 0) {
            throw new UnauthenticatedException("User not found");
        }
        user.setDriveRootFolderId(folderId);
        return user;
    }
}
