package com.aec.DriveSrv.service;

import com.aec.DriveSrv.exception.InvalidRequestException;
import com.aec.DriveSrv.model.UserAccount;
import com.google.api.client.auth.oauth2.TokenResponseException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;

/**
 * Completes the authorization-code flow: code exchange, userinfo lookup and
 * account upsert.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GoogleLoginService {

    private final GoogleOAuthClient oauth;
    private final UserAccountService users;

    public UserAccount completeLogin(String code) {
        TokenGrant grant;
        try {
            grant = oauth.exchangeCode(code);
        } catch (TokenResponseException e) {
            String detail = e.getDetails() != null
                    ? (e.getDetails().getErrorDescription() != null
                        ? e.getDetails().getErrorDescription()
                        : e.getDetails().getError())
                    : e.getStatusMessage();
            log.warn("Code exchange rejected: {}", detail);
            throw new InvalidRequestException("Token exchange failed: " + detail, e);
        } catch (IOException e) {
            log.error("Code exchange failed: {}", e.getMessage(), e);
            throw new InvalidRequestException("Token exchange failed", e);
        }
        if (grant.accessToken() == null || grant.accessToken().isBlank()) {
            throw new InvalidRequestException("Token exchange did not return access_token");
        }

        GoogleUserInfo info;
        try {
            info = oauth.fetchUserInfo(grant.accessToken());
        } catch (IOException e) {
            log.error("Userinfo lookup failed: {}", e.getMessage(), e);
            throw new InvalidRequestException("Google userinfo lookup failed", e);
        }
        if (info.getSub() == null || info.getSub().isBlank()
                || info.getEmail() == null || info.getEmail().isBlank()) {
            throw new InvalidRequestException("Google userinfo missing sub or email");
        }
        return users.recordLogin(info, grant);
    }
}
