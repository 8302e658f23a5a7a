package com.aec.DriveSrv.service;

import com.aec.DriveSrv.config.DriveProperties;
import com.aec.DriveSrv.config.OAuthProperties;
import com.google.api.client.auth.oauth2.TokenResponse;
import com.google.api.client.googleapis.auth.oauth2.GoogleAuthorizationCodeRequestUrl;
import com.google.api.client.googleapis.auth.oauth2.GoogleAuthorizationCodeTokenRequest;
import com.google.api.client.googleapis.auth.oauth2.GoogleRefreshTokenRequest;
import com.google.api.client.http.GenericUrl;
import com.google.api.client.http.HttpRequestInitializer;
import com.google.api.client.http.HttpResponse;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.json.JsonFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Thin wrapper over the Google OAuth endpoints: consent URL, code exchange,
 * refresh and userinfo. Every call uses the token-endpoint timeouts and no retries.
 */
@Component
public class GoogleOAuthClient {

    private final OAuthProperties props;
    private final DriveProperties driveProps;
    private final HttpTransport httpTransport;
    private final JsonFactory jsonFactory;

    public GoogleOAuthClient(OAuthProperties props, DriveProperties driveProps,
                             HttpTransport httpTransport, JsonFactory jsonFactory) {
        this.props = props;
        this.driveProps = driveProps;
        this.httpTransport = httpTransport;
        this.jsonFactory = jsonFactory;
    }

    public String buildAuthorizationUrl(String state) {
        GoogleAuthorizationCodeRequestUrl url = new GoogleAuthorizationCodeRequestUrl(
                props.getAuthUri(), props.getClientId(), props.getRedirectUri(), props.getScopes())
            .setAccessType("offline")
            .setState(state);
        url.set("prompt", "consent");
        return url.build();
    }

    /**
     * @throws com.google.api.client.auth.oauth2.TokenResponseException when Google answers with an error
     */
    public TokenGrant exchangeCode(String code) throws IOException {
        TokenResponse response = new GoogleAuthorizationCodeTokenRequest(
                httpTransport, jsonFactory, props.getTokenUri(),
                props.getClientId(), props.getClientSecret(), code, props.getRedirectUri())
            .setRequestInitializer(tokenEndpointInitializer())
            .execute();
        return toGrant(response);
    }

    /**
     * @throws com.google.api.client.auth.oauth2.TokenResponseException when Google rejects the refresh token
     */
    public TokenGrant refresh(String refreshToken) throws IOException {
        TokenResponse response = new GoogleRefreshTokenRequest(
                httpTransport, jsonFactory,
                refreshToken, props.getClientId(), props.getClientSecret())
            .setTokenServerUrl(new GenericUrl(props.getTokenUri()))
            .setRequestInitializer(tokenEndpointInitializer())
            .execute();
        return toGrant(response);
    }

    public GoogleUserInfo fetchUserInfo(String accessToken) throws IOException {
        HttpRequestInitializer timeouts = tokenEndpointInitializer();
        HttpResponse response = httpTransport.createRequestFactory(request -> {
                    timeouts.initialize(request);
                    request.getHeaders().setAuthorization("Bearer " + accessToken);
                    request.setParser(jsonFactory.createJsonObjectParser());
                })
            .buildGetRequest(new GenericUrl(props.getUserInfoUri()))
            .execute();
        try {
            return response.parseAs(GoogleUserInfo.class);
        } finally {
            response.disconnect();
        }
    }

    private HttpRequestInitializer tokenEndpointInitializer() {
        return request -> {
            request.setConnectTimeout(driveProps.getTokenConnectTimeoutMillis());
            request.setReadTimeout(driveProps.getTokenReadTimeoutMillis());
            request.setNumberOfRetries(0);
        };
    }

    private static TokenGrant toGrant(TokenResponse response) {
        return new TokenGrant(response.getAccessToken(), response.getRefreshToken(), response.getExpiresInSeconds());
    }
}
