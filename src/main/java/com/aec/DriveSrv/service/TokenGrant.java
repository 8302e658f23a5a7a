package com.aec.DriveSrv.service;

/**
 * Tokens returned by the Google token endpoint. {@code refreshToken} is null when
 * Google did not issue or rotate one; {@code expiresInSeconds} is null when omitted.
 */
public record TokenGrant(String accessToken, String refreshToken, Long expiresInSeconds) {
}
