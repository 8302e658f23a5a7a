package com.aec.DriveSrv.security;

/**
 * Encryption of Google tokens at rest. {@code decrypt(null)} returns {@code null}
 * so an absent refresh token passes straight through.
 */
public interface TokenVault {
    String encrypt(String plaintext);
    String decrypt(String ciphertext);
}
