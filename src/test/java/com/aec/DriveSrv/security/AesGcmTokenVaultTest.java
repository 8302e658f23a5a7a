package com.aec.DriveSrv.security;

import org.junit.jupiter.api.Test;

import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AesGcmTokenVaultTest {

    private static final String KEY = Base64.getEncoder().encodeToString(new byte[32]);

    private final AesGcmTokenVault vault = new AesGcmTokenVault(KEY);

    @Test
    void decryptsWhatItEncrypted() {
        String ciphertext = vault.encrypt("ya29.a0-access-token");

        assertThat(ciphertext).doesNotContain("ya29");
        assertThat(vault.decrypt(ciphertext)).isEqualTo("ya29.a0-access-token");
    }

    @Test
    void sameValueEncryptsDifferentlyEachTime() {
        assertThat(vault.encrypt("token")).isNotEqualTo(vault.encrypt("token"));
    }

    @Test
    void nullCiphertextDecryptsToNull() {
        assertThat(vault.decrypt(null)).isNull();
    }

    @Test
    void emptyPlaintextIsRejected() {
        assertThatThrownBy(() -> vault.encrypt("")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void tamperedCiphertextFails() {
        byte[] raw = Base64.getDecoder().decode(vault.encrypt("token"));
        raw[raw.length - 1] ^= 1;

        assertThatThrownBy(() -> vault.decrypt(Base64.getEncoder().encodeToString(raw)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void otherKeyCannotDecrypt() {
        byte[] otherKey = new byte[32];
        otherKey[0] = 7;
        AesGcmTokenVault other = new AesGcmTokenVault(Base64.getEncoder().encodeToString(otherKey));

        assertThatThrownBy(() -> other.decrypt(vault.encrypt("token")))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void missingOrMalformedKeyFailsAtStartup() {
        assertThatThrownBy(() -> new AesGcmTokenVault(""))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("TOKEN_ENCRYPTION_KEY");
        assertThatThrownBy(() -> new AesGcmTokenVault("not base64!"))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new AesGcmTokenVault(Base64.getEncoder().encodeToString(new byte[20])))
                .isInstanceOf(IllegalStateException.class);
    }
}
