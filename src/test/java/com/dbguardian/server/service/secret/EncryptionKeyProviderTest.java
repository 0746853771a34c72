package com.dbguardian.server.service.secret;

import com.dbguardian.server.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import javax.crypto.SecretKey;
import java.util.Arrays;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

class EncryptionKeyProviderTest {

    @Test
    void ShouldDeriveSameKeyWhenPasswordIsSame() {
        SecretKey first = new EncryptionKeyProvider(true, "", "s3cret").resolveKey();
        SecretKey second = new EncryptionKeyProvider(true, null, "s3cret").resolveKey();
        SecretKey other = new EncryptionKeyProvider(true, "", "different").resolveKey();

        assertEquals(32, first.getEncoded().length);
        assertArrayEquals(first.getEncoded(), second.getEncoded());
        assertFalse(Arrays.equals(first.getEncoded(), other.getEncoded()));
        assertEquals("AES", first.getAlgorithm());
    }

    @Test
    void ShouldPreferConfiguredKeyWhenBothAreSet() {
        byte[] raw = new byte[32];
        Arrays.fill(raw, (byte) 0x3F);
        String standard = Base64.getEncoder().encodeToString(raw);
        String urlSafe = Base64.getUrlEncoder().encodeToString(raw);

        assertArrayEquals(raw, new EncryptionKeyProvider(true, standard, "ignored").resolveKey().getEncoded());
        assertArrayEquals(raw, new EncryptionKeyProvider(true, urlSafe, "").resolveKey().getEncoded());
    }

    @Test
    void ShouldThrowConfigurationExceptionWhenKeyHasWrongLength() {
        String shortKey = Base64.getEncoder().encodeToString(new byte[16]);

        assertThrows(ConfigurationException.class,
                () -> new EncryptionKeyProvider(true, shortKey, "").resolveKey());
        assertThrows(ConfigurationException.class,
                () -> new EncryptionKeyProvider(true, "%%% not base64 %%%", "").resolveKey());
    }

    @Test
    void ShouldThrowConfigurationExceptionWhenEnabledWithoutKeyOrPassword() {
        EncryptionKeyProvider enabled = new EncryptionKeyProvider(true, "", "");
        EncryptionKeyProvider disabled = new EncryptionKeyProvider(false, "", "");

        assertThrows(ConfigurationException.class, enabled::checkPolicy);
        assertNull(disabled.checkPolicy());
        assertNotNull(new EncryptionKeyProvider(true, "", "pw").checkPolicy());
    }
}
