package com.dbguardian.server.service.secret;

import com.dbguardian.server.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Backup encryption policy and key source. A configured key wins over a password; a password is
 * stretched with PBKDF2 over a fixed salt so the same password always yields the same key.
 */
@Slf4j
@Service
public class EncryptionKeyProvider {

    static final byte[] SALT = "dbguardian_backup_salt".getBytes(StandardCharsets.UTF_8);

    static final int ITERATIONS = 100_000;

    private static final int KEY_LENGTH_BITS = 256;

    private static final int KEY_LENGTH_BYTES = KEY_LENGTH_BITS / 8;

    private final boolean enabled;

    private final String key;

    private final String password;

    @Autowired
    public EncryptionKeyProvider(
            @Value("${dbguardian.server.encryption.enabled:false}") boolean enabled,
            @Value("${dbguardian.server.encryption.key:}") String key,
            @Value("${dbguardian.server.encryption.password:}") String password) {
        this.enabled = enabled;
        this.key = key;
        this.password = password;
    }

    public SecretKey resolveKey() throws ConfigurationException {
        if (StringUtils.isNotBlank(this.key)) {
            return new SecretKeySpec(decodeKey(this.key.trim()), "AES");
        }
        if (StringUtils.isNotEmpty(this.password)) {
            return new SecretKeySpec(deriveKey(this.password), "AES");
        }
        throw new ConfigurationException("encryption is enabled but neither " +
                "dbguardian.server.encryption.key nor dbguardian.server.encryption.password is set");
    }

    /**
     * Check the encryption policy before any side effect.
     *
     * @return the key to encrypt with, or null when encryption is disabled
     */
    public SecretKey checkPolicy() throws ConfigurationException {
        return this.enabled ? this.resolveKey() : null;
    }

    static byte[] deriveKey(String password) throws ConfigurationException {
        try {
            PBEKeySpec spec = new PBEKeySpec(password.toCharArray(), SALT, ITERATIONS, KEY_LENGTH_BITS);
            try {
                return SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256").generateSecret(spec).getEncoded();
            } finally {
                spec.clearPassword();
            }
        } catch (Exception e) {
            throw new ConfigurationException("deriveKey failed.", e);
        }
    }

    private static byte[] decodeKey(String encoded) throws ConfigurationException {
        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(encoded);
        } catch (IllegalArgumentException e) {
            try {
                decoded = Base64.getUrlDecoder().decode(encoded);
            } catch (IllegalArgumentException urlSafeError) {
                throw new ConfigurationException("encryption key is not base64", urlSafeError);
            }
        }
        if (decoded.length != KEY_LENGTH_BYTES) {
            throw new ConfigurationException("encryption key must decode to %s bytes but got %s"
                    .formatted(KEY_LENGTH_BYTES, decoded.length));
        }
        return decoded;
    }
}
