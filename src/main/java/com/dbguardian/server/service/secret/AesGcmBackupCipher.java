package com.dbguardian.server.service.secret;

import com.dbguardian.server.exception.FileOperationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;

/**
 * AES-256-GCM. File layout: 12-byte random IV, then ciphertext with the 16-byte tag appended.
 */
@Slf4j
@Component
public class AesGcmBackupCipher implements BackupCipher {

    static final int IV_LENGTH = 12;

    private static final int TAG_LENGTH_BITS = 128;

    private static final int BUFFER_SIZE = 64 * 1024;

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";

    private final SecureRandom secureRandom = new SecureRandom();

    @Override
    public void encrypt(Path source, Path target, SecretKey key) throws FileOperationException {
        byte[] iv = new byte[IV_LENGTH];
        this.secureRandom.nextBytes(iv);
        try (InputStream in = Files.newInputStream(source);
             OutputStream out = Files.newOutputStream(target)) {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            out.write(iv);
            pipe(cipher, in, out);
        } catch (Exception e) {
            throw new FileOperationException("encrypt failed. source is %s".formatted(source), e);
        }
        log.debug("{} encrypted into {}", source, target);
    }

    @Override
    public void decrypt(Path source, Path target, SecretKey key) throws FileOperationException {
        try (InputStream in = Files.newInputStream(source);
             OutputStream out = Files.newOutputStream(target)) {
            byte[] iv = in.readNBytes(IV_LENGTH);
            if (iv.length != IV_LENGTH) {
                throw new FileOperationException("decrypt failed. %s is too short".formatted(source));
            }
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            pipe(cipher, in, out);
        } catch (FileOperationException e) {
            throw e;
        } catch (Exception e) {
            throw new FileOperationException("decrypt failed. source is %s".formatted(source), e);
        }
    }

    private static void pipe(Cipher cipher, InputStream in, OutputStream out) throws Exception {
        byte[] buffer = new byte[BUFFER_SIZE];
        int read;
        while ((read = in.read(buffer)) != -1) {
            byte[] chunk = cipher.update(buffer, 0, read);
            if (chunk != null) {
                out.write(chunk);
            }
        }
        out.write(cipher.doFinal());
    }
}
