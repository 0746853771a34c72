package com.dbguardian.server.service.secret;

import com.dbguardian.server.exception.FileOperationException;

import javax.crypto.SecretKey;
import java.nio.file.Path;

public interface BackupCipher {

    void encrypt(Path source, Path target, SecretKey key) throws FileOperationException;

    void decrypt(Path source, Path target, SecretKey key) throws FileOperationException;
}
