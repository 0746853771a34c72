package com.dbguardian.server.service.storage;

import com.dbguardian.server.exception.FileOperationException;
import com.dbguardian.server.exception.ValidationException;
import com.dbguardian.server.util.FilesystemUtil;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Flat directory that receives backups when the primary store is unavailable.
 */
@Slf4j
@Component
public class LocalFallbackStore {

    @Getter
    private final Path fallbackDir;

    @Autowired
    public LocalFallbackStore(@Value("${dbguardian.server.storage.fallbackDir:/fallback}") String fallbackDir) {
        this.fallbackDir = Paths.get(fallbackDir).toAbsolutePath().normalize();
    }

    public Path save(Path source, String fileName) throws FileOperationException {
        Path target = this.resolve(fileName);
        FilesystemUtil.createFolderIfAbsent(this.fallbackDir.toString());
        try {
            return Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new FileOperationException("save failed. source is %s, target is %s".formatted(source, target), e);
        }
    }

    public List<Path> list() throws FileOperationException {
        return FilesystemUtil.getFiles(this.fallbackDir);
    }

    public boolean delete(String fileName) throws FileOperationException {
        Path target = this.resolve(fileName);
        try {
            return Files.deleteIfExists(target);
        } catch (IOException e) {
            throw new FileOperationException("delete failed. file is %s".formatted(target), e);
        }
    }

    // 只允许目录下的一层文件名
    public Path resolve(String fileName) throws ValidationException {
        if (StringUtils.isBlank(fileName)
                || fileName.contains("/")
                || fileName.contains("\\")
                || ".".equals(fileName)
                || "..".equals(fileName)) {
            throw new ValidationException("resolve failed. fileName %s is not a plain file name".formatted(fileName));
        }
        return this.fallbackDir.resolve(fileName);
    }
}
