package com.dbguardian.server.util;

import com.dbguardian.server.exception.FileOperationException;
import com.dbguardian.server.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.nio.file.*;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

@Slf4j
public class FilesystemUtil {

    public static Path createFolderIfAbsent(String folderPathString)
            throws ValidationException, FileOperationException {
        if (StringUtils.isBlank(folderPathString)) {
            throw new ValidationException("createFolderIfAbsent failed. folderPathString is null");
        }
        Path folder = Paths.get(folderPathString);
        if (Files.exists(folder) && !Files.isDirectory(folder)) {
            throw new ValidationException("createFolderIfAbsent failed. " +
                    "folderPathString:%s exists but is not a folder.".formatted(folderPathString));
        }
        try {
            return Files.createDirectories(folder);
        } catch (IOException e) {
            throw new FileOperationException("createFolderIfAbsent failed. " +
                    "folderPathString is %s".formatted(folderPathString), e);
        }
    }

    // 只列出第一层的普通文件
    public static List<Path> getFiles(Path folder) throws FileOperationException {
        if (!Files.isDirectory(folder)) {
            return new ArrayList<>();
        }
        try (Stream<Path> stream = Files.list(folder)) {
            return stream.filter(Files::isRegularFile).toList();
        } catch (IOException e) {
            throw new FileOperationException("getFiles failed. folder is %s".formatted(folder), e);
        }
    }

    public static void deleteFolder(Path folderPath, boolean includeSelf) throws FileOperationException {
        if (folderPath == null || !Files.exists(folderPath)) {
            return;
        }
        try {
            Files.walkFileTree(folderPath, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    Files.delete(file);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                    // 遇到 self 则跳过
                    if (!includeSelf && dir.equals(folderPath)) {
                        return FileVisitResult.CONTINUE;
                    }
                    Files.delete(dir);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new FileOperationException("deleteFolder failed. folder is %s".formatted(folderPath), e);
        }
    }
}
