package com.dbguardian.server.service.storage;

import org.apache.commons.lang3.StringUtils;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

// backup_<db>_<yyyyMMdd_HHmmss>.dump[.enc]
public final class BackupNaming {

    public static final String DUMP_SUFFIX = ".dump";

    public static final String ENCRYPTED_SUFFIX = ".enc";

    public static final String PRIMARY_SCHEME = "s3://";

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    // db 名可以包含下划线, 时间戳固定在末尾
    private static final Pattern FILE_NAME_PATTERN =
            Pattern.compile("^backup_(.+)_(\\d{8}_\\d{6})\\.dump(\\.enc)?$");

    private BackupNaming() {
    }

    public static String backupName(String databaseName, LocalDateTime time) {
        return "backup_%s_%s%s".formatted(databaseName, TIMESTAMP_FORMAT.format(time), DUMP_SUFFIX);
    }

    public static String fileName(String backupName, boolean encrypted) {
        return encrypted ? backupName + ENCRYPTED_SUFFIX : backupName;
    }

    public static String primaryKey(String databaseName, String fileName) {
        return databaseName + "/" + fileName;
    }

    public static String primaryLocation(String key) {
        return PRIMARY_SCHEME + key;
    }

    public static boolean isBackupFile(String fileName) {
        return StringUtils.endsWithAny(fileName, DUMP_SUFFIX, DUMP_SUFFIX + ENCRYPTED_SUFFIX);
    }

    public static String lastSegment(String key) {
        return StringUtils.substringAfterLast("/" + key, "/");
    }

    // backup name without the encryption suffix
    public static String stripEncryptedSuffix(String fileName) {
        return StringUtils.removeEnd(fileName, ENCRYPTED_SUFFIX);
    }

    public static Optional<ParsedName> parse(String fileName) {
        if (StringUtils.isBlank(fileName)) {
            return Optional.empty();
        }
        Matcher matcher = FILE_NAME_PATTERN.matcher(fileName);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        LocalDateTime createdAt;
        try {
            createdAt = LocalDateTime.parse(matcher.group(2), TIMESTAMP_FORMAT);
        } catch (DateTimeParseException e) {
            createdAt = null;
        }
        return Optional.of(new ParsedName(
                matcher.group(1),
                stripEncryptedSuffix(fileName),
                createdAt,
                matcher.group(3) != null));
    }

    public record ParsedName(String databaseName, String backupName, LocalDateTime createdAt, boolean encrypted) {
    }
}
