package com.dbguardian.server.service.backup;

import com.dbguardian.server.enums.BackupStatusEnum;
import com.dbguardian.server.enums.InvocationStateEnum;
import com.dbguardian.server.exception.BackupException;
import com.dbguardian.server.exception.FileOperationException;
import com.dbguardian.server.model.api.BackupResult;
import com.dbguardian.server.model.entity.BackupScheduleEntity;
import com.dbguardian.server.model.internal.BackupTarget;
import com.dbguardian.server.model.internal.CommandResult;
import com.dbguardian.server.model.internal.ConnectionParams;
import com.dbguardian.server.model.internal.StoredArtifact;
import com.dbguardian.server.service.db.IBackupRecordService;
import com.dbguardian.server.service.db.IBackupScheduleService;
import com.dbguardian.server.service.dump.ConnectionResolver;
import com.dbguardian.server.service.dump.DumpTool;
import com.dbguardian.server.service.secret.BackupCipher;
import com.dbguardian.server.service.secret.EncryptionKeyProvider;
import com.dbguardian.server.service.storage.BackupNaming;
import com.dbguardian.server.service.storage.BackupStorageService;
import com.dbguardian.server.util.FilesystemUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * One backup run: resolve target, dump, optionally encrypt, upload with fallback, record.
 * Runs on the caller's thread; the temporary directory is gone once this returns or throws.
 */
@Slf4j
@Service
public class BackupExecutor {

    static final String SCHEDULE_DISABLED = "schedule_disabled";

    private final IBackupScheduleService backupScheduleService;

    private final IBackupRecordService backupRecordService;

    private final ConnectionResolver connectionResolver;

    private final DumpTool dumpTool;

    private final BackupCipher backupCipher;

    private final EncryptionKeyProvider encryptionKeyProvider;

    private final BackupStorageService backupStorageService;

    private final String workDir;

    @Autowired
    public BackupExecutor(
            IBackupScheduleService backupScheduleService,
            IBackupRecordService backupRecordService,
            ConnectionResolver connectionResolver,
            DumpTool dumpTool,
            BackupCipher backupCipher,
            EncryptionKeyProvider encryptionKeyProvider,
            BackupStorageService backupStorageService,
            @Value("${dbguardian.server.backup.workDir:}") String workDir) {
        this.backupScheduleService = backupScheduleService;
        this.backupRecordService = backupRecordService;
        this.connectionResolver = connectionResolver;
        this.dumpTool = dumpTool;
        this.backupCipher = backupCipher;
        this.encryptionKeyProvider = encryptionKeyProvider;
        this.backupStorageService = backupStorageService;
        this.workDir = workDir;
    }

    public BackupResult execute(BackupTarget target, InvocationProgress progress) {
        // 1. 解析目标
        String databaseName;
        if (target.isSchedule()) {
            BackupScheduleEntity schedule = this.backupScheduleService.getByScheduleId(target.getScheduleId());
            if (ObjectUtils.isEmpty(schedule) || !Boolean.TRUE.equals(schedule.getEnabled())) {
                log.info("schedule {} is disabled or deleted, skipping backup", target.getScheduleId());
                return BackupResult.skipped(SCHEDULE_DISABLED);
            }
            databaseName = StringUtils.defaultIfBlank(schedule.getDatabaseName(), BackupTarget.DEFAULT_DATABASE);
        } else {
            databaseName = target.getDatabaseName();
        }
        progress.updateState(InvocationStateEnum.PROGRESS, "Starting backup");
        // 2. 加密策略和连接参数, 都在产生副作用之前检查
        SecretKey secretKey = this.encryptionKeyProvider.checkPolicy();
        ConnectionParams connectionParams = this.connectionResolver.resolve(databaseName);
        String backupName = BackupNaming.backupName(databaseName, LocalDateTime.now(ZoneOffset.UTC));
        Path tempDir = this.createTempDir();
        try {
            // 3. dump
            progress.updateState(InvocationStateEnum.PROGRESS, "Creating database dump");
            Path dumpFile = tempDir.resolve(backupName);
            CommandResult commandResult = this.dumpTool.dump(connectionParams, dumpFile).join();
            if (!commandResult.isSuccess()) {
                throw new BackupException(
                        "Database backup failed: %s".formatted(commandResult.getError()),
                        commandResult.getExitCode(),
                        commandResult.getError());
            }
            if (!Files.isRegularFile(dumpFile)) {
                throw new BackupException("Database backup failed: dump tool produced no file " + dumpFile);
            }
            // 4. 加密
            Path uploadFile = dumpFile;
            if (secretKey != null) {
                progress.updateState(InvocationStateEnum.PROGRESS, "Encrypting backup");
                uploadFile = tempDir.resolve(BackupNaming.fileName(backupName, true));
                this.backupCipher.encrypt(dumpFile, uploadFile, secretKey);
            }
            // 5. 上传, 主存储失败则写本地
            progress.updateState(InvocationStateEnum.PROGRESS, "Uploading backup to storage");
            StoredArtifact artifact = this.backupStorageService.store(
                    uploadFile, databaseName, uploadFile.getFileName().toString());
            // 6. 记录元数据
            this.backupRecordService.addBackupRecord(
                    databaseName,
                    backupName,
                    artifact.storageType().getType(),
                    artifact.storageLocation(),
                    artifact.sizeBytes());
            log.info("backup {} of {} stored at {}", backupName, databaseName, artifact.storageLocation());
            return new BackupResult()
                    .setStatus(BackupStatusEnum.SUCCESS.getStatus())
                    .setDatabaseName(databaseName)
                    .setBackupName(backupName)
                    .setStorageType(artifact.storageType().getType())
                    .setStorageLocation(artifact.storageLocation())
                    .setSizeBytes(artifact.sizeBytes());
        } finally {
            // 7. 清理临时目录
            try {
                FilesystemUtil.deleteFolder(tempDir, true);
            } catch (FileOperationException e) {
                log.warn("can't delete temporary directory {}", tempDir, e);
            }
        }
    }

    private Path createTempDir() throws FileOperationException {
        try {
            if (StringUtils.isBlank(this.workDir)) {
                return Files.createTempDirectory("dbguardian-");
            }
            Path parent = FilesystemUtil.createFolderIfAbsent(this.workDir);
            return Files.createTempDirectory(parent, "dbguardian-");
        } catch (IOException e) {
            throw new FileOperationException("createTempDir failed. workDir is %s".formatted(this.workDir), e);
        }
    }
}
