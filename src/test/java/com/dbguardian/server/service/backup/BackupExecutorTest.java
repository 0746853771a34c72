package com.dbguardian.server.service.backup;

import com.dbguardian.server.InMemoryBackupRecordStore;
import com.dbguardian.server.InMemoryObjectStore;
import com.dbguardian.server.InMemoryScheduleStore;
import com.dbguardian.server.enums.BackupStatusEnum;
import com.dbguardian.server.enums.InvocationStateEnum;
import com.dbguardian.server.enums.StorageTypeEnum;
import com.dbguardian.server.exception.BackupException;
import com.dbguardian.server.exception.ConfigurationException;
import com.dbguardian.server.exception.StorageException;
import com.dbguardian.server.model.api.BackupResult;
import com.dbguardian.server.model.entity.BackupEntity;
import com.dbguardian.server.model.entity.BackupScheduleEntity;
import com.dbguardian.server.model.internal.BackupTarget;
import com.dbguardian.server.model.internal.CommandResult;
import com.dbguardian.server.model.internal.ConnectionParams;
import com.dbguardian.server.service.dump.ConnectionResolver;
import com.dbguardian.server.service.dump.DumpTool;
import com.dbguardian.server.service.secret.AesGcmBackupCipher;
import com.dbguardian.server.service.secret.EncryptionKeyProvider;
import com.dbguardian.server.service.storage.BackupStorageService;
import com.dbguardian.server.service.storage.LocalFallbackStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class BackupExecutorTest {

    private static final byte[] DUMP_CONTENT = "PGDMP fake custom format dump".getBytes(StandardCharsets.UTF_8);

    @TempDir
    Path tempDir;

    private Path workDir;

    private Path fallbackDir;

    private InMemoryScheduleStore scheduleStore;

    private InMemoryBackupRecordStore recordStore;

    private InMemoryObjectStore objectStore;

    private FakeDumpTool dumpTool;

    private AesGcmBackupCipher cipher;

    private final List<String> progressMessages = new ArrayList<>();

    private final InvocationProgress progress = (state, message) -> {
        assertEquals(InvocationStateEnum.PROGRESS, state);
        this.progressMessages.add(message);
    };

    @BeforeEach
    void setUp() {
        this.workDir = this.tempDir.resolve("work");
        this.fallbackDir = this.tempDir.resolve("fallback");
        this.scheduleStore = new InMemoryScheduleStore();
        this.recordStore = new InMemoryBackupRecordStore();
        this.objectStore = new InMemoryObjectStore();
        this.dumpTool = new FakeDumpTool();
        this.cipher = new AesGcmBackupCipher();
    }

    private BackupExecutor newExecutor(EncryptionKeyProvider encryptionKeyProvider) {
        return new BackupExecutor(
                this.scheduleStore,
                this.recordStore,
                new ConnectionResolver(name -> null, "postgresql://backup:secret@db:5432/app"),
                this.dumpTool,
                this.cipher,
                encryptionKeyProvider,
                new BackupStorageService(this.objectStore, new LocalFallbackStore(this.fallbackDir.toString())),
                this.workDir.toString());
    }

    private BackupExecutor newExecutor() {
        return newExecutor(new EncryptionKeyProvider(false, "", ""));
    }

    private void assertWorkDirEmpty() throws IOException {
        if (!Files.exists(this.workDir)) {
            return;
        }
        try (Stream<Path> children = Files.list(this.workDir)) {
            assertEquals(0, children.count());
        }
    }

    @Test
    void ShouldUploadToPrimaryAndRecordWhenEverythingWorks() throws IOException {
        BackupScheduleEntity schedule = this.scheduleStore.addInterval("orders", 60, true);

        BackupResult result = newExecutor().execute(BackupTarget.ofSchedule(schedule.getId()), this.progress);

        assertEquals(BackupStatusEnum.SUCCESS.getStatus(), result.getStatus());
        assertEquals(StorageTypeEnum.PRIMARY.getType(), result.getStorageType());
        assertTrue(result.getBackupName().matches("backup_orders_\\d{8}_\\d{6}\\.dump"));
        String key = "orders/" + result.getBackupName();
        assertEquals("s3://" + key, result.getStorageLocation());
        assertArrayEquals(DUMP_CONTENT, this.objectStore.objects.get(key));
        assertEquals(DUMP_CONTENT.length, result.getSizeBytes());

        assertEquals(1, this.recordStore.records.size());
        BackupEntity record = this.recordStore.records.get(0);
        assertEquals("orders", record.getDatabaseName());
        assertEquals(result.getBackupName(), record.getBackupName());
        assertEquals("minio", record.getStorageType());
        assertEquals(result.getStorageLocation(), record.getStorageLocation());
        assertEquals((long) DUMP_CONTENT.length, record.getSizeBytes());

        assertEquals("app", this.dumpTool.lastParams.getDatabase());
        assertEquals(List.of("Starting backup", "Creating database dump", "Uploading backup to storage"),
                this.progressMessages);
        assertWorkDirEmpty();
    }

    @Test
    void ShouldWriteToFallbackWhenPrimaryIsUnreachable() throws IOException {
        this.objectStore.unavailable = true;

        BackupResult result = newExecutor().execute(BackupTarget.ofDatabase("orders"), this.progress);

        assertEquals(StorageTypeEnum.FALLBACK.getType(), result.getStorageType());
        Path stored = this.fallbackDir.toAbsolutePath().normalize().resolve(result.getBackupName());
        assertEquals(stored.toString(), result.getStorageLocation());
        assertArrayEquals(DUMP_CONTENT, Files.readAllBytes(stored));
        assertEquals("local", this.recordStore.records.get(0).getStorageType());
        assertEquals(stored.toString(), this.recordStore.records.get(0).getStorageLocation());
        assertWorkDirEmpty();
    }

    @Test
    void ShouldThrowStorageExceptionWhenBothStoresFail() throws IOException {
        this.objectStore.unavailable = true;
        // fallback path occupied by a regular file
        Files.writeString(this.fallbackDir, "not a directory");

        BackupExecutor executor = newExecutor();
        assertThrows(StorageException.class,
                () -> executor.execute(BackupTarget.ofDatabase("orders"), this.progress));

        assertTrue(this.recordStore.records.isEmpty());
        assertWorkDirEmpty();
    }

    @Test
    void ShouldThrowBackupExceptionWhenDumpToolFails() throws IOException {
        this.dumpTool.failWith = CommandResult.failed(1, "pg_dump: error: connection to server failed");

        BackupExecutor executor = newExecutor();
        BackupException exception = assertThrows(BackupException.class,
                () -> executor.execute(BackupTarget.ofDatabase("orders"), this.progress));

        assertEquals(1, exception.getExitCode());
        assertEquals("pg_dump: error: connection to server failed", exception.getToolOutput());
        assertTrue(exception.getMessage().contains("connection to server failed"));
        assertTrue(this.objectStore.objects.isEmpty());
        assertTrue(this.recordStore.records.isEmpty());
        assertWorkDirEmpty();
    }

    @Test
    void ShouldSkipWithoutDumpingWhenScheduleIsDisabledOrMissing() {
        BackupScheduleEntity disabled = this.scheduleStore.addInterval("orders", 60, false);
        BackupExecutor executor = newExecutor();

        BackupResult disabledResult = executor.execute(BackupTarget.ofSchedule(disabled.getId()), this.progress);
        BackupResult missingResult = executor.execute(BackupTarget.ofSchedule(999L), this.progress);

        assertTrue(disabledResult.isSkipped());
        assertEquals("schedule_disabled", disabledResult.getReason());
        assertTrue(missingResult.isSkipped());
        assertEquals(0, this.dumpTool.invocations);
        assertTrue(this.progressMessages.isEmpty());
    }

    @Test
    void ShouldFailBeforeDumpWhenEncryptionHasNoKey() {
        BackupExecutor executor = newExecutor(new EncryptionKeyProvider(true, "", ""));

        assertThrows(ConfigurationException.class,
                () -> executor.execute(BackupTarget.ofDatabase("orders"), this.progress));

        assertEquals(0, this.dumpTool.invocations);
        assertTrue(this.objectStore.objects.isEmpty());
        assertFalse(Files.exists(this.fallbackDir));
    }

    @Test
    void ShouldUploadEncryptedFileWhenEncryptionIsEnabled() throws IOException {
        EncryptionKeyProvider keyProvider = new EncryptionKeyProvider(true, "", "correct horse battery staple");

        BackupResult result = newExecutor(keyProvider).execute(BackupTarget.ofDatabase("orders"), this.progress);

        String key = "orders/" + result.getBackupName() + ".enc";
        assertEquals("s3://" + key, result.getStorageLocation());
        byte[] encrypted = this.objectStore.objects.get(key);
        assertNotNull(encrypted);
        assertFalse(new String(encrypted, StandardCharsets.UTF_8).contains("PGDMP"));

        Path encryptedFile = this.tempDir.resolve("downloaded.enc");
        Path decryptedFile = this.tempDir.resolve("downloaded.dump");
        Files.write(encryptedFile, encrypted);
        this.cipher.decrypt(encryptedFile, decryptedFile, keyProvider.resolveKey());
        assertArrayEquals(DUMP_CONTENT, Files.readAllBytes(decryptedFile));
        assertTrue(this.progressMessages.contains("Encrypting backup"));
        assertWorkDirEmpty();
    }

    @Test
    void ShouldUseDefaultDatabaseWhenNameIsBlank() {
        BackupResult result = newExecutor().execute(BackupTarget.ofDatabase(" "), this.progress);

        assertEquals("default", result.getDatabaseName());
        assertTrue(result.getBackupName().startsWith("backup_default_"));
    }

    private static class FakeDumpTool implements DumpTool {

        volatile CommandResult failWith;

        volatile ConnectionParams lastParams;

        volatile int invocations = 0;

        @Override
        public CompletableFuture<CommandResult> dump(ConnectionParams connectionParams, Path outputFile) {
            this.invocations++;
            this.lastParams = connectionParams;
            if (this.failWith != null) {
                return CompletableFuture.completedFuture(this.failWith);
            }
            try {
                Files.write(outputFile, DUMP_CONTENT);
            } catch (IOException e) {
                return CompletableFuture.completedFuture(CommandResult.failed(-1, e.getMessage()));
            }
            return CompletableFuture.completedFuture(CommandResult.success(0, ""));
        }
    }
}
