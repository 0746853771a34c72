package com.dbguardian.server.service.storage;

import com.dbguardian.server.exception.StorageException;
import io.minio.BucketExistsArgs;
import io.minio.ListObjectsArgs;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import io.minio.RemoveObjectArgs;
import io.minio.Result;
import io.minio.StatObjectArgs;
import io.minio.StatObjectResponse;
import io.minio.UploadObjectArgs;
import io.minio.errors.ErrorResponseException;
import io.minio.messages.Item;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
@Component
public class MinioObjectStore implements ObjectStore {

    private static final String NO_SUCH_KEY = "NoSuchKey";

    private final MinioClient minioClient;

    private final String bucket;

    private volatile boolean bucketChecked = false;

    @Autowired
    public MinioObjectStore(
            MinioClient minioClient,
            @Value("${dbguardian.server.storage.minio.bucket:backups}") String bucket) {
        this.minioClient = minioClient;
        this.bucket = bucket;
    }

    @Override
    public void put(String key, Path file) throws StorageException {
        try {
            this.ensureBucket();
            this.minioClient.uploadObject(UploadObjectArgs.builder()
                    .bucket(this.bucket)
                    .object(key)
                    .filename(file.toAbsolutePath().toString())
                    .build());
        } catch (StorageException e) {
            throw e;
        } catch (Exception e) {
            throw new StorageException("put failed. bucket is %s, key is %s".formatted(this.bucket, key), e);
        }
    }

    @Override
    public List<StoredObject> list(String prefix) throws StorageException {
        List<StoredObject> result = new ArrayList<>();
        try {
            ListObjectsArgs.Builder builder = ListObjectsArgs.builder().bucket(this.bucket).recursive(true);
            if (StringUtils.isNotBlank(prefix)) {
                builder.prefix(prefix);
            }
            for (Result<Item> itemResult : this.minioClient.listObjects(builder.build())) {
                Item item = itemResult.get();
                if (item.isDir()) {
                    continue;
                }
                Instant lastModified = item.lastModified() == null ? null : item.lastModified().toInstant();
                result.add(new StoredObject(item.objectName(), item.size(), lastModified));
            }
            return result;
        } catch (Exception e) {
            throw new StorageException("list failed. bucket is %s, prefix is %s".formatted(this.bucket, prefix), e);
        }
    }

    @Override
    public Optional<StoredObject> stat(String key) throws StorageException {
        try {
            StatObjectResponse response = this.minioClient.statObject(StatObjectArgs.builder()
                    .bucket(this.bucket)
                    .object(key)
                    .build());
            Instant lastModified = response.lastModified() == null ? null : response.lastModified().toInstant();
            return Optional.of(new StoredObject(key, response.size(), lastModified));
        } catch (ErrorResponseException e) {
            if (NO_SUCH_KEY.equals(e.errorResponse().code())) {
                return Optional.empty();
            }
            throw new StorageException("stat failed. bucket is %s, key is %s".formatted(this.bucket, key), e);
        } catch (Exception e) {
            throw new StorageException("stat failed. bucket is %s, key is %s".formatted(this.bucket, key), e);
        }
    }

    @Override
    public void remove(String key) throws StorageException {
        try {
            this.minioClient.removeObject(RemoveObjectArgs.builder()
                    .bucket(this.bucket)
                    .object(key)
                    .build());
        } catch (Exception e) {
            throw new StorageException("remove failed. bucket is %s, key is %s".formatted(this.bucket, key), e);
        }
    }

    private void ensureBucket() throws StorageException {
        if (this.bucketChecked) {
            return;
        }
        try {
            boolean exists = this.minioClient.bucketExists(BucketExistsArgs.builder().bucket(this.bucket).build());
            if (!exists) {
                this.minioClient.makeBucket(MakeBucketArgs.builder().bucket(this.bucket).build());
                log.info("bucket {} created", this.bucket);
            }
            this.bucketChecked = true;
        } catch (Exception e) {
            throw new StorageException("ensureBucket failed. bucket is %s".formatted(this.bucket), e);
        }
    }
}
