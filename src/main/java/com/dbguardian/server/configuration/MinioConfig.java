package com.dbguardian.server.configuration;

import io.minio.MinioClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MinioConfig {

    @Value("${dbguardian.server.storage.minio.endpoint:http://minio:9000}")
    private String endpoint;

    @Value("${dbguardian.server.storage.minio.accessKey:}")
    private String accessKey;

    @Value("${dbguardian.server.storage.minio.secretKey:}")
    private String secretKey;

    @Bean
    public MinioClient minioClient() {
        return MinioClient.builder()
                .endpoint(this.endpoint)
                .credentials(this.accessKey, this.secretKey)
                .build();
    }
}
