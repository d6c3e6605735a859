package com.bastion.storage.blob;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

import java.net.URI;

/**
 * Raw content retention, enabled with bastion.storage.raw.enabled=true.
 *
 * Credentials come from the SDK default provider chain. Setting an endpoint
 * switches to path-style access for S3-compatible stores.
 */
@Configuration
@ConditionalOnProperty(prefix = "bastion.storage.raw", name = "enabled", havingValue = "true")
public class BlobStoreConfig {
    private static final Logger logger = LoggerFactory.getLogger(BlobStoreConfig.class);

    @Value("${bastion.storage.s3.bucket:bastion-raw-uploads}")
    private String bucketName;

    @Value("${bastion.storage.s3.region:us-east-1}")
    private String region;

    @Value("${bastion.storage.s3.endpoint:}")
    private String endpoint;

    @Value("${bastion.storage.s3.key-prefix:}")
    private String keyPrefix;

    @Bean(destroyMethod = "close")
    public S3Client rawContentS3Client() {
        S3ClientBuilder builder = S3Client.builder()
            .region(Region.of(region));

        if (!endpoint.isBlank()) {
            builder.endpointOverride(URI.create(endpoint))
                .forcePathStyle(true);
        }

        logger.info("Raw content retention enabled: bucket={}, region={}, endpoint={}",
            bucketName, region, endpoint.isBlank() ? "default" : endpoint);
        return builder.build();
    }

    @Bean
    public RawContentStore rawContentStore(S3Client rawContentS3Client) {
        return new S3RawContentStore(rawContentS3Client, bucketName, keyPrefix);
    }
}
