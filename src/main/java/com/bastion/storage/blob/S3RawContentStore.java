package com.bastion.storage.blob;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Raw content store backed by an S3-compatible bucket
 */
public class S3RawContentStore implements RawContentStore {
    private static final Logger logger = LoggerFactory.getLogger(S3RawContentStore.class);

    private final S3Client s3Client;
    private final String bucketName;
    private final String keyPrefix;

    public S3RawContentStore(S3Client s3Client, String bucketName, String keyPrefix) {
        this.s3Client = s3Client;
        this.bucketName = bucketName;
        this.keyPrefix = keyPrefix != null ? keyPrefix : "";
    }

    @Override
    public void put(String key, String content) {
        String objectKey = objectKey(key);
        try {
            PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucketName)
                .key(objectKey)
                .contentType("application/json")
                .build();

            s3Client.putObject(request, RequestBody.fromString(content, StandardCharsets.UTF_8));
            logger.info("Stored raw content: s3://{}/{}", bucketName, objectKey);

        } catch (SdkException e) {
            logger.error("Failed to store raw content s3://{}/{}", bucketName, objectKey, e);
            throw new RawContentStoreException("Failed to store raw content", key, e);
        }
    }

    @Override
    public Optional<String> get(String key) {
        String objectKey = objectKey(key);
        try {
            GetObjectRequest request = GetObjectRequest.builder()
                .bucket(bucketName)
                .key(objectKey)
                .build();

            ResponseBytes<GetObjectResponse> bytes = s3Client.getObjectAsBytes(request);
            return Optional.of(bytes.asUtf8String());

        } catch (NoSuchKeyException e) {
            logger.warn("Raw content not found: s3://{}/{}", bucketName, objectKey);
            return Optional.empty();

        } catch (SdkException e) {
            logger.error("Failed to read raw content s3://{}/{}", bucketName, objectKey, e);
            throw new RawContentStoreException("Failed to read raw content", key, e);
        }
    }

    private String objectKey(String key) {
        return keyPrefix + key;
    }
}
