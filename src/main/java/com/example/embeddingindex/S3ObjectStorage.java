package com.example.embeddingindex;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.core.sync.ResponseTransformer;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * S3-compatible object storage (AWS S3, Cloudflare R2, MinIO).
 */
@Slf4j
public class S3ObjectStorage implements ObjectStorage {

    private final S3Client s3;
    private final S3Presigner presigner;
    private final String bucket;

    public S3ObjectStorage(S3Client s3, S3Presigner presigner, String bucket) {
        if (bucket == null || bucket.isBlank()) {
            throw new IllegalArgumentException("embeddingindex.storage.s3.bucket must be set");
        }
        this.s3 = s3;
        this.presigner = presigner;
        this.bucket = bucket;
    }

    @Override
    public void put(String key, byte[] data, String contentType) {
        try {
            s3.putObject(PutObjectRequest.builder().bucket(bucket).key(key).contentType(contentType).build(),
                    RequestBody.fromBytes(data));
        } catch (SdkException e) {
            throw new StorageIOException("Failed to put s3://" + bucket + "/" + key, e);
        }
    }

    @Override
    public byte[] get(String key) {
        try {
            ResponseBytes<GetObjectResponse> bytes =
                    s3.getObjectAsBytes(GetObjectRequest.builder().bucket(bucket).key(key).build());
            return bytes.asByteArray();
        } catch (NoSuchKeyException e) {
            throw NotFoundException.object(key);
        } catch (SdkException e) {
            throw new StorageIOException("Failed to get s3://" + bucket + "/" + key, e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            s3.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
        } catch (SdkException e) {
            throw new StorageIOException("Failed to delete s3://" + bucket + "/" + key, e);
        }
    }

    @Override
    public boolean exists(String key) {
        try {
            s3.headObject(HeadObjectRequest.builder().bucket(bucket).key(key).build());
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) return false;
            throw new StorageIOException("Failed to stat s3://" + bucket + "/" + key, e);
        } catch (SdkException e) {
            throw new StorageIOException("Failed to stat s3://" + bucket + "/" + key, e);
        }
    }

    @Override
    public void upload(String key, Path source) {
        try {
            s3.putObject(PutObjectRequest.builder().bucket(bucket).key(key).build(), RequestBody.fromFile(source));
            log.debug("Uploaded {} to s3://{}/{}", source, bucket, key);
        } catch (SdkException e) {
            throw new StorageIOException("Failed to upload " + source + " to s3://" + bucket + "/" + key, e);
        }
    }

    @Override
    public boolean download(String key, Path target) {
        try {
            // toFile refuses to overwrite
            Files.deleteIfExists(target);
            s3.getObject(GetObjectRequest.builder().bucket(bucket).key(key).build(), ResponseTransformer.toFile(target));
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (IOException | SdkException e) {
            throw new StorageIOException("Failed to download s3://" + bucket + "/" + key, e);
        }
    }

    @Override
    public URI presignedUrl(String key, Duration ttl) {
        if (!exists(key)) throw NotFoundException.object(key);
        try {
            GetObjectPresignRequest req = GetObjectPresignRequest.builder()
                    .signatureDuration(ttl)
                    .getObjectRequest(GetObjectRequest.builder().bucket(bucket).key(key).build())
                    .build();
            return presigner.presignGetObject(req).url().toURI();
        } catch (SdkException | java.net.URISyntaxException e) {
            throw new StorageIOException("Failed to presign s3://" + bucket + "/" + key, e);
        }
    }
}
