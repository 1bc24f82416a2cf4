package com.eyelevel.dispatcher.storage;

import com.eyelevel.dispatcher.exception.ObjectStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.core.sync.ResponseTransformer;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link ObjectStore} backed by one S3 bucket. Transfers are retried on SDK failures after the client's
 * own retry policy has given up.
 */
@Slf4j
public class S3ObjectStore implements ObjectStore {

    private final S3Client s3Client;
    private final String bucketName;

    public S3ObjectStore(final S3Client s3Client, final String bucketName) {
        this.s3Client = s3Client;
        this.bucketName = bucketName;
        log.info("S3ObjectStore initialized for bucket '{}'.", bucketName);
    }

    @Override
    public String location() {
        return "s3://" + bucketName;
    }

    @Override
    @Retryable(retryFor = {ObjectStoreException.class},
            maxAttemptsExpression = "#{${app.dispatch.storage.retry.attempts:2} + 1}",
            backoff = @Backoff(delayExpression = "#{${app.dispatch.storage.retry.delay-ms:500}}"),
            listeners = {"objectStoreRetryListener"})
    public void upload(final String key, final Path source) {
        log.debug("Uploading {} to {}/{}", source, location(), key);
        try {
            s3Client.putObject(PutObjectRequest.builder().bucket(bucketName).key(key).build(),
                               RequestBody.fromFile(source));
        } catch (SdkException e) {
            throw new ObjectStoreException("Failed to upload key '" + key + "' to " + location(), e);
        }
    }

    @Override
    @Retryable(retryFor = {ObjectStoreException.class},
            maxAttemptsExpression = "#{${app.dispatch.storage.retry.attempts:2} + 1}",
            backoff = @Backoff(delayExpression = "#{${app.dispatch.storage.retry.delay-ms:500}}"),
            listeners = {"objectStoreRetryListener"})
    public void download(final String key, final Path target) {
        log.debug("Downloading {}/{} to {}", location(), key, target);
        try {
            // ResponseTransformer.toFile refuses to overwrite, so the target is cleared first.
            Files.deleteIfExists(target);
            s3Client.getObject(GetObjectRequest.builder().bucket(bucketName).key(key).build(),
                               ResponseTransformer.toFile(target));
        } catch (SdkException | IOException e) {
            throw new ObjectStoreException("Failed to download key '" + key + "' from " + location(), e);
        }
    }

    @Override
    public boolean exists(final String key) {
        try {
            s3Client.headObject(HeadObjectRequest.builder().bucket(bucketName).key(key).build());
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (S3Exception e) {
            // HEAD responses carry no error code, a missing key may only show as a 404
            if (e.statusCode() == 404) {
                return false;
            }
            throw new ObjectStoreException("Failed to look up key '" + key + "' in " + location(), e);
        } catch (SdkException e) {
            throw new ObjectStoreException("Failed to look up key '" + key + "' in " + location(), e);
        }
    }

    @Override
    @Retryable(retryFor = {ObjectStoreException.class},
            maxAttemptsExpression = "#{${app.dispatch.storage.retry.attempts:2} + 1}",
            backoff = @Backoff(delayExpression = "#{${app.dispatch.storage.retry.delay-ms:500}}"),
            listeners = {"objectStoreRetryListener"})
    public void delete(final String key) {
        log.debug("Deleting {}/{}", location(), key);
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucketName).key(key).build());
        } catch (SdkException e) {
            throw new ObjectStoreException("Failed to delete key '" + key + "' from " + location(), e);
        }
    }
}
