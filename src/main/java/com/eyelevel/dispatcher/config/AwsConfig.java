package com.eyelevel.dispatcher.config;

import com.eyelevel.dispatcher.storage.ObjectStore;
import com.eyelevel.dispatcher.storage.S3ObjectStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryMode;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;

/**
 * Configures the AWS SDK clients for S3 and SQS and the three object stores built on top of S3.
 * The credential strategy is selected from the active Spring profile.
 */
@Slf4j
@Configuration
public class AwsConfig {

    @Value("${aws.region}")
    private String awsRegion;

    @Value("${aws.access-key:}")
    private String accessKey;

    @Value("${aws.secret-key:}")
    private String secretKey;

    @Value("${aws.s3.retry-count}")
    private int s3RetryCount;

    /**
     * Determines which credentials provider to use based on the active Spring profile.
     */
    @Bean
    public AwsCredentialsProvider awsCredentialsProvider(Environment environment) {
        if (environment.acceptsProfiles(Profiles.of("local"))) {
            log.info("Local profile active. Using StaticCredentialsProvider.");
            if (!StringUtils.hasText(accessKey) || !StringUtils.hasText(secretKey)) {
                throw new IllegalArgumentException(
                        "aws.access-key and aws.secret-key must be set for the 'local' profile.");
            }
            return StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKey, secretKey));
        } else {
            log.info("Non-local profile active. Using DefaultCredentialsProvider (for IAM role).");
            return DefaultCredentialsProvider.create();
        }
    }

    /**
     * Shared override configuration with an adaptive retry policy for the synchronous S3 client.
     */
    @Bean
    public ClientOverrideConfiguration clientOverrideConfiguration() {
        RetryPolicy adaptiveRetryPolicy = RetryPolicy.forRetryMode(RetryMode.ADAPTIVE).toBuilder()
                                                     .numRetries(s3RetryCount).build();

        return ClientOverrideConfiguration.builder().retryPolicy(adaptiveRetryPolicy).build();
    }

    @Bean
    public S3Client s3Client(AwsCredentialsProvider credentialsProvider,
                             ClientOverrideConfiguration clientOverrideConfig) {
        log.info("Configuring AWS S3Client for region: {}", awsRegion);
        return S3Client.builder().credentialsProvider(credentialsProvider)
                       .region(Region.of(awsRegion)).overrideConfiguration(clientOverrideConfig).build();
    }

    @Bean
    public SqsAsyncClient sqsAsyncClient(AwsCredentialsProvider credentialsProvider) {
        log.info("Configuring AWS SqsAsyncClient for region: {}", awsRegion);
        return SqsAsyncClient.builder().region(Region.of(awsRegion)).credentialsProvider(credentialsProvider).build();
    }

    /**
     * Raw submitted and extracted files, keyed by sha256.
     */
    @Bean("fileStore")
    public ObjectStore fileStore(S3Client s3Client, DispatchConfig dispatchConfig) {
        return new S3ObjectStore(s3Client, dispatchConfig.getStorage().getFileBucket());
    }

    /**
     * Cached service artifacts.
     */
    @Bean("cacheStore")
    public ObjectStore cacheStore(S3Client s3Client, DispatchConfig dispatchConfig) {
        return new S3ObjectStore(s3Client, dispatchConfig.getStorage().getCacheBucket());
    }

    /**
     * Cold storage for archived submissions.
     */
    @Bean("archiveStore")
    public ObjectStore archiveStore(S3Client s3Client, DispatchConfig dispatchConfig) {
        return new S3ObjectStore(s3Client, dispatchConfig.getStorage().getArchiveBucket());
    }
}
