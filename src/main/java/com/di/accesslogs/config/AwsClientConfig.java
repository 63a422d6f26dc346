package com.di.accesslogs.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.athena.AthenaClient;
import software.amazon.awssdk.services.athena.AthenaClientBuilder;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

/**
 * Registers the AWS clients backed by the default credentials provider chain (instance/task role,
 * profile, environment). The region comes from {@code cdnlogs.aws-region} when set, otherwise from
 * the default region chain ({@code AWS_REGION}, profile).
 */
@Configuration
public class AwsClientConfig {

    private final String region;

    public AwsClientConfig(@Value("${cdnlogs.aws-region:}") String region) {
        this.region = region;
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(S3Client.class)
    public S3Client s3Client() {
        S3ClientBuilder builder = S3Client.builder();
        if (!region.isBlank()) {
            builder.region(Region.of(region.trim()));
        }
        return builder.build();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(AthenaClient.class)
    public AthenaClient athenaClient() {
        AthenaClientBuilder builder = AthenaClient.builder();
        if (!region.isBlank()) {
            builder.region(Region.of(region.trim()));
        }
        return builder.build();
    }
}
