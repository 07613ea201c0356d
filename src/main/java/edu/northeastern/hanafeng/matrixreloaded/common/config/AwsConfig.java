package edu.northeastern.hanafeng.matrixreloaded.common.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.regions.providers.DefaultAwsRegionProviderChain;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;

/**
 * AWS clients, only created when CloudWatch publishing of step reports is enabled.
 */
@Configuration
@Slf4j
@ConditionalOnProperty(prefix = "simulation.cloudwatch", name = "enabled", havingValue = "true")
public class AwsConfig {

    @Bean
    public AwsCredentialsProvider awsCredentialsProvider() {
        log.info("Creating AWS credentials provider");
        DefaultCredentialsProvider provider = DefaultCredentialsProvider.create();
        // Force eager initialization by resolving credentials now
        provider.resolveCredentials();
        log.info("AWS credentials provider initialized successfully");
        return provider;
    }

    @Bean
    public Region awsRegion() {
        Region region = new DefaultAwsRegionProviderChain().getRegion();
        log.info("Using AWS region: {}", region);
        return region;
    }

    @Bean
    public CloudWatchClient cloudWatchClient(AwsCredentialsProvider credentialsProvider, Region region) {
        log.info("Creating CloudWatchClient bean");
        return CloudWatchClient.builder()
                .credentialsProvider(credentialsProvider)
                .region(region)
                .build();
    }
}
