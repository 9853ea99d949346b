package com.cred.freestyle.deadpool.config;

import io.micrometer.cloudwatch2.CloudWatchMeterRegistry;
import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatch.CloudWatchAsyncClient;

import java.util.Map;

/**
 * Exports draft and transition meters to CloudWatch.
 * Enabled with {@code cloud.aws.cloudwatch.enabled=true}; otherwise the actuator's
 * default registry collects the same meters locally.
 *
 * @author Deadpool Team
 */
@Configuration
@ConditionalOnProperty(name = "cloud.aws.cloudwatch.enabled", havingValue = "true")
public class CloudWatchConfig {

    @Value("${cloud.aws.region:us-east-1}")
    private String awsRegion;

    @Value("${cloud.aws.cloudwatch.namespace:Deadpool}")
    private String namespace;

    @Value("${cloud.aws.cloudwatch.step:PT1M}")
    private String step;

    @Value("${spring.application.name:deadpool-draft-engine}")
    private String serviceName;

    @Bean
    public CloudWatchAsyncClient cloudWatchAsyncClient() {
        return CloudWatchAsyncClient.builder()
                .region(Region.of(awsRegion))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .build();
    }

    /**
     * Registry backed by a key map; unset keys fall back to Micrometer's defaults.
     */
    @Bean
    public MeterRegistry meterRegistry(CloudWatchAsyncClient cloudWatchAsyncClient) {
        Map<String, String> settings = Map.of(
                "cloudwatch.namespace", namespace,
                "cloudwatch.step", step
        );
        io.micrometer.cloudwatch2.CloudWatchConfig exportConfig = settings::get;

        MeterRegistry registry = new CloudWatchMeterRegistry(exportConfig, Clock.SYSTEM, cloudWatchAsyncClient);
        registry.config().commonTags("service", serviceName);
        return registry;
    }
}
