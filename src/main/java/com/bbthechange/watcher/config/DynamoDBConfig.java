package com.bbthechange.watcher.config;

import com.amazonaws.xray.interceptors.TracingInterceptor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

import java.net.URI;

@Configuration
public class DynamoDBConfig {

    @Value("${aws.region:us-east-1}")
    private String region;

    @Value("${aws.dynamodb.endpoint:}")
    private String endpoint;

    @Value("${xray.enabled:false}")
    private boolean xrayEnabled;

    @Bean
    public DynamoDbClient dynamoDbClient() {
        var builder = DynamoDbClient.builder()
                .region(Region.of(region));

        if (!endpoint.isEmpty()) {
            // For DynamoDB Local, use dummy credentials
            builder.endpointOverride(URI.create(endpoint))
                   .credentialsProvider(StaticCredentialsProvider.create(
                       AwsBasicCredentials.create("dummykey", "dummysecret")
                   ));
        } else {
            builder.credentialsProvider(DefaultCredentialsProvider.create());
        }

        if (xrayEnabled) {
            builder.overrideConfiguration(c -> c.addExecutionInterceptor(new TracingInterceptor()));
        }

        return builder.build();
    }
}
