package com.bbthechange.watcher.config;

import com.amazonaws.xray.interceptors.TracingInterceptor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sesv2.SesV2Client;
import software.amazon.awssdk.services.sesv2.SesV2ClientBuilder;

@Configuration
public class SesConfig {

    @Value("${aws.region:us-east-1}")
    private String region;

    @Value("${xray.enabled:false}")
    private boolean xrayEnabled;

    @Bean
    public SesV2Client sesV2Client() {
        SesV2ClientBuilder builder = SesV2Client.builder()
                .region(Region.of(region))
                .credentialsProvider(DefaultCredentialsProvider.create());

        // Add X-Ray tracing if enabled
        if (xrayEnabled) {
            builder.overrideConfiguration(c -> c.addExecutionInterceptor(new TracingInterceptor()));
        }

        return builder.build();
    }
}
