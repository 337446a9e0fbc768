package com.bbthechange.watcher.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

@Component
@Validated
@ConfigurationProperties(prefix = "reddit")
public class RedditProperties {

    private String clientId;

    private String clientSecret;

    @NotBlank
    private String userAgent = "feed-watcher/1.0";

    @NotBlank
    private String publicBaseUrl = "https://www.reddit.com";

    @NotBlank
    private String oauthBaseUrl = "https://oauth.reddit.com";

    @NotBlank
    private String tokenUrl = "https://www.reddit.com/api/v1/access_token";

    @NotNull
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration requestTimeout = Duration.ofSeconds(10);

    public boolean hasCredentials() {
        return isSet(clientId) && isSet(clientSecret);
    }

    @AssertTrue(message = "reddit.client-id and reddit.client-secret must be set together")
    public boolean isCredentialPairComplete() {
        return isSet(clientId) == isSet(clientSecret);
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }

    public String getClientId() {
        return clientId;
    }

    public void setClientId(String clientId) {
        this.clientId = clientId;
    }

    public String getClientSecret() {
        return clientSecret;
    }

    public void setClientSecret(String clientSecret) {
        this.clientSecret = clientSecret;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public String getPublicBaseUrl() {
        return publicBaseUrl;
    }

    public void setPublicBaseUrl(String publicBaseUrl) {
        this.publicBaseUrl = publicBaseUrl;
    }

    public String getOauthBaseUrl() {
        return oauthBaseUrl;
    }

    public void setOauthBaseUrl(String oauthBaseUrl) {
        this.oauthBaseUrl = oauthBaseUrl;
    }

    public String getTokenUrl() {
        return tokenUrl;
    }

    public void setTokenUrl(String tokenUrl) {
        this.tokenUrl = tokenUrl;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }
}
