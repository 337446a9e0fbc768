package com.bbthechange.watcher.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RedditPropertiesTest {

    @Test
    void noCredentials_AnonymousAndValid() {
        RedditProperties properties = new RedditProperties();

        assertThat(properties.hasCredentials()).isFalse();
        assertThat(properties.isCredentialPairComplete()).isTrue();
    }

    @Test
    void bothCredentials_Authenticated() {
        RedditProperties properties = new RedditProperties();
        properties.setClientId("id");
        properties.setClientSecret("secret");

        assertThat(properties.hasCredentials()).isTrue();
        assertThat(properties.isCredentialPairComplete()).isTrue();
    }

    @Test
    void halfCredentials_Invalid() {
        RedditProperties properties = new RedditProperties();
        properties.setClientId("id");
        properties.setClientSecret("  ");

        assertThat(properties.hasCredentials()).isFalse();
        assertThat(properties.isCredentialPairComplete()).isFalse();
    }
}
