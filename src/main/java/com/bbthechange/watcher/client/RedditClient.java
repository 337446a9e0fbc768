package com.bbthechange.watcher.client;

import com.bbthechange.watcher.config.RedditProperties;
import com.bbthechange.watcher.dto.FeedItem;
import com.bbthechange.watcher.dto.reddit.RedditListingResponse;
import com.bbthechange.watcher.dto.reddit.RedditTokenResponse;
import com.bbthechange.watcher.exception.FeedException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Objects;

/**
 * Client for the Reddit listing API.
 * Reads /r/{subreddit}/new either anonymously or with an app-only OAuth token when credentials are configured.
 * Does not retry on its own; failures are classified through FeedException so the caller can decide.
 */
@Component
public class RedditClient implements FeedGateway {

    private static final Logger logger = LoggerFactory.getLogger(RedditClient.class);

    private static final String REDDIT_WEB_URL = "https://www.reddit.com";
    private static final int MAX_PAGE_SIZE = 100;
    private static final Duration TOKEN_REFRESH_MARGIN = Duration.ofSeconds(60);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final RedditProperties properties;
    private final Clock clock;

    private String accessToken;
    private Instant accessTokenExpiresAt = Instant.EPOCH;

    @Autowired
    public RedditClient(ObjectMapper objectMapper, RedditProperties properties) {
        this(HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NEVER)
                .build(),
            objectMapper, properties, Clock.systemUTC());
    }

    /**
     * Constructor for testing with custom HttpClient.
     */
    RedditClient(HttpClient httpClient, ObjectMapper objectMapper, RedditProperties properties, Clock clock) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public List<FeedItem> fetchLatest(String sourceUnit, int limit) {
        int pageSize = Math.max(1, Math.min(limit, MAX_PAGE_SIZE));
        if (pageSize != limit) {
            logger.debug("Clamped fetch limit {} to {} for r/{}", limit, pageSize, sourceUnit);
        }

        boolean authenticated = properties.hasCredentials();
        HttpResponse<String> response = authenticated
                ? getAuthenticated(sourceUnit, pageSize)
                : send(listingRequest(publicListingUrl(sourceUnit, pageSize), null), sourceUnit);

        int statusCode = response.statusCode();
        logger.debug("Reddit listing response status: {} for r/{}", statusCode, sourceUnit);
        checkStatus(statusCode, sourceUnit);

        List<FeedItem> items = parseListing(response.body(), sourceUnit);
        logger.info("Fetched {} items from r/{}", items.size(), sourceUnit);
        return items;
    }

    private HttpResponse<String> getAuthenticated(String sourceUnit, int pageSize) {
        URI url = oauthListingUrl(sourceUnit, pageSize);
        HttpResponse<String> response = send(listingRequest(url, currentToken(sourceUnit)), sourceUnit);

        if (response.statusCode() == 401) {
            // Token revoked or expired early; fetch a fresh one once
            logger.info("Reddit rejected cached access token; refreshing");
            invalidateToken();
            response = send(listingRequest(url, currentToken(sourceUnit)), sourceUnit);
        }
        return response;
    }

    private void checkStatus(int statusCode, String sourceUnit) {
        if (statusCode >= 200 && statusCode < 300) {
            return;
        }
        if (statusCode == 429) {
            throw FeedException.rateLimited(sourceUnit);
        }
        if (statusCode == 401 || statusCode == 403) {
            throw FeedException.unauthorized(sourceUnit, statusCode);
        }
        // Reddit redirects unknown subreddits to search
        if (statusCode == 404 || (statusCode >= 300 && statusCode < 400)) {
            throw FeedException.notFound(sourceUnit);
        }
        if (statusCode >= 500) {
            throw FeedException.unavailable(sourceUnit, "HTTP " + statusCode, null);
        }
        throw new FeedException(FeedException.ErrorType.REJECTED, sourceUnit,
                "Feed API returned HTTP " + statusCode + " for r/" + sourceUnit);
    }

    /**
     * Map a listing body to feed items, dropping children that are not posts or lack an id or timestamp.
     */
    List<FeedItem> parseListing(String body, String sourceUnit) {
        RedditListingResponse listing;
        try {
            listing = objectMapper.readValue(body, RedditListingResponse.class);
        } catch (JsonProcessingException e) {
            throw FeedException.malformed(sourceUnit, e);
        }
        if (listing == null || listing.getData() == null || listing.getData().getChildren() == null) {
            throw FeedException.malformed(sourceUnit, null);
        }

        List<FeedItem> items = new ArrayList<>();
        for (RedditListingResponse.Child child : listing.getData().getChildren()) {
            RedditListingResponse.Post post = child == null ? null : child.getData();
            if (post == null || post.getId() == null || post.getCreatedUtc() == null) {
                logger.warn("Skipping listing entry without id or timestamp in r/{}", sourceUnit);
                continue;
            }
            items.add(FeedItem.builder()
                    .id(post.getId())
                    .sourceUnit(sourceUnit)
                    .title(Objects.toString(post.getTitle(), ""))
                    .body(Objects.toString(post.getSelftext(), ""))
                    .createdAt(Instant.ofEpochMilli(Math.round(post.getCreatedUtc() * 1000)))
                    .permalink(post.getPermalink() == null ? null : REDDIT_WEB_URL + post.getPermalink())
                    .build());
        }
        return items;
    }

    private synchronized String currentToken(String sourceUnit) {
        if (accessToken != null && clock.instant().isBefore(accessTokenExpiresAt.minus(TOKEN_REFRESH_MARGIN))) {
            return accessToken;
        }

        String credentials = properties.getClientId() + ":" + properties.getClientSecret();
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(properties.getTokenUrl()))
                .header("User-Agent", properties.getUserAgent())
                .header("Authorization", "Basic " + Base64.getEncoder()
                        .encodeToString(credentials.getBytes(StandardCharsets.UTF_8)))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .timeout(properties.getRequestTimeout())
                .POST(HttpRequest.BodyPublishers.ofString("grant_type=client_credentials"))
                .build();

        HttpResponse<String> response = send(request, sourceUnit);
        int statusCode = response.statusCode();
        logger.debug("Reddit token response status: {}", statusCode);
        checkStatus(statusCode, sourceUnit);

        RedditTokenResponse token;
        try {
            token = objectMapper.readValue(response.body(), RedditTokenResponse.class);
        } catch (JsonProcessingException e) {
            throw FeedException.malformed(sourceUnit, e);
        }
        if (token == null || token.getAccessToken() == null) {
            throw FeedException.unauthorized(sourceUnit, statusCode);
        }

        long lifetimeSeconds = token.getExpiresIn() == null ? 3600 : token.getExpiresIn();
        accessToken = token.getAccessToken();
        accessTokenExpiresAt = clock.instant().plusSeconds(lifetimeSeconds);
        logger.info("Obtained Reddit access token valid for {}s", lifetimeSeconds);
        return accessToken;
    }

    private synchronized void invalidateToken() {
        accessToken = null;
        accessTokenExpiresAt = Instant.EPOCH;
    }

    private HttpRequest listingRequest(URI url, String bearerToken) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(url)
                .header("User-Agent", properties.getUserAgent())
                .timeout(properties.getRequestTimeout())
                .GET();
        if (bearerToken != null) {
            builder.header("Authorization", "Bearer " + bearerToken);
        }
        return builder.build();
    }

    private HttpResponse<String> send(HttpRequest request, String sourceUnit) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw FeedException.timeout(sourceUnit, e);
        } catch (IOException e) {
            throw FeedException.unavailable(sourceUnit, e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw FeedException.unavailable(sourceUnit, "interrupted", e);
        }
    }

    private URI publicListingUrl(String sourceUnit, int limit) {
        return listingUri(properties.getPublicBaseUrl(), sourceUnit, "new.json", limit);
    }

    private URI oauthListingUrl(String sourceUnit, int limit) {
        return listingUri(properties.getOauthBaseUrl(), sourceUnit, "new", limit);
    }

    private static URI listingUri(String baseUrl, String sourceUnit, String listing, int limit) {
        return UriComponentsBuilder.fromUriString(baseUrl)
                .pathSegment("r", sourceUnit, listing)
                .queryParam("limit", limit)
                .queryParam("raw_json", 1)
                .encode()
                .build()
                .toUri();
    }
}
