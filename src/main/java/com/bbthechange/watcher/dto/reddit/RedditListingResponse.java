package com.bbthechange.watcher.dto.reddit;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * DTO for the Reddit listing API response.
 * Maps the JSON response from GET /r/{subreddit}/new
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RedditListingResponse {

    private String kind;

    private ListingData data;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ListingData {
        private List<Child> children = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Child {
        private String kind;
        private Post data;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Post {

        /**
         * Base-36 post id, e.g. "1abc2d".
         */
        private String id;

        private String subreddit;

        private String title;

        /**
         * Markdown body of a self post; empty for link posts.
         */
        private String selftext;

        /**
         * Creation time in fractional Unix epoch seconds.
         */
        @JsonProperty("created_utc")
        private Double createdUtc;

        /**
         * Site-relative path, e.g. "/r/Watchexchange/comments/1abc2d/...".
         */
        private String permalink;
    }
}
