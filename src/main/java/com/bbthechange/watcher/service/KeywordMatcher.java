package com.bbthechange.watcher.service;

import com.bbthechange.watcher.dto.FeedItem;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Decides whether a feed item matches a keyword filter.
 * The filter is a literal, case-insensitive substring of the title or the body; regex characters carry no meaning.
 */
@Component
public class KeywordMatcher {

    private final Map<String, Pattern> patterns = new ConcurrentHashMap<>();

    public boolean matches(FeedItem item, String filter) {
        Pattern pattern = patterns.computeIfAbsent(filter,
                f -> Pattern.compile(Pattern.quote(f), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));

        return find(pattern, item.getTitle()) || find(pattern, item.getBody());
    }

    private static boolean find(Pattern pattern, String text) {
        return pattern.matcher(text == null ? "" : text).find();
    }
}
