package com.bbthechange.watcher.service;

import com.bbthechange.watcher.dto.FeedItem;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Builds the subject and bodies of a match notification email.
 * Feed text is untrusted, so every value placed into the HTML part is escaped.
 */
@Component
public class MatchEmailComposer {

    static final int MAX_SUBJECT_TITLE_LENGTH = 100;
    static final int MAX_BODY_LENGTH = 2000;

    private static final DateTimeFormatter CREATED_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    private final ZoneId zoneId;

    public MatchEmailComposer() {
        this(ZoneId.systemDefault());
    }

    // For testing
    MatchEmailComposer(ZoneId zoneId) {
        this.zoneId = zoneId;
    }

    public MatchEmail compose(String sourceUnit, String filter, FeedItem item) {
        String title = Objects.toString(item.getTitle(), "");
        String body = truncate(Objects.toString(item.getBody(), ""), MAX_BODY_LENGTH);
        String created = item.getCreatedAt() == null
                ? "unknown"
                : CREATED_FORMAT.format(item.getCreatedAt().atZone(zoneId));
        String link = Objects.toString(item.getPermalink(), "");

        String subject = String.format("[r/%s] '%s' match: %s",
                sourceUnit, filter, truncate(title, MAX_SUBJECT_TITLE_LENGTH));

        String html = "<p><b>Subreddit:</b> r/" + HtmlUtils.htmlEscape(sourceUnit) + "<br>"
                + "<b>Keyword:</b> " + HtmlUtils.htmlEscape(filter) + "<br>"
                + "<b>Title:</b> " + HtmlUtils.htmlEscape(title) + "<br>"
                + "<b>Posted:</b> " + HtmlUtils.htmlEscape(created) + "<br>"
                + "<b>Link:</b> <a href=\"" + HtmlUtils.htmlEscape(link) + "\">"
                + HtmlUtils.htmlEscape(link) + "</a></p>"
                + "<pre style=\"white-space:pre-wrap\">" + HtmlUtils.htmlEscape(body) + "</pre>";

        String text = "Subreddit: r/" + sourceUnit + "\n"
                + "Keyword: " + filter + "\n"
                + "Title: " + title + "\n"
                + "Posted: " + created + "\n"
                + "Link: " + link + "\n\n"
                + body;

        return new MatchEmail(subject, html, text);
    }

    private static String truncate(String value, int maxLength) {
        return value.length() <= maxLength ? value : value.substring(0, maxLength);
    }

    public record MatchEmail(String subject, String htmlBody, String textBody) {
    }
}
