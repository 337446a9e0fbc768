package com.bbthechange.watcher.service.impl;

import com.bbthechange.watcher.config.WatcherProperties;
import com.bbthechange.watcher.dto.FeedItem;
import com.bbthechange.watcher.exception.ExternalServiceException.ErrorType;
import com.bbthechange.watcher.exception.NotificationException;
import com.bbthechange.watcher.model.Subscription;
import com.bbthechange.watcher.service.MatchEmailComposer;
import com.bbthechange.watcher.service.MatchEmailComposer.MatchEmail;
import com.bbthechange.watcher.service.Notifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.sesv2.SesV2Client;
import software.amazon.awssdk.services.sesv2.model.Body;
import software.amazon.awssdk.services.sesv2.model.Content;
import software.amazon.awssdk.services.sesv2.model.Destination;
import software.amazon.awssdk.services.sesv2.model.EmailContent;
import software.amazon.awssdk.services.sesv2.model.Message;
import software.amazon.awssdk.services.sesv2.model.SendEmailRequest;
import software.amazon.awssdk.services.sesv2.model.SendEmailResponse;
import software.amazon.awssdk.services.sesv2.model.SesV2Exception;

/**
 * Sends match notifications as email through Amazon SES.
 */
@Service
public class EmailNotifier implements Notifier {

    private static final Logger logger = LoggerFactory.getLogger(EmailNotifier.class);

    private final SesV2Client sesClient;
    private final MatchEmailComposer composer;
    private final String fromAddress;
    private final boolean dryRun;

    public EmailNotifier(SesV2Client sesClient, MatchEmailComposer composer, WatcherProperties properties) {
        this.sesClient = sesClient;
        this.composer = composer;
        this.fromAddress = properties.getNotifier().getFromAddress();
        this.dryRun = properties.getNotifier().isDryRun();

        if (dryRun) {
            logger.info("Email notifier in dry-run mode: notifications will be logged, not sent");
        } else if (fromAddress == null || fromAddress.isBlank()) {
            throw new IllegalStateException("watcher.notifier.from-address must be set unless dry-run is enabled");
        }
    }

    @Override
    public void send(Subscription subscription, FeedItem item, String filter) {
        String recipient = subscription.getSubscriberEmail();
        MatchEmail email = composer.compose(item.getSourceUnit(), filter, item);

        if (dryRun) {
            logger.info("[Email Dry Run] To {}: {}", recipient, email.subject());
            logger.debug("[Email Dry Run] Body:\n{}", email.textBody());
            return;
        }

        try {
            SendEmailRequest request = SendEmailRequest.builder()
                .fromEmailAddress(fromAddress)
                .destination(Destination.builder().toAddresses(recipient).build())
                .content(EmailContent.builder()
                    .simple(Message.builder()
                        .subject(utf8(email.subject()))
                        .body(Body.builder()
                            .html(utf8(email.htmlBody()))
                            .text(utf8(email.textBody()))
                            .build())
                        .build())
                    .build())
                .build();

            SendEmailResponse response = sesClient.sendEmail(request);
            logger.info("Email sent to {} for item {} with messageId: {}",
                recipient, item.getId(), response.messageId());

        } catch (SesV2Exception e) {
            ErrorType errorType = classify(e);
            logger.error("Failed to send email to {} for item {} ({}): {}",
                recipient, item.getId(), errorType, e.getMessage());
            throw new NotificationException(errorType, recipient, "SES rejected email: " + e.getMessage(), e);
        } catch (SdkClientException e) {
            logger.error("Could not reach SES sending to {} for item {}: {}", recipient, item.getId(), e.getMessage());
            throw new NotificationException(ErrorType.UNAVAILABLE, recipient, "SES unreachable", e);
        }
    }

    static ErrorType classify(SesV2Exception e) {
        if (e.isThrottlingException() || e.statusCode() == 429) {
            return ErrorType.RATE_LIMITED;
        }
        if (e.statusCode() >= 500) {
            return ErrorType.UNAVAILABLE;
        }
        if (e.statusCode() == 401 || e.statusCode() == 403) {
            return ErrorType.UNAUTHORIZED;
        }
        return ErrorType.REJECTED;
    }

    private static Content utf8(String data) {
        return Content.builder().data(data).charset("UTF-8").build();
    }
}
