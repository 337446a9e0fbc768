package com.bbthechange.watcher.service.impl;

import com.bbthechange.watcher.client.FeedGateway;
import com.bbthechange.watcher.config.WatcherProperties;
import com.bbthechange.watcher.dto.FeedItem;
import com.bbthechange.watcher.dto.SubscriptionGroup;
import com.bbthechange.watcher.dto.poll.CycleResult;
import com.bbthechange.watcher.dto.poll.CycleStatus;
import com.bbthechange.watcher.dto.poll.GroupResult;
import com.bbthechange.watcher.exception.LockException;
import com.bbthechange.watcher.lock.CycleLock;
import com.bbthechange.watcher.lock.LockToken;
import com.bbthechange.watcher.lock.NoOpCycleLock;
import com.bbthechange.watcher.model.Checkpoint;
import com.bbthechange.watcher.model.Delivery;
import com.bbthechange.watcher.model.Subscription;
import com.bbthechange.watcher.repository.CheckpointRepository;
import com.bbthechange.watcher.repository.DeliveryRepository;
import com.bbthechange.watcher.repository.SubscriptionRepository;
import com.bbthechange.watcher.service.CycleOptions;
import com.bbthechange.watcher.service.KeywordMatcher;
import com.bbthechange.watcher.service.Notifier;
import com.bbthechange.watcher.service.PollerService;
import com.bbthechange.watcher.service.RetryExecutor;
import com.bbthechange.watcher.service.SubscriptionAggregator;
import com.bbthechange.watcher.util.SourceUnitNormalizer;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.stream.Collectors;

/**
 * Implementation of PollerService.
 * Processes groups strictly one after another; a failing group is logged and left
 * at its old checkpoint so the next cycle replays it, while the remaining groups carry on.
 */
@Service
public class PollerServiceImpl implements PollerService {

    private static final Logger logger = LoggerFactory.getLogger(PollerServiceImpl.class);

    private final SubscriptionRepository subscriptionRepository;
    private final CheckpointRepository checkpointRepository;
    private final DeliveryRepository deliveryRepository;
    private final FeedGateway feedGateway;
    private final Notifier notifier;
    private final SubscriptionAggregator aggregator;
    private final KeywordMatcher matcher;
    private final RetryExecutor retryExecutor;
    private final CycleLock cycleLock;
    private final CycleLock bypassLock = new NoOpCycleLock();
    private final MeterRegistry meterRegistry;
    private final int fetchLimit;

    @Autowired
    public PollerServiceImpl(
            SubscriptionRepository subscriptionRepository,
            CheckpointRepository checkpointRepository,
            DeliveryRepository deliveryRepository,
            FeedGateway feedGateway,
            Notifier notifier,
            SubscriptionAggregator aggregator,
            KeywordMatcher matcher,
            RetryExecutor retryExecutor,
            CycleLock cycleLock,
            MeterRegistry meterRegistry,
            WatcherProperties properties) {
        this(subscriptionRepository, checkpointRepository, deliveryRepository, feedGateway, notifier,
                aggregator, matcher, retryExecutor, cycleLock, meterRegistry,
                properties.getPoller().getFetchLimit());
    }

    /**
     * Package-private constructor for testing.
     */
    PollerServiceImpl(
            SubscriptionRepository subscriptionRepository,
            CheckpointRepository checkpointRepository,
            DeliveryRepository deliveryRepository,
            FeedGateway feedGateway,
            Notifier notifier,
            SubscriptionAggregator aggregator,
            KeywordMatcher matcher,
            RetryExecutor retryExecutor,
            CycleLock cycleLock,
            MeterRegistry meterRegistry,
            int fetchLimit) {
        this.subscriptionRepository = subscriptionRepository;
        this.checkpointRepository = checkpointRepository;
        this.deliveryRepository = deliveryRepository;
        this.feedGateway = feedGateway;
        this.notifier = notifier;
        this.aggregator = aggregator;
        this.matcher = matcher;
        this.retryExecutor = retryExecutor;
        this.cycleLock = cycleLock;
        this.meterRegistry = meterRegistry;
        this.fetchLimit = fetchLimit;
    }

    @Override
    public CycleResult runCycle(CycleOptions options) {
        Timer.Sample timer = Timer.start(meterRegistry);
        long startTime = System.currentTimeMillis();

        CycleLock lock = options.bypassLock() ? bypassLock : cycleLock;
        Optional<LockToken> token = acquire(lock);
        if (token.isEmpty()) {
            logger.info("Another cycle holds the lock; skipping this run");
            CycleResult result = CycleResult.skipped(System.currentTimeMillis() - startTime);
            recordCycleMetrics(timer, result.getStatus());
            return result;
        }

        List<GroupResult> groupResults = new ArrayList<>();
        CycleResult result;
        try {
            List<SubscriptionGroup> groups = aggregator.aggregate(loadValidSubscriptions());
            logger.info("Starting cycle over {} groups", groups.size());

            boolean cancelled = false;
            for (SubscriptionGroup group : groups) {
                if (options.isCancelled()) {
                    cancelled = true;
                    break;
                }
                GroupResult groupResult = processGroup(group, options);
                groupResults.add(groupResult);
                if (groupResult.isCancelled()) {
                    cancelled = true;
                    break;
                }
                if (!groupResult.isSucceeded()) {
                    meterRegistry.counter("watcher_group_failures").increment();
                }
            }

            long durationMs = System.currentTimeMillis() - startTime;
            if (cancelled) {
                logger.info("Cycle cancelled after {} of {} groups", groupResults.size(), groups.size());
                result = CycleResult.cancelled(groupResults, durationMs);
            } else {
                result = CycleResult.completed(groupResults, durationMs);
            }

        } catch (RuntimeException e) {
            logger.error("Cycle aborted after {} groups", groupResults.size(), e);
            result = CycleResult.aborted(groupResults, System.currentTimeMillis() - startTime);
        } finally {
            lock.release(token.get());
        }

        recordCycleMetrics(timer, result.getStatus());
        logger.info("Cycle finished: {}", result);
        return result;
    }

    private Optional<LockToken> acquire(CycleLock lock) {
        try {
            return lock.tryAcquire();
        } catch (LockException e) {
            logger.error("Could not acquire cycle lock", e);
            return Optional.empty();
        }
    }

    /**
     * Drop registry rows the aggregator would reject so one bad row cannot block every group.
     */
    private List<Subscription> loadValidSubscriptions() {
        return subscriptionRepository.findAllActive().stream()
                .filter(subscription -> {
                    try {
                        SourceUnitNormalizer.normalizeSourceUnit(subscription.getSourceUnit());
                        SourceUnitNormalizer.normalizeFilter(subscription.getFilter());
                        return true;
                    } catch (IllegalArgumentException e) {
                        logger.warn("Ignoring malformed subscription {}: {}",
                                subscription.getSubscriptionId(), e.getMessage());
                        return false;
                    }
                })
                .collect(Collectors.toList());
    }

    private GroupResult processGroup(SubscriptionGroup group, CycleOptions options) {
        String sourceUnit = group.getSourceUnit();
        String filter = group.getFilter();
        GroupResult result = GroupResult.builder()
                .sourceUnit(sourceUnit)
                .filter(filter)
                .build();

        try {
            Instant watermark = checkpointRepository.find(sourceUnit, filter)
                    .map(Checkpoint::getLastSeenTime)
                    .orElse(Instant.EPOCH);
            result.setPreviousWatermark(watermark);
            result.setNewWatermark(watermark);

            List<FeedItem> fetched = retryExecutor.execute("fetch",
                    () -> feedGateway.fetchLatest(sourceUnit, fetchLimit), options::isCancelled);
            List<FeedItem> items = fetched.stream()
                    .filter(item -> item.getCreatedAt() != null)
                    .sorted(Comparator.comparing(FeedItem::getCreatedAt))
                    .collect(Collectors.toList());
            result.setItemsFetched(items.size());

            Instant newest = watermark;
            for (FeedItem item : items) {
                if (options.isCancelled()) {
                    logger.info("Cancelled while processing r/{} '{}'; checkpoint left at {}",
                            sourceUnit, filter, watermark);
                    markCancelled(result);
                    return result;
                }
                if (!item.getCreatedAt().isAfter(watermark)) {
                    continue;
                }
                result.setItemsExamined(result.getItemsExamined() + 1);
                if (item.getCreatedAt().isAfter(newest)) {
                    newest = item.getCreatedAt();
                }
                if (!matcher.matches(item, filter)) {
                    continue;
                }

                result.setMatches(result.getMatches() + 1);
                logger.info("Match in r/{} for '{}': {} ({})", sourceUnit, filter, item.getTitle(), item.getId());
                for (Subscription subscription : group.getSubscriptions()) {
                    deliver(subscription, item, filter, result, options);
                }
            }

            if (newest.isAfter(watermark)) {
                checkpointRepository.advance(sourceUnit, filter, newest);
                result.setNewWatermark(newest);
            }
            result.setSucceeded(true);
            logger.debug("Group r/{} '{}' done: {} new items, {} matches, {} sent",
                    sourceUnit, filter, result.getItemsExamined(), result.getMatches(), result.getNotificationsSent());

        } catch (CancellationException e) {
            logger.info("Cancelled during {} for r/{} '{}'; checkpoint left at {}",
                    e.getMessage(), sourceUnit, filter, result.getPreviousWatermark());
            markCancelled(result);
        } catch (Exception e) {
            logger.error("Group r/{} '{}' failed; checkpoint stays at {}",
                    sourceUnit, filter, result.getPreviousWatermark(), e);
            result.setSucceeded(false);
            result.setFailureReason(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
        return result;
    }

    private void markCancelled(GroupResult result) {
        result.setSucceeded(false);
        result.setCancelled(true);
        result.setFailureReason("cancelled");
    }

    private void deliver(Subscription subscription, FeedItem item, String filter, GroupResult result,
                         CycleOptions options) throws Exception {
        String subscriptionId = subscription.getSubscriptionId();
        if (deliveryRepository.exists(subscriptionId, item.getId())) {
            logger.debug("Item {} already delivered to subscription {}", item.getId(), subscriptionId);
            result.setDuplicatesSkipped(result.getDuplicatesSkipped() + 1);
            return;
        }
        String email = subscription.getSubscriberEmail();
        if (email == null || email.isBlank()) {
            logger.warn("Subscriber {} has no email; skipping notification for item {}",
                    subscription.getSubscriberId(), item.getId());
            return;
        }

        retryExecutor.execute("notify", () -> {
            notifier.send(subscription, item, filter);
            return null;
        }, options::isCancelled);
        result.setNotificationsSent(result.getNotificationsSent() + 1);
        meterRegistry.counter("watcher_notifications_sent").increment();

        if (!deliveryRepository.record(new Delivery(subscriptionId, item.getId(), result.getSourceUnit()))) {
            logger.info("Delivery of item {} to subscription {} was recorded concurrently",
                    item.getId(), subscriptionId);
        }
    }

    private void recordCycleMetrics(Timer.Sample timer, CycleStatus status) {
        String tag = status.name().toLowerCase(Locale.ROOT);
        timer.stop(meterRegistry.timer("watcher_cycle_duration", "status", tag));
        meterRegistry.counter("watcher_cycle_total", "status", tag).increment();
    }
}
