package com.bbthechange.watcher.service;

import com.bbthechange.watcher.dto.SubscriptionGroup;
import com.bbthechange.watcher.model.Subscription;
import com.bbthechange.watcher.util.SourceUnitNormalizer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups active subscriptions by normalized (source-unit, filter) so each pair is fetched once per cycle.
 */
@Component
public class SubscriptionAggregator {

    /**
     * @param subscriptions Snapshot of the registry; inactive entries are ignored
     * @return Groups in the order their first subscription appeared
     * @throws IllegalArgumentException if an active subscription has a blank source-unit or filter
     */
    public List<SubscriptionGroup> aggregate(List<Subscription> subscriptions) {
        Map<GroupKey, SubscriptionGroup> groups = new LinkedHashMap<>();

        for (Subscription subscription : subscriptions) {
            if (!subscription.isActive()) {
                continue;
            }
            String sourceUnit = SourceUnitNormalizer.normalizeSourceUnit(subscription.getSourceUnit());
            String filter = SourceUnitNormalizer.normalizeFilter(subscription.getFilter());

            groups.computeIfAbsent(new GroupKey(sourceUnit, filter), k -> new SubscriptionGroup(sourceUnit, filter))
                    .add(subscription);
        }

        return new ArrayList<>(groups.values());
    }

    private record GroupKey(String sourceUnit, String filter) {
    }
}
