package com.bbthechange.watcher.dto;

import com.bbthechange.watcher.model.Subscription;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Active subscriptions sharing one (source-unit, filter) pair.
 * Built by the aggregator at the start of a cycle and dropped at its end.
 */
public class SubscriptionGroup {

    private final String sourceUnit;
    private final String filter;
    private final List<Subscription> subscriptions = new ArrayList<>();

    public SubscriptionGroup(String sourceUnit, String filter) {
        this.sourceUnit = sourceUnit;
        this.filter = filter;
    }

    public void add(Subscription subscription) {
        subscriptions.add(subscription);
    }

    public String getSourceUnit() {
        return sourceUnit;
    }

    public String getFilter() {
        return filter;
    }

    public List<Subscription> getSubscriptions() {
        return Collections.unmodifiableList(subscriptions);
    }

    public List<String> getSubscriberIds() {
        return subscriptions.stream()
                .map(Subscription::getSubscriberId)
                .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "r/" + sourceUnit + " '" + filter + "' (" + subscriptions.size() + " subscribers)";
    }
}
