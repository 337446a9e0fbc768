package com.bbthechange.watcher.testutil;

import com.bbthechange.watcher.model.Subscription;
import com.bbthechange.watcher.repository.SubscriptionRepository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

public class InMemorySubscriptionRepository implements SubscriptionRepository {

    private final Map<String, Subscription> subscriptions = new LinkedHashMap<>();

    @Override
    public List<Subscription> findAllActive() {
        return subscriptions.values().stream()
                .filter(Subscription::isActive)
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public Subscription save(Subscription subscription) {
        subscriptions.put(subscription.getSubscriptionId(), subscription);
        return subscription;
    }

    @Override
    public Optional<Subscription> findById(String subscriptionId) {
        return Optional.ofNullable(subscriptions.get(subscriptionId));
    }

    @Override
    public int delete(String subscriptionId) {
        subscriptions.remove(subscriptionId);
        return 0;
    }
}
