package com.neolms.studygroups.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Channel fed by Spring application events published by the services after each write.
 * Listeners run on the publishing thread and must hand real work off to an executor.
 */
@Component
public class InProcessGroupChangeChannel implements GroupChangeChannel {

    private static final Logger logger = LoggerFactory.getLogger(InProcessGroupChangeChannel.class);

    private final Map<String, Consumer<GroupChangeEvent>> listeners = new ConcurrentHashMap<>();

    @Override
    public ChangeSubscription subscribe(String subscriberId, Consumer<GroupChangeEvent> listener) {
        if (listeners.putIfAbsent(subscriberId, listener) != null) {
            throw new IllegalStateException("Subscriber already registered: " + subscriberId);
        }
        logger.debug("Subscriber {} registered ({} total)", subscriberId, listeners.size());
        return new Subscription(subscriberId, listener);
    }

    @EventListener
    public void onGroupChange(GroupChangeEvent event) {
        for (Map.Entry<String, Consumer<GroupChangeEvent>> entry : listeners.entrySet()) {
            try {
                entry.getValue().accept(event);
            } catch (RuntimeException e) {
                logger.warn("Subscriber {} failed to handle {}: {}", entry.getKey(), event, e.getMessage());
            }
        }
    }

    public int subscriberCount() {
        return listeners.size();
    }

    private class Subscription implements ChangeSubscription {

        private final String subscriberId;
        private final Consumer<GroupChangeEvent> listener;
        private final AtomicBoolean active = new AtomicBoolean(true);

        Subscription(String subscriberId, Consumer<GroupChangeEvent> listener) {
            this.subscriberId = subscriberId;
            this.listener = listener;
        }

        @Override
        public boolean isActive() {
            return active.get();
        }

        @Override
        public void close() {
            if (active.compareAndSet(true, false)) {
                // only remove our own registration, a later subscriber may reuse the id
                listeners.remove(subscriberId, listener);
                logger.debug("Subscriber {} removed", subscriberId);
            }
        }
    }
}
