package com.neolms.studygroups.sync;

import java.util.function.Consumer;

/**
 * Fan-out of {@link GroupChangeEvent}s to live subscribers.
 */
public interface GroupChangeChannel {

    /**
     * Register a listener under a unique subscriber id.
     *
     * @throws IllegalStateException if the id is already subscribed
     */
    ChangeSubscription subscribe(String subscriberId, Consumer<GroupChangeEvent> listener);
}
