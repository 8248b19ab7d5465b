package com.neolms.studygroups.sync;

/**
 * Handle returned by {@link GroupChangeChannel#subscribe}. Closing is idempotent.
 */
public interface ChangeSubscription extends AutoCloseable {

    boolean isActive();

    @Override
    void close();
}
