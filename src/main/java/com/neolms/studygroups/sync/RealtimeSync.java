package com.neolms.studygroups.sync;

import com.neolms.studygroups.dto.GroupView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Keeps one session's group list in step with the store.
 *
 * <pre>
 *   IDLE --subscribe--> SUBSCRIBED --relevant event--> RESYNCING --done--> SUBSCRIBED
 *   any  --unsubscribe--> IDLE
 * </pre>
 *
 * Events that arrive while a resync is running collapse into a single follow-up resync.
 * Every subscribe/unsubscribe cycle has its own epoch; a resync that finishes under an
 * older epoch is dropped without reaching the sink.
 */
public class RealtimeSync {

    private static final Logger logger = LoggerFactory.getLogger(RealtimeSync.class);

    public enum State {
        IDLE,
        SUBSCRIBED,
        RESYNCING
    }

    private final String subscriberId;
    private final GroupChangeChannel channel;
    private final Supplier<List<GroupView>> loader;
    private final Consumer<List<GroupView>> sink;
    private final Predicate<GroupChangeEvent> relevance;
    private final Executor executor;

    private final Object lock = new Object();
    private State state = State.IDLE;
    private boolean pending;
    private long epoch;
    private ChangeSubscription subscription;

    public RealtimeSync(String subscriberId, GroupChangeChannel channel, Supplier<List<GroupView>> loader,
                        Consumer<List<GroupView>> sink, Predicate<GroupChangeEvent> relevance, Executor executor) {
        this.subscriberId = subscriberId;
        this.channel = channel;
        this.loader = loader;
        this.sink = sink;
        this.relevance = relevance;
        this.executor = executor;
    }

    /**
     * @throws IllegalStateException if already subscribed
     */
    public void subscribe() {
        synchronized (lock) {
            if (state != State.IDLE) {
                throw new IllegalStateException("Already subscribed: " + subscriberId);
            }
            subscription = channel.subscribe(subscriberId, this::onEvent);
            state = State.SUBSCRIBED;
        }
        logger.debug("Sync {} subscribed", subscriberId);
    }

    public void unsubscribe() {
        ChangeSubscription toClose;
        synchronized (lock) {
            if (state == State.IDLE) {
                return;
            }
            epoch++;
            state = State.IDLE;
            pending = false;
            toClose = subscription;
            subscription = null;
        }
        toClose.close();
        logger.debug("Sync {} unsubscribed", subscriberId);
    }

    /**
     * Start a full resync, or queue one if a resync is already running. Ignored while IDLE.
     */
    public void requestResync() {
        long current;
        synchronized (lock) {
            if (state == State.IDLE) {
                return;
            }
            if (state == State.RESYNCING) {
                pending = true;
                return;
            }
            state = State.RESYNCING;
            current = epoch;
        }
        try {
            executor.execute(() -> runResync(current));
        } catch (RejectedExecutionException e) {
            logger.warn("Resync for {} rejected by executor: {}", subscriberId, e.getMessage());
            synchronized (lock) {
                if (epoch == current) {
                    state = State.SUBSCRIBED;
                    pending = false;
                }
            }
        }
    }

    public State getState() {
        synchronized (lock) {
            return state;
        }
    }

    void onEvent(GroupChangeEvent event) {
        if (relevance.test(event)) {
            requestResync();
        }
    }

    private void runResync(long startEpoch) {
        while (true) {
            List<GroupView> groups = null;
            try {
                groups = loader.get();
            } catch (RuntimeException e) {
                logger.warn("Resync for {} failed, keeping previous snapshot: {}", subscriberId, e.getMessage());
            }

            synchronized (lock) {
                if (epoch != startEpoch) {
                    logger.debug("Discarding resync result for {} after unsubscribe", subscriberId);
                    return;
                }
                if (groups != null) {
                    // under the lock so an unsubscribe cannot slip in between check and delivery
                    sink.accept(groups);
                }
                if (!pending) {
                    state = State.SUBSCRIBED;
                    return;
                }
                pending = false;
            }
        }
    }
}
