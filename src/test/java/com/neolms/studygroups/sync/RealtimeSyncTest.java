package com.neolms.studygroups.sync;

import com.neolms.studygroups.dto.GroupView;
import com.neolms.studygroups.exception.RepositoryException;
import com.neolms.studygroups.testutil.ManualExecutor;
import com.neolms.studygroups.testutil.StudyGroupTestBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.function.Supplier;

import static com.neolms.studygroups.testutil.TestConstants.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RealtimeSyncTest {

    private InProcessGroupChangeChannel channel;
    private ManualExecutor executor;
    private List<List<GroupView>> delivered;
    private AtomicInteger loads;
    private Supplier<List<GroupView>> loader;
    private Predicate<GroupChangeEvent> relevance;

    private final GroupView group = StudyGroupTestBuilder.aGroup().withOwner(USER_ID).buildView(USER_ID);

    @BeforeEach
    void setUp() {
        channel = new InProcessGroupChangeChannel();
        executor = new ManualExecutor();
        delivered = new ArrayList<>();
        loads = new AtomicInteger();
        loader = () -> {
            loads.incrementAndGet();
            return List.of(group);
        };
        relevance = event -> GROUP_ID.equals(event.getGroupId());
    }

    private RealtimeSync newSync() {
        return new RealtimeSync("session-1", channel, () -> loader.get(), delivered::add, e -> relevance.test(e), executor);
    }

    private static GroupChangeEvent joinedEvent(String groupId) {
        return new GroupChangeEvent(GroupChangeEvent.Type.MEMBER_JOINED, groupId, OTHER_USER_ID, NOW);
    }

    @Test
    void subscribe_RegistersOnChannel() {
        RealtimeSync sync = newSync();

        sync.subscribe();

        assertThat(sync.getState()).isEqualTo(RealtimeSync.State.SUBSCRIBED);
        assertThat(channel.subscriberCount()).isEqualTo(1);
    }

    @Test
    void subscribe_Twice_IsRejected() {
        RealtimeSync sync = newSync();
        sync.subscribe();

        assertThatThrownBy(sync::subscribe).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void requestResync_LoadsAndDeliversThenReturnsToSubscribed() {
        // Given
        RealtimeSync sync = newSync();
        sync.subscribe();

        // When
        sync.requestResync();

        // Then
        assertThat(sync.getState()).isEqualTo(RealtimeSync.State.RESYNCING);
        executor.runAll();
        assertThat(delivered).containsExactly(List.of(group));
        assertThat(sync.getState()).isEqualTo(RealtimeSync.State.SUBSCRIBED);
    }

    @Test
    void requestResync_WhileIdle_IsIgnored() {
        RealtimeSync sync = newSync();

        sync.requestResync();

        assertThat(executor.pending()).isZero();
        assertThat(sync.getState()).isEqualTo(RealtimeSync.State.IDLE);
    }

    @Test
    void requestsDuringResync_CoalesceIntoOneFollowUp() {
        // Given
        RealtimeSync sync = newSync();
        sync.subscribe();
        sync.requestResync();

        // When
        sync.requestResync();
        sync.requestResync();
        sync.requestResync();

        // Then
        assertThat(executor.pending()).isEqualTo(1);
        executor.runAll();
        assertThat(loads.get()).isEqualTo(2);
        assertThat(delivered).hasSize(2);
        assertThat(sync.getState()).isEqualTo(RealtimeSync.State.SUBSCRIBED);
    }

    @Test
    void relevantEvent_TriggersResync() {
        RealtimeSync sync = newSync();
        sync.subscribe();

        channel.onGroupChange(joinedEvent(GROUP_ID));

        assertThat(sync.getState()).isEqualTo(RealtimeSync.State.RESYNCING);
        assertThat(executor.pending()).isEqualTo(1);
    }

    @Test
    void irrelevantEvent_IsIgnored() {
        RealtimeSync sync = newSync();
        sync.subscribe();

        channel.onGroupChange(joinedEvent(OTHER_GROUP_ID));

        assertThat(sync.getState()).isEqualTo(RealtimeSync.State.SUBSCRIBED);
        assertThat(executor.pending()).isZero();
    }

    @Test
    void unsubscribe_DuringResync_DiscardsResult() {
        // Given
        RealtimeSync sync = newSync();
        sync.subscribe();
        sync.requestResync();

        // When
        sync.unsubscribe();
        executor.runAll();

        // Then
        assertThat(delivered).isEmpty();
        assertThat(sync.getState()).isEqualTo(RealtimeSync.State.IDLE);
        assertThat(channel.subscriberCount()).isZero();
    }

    @Test
    void unsubscribe_IsIdempotent() {
        RealtimeSync sync = newSync();
        sync.subscribe();

        sync.unsubscribe();
        sync.unsubscribe();

        assertThat(sync.getState()).isEqualTo(RealtimeSync.State.IDLE);
    }

    @Test
    void resubscribe_AfterUnsubscribe_DeliversAgain() {
        RealtimeSync sync = newSync();
        sync.subscribe();
        sync.requestResync();
        sync.unsubscribe();

        sync.subscribe();
        sync.requestResync();
        executor.runAll();

        // the stale first run is discarded, the second delivers
        assertThat(delivered).hasSize(1);
    }

    @Test
    void failedLoad_KeepsPreviousStateAndStaysSubscribed() {
        // Given
        loader = () -> {
            throw new RepositoryException("throttled");
        };
        RealtimeSync sync = newSync();
        sync.subscribe();

        // When
        sync.requestResync();
        executor.runAll();

        // Then
        assertThat(delivered).isEmpty();
        assertThat(sync.getState()).isEqualTo(RealtimeSync.State.SUBSCRIBED);
    }

    @Test
    void rejectedByExecutor_FallsBackToSubscribed() {
        // Given
        RealtimeSync sync = new RealtimeSync("session-1", channel, loader, delivered::add, relevance,
            command -> {
                throw new RejectedExecutionException("saturated");
            });
        sync.subscribe();

        // When
        sync.requestResync();

        // Then
        assertThat(sync.getState()).isEqualTo(RealtimeSync.State.SUBSCRIBED);
    }
}
