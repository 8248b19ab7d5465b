package com.neolms.studygroups.sync;

import com.neolms.studygroups.dto.CreateGroupRequest;
import com.neolms.studygroups.dto.GroupMemberDTO;
import com.neolms.studygroups.dto.GroupStats;
import com.neolms.studygroups.dto.GroupView;
import com.neolms.studygroups.dto.InviteLinkResponse;
import com.neolms.studygroups.model.GroupCategory;
import com.neolms.studygroups.model.GroupSortOption;
import com.neolms.studygroups.model.MemberRole;
import com.neolms.studygroups.model.MembershipScope;
import com.neolms.studygroups.model.Viewer;
import com.neolms.studygroups.service.GroupDirectoryService;
import com.neolms.studygroups.service.InviteService;
import com.neolms.studygroups.service.MembershipManager;
import com.neolms.studygroups.service.MembershipResult;
import com.neolms.studygroups.service.PresenceTracker;
import com.neolms.studygroups.util.GroupQueryEngine;
import com.neolms.studygroups.util.InviteCodeGenerator;
import com.neolms.studygroups.util.StudyGroupValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * One viewer's live view of the group directory.
 *
 * Mutations update the local snapshot immediately, then run the real operation on the
 * executor. A rejected or failed operation undoes its local change unless a resync has
 * replaced the snapshot in the meantime, in which case the resync already holds the
 * store's state. Successful operations write the returned group back into the snapshot.
 *
 * After {@link #close()} late completions still complete their futures but no longer touch
 * the snapshot or the listener.
 */
public class GroupDirectorySession implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(GroupDirectorySession.class);

    private final String sessionId;
    private final Viewer viewer;
    private final MembershipManager membershipManager;
    private final InviteService inviteService;
    private final PresenceTracker presenceTracker;
    private final Executor executor;
    private final Clock clock;
    private final GroupSessionListener listener;
    private final RealtimeSync sync;

    private final AtomicReference<GroupSnapshot> snapshot = new AtomicReference<>(GroupSnapshot.empty());
    private final AtomicBoolean opened = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    // Orders the queued online write against the offline write in close().
    private final Object presenceLock = new Object();

    public GroupDirectorySession(String sessionId, Viewer viewer, GroupDirectoryService directoryService,
                                 MembershipManager membershipManager, InviteService inviteService,
                                 PresenceTracker presenceTracker, GroupChangeChannel channel, Executor executor,
                                 Clock clock, GroupSessionListener listener) {
        this.sessionId = sessionId;
        this.viewer = viewer;
        this.membershipManager = membershipManager;
        this.inviteService = inviteService;
        this.presenceTracker = presenceTracker;
        this.executor = executor;
        this.clock = clock;
        this.listener = listener;
        this.sync = new RealtimeSync(sessionId, channel, () -> directoryService.listGroups(viewer),
            this::applyAuthoritative, this::isRelevant, executor);
    }

    /**
     * Marks the viewer online, subscribes to changes and starts the initial load.
     *
     * @throws IllegalStateException if the session was already opened
     */
    public void open() {
        if (!opened.compareAndSet(false, true)) {
            throw new IllegalStateException("Session already opened: " + sessionId);
        }
        executor.execute(this::markOnline);
        sync.subscribe();
        sync.requestResync();
        logger.info("Opened group session {} for {}", sessionId, viewer.getUserId());
    }

    private void markOnline() {
        synchronized (presenceLock) {
            if (closed.get()) {
                logger.debug("Session {} closed before going online, skipping presence write", sessionId);
                return;
            }
            presenceTracker.setOnline(viewer, true);
        }
    }

    // Reads

    public GroupSnapshot getSnapshot() {
        return snapshot.get();
    }

    public List<GroupView> query(MembershipScope scope, String search, GroupSortOption sort, GroupCategory category) {
        return GroupQueryEngine.query(snapshot.get().getGroups(), scope, search, sort, category);
    }

    public GroupStats stats() {
        return GroupQueryEngine.getGroupStats(snapshot.get().getGroups());
    }

    // Mutations

    public CompletableFuture<MembershipResult> join(String groupId) {
        Optional<GroupView> local = snapshot.get().find(groupId);
        if (local.isEmpty()) {
            return rejected(MembershipResult.groupNotFound(groupId));
        }
        if (local.get().isMember()) {
            return rejected(MembershipResult.alreadyMember(groupId));
        }
        if (local.get().isFull()) {
            return rejected(MembershipResult.capacityExceeded(groupId));
        }

        String userId = viewer.getUserId();
        GroupMemberDTO pending = GroupMemberDTO.pending(viewer, clock.instant());
        Delta delta = applyDelta(groupId,
            view -> view.withMemberAdded(pending),
            view -> view.withMemberRemoved(userId));
        return dispatch(() -> membershipManager.join(groupId, viewer), delta.generation, delta);
    }

    public CompletableFuture<MembershipResult> leave(String groupId) {
        Optional<GroupView> local = snapshot.get().find(groupId);
        if (local.isEmpty()) {
            return rejected(MembershipResult.groupNotFound(groupId));
        }
        GroupMemberDTO self = local.get().findMember(viewer.getUserId());
        if (self == null) {
            return rejected(MembershipResult.notMember(groupId));
        }
        if (self.getRole() == MemberRole.OWNER && local.get().getMemberCount() <= 1) {
            return rejected(MembershipResult.ownerCannotLeave(groupId));
        }

        Delta delta = applyDelta(groupId,
            view -> view.withMemberRemoved(self.getUserId()),
            view -> view.withMemberAdded(self));
        return dispatch(() -> membershipManager.leave(groupId, viewer), delta.generation, delta);
    }

    public CompletableFuture<MembershipResult> togglePin(String groupId, boolean pinned) {
        Optional<GroupView> local = snapshot.get().find(groupId);
        if (local.isEmpty()) {
            return rejected(MembershipResult.groupNotFound(groupId));
        }

        boolean previous = local.get().isPinned();
        Delta delta = applyDelta(groupId,
            view -> view.withPinned(pinned),
            view -> view.withPinned(previous));
        return dispatch(() -> membershipManager.togglePin(groupId, pinned, viewer), delta.generation, delta);
    }

    /**
     * @throws com.neolms.studygroups.exception.ValidationException synchronously for an invalid draft
     */
    public CompletableFuture<MembershipResult> create(CreateGroupRequest draft) {
        StudyGroupValidator.validateDraft(draft);
        return dispatch(() -> membershipManager.create(draft, viewer), snapshot.get().getGeneration(), null);
    }

    /**
     * @throws com.neolms.studygroups.exception.ValidationException synchronously for invalid limits
     */
    public CompletableFuture<InviteLinkResponse> generateInvite(String groupId, Integer expiresInDays,
                                                                Integer maxUses) {
        StudyGroupValidator.validateInviteLimits(expiresInDays, maxUses);
        return CompletableFuture.supplyAsync(
            () -> inviteService.generate(groupId, expiresInDays, maxUses, viewer), executor);
    }

    public CompletableFuture<MembershipResult> redeemInvite(String code) {
        if (!InviteCodeGenerator.isWellFormed(code)) {
            return rejected(MembershipResult.inviteNotFound());
        }
        return dispatch(() -> inviteService.redeem(code, viewer), snapshot.get().getGeneration(), null);
    }

    public CompletableFuture<Void> setOnline(boolean online) {
        return CompletableFuture.runAsync(() -> presenceTracker.setOnline(viewer, online), executor);
    }

    public void resync() {
        sync.requestResync();
    }

    /**
     * Single teardown path. Safe to call more than once.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        sync.unsubscribe();
        if (opened.get()) {
            synchronized (presenceLock) {
                presenceTracker.setOnline(viewer, false);
            }
        }
        logger.info("Closed group session {} for {}", sessionId, viewer.getUserId());
    }

    public boolean isClosed() {
        return closed.get();
    }

    public String getSessionId() {
        return sessionId;
    }

    public Viewer getViewer() {
        return viewer;
    }

    RealtimeSync.State getSyncState() {
        return sync.getState();
    }

    void applyAuthoritative(List<GroupView> groups) {
        if (closed.get()) {
            return;
        }
        GroupSnapshot before = snapshot.get();
        Instant refreshedAt = clock.instant();
        GroupSnapshot updated = snapshot.updateAndGet(
            current -> SnapshotReconciler.reconcile(current, groups, refreshedAt));
        if (logger.isDebugEnabled()) {
            Set<String> divergent = SnapshotReconciler.divergentGroupIds(before, groups);
            if (!divergent.isEmpty()) {
                logger.debug("Resync of session {} corrected groups {}", sessionId, divergent);
            }
        }
        listener.onSnapshot(viewer, updated);
    }

    boolean isRelevant(GroupChangeEvent event) {
        return event.getType() == GroupChangeEvent.Type.GROUP_CREATED
            || viewer.getUserId().equals(event.getActorId())
            || snapshot.get().contains(event.getGroupId());
    }

    private CompletableFuture<MembershipResult> rejected(MembershipResult result) {
        logger.debug("Session {} rejected locally: {}", sessionId, result.getStatus());
        if (!closed.get()) {
            listener.onResult(viewer, result);
        }
        return CompletableFuture.completedFuture(result);
    }

    private CompletableFuture<MembershipResult> dispatch(Supplier<MembershipResult> call, long generation,
                                                         Delta delta) {
        return CompletableFuture.supplyAsync(call, executor).handle((result, error) -> {
            if (closed.get()) {
                logger.debug("Session {} closed, discarding late response", sessionId);
                if (error != null) {
                    throw asCompletionException(error);
                }
                return result;
            }
            if (error != null) {
                rollback(delta);
                logger.warn("Group operation failed in session {}: {}", sessionId, error.getMessage());
                throw asCompletionException(error);
            }
            if (result.isSuccess()) {
                confirm(result, generation);
            } else {
                rollback(delta);
            }
            listener.onResult(viewer, result);
            return result;
        });
    }

    private void confirm(MembershipResult result, long generation) {
        snapshot.updateAndGet(current -> {
            if (current.getGeneration() != generation) {
                return current;
            }
            GroupView confirmed = result.getGroup();
            if (confirmed == null) {
                return current.removeGroup(result.getGroupId());
            }
            return current.replaceGroup(confirmed);
        });
    }

    private Delta applyDelta(String groupId, UnaryOperator<GroupView> change, UnaryOperator<GroupView> inverse) {
        while (true) {
            GroupSnapshot current = snapshot.get();
            GroupSnapshot next = current.updateGroup(groupId, change);
            if (snapshot.compareAndSet(current, next)) {
                return new Delta(groupId, current.getGeneration(), inverse);
            }
        }
    }

    private void rollback(Delta delta) {
        if (delta == null) {
            return;
        }
        snapshot.updateAndGet(current -> current.getGeneration() == delta.generation
            ? current.updateGroup(delta.groupId, delta.inverse)
            : current);
    }

    private static CompletionException asCompletionException(Throwable error) {
        if (error instanceof CompletionException) {
            return (CompletionException) error;
        }
        return new CompletionException(error);
    }

    /**
     * An applied optimistic change and how to undo it.
     */
    private static final class Delta {
        private final String groupId;
        private final long generation;
        private final UnaryOperator<GroupView> inverse;

        Delta(String groupId, long generation, UnaryOperator<GroupView> inverse) {
            this.groupId = groupId;
            this.generation = generation;
            this.inverse = inverse;
        }
    }
}
