package com.neolms.studygroups.sync;

import com.neolms.studygroups.dto.GroupView;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Immutable list of groups held by one session.
 *
 * The generation only moves forward when an authoritative list replaces the snapshot
 * (see {@link SnapshotReconciler}); local edits keep it, so an optimistic change can tell
 * whether a resync has happened since it was applied.
 */
public final class GroupSnapshot {

    private final long generation;
    private final List<GroupView> groups;
    private final Instant refreshedAt;

    public GroupSnapshot(long generation, List<GroupView> groups, Instant refreshedAt) {
        this.generation = generation;
        this.groups = Collections.unmodifiableList(new ArrayList<>(groups));
        this.refreshedAt = refreshedAt;
    }

    public static GroupSnapshot empty() {
        return new GroupSnapshot(0, List.of(), null);
    }

    public long getGeneration() {
        return generation;
    }

    public List<GroupView> getGroups() {
        return groups;
    }

    /**
     * When the last authoritative list arrived, or null before the first resync.
     */
    public Instant getRefreshedAt() {
        return refreshedAt;
    }

    public Optional<GroupView> find(String groupId) {
        return groups.stream().filter(g -> g.getGroupId().equals(groupId)).findFirst();
    }

    public boolean contains(String groupId) {
        return find(groupId).isPresent();
    }

    /**
     * Replace the group with the same id in place, or append it if absent.
     */
    public GroupSnapshot replaceGroup(GroupView group) {
        List<GroupView> updated = new ArrayList<>(groups.size() + 1);
        boolean replaced = false;
        for (GroupView existing : groups) {
            if (existing.getGroupId().equals(group.getGroupId())) {
                updated.add(group);
                replaced = true;
            } else {
                updated.add(existing);
            }
        }
        if (!replaced) {
            updated.add(group);
        }
        return new GroupSnapshot(generation, updated, refreshedAt);
    }

    public GroupSnapshot removeGroup(String groupId) {
        List<GroupView> updated = new ArrayList<>(groups);
        updated.removeIf(g -> g.getGroupId().equals(groupId));
        return new GroupSnapshot(generation, updated, refreshedAt);
    }

    /**
     * Apply {@code change} to one group; unchanged when the group is absent.
     */
    public GroupSnapshot updateGroup(String groupId, UnaryOperator<GroupView> change) {
        return find(groupId).map(g -> replaceGroup(change.apply(g))).orElse(this);
    }

    public int size() {
        return groups.size();
    }
}
