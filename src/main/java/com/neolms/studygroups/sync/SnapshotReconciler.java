package com.neolms.studygroups.sync;

import com.neolms.studygroups.dto.GroupView;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges a freshly loaded group list into a session snapshot.
 */
public final class SnapshotReconciler {

    private SnapshotReconciler() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * The store wins: the result holds exactly the authoritative groups, one generation
     * past the local snapshot. Optimistic edits still pending against {@code local} will
     * see the generation change and skip their rollback.
     */
    public static GroupSnapshot reconcile(GroupSnapshot local, List<GroupView> authoritative, Instant refreshedAt) {
        return new GroupSnapshot(local.getGeneration() + 1, authoritative, refreshedAt);
    }

    /**
     * Ids of groups whose member count, pin flag or membership differ between the two lists,
     * or that appear in only one of them.
     */
    public static Set<String> divergentGroupIds(GroupSnapshot local, List<GroupView> authoritative) {
        Map<String, GroupView> remote = new HashMap<>();
        for (GroupView view : authoritative) {
            remote.put(view.getGroupId(), view);
        }

        Set<String> divergent = new LinkedHashSet<>();
        for (GroupView mine : local.getGroups()) {
            GroupView theirs = remote.remove(mine.getGroupId());
            if (theirs == null
                    || mine.getMemberCount() != theirs.getMemberCount()
                    || mine.isPinned() != theirs.isPinned()
                    || mine.isMember() != theirs.isMember()) {
                divergent.add(mine.getGroupId());
            }
        }
        divergent.addAll(remote.keySet());
        return divergent;
    }
}
