package com.neolms.studygroups.util;

import com.neolms.studygroups.dto.GroupMemberDTO;
import com.neolms.studygroups.dto.GroupStats;
import com.neolms.studygroups.dto.GroupView;
import com.neolms.studygroups.model.GroupCategory;
import com.neolms.studygroups.model.GroupSortOption;
import com.neolms.studygroups.model.MembershipScope;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Filtering, search, sorting and statistics over an in-memory group list.
 *
 * All methods are pure: they never modify their input and return new lists.
 */
public final class GroupQueryEngine {

    private static final Comparator<GroupView> BY_ID = Comparator.comparing(GroupView::getGroupId);

    private GroupQueryEngine() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Directory listing pipeline: scope, category, search, sort, then pinned groups first.
     */
    public static List<GroupView> query(List<GroupView> groups, MembershipScope scope, String search,
                                        GroupSortOption sort, GroupCategory category) {
        List<GroupView> result = filterGroupsByMembership(groups, scope);
        result = filterGroupsByCategory(result, category);
        result = searchGroups(result, search);
        result = sortGroups(result, sort);
        return pinnedFirst(result);
    }

    /**
     * Keep groups matching the scope, preserving order.
     */
    public static List<GroupView> filterGroupsByMembership(List<GroupView> groups, MembershipScope scope) {
        if (scope == null || scope == MembershipScope.ALL) {
            return new ArrayList<>(groups);
        }
        return groups.stream()
            .filter(g -> scope == MembershipScope.MY_GROUPS ? g.isMember() : !g.isPrivate())
            .collect(Collectors.toList());
    }

    /**
     * Keep groups of one category; a null category keeps everything.
     */
    public static List<GroupView> filterGroupsByCategory(List<GroupView> groups, GroupCategory category) {
        if (category == null) {
            return new ArrayList<>(groups);
        }
        return groups.stream()
            .filter(g -> g.getCategory() == category)
            .collect(Collectors.toList());
    }

    /**
     * Case-insensitive substring match on name, description or course name.
     * A blank query returns the input unchanged.
     */
    public static List<GroupView> searchGroups(List<GroupView> groups, String query) {
        if (query == null || query.isBlank()) {
            return new ArrayList<>(groups);
        }
        String needle = query.trim().toLowerCase(Locale.ROOT);
        return groups.stream()
            .filter(g -> contains(g.getName(), needle)
                || contains(g.getDescription(), needle)
                || contains(g.getCourseName(), needle))
            .collect(Collectors.toList());
    }

    /**
     * Sort by the given key with group id as the final tie-breaker, so the result
     * does not depend on input order.
     */
    public static List<GroupView> sortGroups(List<GroupView> groups, GroupSortOption key) {
        List<GroupView> sorted = new ArrayList<>(groups);
        sorted.sort(comparatorFor(key == null ? GroupSortOption.RECENT : key).thenComparing(BY_ID));
        return sorted;
    }

    /**
     * Move pinned groups to the front, keeping relative order within both partitions.
     */
    public static List<GroupView> pinnedFirst(List<GroupView> groups) {
        List<GroupView> result = new ArrayList<>(groups.size());
        groups.stream().filter(GroupView::isPinned).forEach(result::add);
        groups.stream().filter(g -> !g.isPinned()).forEach(result::add);
        return result;
    }

    /**
     * Aggregate counters over the list. Members in several groups are counted once.
     */
    public static GroupStats getGroupStats(List<GroupView> groups) {
        int myGroups = 0;
        int publicGroups = 0;
        Set<String> members = new HashSet<>();
        Set<String> online = new HashSet<>();
        for (GroupView group : groups) {
            if (group.isMember()) {
                myGroups++;
            }
            if (!group.isPrivate()) {
                publicGroups++;
            }
            for (GroupMemberDTO member : group.getMembers()) {
                members.add(member.getUserId());
                if (member.isOnline()) {
                    online.add(member.getUserId());
                }
            }
        }
        return new GroupStats(groups.size(), myGroups, publicGroups, members.size(), online.size());
    }

    private static Comparator<GroupView> comparatorFor(GroupSortOption key) {
        switch (key) {
            case MEMBERS:
                return Comparator.comparingInt(GroupView::getMemberCount).reversed();
            case ACTIVITY:
                return Comparator.comparing(GroupView::getLastActivity,
                    Comparator.nullsLast(Comparator.<Instant>reverseOrder()));
            case NAME:
                return Comparator.comparing(g -> g.getName() == null ? "" : g.getName().toLowerCase(Locale.ROOT));
            case RECENT:
            default:
                return Comparator.comparing(GroupView::getCreatedAt,
                    Comparator.nullsLast(Comparator.<Instant>reverseOrder()));
        }
    }

    private static boolean contains(String field, String needle) {
        return field != null && field.toLowerCase(Locale.ROOT).contains(needle);
    }
}
