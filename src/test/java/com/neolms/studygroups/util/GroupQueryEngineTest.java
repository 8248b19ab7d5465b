package com.neolms.studygroups.util;

import com.neolms.studygroups.dto.GroupStats;
import com.neolms.studygroups.dto.GroupView;
import com.neolms.studygroups.model.GroupCategory;
import com.neolms.studygroups.model.GroupSortOption;
import com.neolms.studygroups.model.MemberRole;
import com.neolms.studygroups.model.MembershipScope;
import com.neolms.studygroups.testutil.StudyGroupTestBuilder;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Constructor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static com.neolms.studygroups.testutil.TestConstants.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GroupQueryEngineTest {

    private static final String G1 = "00000000-0000-0000-0000-00000000000a";
    private static final String G2 = "00000000-0000-0000-0000-00000000000b";
    private static final String G3 = "00000000-0000-0000-0000-00000000000c";

    private GroupView calculus() {
        return StudyGroupTestBuilder.aGroup().withId(G1).named("Calculus Crew")
            .withDescription("Limits and series").forCourse("MATH 101")
            .createdAt(NOW.minusSeconds(300))
            .withOwner(USER_ID).withMember(OTHER_USER_ID, true)
            .buildView(USER_ID);
    }

    private GroupView physics() {
        return StudyGroupTestBuilder.aGroup().withId(G2).named("physics lab")
            .inCategory(GroupCategory.PROJECT).createdAt(NOW.minusSeconds(100))
            .withOwner(OTHER_USER_ID).withMember(THIRD_USER_ID, true).withMember(userId(1), false)
            .pinned()
            .buildView(USER_ID);
    }

    private GroupView secretClub() {
        return StudyGroupTestBuilder.aGroup().withId(G3).named("Algorithms Circle").privateGroup()
            .inCategory(GroupCategory.REVIEW).createdAt(NOW.minusSeconds(200))
            .withOwner(USER_ID)
            .buildView(USER_ID);
    }

    private List<GroupView> all() {
        return List.of(calculus(), physics(), secretClub());
    }

    @Nested
    class FilterByMembership {

        @Test
        void myGroups_KeepsOnlyGroupsTheViewerBelongsTo() {
            List<GroupView> result = GroupQueryEngine.filterGroupsByMembership(all(), MembershipScope.MY_GROUPS);

            assertThat(result).extracting(GroupView::getGroupId).containsExactly(G1, G3);
        }

        @Test
        void publicScope_DropsPrivateGroups() {
            List<GroupView> result = GroupQueryEngine.filterGroupsByMembership(all(), MembershipScope.PUBLIC);

            assertThat(result).extracting(GroupView::getGroupId).containsExactly(G1, G2);
        }

        @Test
        void allScope_ReturnsCopyOfInput() {
            List<GroupView> input = all();

            List<GroupView> result = GroupQueryEngine.filterGroupsByMembership(input, MembershipScope.ALL);

            assertThat(result).containsExactlyElementsOf(input);
            assertThat(result).isNotSameAs(input);
        }
    }

    @Nested
    class Search {

        @Test
        void matchesNameCaseInsensitively() {
            assertThat(GroupQueryEngine.searchGroups(all(), "PHYSICS"))
                .extracting(GroupView::getGroupId).containsExactly(G2);
        }

        @Test
        void matchesDescriptionAndCourseName() {
            assertThat(GroupQueryEngine.searchGroups(all(), "series"))
                .extracting(GroupView::getGroupId).containsExactly(G1);
            assertThat(GroupQueryEngine.searchGroups(all(), "math 1"))
                .extracting(GroupView::getGroupId).containsExactly(G1);
        }

        @Test
        void blankQuery_ReturnsEverything() {
            assertThat(GroupQueryEngine.searchGroups(all(), "   ")).hasSize(3);
            assertThat(GroupQueryEngine.searchGroups(all(), null)).hasSize(3);
        }

        @Test
        void noMatch_ReturnsEmpty() {
            assertThat(GroupQueryEngine.searchGroups(all(), "chemistry")).isEmpty();
        }
    }

    @Nested
    class Sort {

        @Test
        void recent_NewestFirst() {
            assertThat(GroupQueryEngine.sortGroups(all(), GroupSortOption.RECENT))
                .extracting(GroupView::getGroupId).containsExactly(G2, G3, G1);
        }

        @Test
        void members_LargestFirst() {
            assertThat(GroupQueryEngine.sortGroups(all(), GroupSortOption.MEMBERS))
                .extracting(GroupView::getGroupId).containsExactly(G2, G1, G3);
        }

        @Test
        void name_IgnoresCase() {
            assertThat(GroupQueryEngine.sortGroups(all(), GroupSortOption.NAME))
                .extracting(GroupView::getName)
                .containsExactly("Algorithms Circle", "Calculus Crew", "physics lab");
        }

        @Test
        void ties_AreBrokenByGroupIdRegardlessOfInputOrder() {
            GroupView a = StudyGroupTestBuilder.aGroup().withId(G1).named("Same").buildView(USER_ID);
            GroupView b = StudyGroupTestBuilder.aGroup().withId(G2).named("Same").buildView(USER_ID);
            List<GroupView> reversed = new ArrayList<>(List.of(b, a));

            List<GroupView> first = GroupQueryEngine.sortGroups(List.of(a, b), GroupSortOption.NAME);
            List<GroupView> second = GroupQueryEngine.sortGroups(reversed, GroupSortOption.NAME);

            assertThat(first).extracting(GroupView::getGroupId).containsExactly(G1, G2);
            assertThat(second).extracting(GroupView::getGroupId).containsExactly(G1, G2);
        }

        @Test
        void activity_MostRecentFirstWithInactiveGroupsLast() {
            // Given
            String g4 = "00000000-0000-0000-0000-00000000000d";
            GroupView older = StudyGroupTestBuilder.aGroup().withId(G1).lastActivityAt(NOW.minusSeconds(50))
                .buildView(USER_ID);
            GroupView quiet = StudyGroupTestBuilder.aGroup().withId(G2).withoutActivity().buildView(USER_ID);
            GroupView newest = StudyGroupTestBuilder.aGroup().withId(G3).lastActivityAt(NOW.minusSeconds(10))
                .buildView(USER_ID);
            GroupView alsoQuiet = StudyGroupTestBuilder.aGroup().withId(g4).withoutActivity().buildView(USER_ID);

            // When
            List<GroupView> sorted = GroupQueryEngine.sortGroups(List.of(alsoQuiet, quiet, older, newest),
                GroupSortOption.ACTIVITY);

            // Then
            assertThat(quiet.getLastActivity()).isNull();
            assertThat(sorted).extracting(GroupView::getGroupId).containsExactly(G3, G1, G2, g4);
        }

        @Test
        void activity_MemberActivityCountsTowardsGroup() {
            GroupView busy = StudyGroupTestBuilder.aGroup().withId(G1).lastActivityAt(NOW.minusSeconds(500))
                .withMember(USER_ID, MemberRole.MEMBER, true, NOW.minusSeconds(5))
                .buildView(USER_ID);
            GroupView recent = StudyGroupTestBuilder.aGroup().withId(G2).lastActivityAt(NOW.minusSeconds(60))
                .buildView(USER_ID);

            assertThat(GroupQueryEngine.sortGroups(List.of(recent, busy), GroupSortOption.ACTIVITY))
                .extracting(GroupView::getGroupId).containsExactly(G1, G2);
        }

        @Test
        void sortingTwice_GivesSameOrderForEveryKey() {
            for (GroupSortOption key : GroupSortOption.values()) {
                List<GroupView> once = GroupQueryEngine.sortGroups(all(), key);
                List<GroupView> twice = GroupQueryEngine.sortGroups(once, key);

                assertThat(twice).as("sort by %s", key)
                    .extracting(GroupView::getGroupId)
                    .containsExactlyElementsOf(once.stream().map(GroupView::getGroupId).collect(Collectors.toList()));
            }
        }

        @Test
        void doesNotModifyInput() {
            List<GroupView> input = Collections.unmodifiableList(all());

            GroupQueryEngine.sortGroups(input, GroupSortOption.MEMBERS);

            assertThat(input).extracting(GroupView::getGroupId).containsExactly(G1, G2, G3);
        }
    }

    @Test
    void filterByCategory_KeepsMatchingOnly() {
        assertThat(GroupQueryEngine.filterGroupsByCategory(all(), GroupCategory.REVIEW))
            .extracting(GroupView::getGroupId).containsExactly(G3);
        assertThat(GroupQueryEngine.filterGroupsByCategory(all(), null)).hasSize(3);
    }

    @Test
    void query_PutsPinnedGroupsFirstAfterSorting() {
        // When
        List<GroupView> result = GroupQueryEngine.query(all(), MembershipScope.ALL, null, GroupSortOption.NAME, null);

        // Then
        assertThat(result).extracting(GroupView::getGroupId).containsExactly(G2, G3, G1);
    }

    @Test
    void query_CombinesScopeAndSearch() {
        List<GroupView> result = GroupQueryEngine.query(all(), MembershipScope.MY_GROUPS, "circle", null, null);

        assertThat(result).extracting(GroupView::getGroupId).containsExactly(G3);
    }

    @Test
    void stats_CountsDistinctMembersAndOnlineMembers() {
        // When
        GroupStats stats = GroupQueryEngine.getGroupStats(all());

        // Then
        assertThat(stats.getTotalGroups()).isEqualTo(3);
        assertThat(stats.getMyGroups()).isEqualTo(2);
        assertThat(stats.getPublicGroups()).isEqualTo(2);
        // USER_ID, OTHER_USER_ID, THIRD_USER_ID, userId(1)
        assertThat(stats.getTotalMembers()).isEqualTo(4);
        assertThat(stats.getOnlineMembers()).isEqualTo(2);
    }

    @Test
    void stats_EmptyList_AllZero() {
        GroupStats stats = GroupQueryEngine.getGroupStats(List.of());

        assertThat(stats.getTotalGroups()).isZero();
        assertThat(stats.getTotalMembers()).isZero();
    }

    @Test
    void constructor_IsNotInstantiable() throws Exception {
        Constructor<GroupQueryEngine> constructor = GroupQueryEngine.class.getDeclaredConstructor();
        constructor.setAccessible(true);

        assertThatThrownBy(constructor::newInstance).hasCauseInstanceOf(UnsupportedOperationException.class);
    }
}
