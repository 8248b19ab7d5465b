package com.neolms.studygroups.service;

import com.neolms.studygroups.config.StudyGroupsProperties;
import com.neolms.studygroups.dto.CreateGroupRequest;
import com.neolms.studygroups.dto.GroupMemberDTO;
import com.neolms.studygroups.dto.GroupStats;
import com.neolms.studygroups.dto.GroupView;
import com.neolms.studygroups.dto.InviteLinkResponse;
import com.neolms.studygroups.model.MemberRole;
import com.neolms.studygroups.model.Viewer;
import com.neolms.studygroups.service.impl.GroupDirectoryServiceImpl;
import com.neolms.studygroups.service.impl.InviteServiceImpl;
import com.neolms.studygroups.service.impl.MembershipManagerImpl;
import com.neolms.studygroups.service.impl.PresenceTrackerImpl;
import com.neolms.studygroups.sync.GroupChangeEvent;
import com.neolms.studygroups.sync.GroupDirectorySession;
import com.neolms.studygroups.sync.GroupSessionListener;
import com.neolms.studygroups.sync.InProcessGroupChangeChannel;
import com.neolms.studygroups.testutil.InMemoryGroupInviteRepository;
import com.neolms.studygroups.testutil.InMemoryGroupRepository;
import com.neolms.studygroups.testutil.ManualExecutor;
import com.neolms.studygroups.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.neolms.studygroups.testutil.TestConstants.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

/**
 * Real services over the in-memory store, wired the way the application context wires them.
 */
class StudyGroupScenarioTest {

    private InMemoryGroupRepository groupRepository;
    private InMemoryGroupInviteRepository inviteRepository;
    private InProcessGroupChangeChannel channel;
    private MutableClock clock;

    private MembershipManager membershipManager;
    private InviteService inviteService;
    private PresenceTracker presenceTracker;
    private GroupDirectoryService directoryService;

    @BeforeEach
    void setUp() {
        groupRepository = new InMemoryGroupRepository();
        inviteRepository = new InMemoryGroupInviteRepository(groupRepository);
        channel = new InProcessGroupChangeChannel();
        clock = new MutableClock(NOW);
        ApplicationEventPublisher publisher = event -> channel.onGroupChange((GroupChangeEvent) event);

        StudyGroupsProperties properties = new StudyGroupsProperties();
        properties.setInviteBaseUrl("https://groups.example.edu");

        membershipManager = new MembershipManagerImpl(groupRepository, publisher, clock);
        inviteService = new InviteServiceImpl(inviteRepository, groupRepository, properties, publisher, clock);
        presenceTracker = new PresenceTrackerImpl(groupRepository, publisher, clock);
        directoryService = new GroupDirectoryServiceImpl(groupRepository);
    }

    @Test
    void createGroup_UpdatesStatsAndMakesCreatorOwner() {
        // Given
        GroupStats before = directoryService.getStats(VIEWER);

        // When
        MembershipResult result = membershipManager.create(new CreateGroupRequest("CP1 Study Squad", 10, false), VIEWER);

        // Then
        assertThat(result.getStatus()).isEqualTo(MembershipResult.Status.CREATED);
        GroupStats after = directoryService.getStats(VIEWER);
        assertThat(after.getTotalGroups()).isEqualTo(before.getTotalGroups() + 1);
        assertThat(after.getMyGroups()).isEqualTo(before.getMyGroups() + 1);

        GroupView created = directoryService.listGroups(VIEWER).get(0);
        assertThat(created.getName()).isEqualTo("CP1 Study Squad");
        assertThat(created.getUserRole()).isEqualTo(MemberRole.OWNER);
        assertThat(created.getMaxMembers()).isEqualTo(10);
    }

    @Test
    void createGroup_NameLengthBoundary() {
        MembershipResult threeChars = membershipManager.create(new CreateGroupRequest("SQL", 10, false), VIEWER);

        assertThat(threeChars.isSuccess()).isTrue();
        assertThat(groupRepository.groupCount()).isEqualTo(1);
    }

    @Test
    void inviteWithFiveUses_SixthRedemptionIsExhausted() {
        // Given
        String groupId = createGroup("Algorithms Crew", 20, true);
        InviteLinkResponse invite = inviteService.generate(groupId, 7, 5, VIEWER);

        // When
        List<MembershipResult> results = new ArrayList<>();
        for (int i = 1; i <= 6; i++) {
            results.add(inviteService.redeem(invite.getCode(), new Viewer(userId(i), "Student " + i, null)));
        }

        // Then
        assertThat(results.subList(0, 5)).allMatch(MembershipResult::isSuccess);
        assertThat(results.get(5).getStatus()).isEqualTo(MembershipResult.Status.INVITE_EXHAUSTED);
        assertThat(inviteRepository.useCount(invite.getInviteId())).isEqualTo(5);
        assertThat(groupRepository.storedGroup(groupId).getMemberCount()).isEqualTo(6);
    }

    @Test
    void inviteRedeemedAfterExpiry_IsExpired() {
        String groupId = createGroup("Algorithms Crew", 20, true);
        InviteLinkResponse invite = inviteService.generate(groupId, 1, null, VIEWER);

        clock.advance(Duration.ofDays(2));
        MembershipResult result = inviteService.redeem(invite.getCode(), OTHER_VIEWER);

        assertThat(result.getStatus()).isEqualTo(MembershipResult.Status.INVITE_EXPIRED);
        assertThat(groupRepository.findMember(groupId, OTHER_USER_ID)).isEmpty();
    }

    @Test
    void concurrentRedemptionsOfSingleUseInvite_ExactlyOneSucceeds() throws Exception {
        // Given
        String groupId = createGroup("Physics Lab", 20, true);
        InviteLinkResponse invite = inviteService.generate(groupId, null, 1, VIEWER);
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);

        // When
        List<Future<MembershipResult>> futures = new ArrayList<>();
        try {
            for (Viewer redeemer : List.of(OTHER_VIEWER, THIRD_VIEWER)) {
                Callable<MembershipResult> redeem = () -> {
                    start.await();
                    return inviteService.redeem(invite.getCode(), redeemer);
                };
                futures.add(pool.submit(redeem));
            }
            start.countDown();

            List<MembershipResult> results = new ArrayList<>();
            for (Future<MembershipResult> future : futures) {
                results.add(future.get(5, TimeUnit.SECONDS));
            }

            // Then
            assertThat(results).filteredOn(MembershipResult::isSuccess).hasSize(1);
            assertThat(results).filteredOn(r -> !r.isSuccess())
                .extracting(MembershipResult::getStatus)
                .containsExactly(MembershipResult.Status.INVITE_EXHAUSTED);
            assertThat(inviteRepository.useCount(invite.getInviteId())).isEqualTo(1);
            assertThat(groupRepository.storedGroup(groupId).getMemberCount()).isEqualTo(2);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void joinFullGroup_LeavesStoreUntouched() {
        // Given
        String groupId = createGroup("Tiny Group", 5, false);
        for (int i = 1; i <= 4; i++) {
            assertThat(membershipManager.join(groupId, Viewer.of(userId(i))).isSuccess()).isTrue();
        }

        // When
        MembershipResult result = membershipManager.join(groupId, THIRD_VIEWER);

        // Then
        assertThat(result.getStatus()).isEqualTo(MembershipResult.Status.CAPACITY_EXCEEDED);
        assertThat(groupRepository.storedGroup(groupId).getMemberCount()).isEqualTo(5);
        assertThat(groupRepository.findMember(groupId, THIRD_USER_ID)).isEmpty();
    }

    @Test
    void ownerLeaving_HandsOwnershipToEarliestMember() {
        // Given
        String groupId = createGroup("Chemistry", 10, false);
        clock.advance(Duration.ofMinutes(1));
        membershipManager.join(groupId, OTHER_VIEWER);
        clock.advance(Duration.ofMinutes(1));
        membershipManager.join(groupId, THIRD_VIEWER);

        // When
        MembershipResult result = membershipManager.leave(groupId, VIEWER);

        // Then
        assertThat(result.getStatus()).isEqualTo(MembershipResult.Status.LEFT);
        List<GroupMemberDTO> members = membershipManager.getMembers(groupId, OTHER_VIEWER);
        assertThat(members).extracting(GroupMemberDTO::getUserId).containsExactly(OTHER_USER_ID, THIRD_USER_ID);
        assertThat(members.get(0).getRole()).isEqualTo(MemberRole.OWNER);
    }

    @Test
    void soleOwner_CannotLeave() {
        String groupId = createGroup("Solo", 10, false);

        MembershipResult result = membershipManager.leave(groupId, VIEWER);

        assertThat(result.getStatus()).isEqualTo(MembershipResult.Status.OWNER_CANNOT_LEAVE);
        assertThat(groupRepository.storedGroup(groupId)).isNotNull();
    }

    @Test
    void presence_IsReportedAcrossAllMemberships() {
        String first = createGroup("Biology", 10, false);
        String second = createGroup("History", 10, false);
        membershipManager.join(first, OTHER_VIEWER);
        membershipManager.join(second, OTHER_VIEWER);

        presenceTracker.setOnline(OTHER_VIEWER, false);

        assertThat(directoryService.getStats(VIEWER).getOnlineMembers()).isEqualTo(1);
        assertThat(groupRepository.findMember(first, OTHER_USER_ID).orElseThrow().isOnline()).isFalse();
        assertThat(groupRepository.findMember(second, OTHER_USER_ID).orElseThrow().isOnline()).isFalse();

        presenceTracker.setOnline(OTHER_VIEWER, true);
        assertThat(directoryService.getStats(VIEWER).getOnlineMembers()).isEqualTo(2);
    }

    @Test
    void openSession_SeesOtherUsersJoinThroughChangeEvents() {
        // Given
        String groupId = createGroup("Linear Algebra", 10, false);
        ManualExecutor executor = new ManualExecutor();
        GroupDirectorySession session = new GroupDirectorySession("s1", VIEWER, directoryService,
            membershipManager, inviteService, presenceTracker, channel, executor, clock,
            mock(GroupSessionListener.class));
        session.open();
        executor.runAll();
        assertThat(session.getSnapshot().find(groupId).orElseThrow().getMemberCount()).isEqualTo(1);

        // When
        membershipManager.join(groupId, OTHER_VIEWER);
        executor.runAll();

        // Then
        GroupView synced = session.getSnapshot().find(groupId).orElseThrow();
        assertThat(synced.getMemberCount()).isEqualTo(2);
        assertThat(synced.findMember(OTHER_USER_ID)).isNotNull();

        session.close();
        assertThat(channel.subscriberCount()).isZero();
    }

    private String createGroup(String name, int maxMembers, boolean isPrivate) {
        MembershipResult result = membershipManager.create(new CreateGroupRequest(name, maxMembers, isPrivate), VIEWER);
        assertThat(result.isSuccess()).isTrue();
        return result.getGroupId();
    }
}
