package com.neolms.studygroups.service.impl;

import com.neolms.studygroups.exception.RepositoryException;
import com.neolms.studygroups.model.GroupMember;
import com.neolms.studygroups.model.MemberRole;
import com.neolms.studygroups.repository.GroupRepository;
import com.neolms.studygroups.sync.GroupChangeEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;

import static com.neolms.studygroups.testutil.TestConstants.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PresenceTrackerImplTest {

    @Mock
    private GroupRepository groupRepository;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private PresenceTrackerImpl presenceTracker;

    @BeforeEach
    void setUp() {
        presenceTracker = new PresenceTrackerImpl(groupRepository, eventPublisher, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void setOnline_UpdatesEveryMembershipAndPublishes() {
        // Given
        when(groupRepository.findMembershipsByUser(USER_ID)).thenReturn(List.of(
            new GroupMember(GROUP_ID, USER_ID, MemberRole.MEMBER),
            new GroupMember(OTHER_GROUP_ID, USER_ID, MemberRole.OWNER)));
        when(groupRepository.updateMemberPresence(anyString(), eq(USER_ID), eq(true), eq(NOW))).thenReturn(true);

        // When
        presenceTracker.setOnline(VIEWER, true);

        // Then
        verify(groupRepository).updateMemberPresence(GROUP_ID, USER_ID, true, NOW);
        verify(groupRepository).updateMemberPresence(OTHER_GROUP_ID, USER_ID, true, NOW);
        ArgumentCaptor<GroupChangeEvent> events = ArgumentCaptor.forClass(GroupChangeEvent.class);
        verify(eventPublisher, times(2)).publishEvent(events.capture());
        assertThat(events.getAllValues()).extracting(GroupChangeEvent::getType)
            .containsOnly(GroupChangeEvent.Type.PRESENCE_CHANGED);
    }

    @Test
    void setOnline_FailureInOneGroup_StillUpdatesTheRest() {
        // Given
        when(groupRepository.findMembershipsByUser(USER_ID)).thenReturn(List.of(
            new GroupMember(GROUP_ID, USER_ID, MemberRole.MEMBER),
            new GroupMember(OTHER_GROUP_ID, USER_ID, MemberRole.MEMBER)));
        when(groupRepository.updateMemberPresence(GROUP_ID, USER_ID, false, NOW))
            .thenThrow(new RepositoryException("throttled"));
        when(groupRepository.updateMemberPresence(OTHER_GROUP_ID, USER_ID, false, NOW)).thenReturn(true);

        // When
        presenceTracker.setOnline(VIEWER, false);

        // Then
        verify(groupRepository).updateMemberPresence(OTHER_GROUP_ID, USER_ID, false, NOW);
        verify(eventPublisher, times(1)).publishEvent(any(GroupChangeEvent.class));
    }

    @Test
    void setOnline_RowRemovedMeanwhile_DoesNotPublish() {
        when(groupRepository.findMembershipsByUser(USER_ID)).thenReturn(List.of(
            new GroupMember(GROUP_ID, USER_ID, MemberRole.MEMBER)));
        when(groupRepository.updateMemberPresence(GROUP_ID, USER_ID, true, NOW)).thenReturn(false);

        presenceTracker.setOnline(VIEWER, true);

        verifyNoInteractions(eventPublisher);
    }

    @Test
    void setOnline_MembershipLookupFails_IsLoggedNotThrown() {
        when(groupRepository.findMembershipsByUser(USER_ID)).thenThrow(new RepositoryException("down"));

        assertThatCode(() -> presenceTracker.setOnline(VIEWER, true)).doesNotThrowAnyException();
        verify(groupRepository, never()).updateMemberPresence(anyString(), anyString(), anyBoolean(), any());
    }
}
