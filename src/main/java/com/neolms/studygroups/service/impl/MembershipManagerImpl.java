package com.neolms.studygroups.service.impl;

import com.neolms.studygroups.dto.CreateGroupRequest;
import com.neolms.studygroups.dto.GroupMemberDTO;
import com.neolms.studygroups.dto.GroupView;
import com.neolms.studygroups.exception.AlreadyMemberException;
import com.neolms.studygroups.exception.CapacityExceededException;
import com.neolms.studygroups.exception.NotMemberException;
import com.neolms.studygroups.exception.ResourceNotFoundException;
import com.neolms.studygroups.model.*;
import com.neolms.studygroups.repository.GroupRepository;
import com.neolms.studygroups.service.MembershipManager;
import com.neolms.studygroups.service.MembershipResult;
import com.neolms.studygroups.sync.GroupChangeEvent;
import com.neolms.studygroups.util.StudyGroupValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Membership operations backed by the conditional transactions in {@link GroupRepository}.
 *
 * Each operation pre-checks its policy against the current store state and then relies on
 * the repository's conditional write for the final word, so a request that loses a race
 * still gets the matching typed result.
 */
@Service
public class MembershipManagerImpl implements MembershipManager {

    private static final Logger logger = LoggerFactory.getLogger(MembershipManagerImpl.class);

    /**
     * Highest role first, then earliest joiner, then user id.
     */
    static final Comparator<GroupMember> SUCCESSION_ORDER = Comparator
        .comparing((GroupMember m) -> m.getMemberRole().getPrivilege(), Comparator.reverseOrder())
        .thenComparing(GroupMember::getJoinedAt, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(GroupMember::getUserId);

    private final GroupRepository groupRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Autowired
    public MembershipManagerImpl(GroupRepository groupRepository, ApplicationEventPublisher eventPublisher,
                                 Clock clock) {
        this.groupRepository = groupRepository;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    @Override
    public MembershipResult join(String groupId, Viewer viewer) {
        String userId = viewer.getUserId();
        Optional<GroupWithMembers> loaded = groupRepository.findGroup(groupId, userId);
        if (loaded.isEmpty() || !loaded.get().isVisibleTo(userId)) {
            return MembershipResult.groupNotFound(groupId);
        }
        GroupWithMembers current = loaded.get();
        if (current.hasMember(userId)) {
            return MembershipResult.alreadyMember(groupId);
        }
        if (current.getGroup().isFull()) {
            logger.debug("Join rejected for {}: group {} is full", userId, groupId);
            return MembershipResult.capacityExceeded(groupId);
        }

        GroupMember member = newMember(groupId, viewer, MemberRole.MEMBER);
        try {
            groupRepository.insertMember(member);
        } catch (CapacityExceededException e) {
            return MembershipResult.capacityExceeded(groupId);
        } catch (AlreadyMemberException e) {
            return MembershipResult.alreadyMember(groupId);
        }

        publish(GroupChangeEvent.Type.MEMBER_JOINED, groupId, userId);
        GroupView view = GroupView.from(current, userId).withMemberAdded(GroupMemberDTO.from(member));
        return MembershipResult.joined(view);
    }

    @Override
    public MembershipResult leave(String groupId, Viewer viewer) {
        String userId = viewer.getUserId();
        Optional<GroupWithMembers> loaded = groupRepository.findGroup(groupId, userId);
        if (loaded.isEmpty()) {
            return MembershipResult.groupNotFound(groupId);
        }
        GroupWithMembers current = loaded.get();
        GroupMember membership = current.getMembers().stream()
            .filter(m -> m.getUserId().equals(userId))
            .findFirst()
            .orElse(null);
        if (membership == null) {
            return MembershipResult.notMember(groupId);
        }

        GroupMember successor = null;
        if (membership.isOwner()) {
            successor = current.getMembers().stream()
                .filter(m -> !m.getUserId().equals(userId))
                .min(SUCCESSION_ORDER)
                .orElse(null);
            if (successor == null) {
                return MembershipResult.ownerCannotLeave(groupId);
            }
        }

        try {
            groupRepository.deleteMember(groupId, userId, successor != null ? successor.getUserId() : null,
                clock.instant());
        } catch (NotMemberException e) {
            return MembershipResult.notMember(groupId);
        }

        publish(GroupChangeEvent.Type.MEMBER_LEFT, groupId, userId);
        GroupView view = GroupView.from(current, userId).withMemberRemoved(userId);
        if (successor != null) {
            view = view.withMemberAdded(GroupMemberDTO.from(successor).withRole(MemberRole.OWNER));
        }
        return MembershipResult.left(groupId, view.isVisibleToViewer() ? view : null);
    }

    @Override
    public MembershipResult create(CreateGroupRequest draft, Viewer viewer) {
        StudyGroupValidator.validateDraft(draft);

        Instant now = clock.instant();
        StudyGroup group = new StudyGroup(draft.getName(), viewer.getUserId(), draft.isPrivate());
        group.setDescription(draft.getDescription() != null ? draft.getDescription() : "");
        GroupCategory category = GroupCategory.fromValue(draft.getCategory());
        group.setCategory((category != null ? category : GroupCategory.STUDY).name());
        if (draft.getColor() != null) {
            group.setColor(draft.getColor());
        }
        if (draft.getIcon() != null && !draft.getIcon().isBlank()) {
            group.setIcon(draft.getIcon());
        }
        group.setAvatarUrl(draft.getAvatarUrl());
        group.setCourseId(draft.getCourseId());
        group.setCourseName(draft.getCourseName());
        group.setMaxMembers(draft.getMaxMembers() != null ? draft.getMaxMembers() : StudyGroup.DEFAULT_MAX_MEMBERS);
        group.setMemberCount(1);
        group.setCreatedAt(now);
        group.setUpdatedAt(now);
        group.setLastActivity(now);

        GroupMember owner = newMember(group.getGroupId(), viewer, MemberRole.OWNER);
        groupRepository.insertGroupWithOwner(group, owner);

        publish(GroupChangeEvent.Type.GROUP_CREATED, group.getGroupId(), viewer.getUserId());
        GroupView view = GroupView.from(new GroupWithMembers(group, List.of(owner), false), viewer.getUserId());
        return MembershipResult.created(view);
    }

    @Override
    public MembershipResult togglePin(String groupId, boolean pinned, Viewer viewer) {
        String userId = viewer.getUserId();
        Optional<GroupWithMembers> loaded = groupRepository.findGroup(groupId, userId);
        if (loaded.isEmpty() || !loaded.get().isVisibleTo(userId)) {
            return MembershipResult.groupNotFound(groupId);
        }

        groupRepository.setPinned(userId, groupId, pinned);
        publish(GroupChangeEvent.Type.PIN_CHANGED, groupId, userId);
        return MembershipResult.pinUpdated(GroupView.from(loaded.get(), userId).withPinned(pinned));
    }

    @Override
    public List<GroupMemberDTO> getMembers(String groupId, Viewer viewer) {
        GroupWithMembers loaded = groupRepository.findGroup(groupId, viewer.getUserId())
            .filter(g -> g.isVisibleTo(viewer.getUserId()))
            .orElseThrow(() -> new ResourceNotFoundException("Group not found: " + groupId));

        return loaded.getMembers().stream()
            .sorted(SUCCESSION_ORDER)
            .map(GroupMemberDTO::from)
            .collect(Collectors.toList());
    }

    private GroupMember newMember(String groupId, Viewer viewer, MemberRole role) {
        Instant now = clock.instant();
        GroupMember member = new GroupMember(groupId, viewer.getUserId(), role);
        member.setDisplayName(viewer.getDisplayName());
        member.setAvatarUrl(viewer.getAvatarUrl());
        member.setOnline(true);
        member.setCreatedAt(now);
        member.setUpdatedAt(now);
        member.setLastActive(now);
        return member;
    }

    private void publish(GroupChangeEvent.Type type, String groupId, String actorId) {
        eventPublisher.publishEvent(new GroupChangeEvent(type, groupId, actorId, clock.instant()));
    }
}
