package com.neolms.studygroups.service.impl;

import com.neolms.studygroups.config.StudyGroupsProperties;
import com.neolms.studygroups.dto.GroupInviteDTO;
import com.neolms.studygroups.dto.GroupMemberDTO;
import com.neolms.studygroups.dto.GroupView;
import com.neolms.studygroups.dto.InviteLinkResponse;
import com.neolms.studygroups.exception.AlreadyMemberException;
import com.neolms.studygroups.exception.CapacityExceededException;
import com.neolms.studygroups.exception.InviteUnavailableException;
import com.neolms.studygroups.exception.ResourceNotFoundException;
import com.neolms.studygroups.exception.UnauthorizedException;
import com.neolms.studygroups.model.*;
import com.neolms.studygroups.repository.GroupInviteRepository;
import com.neolms.studygroups.repository.GroupRepository;
import com.neolms.studygroups.service.InviteService;
import com.neolms.studygroups.service.MembershipResult;
import com.neolms.studygroups.sync.GroupChangeEvent;
import com.neolms.studygroups.util.InviteCodeGenerator;
import com.neolms.studygroups.util.StudyGroupValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Service
public class InviteServiceImpl implements InviteService {

    private static final Logger logger = LoggerFactory.getLogger(InviteServiceImpl.class);

    private final GroupInviteRepository inviteRepository;
    private final GroupRepository groupRepository;
    private final StudyGroupsProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Autowired
    public InviteServiceImpl(GroupInviteRepository inviteRepository, GroupRepository groupRepository,
                             StudyGroupsProperties properties, ApplicationEventPublisher eventPublisher,
                             Clock clock) {
        this.inviteRepository = inviteRepository;
        this.groupRepository = groupRepository;
        this.properties = properties;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    @Override
    public InviteLinkResponse generate(String groupId, Integer expiresInDays, Integer maxUses, Viewer viewer) {
        StudyGroupValidator.validateInviteLimits(expiresInDays, maxUses);

        GroupWithMembers loaded = groupRepository.findGroup(groupId, viewer.getUserId())
            .orElseThrow(() -> new ResourceNotFoundException("Group not found: " + groupId));
        if (!loaded.hasMember(viewer.getUserId())) {
            throw new UnauthorizedException("Only group members can create invites");
        }

        Instant now = clock.instant();
        String code = InviteCodeGenerator.generateUnique(inviteRepository::codeExists);
        GroupInvite invite = new GroupInvite(groupId, code, viewer.getUserId(), now);
        if (expiresInDays != null) {
            invite.setExpiresAt(now.plus(Duration.ofDays(expiresInDays)));
        }
        invite.setMaxUses(maxUses);
        inviteRepository.save(invite);

        logger.info("Created invite {} for group {} by {}", invite.getInviteId(), groupId, viewer.getUserId());
        publish(GroupChangeEvent.Type.INVITE_CHANGED, groupId, viewer.getUserId());
        return new InviteLinkResponse(invite.getInviteId(), code, buildLink(code), invite.getExpiresAt(), maxUses);
    }

    @Override
    public MembershipResult redeem(String code, Viewer viewer) {
        if (!InviteCodeGenerator.isWellFormed(code)) {
            return MembershipResult.inviteNotFound();
        }
        Optional<GroupInvite> found = inviteRepository.findByCode(code);
        if (found.isEmpty()) {
            return MembershipResult.inviteNotFound();
        }
        GroupInvite invite = found.get();
        String groupId = invite.getGroupId();
        Instant now = clock.instant();

        InviteUnavailableException.Reason reason = invite.unavailableReasonAt(now);
        if (reason != null) {
            return unavailable(reason, groupId);
        }

        String userId = viewer.getUserId();
        Optional<GroupWithMembers> loaded = groupRepository.findGroup(groupId, userId);
        if (loaded.isEmpty()) {
            return MembershipResult.groupNotFound(groupId);
        }
        GroupWithMembers current = loaded.get();
        if (current.hasMember(userId)) {
            return MembershipResult.alreadyMember(groupId);
        }
        if (current.getGroup().isFull()) {
            return MembershipResult.capacityExceeded(groupId);
        }

        GroupMember member = new GroupMember(groupId, userId, MemberRole.MEMBER);
        member.setDisplayName(viewer.getDisplayName());
        member.setAvatarUrl(viewer.getAvatarUrl());
        member.setOnline(true);
        member.setCreatedAt(now);
        member.setUpdatedAt(now);
        member.setLastActive(now);

        try {
            inviteRepository.redeem(invite, member, now);
        } catch (InviteUnavailableException e) {
            return unavailable(e.getReason(), groupId);
        } catch (AlreadyMemberException e) {
            return MembershipResult.alreadyMember(groupId);
        } catch (CapacityExceededException e) {
            return MembershipResult.capacityExceeded(groupId);
        }

        publish(GroupChangeEvent.Type.MEMBER_JOINED, groupId, userId);
        // Invites are the one way into a private group, so the view is built for the new member
        GroupView view = GroupView.from(current, userId).withMemberAdded(GroupMemberDTO.from(member));
        return MembershipResult.joined(view);
    }

    @Override
    public List<GroupInviteDTO> listActiveInvites(String groupId, Viewer viewer) {
        GroupWithMembers loaded = groupRepository.findGroup(groupId, viewer.getUserId())
            .orElseThrow(() -> new ResourceNotFoundException("Group not found: " + groupId));
        if (!loaded.hasMember(viewer.getUserId())) {
            throw new UnauthorizedException("Only group members can view invites");
        }

        Instant now = clock.instant();
        return inviteRepository.findAllByGroupId(groupId).stream()
            .filter(invite -> invite.isRedeemableAt(now))
            .map(invite -> new GroupInviteDTO(invite, buildLink(invite.getCode())))
            .collect(Collectors.toList());
    }

    @Override
    public void deactivate(String groupId, String inviteId, Viewer viewer) {
        GroupInvite invite = inviteRepository.findById(inviteId)
            .filter(i -> i.getGroupId().equals(groupId))
            .orElseThrow(() -> new ResourceNotFoundException("Invite not found: " + inviteId));

        String userId = viewer.getUserId();
        if (!userId.equals(invite.getCreatedBy())) {
            boolean canManage = groupRepository.findMember(groupId, userId)
                .map(m -> m.getMemberRole().canManageInvites())
                .orElse(false);
            if (!canManage) {
                throw new UnauthorizedException("Only the invite creator or a group moderator can deactivate invites");
            }
        }

        if (!invite.isActive()) {
            logger.debug("Invite {} already inactive", inviteId);
            return;
        }

        inviteRepository.deactivate(inviteId, userId, clock.instant());
        publish(GroupChangeEvent.Type.INVITE_CHANGED, groupId, userId);
    }

    @Override
    public String buildLink(String code) {
        String base = properties.getInviteBaseUrl();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/join/" + code;
    }

    private MembershipResult unavailable(InviteUnavailableException.Reason reason, String groupId) {
        switch (reason) {
            case EXPIRED:
                return MembershipResult.inviteExpired(groupId);
            case EXHAUSTED:
                return MembershipResult.inviteExhausted(groupId);
            default:
                return MembershipResult.inviteNotFound();
        }
    }

    private void publish(GroupChangeEvent.Type type, String groupId, String actorId) {
        eventPublisher.publishEvent(new GroupChangeEvent(type, groupId, actorId, clock.instant()));
    }
}
