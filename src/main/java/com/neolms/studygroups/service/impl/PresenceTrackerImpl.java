package com.neolms.studygroups.service.impl;

import com.neolms.studygroups.model.GroupMember;
import com.neolms.studygroups.model.Viewer;
import com.neolms.studygroups.repository.GroupRepository;
import com.neolms.studygroups.service.PresenceTracker;
import com.neolms.studygroups.sync.GroupChangeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Marks a user online or offline on every group they belong to.
 *
 * Each membership row is updated independently; a failure on one group is logged and the
 * remaining groups are still updated.
 */
@Service
public class PresenceTrackerImpl implements PresenceTracker {

    private static final Logger logger = LoggerFactory.getLogger(PresenceTrackerImpl.class);

    private final GroupRepository groupRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Autowired
    public PresenceTrackerImpl(GroupRepository groupRepository, ApplicationEventPublisher eventPublisher,
                               Clock clock) {
        this.groupRepository = groupRepository;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    @Override
    public void setOnline(Viewer viewer, boolean online) {
        String userId = viewer.getUserId();
        List<GroupMember> memberships;
        try {
            memberships = groupRepository.findMembershipsByUser(userId);
        } catch (RuntimeException e) {
            logger.warn("Could not load memberships of {} for presence update: {}", userId, e.getMessage());
            return;
        }

        Instant now = clock.instant();
        int updated = 0;
        for (GroupMember membership : memberships) {
            String groupId = membership.getGroupId();
            try {
                if (groupRepository.updateMemberPresence(groupId, userId, online, now)) {
                    updated++;
                    eventPublisher.publishEvent(
                        new GroupChangeEvent(GroupChangeEvent.Type.PRESENCE_CHANGED, groupId, userId, now));
                }
            } catch (RuntimeException e) {
                logger.warn("Presence update failed for user {} in group {}: {}", userId, groupId, e.getMessage());
            }
        }
        logger.debug("Set {} {} in {}/{} groups", userId, online ? "online" : "offline", updated, memberships.size());
    }
}
