package com.neolms.studygroups.sync;

import com.neolms.studygroups.model.Viewer;
import com.neolms.studygroups.service.MembershipResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Pushes session snapshots and operation results to the viewer's STOMP user queues.
 */
@Component
public class GroupSessionBroadcaster implements GroupSessionListener {

    private static final Logger logger = LoggerFactory.getLogger(GroupSessionBroadcaster.class);

    public static final String SNAPSHOT_DESTINATION = "/queue/groups";
    public static final String RESULT_DESTINATION = "/queue/group-results";

    private final SimpMessagingTemplate messagingTemplate;

    @Autowired
    public GroupSessionBroadcaster(SimpMessagingTemplate messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }

    @Override
    public void onSnapshot(Viewer viewer, GroupSnapshot snapshot) {
        send(viewer, SNAPSHOT_DESTINATION, snapshot);
    }

    @Override
    public void onResult(Viewer viewer, MembershipResult result) {
        send(viewer, RESULT_DESTINATION, result);
    }

    private void send(Viewer viewer, String destination, Object payload) {
        try {
            messagingTemplate.convertAndSendToUser(viewer.getUserId(), destination, payload);
        } catch (MessagingException e) {
            // client gone; the next resync carries the state again
            logger.warn("Failed to push {} to {}: {}", destination, viewer.getUserId(), e.getMessage());
        }
    }
}
