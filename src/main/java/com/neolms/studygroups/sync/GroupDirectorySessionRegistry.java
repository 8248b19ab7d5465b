package com.neolms.studygroups.sync;

import com.neolms.studygroups.model.Viewer;
import com.neolms.studygroups.service.GroupDirectoryService;
import com.neolms.studygroups.service.InviteService;
import com.neolms.studygroups.service.MembershipManager;
import com.neolms.studygroups.service.PresenceTracker;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Live {@link GroupDirectorySession}s keyed by STOMP session id.
 */
@Component
public class GroupDirectorySessionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(GroupDirectorySessionRegistry.class);

    private final GroupDirectoryService directoryService;
    private final MembershipManager membershipManager;
    private final InviteService inviteService;
    private final PresenceTracker presenceTracker;
    private final GroupChangeChannel channel;
    private final Executor executor;
    private final Clock clock;
    private final GroupSessionListener listener;

    private final Map<String, GroupDirectorySession> sessions = new ConcurrentHashMap<>();

    @Autowired
    public GroupDirectorySessionRegistry(GroupDirectoryService directoryService, MembershipManager membershipManager,
                                         InviteService inviteService, PresenceTracker presenceTracker,
                                         GroupChangeChannel channel,
                                         @Qualifier("groupSyncExecutor") Executor executor,
                                         Clock clock, GroupSessionListener listener) {
        this.directoryService = directoryService;
        this.membershipManager = membershipManager;
        this.inviteService = inviteService;
        this.presenceTracker = presenceTracker;
        this.channel = channel;
        this.executor = executor;
        this.clock = clock;
        this.listener = listener;
    }

    /**
     * @throws IllegalStateException if a session with this id is already open
     */
    public GroupDirectorySession open(String sessionId, Viewer viewer) {
        GroupDirectorySession session = new GroupDirectorySession(sessionId, viewer, directoryService,
            membershipManager, inviteService, presenceTracker, channel, executor, clock, listener);
        if (sessions.putIfAbsent(sessionId, session) != null) {
            throw new IllegalStateException("Session already open: " + sessionId);
        }
        try {
            session.open();
        } catch (RuntimeException e) {
            sessions.remove(sessionId, session);
            session.close();
            throw e;
        }
        return session;
    }

    public void close(String sessionId) {
        GroupDirectorySession session = sessions.remove(sessionId);
        if (session != null) {
            session.close();
        }
    }

    public Optional<GroupDirectorySession> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public int activeSessionCount() {
        return sessions.size();
    }

    @PreDestroy
    public void closeAll() {
        List<String> ids = new ArrayList<>(sessions.keySet());
        if (!ids.isEmpty()) {
            logger.info("Closing {} group sessions on shutdown", ids.size());
        }
        for (String id : ids) {
            try {
                close(id);
            } catch (RuntimeException e) {
                logger.warn("Failed to close group session {}: {}", id, e.getMessage());
            }
        }
    }
}
