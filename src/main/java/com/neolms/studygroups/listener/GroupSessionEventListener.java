package com.neolms.studygroups.listener;

import com.neolms.studygroups.security.ViewerPrincipal;
import com.neolms.studygroups.sync.GroupDirectorySessionRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectedEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.security.Principal;

/**
 * Ties group sessions to the STOMP connection lifecycle: a session opens when the
 * CONNECT frame has been accepted and closes on disconnect, clean or not.
 */
@Component
public class GroupSessionEventListener {

    private static final Logger logger = LoggerFactory.getLogger(GroupSessionEventListener.class);

    private final GroupDirectorySessionRegistry registry;
    private final MeterRegistry meterRegistry;

    public GroupSessionEventListener(GroupDirectorySessionRegistry registry, MeterRegistry meterRegistry) {
        this.registry = registry;
        this.meterRegistry = meterRegistry;
    }

    @EventListener
    public void handleSessionConnected(SessionConnectedEvent event) {
        StompHeaderAccessor accessor = StompHeaderAccessor.wrap(event.getMessage());
        String sessionId = accessor.getSessionId();
        Principal principal = event.getUser();

        if (!(principal instanceof ViewerPrincipal)) {
            logger.warn("STOMP session {} connected without a viewer principal, no group session opened", sessionId);
            meterRegistry.counter("group_sessions_total", "status", "unauthenticated").increment();
            return;
        }

        try {
            registry.open(sessionId, ((ViewerPrincipal) principal).getViewer());
            meterRegistry.counter("group_sessions_total", "status", "opened").increment();
        } catch (IllegalStateException e) {
            logger.warn("Group session {} not opened: {}", sessionId, e.getMessage());
            meterRegistry.counter("group_sessions_total", "status", "duplicate").increment();
        }
    }

    @EventListener
    public void handleSessionDisconnect(SessionDisconnectEvent event) {
        String sessionId = event.getSessionId();
        logger.debug("STOMP session {} disconnected ({})", sessionId, event.getCloseStatus());
        registry.close(sessionId);
        meterRegistry.counter("group_sessions_total", "status", "closed").increment();
    }
}
