package com.neolms.studygroups.config;

import com.neolms.studygroups.security.ViewerPrincipal;
import com.neolms.studygroups.service.JwtService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.stereotype.Component;

/**
 * Authenticates STOMP CONNECT frames with the same bearer token as the REST API.
 */
@Component
public class JwtStompInterceptor implements ChannelInterceptor {

    private static final Logger logger = LoggerFactory.getLogger(JwtStompInterceptor.class);

    private static final String BEARER = "Bearer ";

    private final JwtService jwtService;

    @Autowired
    public JwtStompInterceptor(JwtService jwtService) {
        this.jwtService = jwtService;
    }

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
        if (accessor == null || !StompCommand.CONNECT.equals(accessor.getCommand())) {
            return message;
        }

        String authHeader = accessor.getFirstNativeHeader("Authorization");
        if (authHeader == null || !authHeader.startsWith(BEARER)) {
            throw new IllegalArgumentException("Missing or invalid Authorization header");
        }

        String token = authHeader.substring(BEARER.length());
        if (!jwtService.isTokenValid(token)) {
            logger.warn("STOMP CONNECT rejected: invalid or expired token");
            throw new IllegalArgumentException("Invalid STOMP CONNECT token");
        }

        accessor.setUser(new ViewerPrincipal(jwtService.extractViewer(token)));
        return message;
    }
}
