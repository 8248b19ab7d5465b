package com.neolms.studygroups.controller;

import com.neolms.studygroups.controller.BaseController.ErrorResponse;
import com.neolms.studygroups.dto.CreateGroupRequest;
import com.neolms.studygroups.dto.GroupCommand;
import com.neolms.studygroups.dto.InviteLinkResponse;
import com.neolms.studygroups.exception.UnauthorizedException;
import com.neolms.studygroups.exception.ValidationException;
import com.neolms.studygroups.sync.GroupDirectorySession;
import com.neolms.studygroups.sync.GroupDirectorySessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.annotation.SendToUser;
import org.springframework.stereotype.Controller;

import java.util.concurrent.CompletableFuture;

/**
 * STOMP commands of a live group session. Results and snapshots are pushed back
 * asynchronously by the session listener; invite links are returned on the caller's
 * invite queue once generated.
 */
@Controller
public class GroupSessionController {

    private static final Logger logger = LoggerFactory.getLogger(GroupSessionController.class);

    private final GroupDirectorySessionRegistry registry;

    @Autowired
    public GroupSessionController(GroupDirectorySessionRegistry registry) {
        this.registry = registry;
    }

    @MessageMapping("groups.join")
    public void join(@Payload GroupCommand command,
                     @Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId) {
        session(sessionId).join(requireGroupId(command));
    }

    @MessageMapping("groups.leave")
    public void leave(@Payload GroupCommand command,
                      @Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId) {
        session(sessionId).leave(requireGroupId(command));
    }

    @MessageMapping("groups.pin")
    public void pin(@Payload GroupCommand command,
                    @Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId) {
        if (command.getPinned() == null) {
            throw new ValidationException("pinned is required");
        }
        session(sessionId).togglePin(requireGroupId(command), command.getPinned());
    }

    @MessageMapping("groups.create")
    public void create(@Payload CreateGroupRequest request,
                       @Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId) {
        session(sessionId).create(request);
    }

    @MessageMapping("invites.generate")
    @SendToUser("/queue/invites")
    public CompletableFuture<InviteLinkResponse> generateInvite(
            @Payload GroupCommand command,
            @Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId) {
        return session(sessionId).generateInvite(requireGroupId(command), command.getExpiresInDays(),
            command.getMaxUses());
    }

    @MessageMapping("invites.redeem")
    public void redeem(@Payload GroupCommand command,
                       @Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId) {
        if (command.getCode() == null || command.getCode().isBlank()) {
            throw new ValidationException("code is required");
        }
        session(sessionId).redeemInvite(command.getCode().trim());
    }

    @MessageMapping("groups.resync")
    public void resync(@Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId) {
        session(sessionId).resync();
    }

    @MessageExceptionHandler({ValidationException.class, UnauthorizedException.class})
    @SendToUser("/queue/errors")
    public ErrorResponse handleRejected(RuntimeException e) {
        logger.warn("Group command rejected: {}", e.getMessage());
        String error = e instanceof ValidationException ? "VALIDATION_ERROR" : "UNAUTHORIZED";
        return new ErrorResponse(error, e.getMessage());
    }

    @MessageExceptionHandler
    @SendToUser("/queue/errors")
    public ErrorResponse handleGeneral(Exception e) {
        logger.error("Group command failed: {}", e.getMessage(), e);
        return new ErrorResponse("INTERNAL_ERROR", "An unexpected error occurred");
    }

    private GroupDirectorySession session(String sessionId) {
        return registry.find(sessionId)
            .orElseThrow(() -> new UnauthorizedException("No open group session for " + sessionId));
    }

    private static String requireGroupId(GroupCommand command) {
        if (command.getGroupId() == null || command.getGroupId().isBlank()) {
            throw new ValidationException("groupId is required");
        }
        return command.getGroupId();
    }
}
