package com.neolms.studygroups.controller;

import com.neolms.studygroups.dto.GenerateInviteRequest;
import com.neolms.studygroups.dto.GroupInviteDTO;
import com.neolms.studygroups.dto.InviteLinkResponse;
import com.neolms.studygroups.model.Viewer;
import com.neolms.studygroups.service.InviteService;
import com.neolms.studygroups.service.MembershipResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@Validated
@Tag(name = "Invites", description = "Shareable invite links for study groups")
@SecurityRequirement(name = "Bearer Authentication")
public class InviteController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(InviteController.class);

    private final InviteService inviteService;

    @Autowired
    public InviteController(InviteService inviteService) {
        this.inviteService = inviteService;
    }

    @PostMapping("/groups/{groupId}/invites")
    @Operation(summary = "Create an invite link",
               description = "Members only. Both limits are optional: no expiry and unlimited uses by default.")
    public ResponseEntity<InviteLinkResponse> generateInvite(
            @Parameter(description = "Group ID")
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid group ID format") String groupId,
            @Valid @RequestBody(required = false) GenerateInviteRequest request,
            HttpServletRequest httpRequest) {

        Viewer viewer = extractViewer(httpRequest);
        GenerateInviteRequest limits = request != null ? request : new GenerateInviteRequest();
        InviteLinkResponse response = inviteService.generate(groupId, limits.getExpiresInDays(),
            limits.getMaxUses(), viewer);
        logger.info("Generated invite {} for group {} by {}", response.getInviteId(), groupId, viewer.getUserId());

        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/groups/{groupId}/invites")
    @Operation(summary = "List active invites of a group, newest first")
    public ResponseEntity<List<GroupInviteDTO>> listInvites(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid group ID format") String groupId,
            HttpServletRequest httpRequest) {

        return ResponseEntity.ok(inviteService.listActiveInvites(groupId, extractViewer(httpRequest)));
    }

    @DeleteMapping("/groups/{groupId}/invites/{inviteId}")
    @Operation(summary = "Deactivate an invite",
               description = "Allowed for the invite creator and for group owners and moderators.")
    public ResponseEntity<Void> deactivateInvite(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid group ID format") String groupId,
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid invite ID format") String inviteId,
            HttpServletRequest httpRequest) {

        inviteService.deactivate(groupId, inviteId, extractViewer(httpRequest));
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/invites/{code}/redeem")
    @Operation(summary = "Join a group through an invite code")
    public ResponseEntity<MembershipResult> redeemInvite(
            @PathVariable String code,
            HttpServletRequest httpRequest) {

        Viewer viewer = extractViewer(httpRequest);
        MembershipResult result = inviteService.redeem(code, viewer);
        logger.info("Invite redemption by {}: {}", viewer.getUserId(), result.getStatus());

        return toResponse(result);
    }
}
