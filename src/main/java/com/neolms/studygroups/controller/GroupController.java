package com.neolms.studygroups.controller;

import com.neolms.studygroups.dto.CreateGroupRequest;
import com.neolms.studygroups.dto.GroupMemberDTO;
import com.neolms.studygroups.dto.GroupReportDTO;
import com.neolms.studygroups.dto.GroupStats;
import com.neolms.studygroups.dto.GroupView;
import com.neolms.studygroups.dto.PinGroupRequest;
import com.neolms.studygroups.dto.ReportGroupRequest;
import com.neolms.studygroups.model.GroupCategory;
import com.neolms.studygroups.model.GroupSortOption;
import com.neolms.studygroups.model.MembershipScope;
import com.neolms.studygroups.model.Viewer;
import com.neolms.studygroups.service.GroupDirectoryService;
import com.neolms.studygroups.service.GroupReportService;
import com.neolms.studygroups.service.MembershipManager;
import com.neolms.studygroups.service.MembershipResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Pattern;
import java.util.List;

/**
 * REST controller for the group directory and membership operations.
 */
@RestController
@RequestMapping("/groups")
@Validated
@Tag(name = "Groups", description = "Study group directory and membership")
@SecurityRequirement(name = "Bearer Authentication")
public class GroupController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(GroupController.class);

    private final GroupDirectoryService directoryService;
    private final MembershipManager membershipManager;
    private final GroupReportService reportService;

    @Autowired
    public GroupController(GroupDirectoryService directoryService, MembershipManager membershipManager,
                           GroupReportService reportService) {
        this.directoryService = directoryService;
        this.membershipManager = membershipManager;
        this.reportService = reportService;
    }

    @GetMapping
    @Operation(summary = "List visible groups",
               description = "Filters by membership scope and category, searches name, description and course, "
                   + "then sorts. Pinned groups come first.")
    public ResponseEntity<List<GroupView>> listGroups(
            @Parameter(description = "all, my_groups or public") @RequestParam(required = false) String scope,
            @Parameter(description = "Search text") @RequestParam(name = "q", required = false) String search,
            @Parameter(description = "recent, members, activity or name") @RequestParam(required = false) String sort,
            @RequestParam(required = false) String category,
            HttpServletRequest httpRequest) {

        Viewer viewer = extractViewer(httpRequest);
        List<GroupView> groups = directoryService.queryGroups(viewer,
            parseOption(MembershipScope.class, scope, "scope"),
            search,
            parseOption(GroupSortOption.class, sort, "sort"),
            parseOption(GroupCategory.class, category, "category"));
        logger.debug("Returning {} groups for user {}", groups.size(), viewer.getUserId());

        return ResponseEntity.ok(groups);
    }

    @GetMapping("/stats")
    @Operation(summary = "Directory statistics for the caller")
    public ResponseEntity<GroupStats> getStats(HttpServletRequest httpRequest) {
        return ResponseEntity.ok(directoryService.getStats(extractViewer(httpRequest)));
    }

    @PostMapping
    @Operation(summary = "Create a group", description = "The caller becomes its owner.")
    public ResponseEntity<MembershipResult> createGroup(
            @Valid @RequestBody CreateGroupRequest request,
            HttpServletRequest httpRequest) {

        Viewer viewer = extractViewer(httpRequest);
        logger.info("Creating group {} for user {}", request.getName(), viewer.getUserId());

        MembershipResult result = membershipManager.create(request, viewer);
        logger.info("Successfully created group {} with ID {}", request.getName(), result.getGroupId());

        return toResponse(result);
    }

    @PostMapping("/{groupId}/join")
    @Operation(summary = "Join a public group")
    public ResponseEntity<MembershipResult> joinGroup(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid group ID format") String groupId,
            HttpServletRequest httpRequest) {

        Viewer viewer = extractViewer(httpRequest);
        MembershipResult result = membershipManager.join(groupId, viewer);
        logger.info("Join of group {} by {}: {}", groupId, viewer.getUserId(), result.getStatus());

        return toResponse(result);
    }

    @PostMapping("/{groupId}/leave")
    @Operation(summary = "Leave a group",
               description = "An owner hands ownership to the next member; a sole owner cannot leave.")
    public ResponseEntity<MembershipResult> leaveGroup(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid group ID format") String groupId,
            HttpServletRequest httpRequest) {

        Viewer viewer = extractViewer(httpRequest);
        MembershipResult result = membershipManager.leave(groupId, viewer);
        logger.info("Leave of group {} by {}: {}", groupId, viewer.getUserId(), result.getStatus());

        return toResponse(result);
    }

    @PutMapping("/{groupId}/pin")
    @Operation(summary = "Pin or unpin a group for the caller")
    public ResponseEntity<MembershipResult> pinGroup(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid group ID format") String groupId,
            @Valid @RequestBody PinGroupRequest request,
            HttpServletRequest httpRequest) {

        Viewer viewer = extractViewer(httpRequest);
        return toResponse(membershipManager.togglePin(groupId, request.getPinned(), viewer));
    }

    @GetMapping("/{groupId}/members")
    @Operation(summary = "List members, owner first")
    public ResponseEntity<List<GroupMemberDTO>> getMembers(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid group ID format") String groupId,
            HttpServletRequest httpRequest) {

        return ResponseEntity.ok(membershipManager.getMembers(groupId, extractViewer(httpRequest)));
    }

    @PostMapping("/{groupId}/reports")
    @Operation(summary = "Report a group to moderators",
               description = "Reason is one of spam, harassment, inappropriate, cheating or other.")
    public ResponseEntity<GroupReportDTO> reportGroup(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid group ID format") String groupId,
            @Valid @RequestBody ReportGroupRequest request,
            HttpServletRequest httpRequest) {

        Viewer viewer = extractViewer(httpRequest);
        GroupReportDTO report = reportService.reportGroup(groupId, request.getReason(), request.getDetails(), viewer);
        logger.info("Report {} filed against group {}", report.getReportId(), groupId);

        return ResponseEntity.status(HttpStatus.CREATED).body(report);
    }
}
