package com.neolms.studygroups.controller;

import com.neolms.studygroups.dto.PresenceRequest;
import com.neolms.studygroups.service.PresenceTracker;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Presence")
@SecurityRequirement(name = "Bearer Authentication")
public class PresenceController extends BaseController {

    private final PresenceTracker presenceTracker;

    @Autowired
    public PresenceController(PresenceTracker presenceTracker) {
        this.presenceTracker = presenceTracker;
    }

    @PutMapping("/presence")
    @Operation(summary = "Mark the caller online or offline in all of their groups")
    public ResponseEntity<Void> setPresence(@Valid @RequestBody PresenceRequest request,
                                            HttpServletRequest httpRequest) {
        presenceTracker.setOnline(extractViewer(httpRequest), request.getOnline());
        return ResponseEntity.noContent().build();
    }
}
