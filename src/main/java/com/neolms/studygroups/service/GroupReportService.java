package com.neolms.studygroups.service;

import com.neolms.studygroups.dto.GroupReportDTO;
import com.neolms.studygroups.model.Viewer;

public interface GroupReportService {

    /**
     * File a pending report against a group the viewer can see.
     *
     * @param reason  one of spam, harassment, inappropriate, cheating or other, in any casing
     * @param details free text, may be null
     * @throws com.neolms.studygroups.exception.ValidationException for an unknown reason or overlong details
     * @throws com.neolms.studygroups.exception.ResourceNotFoundException when the group does not exist
     *         or is private to the viewer
     */
    GroupReportDTO reportGroup(String groupId, String reason, String details, Viewer viewer);
}
