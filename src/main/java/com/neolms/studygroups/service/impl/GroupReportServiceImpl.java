package com.neolms.studygroups.service.impl;

import com.neolms.studygroups.dto.GroupReportDTO;
import com.neolms.studygroups.exception.ResourceNotFoundException;
import com.neolms.studygroups.model.GroupReport;
import com.neolms.studygroups.model.GroupWithMembers;
import com.neolms.studygroups.model.ReportReason;
import com.neolms.studygroups.model.Viewer;
import com.neolms.studygroups.repository.GroupReportRepository;
import com.neolms.studygroups.repository.GroupRepository;
import com.neolms.studygroups.service.GroupReportService;
import com.neolms.studygroups.util.StudyGroupValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;

@Service
public class GroupReportServiceImpl implements GroupReportService {

    private static final Logger logger = LoggerFactory.getLogger(GroupReportServiceImpl.class);

    private final GroupReportRepository reportRepository;
    private final GroupRepository groupRepository;
    private final Clock clock;

    @Autowired
    public GroupReportServiceImpl(GroupReportRepository reportRepository, GroupRepository groupRepository,
                                  Clock clock) {
        this.reportRepository = reportRepository;
        this.groupRepository = groupRepository;
        this.clock = clock;
    }

    @Override
    public GroupReportDTO reportGroup(String groupId, String reason, String details, Viewer viewer) {
        ReportReason parsed = StudyGroupValidator.validateReport(reason, details);

        // A private group the viewer is not in reads as missing, same as in the directory
        GroupWithMembers loaded = groupRepository.findGroup(groupId, viewer.getUserId())
            .filter(g -> g.isVisibleTo(viewer.getUserId()))
            .orElseThrow(() -> new ResourceNotFoundException("Group not found: " + groupId));

        String trimmed = details == null || details.isBlank() ? null : details.trim();
        GroupReport report = new GroupReport(groupId, loaded.getGroup().getName(), viewer, parsed, trimmed,
            clock.instant());
        reportRepository.save(report);

        logger.info("Group {} reported by {} for {}", groupId, viewer.getUserId(), parsed);
        return new GroupReportDTO(report);
    }
}
