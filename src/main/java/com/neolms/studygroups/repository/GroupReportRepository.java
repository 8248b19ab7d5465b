package com.neolms.studygroups.repository;

import com.neolms.studygroups.model.GroupReport;

/**
 * Write side of group reports. Reports are read by the moderation dashboard, not by this service.
 */
public interface GroupReportRepository {

    /**
     * Save a new report. Fails if the report id already exists.
     */
    void save(GroupReport report);
}
