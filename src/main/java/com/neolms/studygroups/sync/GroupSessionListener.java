package com.neolms.studygroups.sync;

import com.neolms.studygroups.model.Viewer;
import com.neolms.studygroups.service.MembershipResult;

/**
 * Receives what a {@link GroupDirectorySession} wants pushed to its client.
 */
public interface GroupSessionListener {

    void onSnapshot(Viewer viewer, GroupSnapshot snapshot);

    void onResult(Viewer viewer, MembershipResult result);
}
