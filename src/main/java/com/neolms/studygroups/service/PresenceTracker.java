package com.neolms.studygroups.service;

import com.neolms.studygroups.model.Viewer;

/**
 * Best-effort online flag on every membership of a user. Never throws.
 */
public interface PresenceTracker {

    void setOnline(Viewer viewer, boolean online);
}
