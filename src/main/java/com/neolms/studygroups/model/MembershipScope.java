package com.neolms.studygroups.model;

/**
 * Which groups a directory listing keeps.
 */
public enum MembershipScope {
    ALL,
    MY_GROUPS,
    PUBLIC
}
