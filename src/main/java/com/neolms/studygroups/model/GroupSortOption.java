package com.neolms.studygroups.model;

public enum GroupSortOption {
    RECENT,
    MEMBERS,
    ACTIVITY,
    NAME
}
