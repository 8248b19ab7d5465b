package com.neolms.studygroups.model;

/**
 * Member roles ordered by privilege, highest first.
 */
public enum MemberRole {
    OWNER(3),
    MODERATOR(2),
    MEMBER(1);

    private final int privilege;

    MemberRole(int privilege) {
        this.privilege = privilege;
    }

    public int getPrivilege() {
        return privilege;
    }

    public boolean outranks(MemberRole other) {
        return other == null || privilege > other.privilege;
    }

    public boolean canManageInvites() {
        return this == OWNER || this == MODERATOR;
    }
}
