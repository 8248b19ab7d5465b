package com.neolms.studygroups.dto;

/**
 * Aggregate counters over one group list. Computed per request and never cached.
 */
public class GroupStats {

    private final int totalGroups;
    private final int myGroups;
    private final int publicGroups;
    private final int totalMembers;
    private final int onlineMembers;

    public GroupStats(int totalGroups, int myGroups, int publicGroups, int totalMembers, int onlineMembers) {
        this.totalGroups = totalGroups;
        this.myGroups = myGroups;
        this.publicGroups = publicGroups;
        this.totalMembers = totalMembers;
        this.onlineMembers = onlineMembers;
    }

    public int getTotalGroups() {
        return totalGroups;
    }

    public int getMyGroups() {
        return myGroups;
    }

    public int getPublicGroups() {
        return publicGroups;
    }

    public int getTotalMembers() {
        return totalMembers;
    }

    public int getOnlineMembers() {
        return onlineMembers;
    }
}
