package com.neolms.studygroups.service;

import com.neolms.studygroups.dto.GroupStats;
import com.neolms.studygroups.dto.GroupView;
import com.neolms.studygroups.model.GroupCategory;
import com.neolms.studygroups.model.GroupSortOption;
import com.neolms.studygroups.model.MembershipScope;
import com.neolms.studygroups.model.Viewer;

import java.util.List;

/**
 * Read side of the group directory.
 */
public interface GroupDirectoryService {

    /**
     * Every group visible to the viewer, unfiltered.
     */
    List<GroupView> listGroups(Viewer viewer);

    List<GroupView> queryGroups(Viewer viewer, MembershipScope scope, String search,
                                GroupSortOption sort, GroupCategory category);

    GroupStats getStats(Viewer viewer);
}
