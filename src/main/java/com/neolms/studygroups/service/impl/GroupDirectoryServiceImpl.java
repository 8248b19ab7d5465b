package com.neolms.studygroups.service.impl;

import com.neolms.studygroups.dto.GroupStats;
import com.neolms.studygroups.dto.GroupView;
import com.neolms.studygroups.model.GroupCategory;
import com.neolms.studygroups.model.GroupSortOption;
import com.neolms.studygroups.model.MembershipScope;
import com.neolms.studygroups.model.Viewer;
import com.neolms.studygroups.repository.GroupRepository;
import com.neolms.studygroups.service.GroupDirectoryService;
import com.neolms.studygroups.util.GroupQueryEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

@Service
public class GroupDirectoryServiceImpl implements GroupDirectoryService {

    private static final Logger logger = LoggerFactory.getLogger(GroupDirectoryServiceImpl.class);

    private final GroupRepository groupRepository;

    @Autowired
    public GroupDirectoryServiceImpl(GroupRepository groupRepository) {
        this.groupRepository = groupRepository;
    }

    @Override
    public List<GroupView> listGroups(Viewer viewer) {
        List<GroupView> views = groupRepository.list(viewer.getUserId()).stream()
            .map(loaded -> GroupView.from(loaded, viewer.getUserId()))
            .collect(Collectors.toList());
        logger.debug("Loaded {} groups for {}", views.size(), viewer.getUserId());
        return views;
    }

    @Override
    public List<GroupView> queryGroups(Viewer viewer, MembershipScope scope, String search,
                                       GroupSortOption sort, GroupCategory category) {
        return GroupQueryEngine.query(listGroups(viewer), scope, search, sort, category);
    }

    @Override
    public GroupStats getStats(Viewer viewer) {
        return GroupQueryEngine.getGroupStats(listGroups(viewer));
    }
}
