package com.neolms.studygroups.model;

import com.neolms.studygroups.util.StudyGroupKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;

/**
 * Per-viewer pin marker. The item existing means the group is pinned for that user.
 *
 * Key Pattern: PK = USER#{UserID}, SK = PIN#{GroupID}
 */
@DynamoDbBean
public class GroupPin extends BaseItem {

    public static final String ITEM_TYPE = "GROUP_PIN";

    private String userId;
    private String groupId;

    public GroupPin() {
        super();
        setItemType(ITEM_TYPE);
    }

    public GroupPin(String userId, String groupId) {
        super();
        setItemType(ITEM_TYPE);
        this.userId = userId;
        this.groupId = groupId;
        setPk(StudyGroupKeyFactory.getUserPk(userId));
        setSk(StudyGroupKeyFactory.getPinSk(groupId));
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getGroupId() {
        return groupId;
    }

    public void setGroupId(String groupId) {
        this.groupId = groupId;
    }
}
