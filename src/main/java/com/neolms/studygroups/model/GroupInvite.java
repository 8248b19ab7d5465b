package com.neolms.studygroups.model;

import com.neolms.studygroups.exception.InviteUnavailableException;
import com.neolms.studygroups.util.EpochMillisInstantConverter;
import com.neolms.studygroups.util.StudyGroupKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbIgnore;

import java.time.Instant;
import java.util.UUID;

/**
 * Shareable invite into a study group.
 *
 * DynamoDB Keys:
 *   PK: INVITE#{inviteId}
 *   SK: METADATA
 *
 * GSI (InviteCodeIndex) for lookup by code string:
 *   gsi3pk: CODE#{code}
 *
 * GSI (UserGroupIndex) for listing invites by group:
 *   gsi1pk: GROUP#{groupId}
 *   gsi1sk: CREATED#{createdAt}
 *
 * Invites are never deleted; expired, exhausted and deactivated rows stay as an audit trail.
 */
@DynamoDbBean
public class GroupInvite extends BaseItem {

    public static final String ITEM_TYPE = "GROUP_INVITE";

    private String inviteId;
    private String groupId;
    private String code;
    private String createdBy;
    private Instant expiresAt;      // null = never expires
    private Integer maxUses;        // null = unlimited
    private int useCount;
    private boolean active;
    private String deactivatedBy;
    private Instant deactivatedAt;

    public GroupInvite() {
        super();
        setItemType(ITEM_TYPE);
    }

    /**
     * Create a new invite.
     *
     * @param groupId Group the invite joins into
     * @param code Opaque URL-safe code
     * @param createdBy User ID of the creator
     * @param createdAt Creation time, also used for the group listing sort key
     */
    public GroupInvite(String groupId, String code, String createdBy, Instant createdAt) {
        super();
        setItemType(ITEM_TYPE);
        this.inviteId = UUID.randomUUID().toString();
        this.groupId = groupId;
        this.code = code;
        this.createdBy = createdBy;
        this.active = true;
        setCreatedAt(createdAt);
        setUpdatedAt(createdAt);

        setPk(StudyGroupKeyFactory.getInvitePk(inviteId));
        setSk(StudyGroupKeyFactory.getMetadataSk());
        setGsi3pk(StudyGroupKeyFactory.getCodeGsi3Pk(code));
        setGsi1pk(StudyGroupKeyFactory.getGroupGsi1Pk(groupId));
        setGsi1sk(StudyGroupKeyFactory.getCreatedGsi1Sk(createdAt));
    }

    /**
     * Why this invite cannot be redeemed at the given instant.
     *
     * @return the blocking reason, or null when the invite is redeemable
     */
    @DynamoDbIgnore
    public InviteUnavailableException.Reason unavailableReasonAt(Instant now) {
        if (!active) {
            return InviteUnavailableException.Reason.NOT_FOUND;
        }
        if (expiresAt != null && !now.isBefore(expiresAt)) {
            return InviteUnavailableException.Reason.EXPIRED;
        }
        if (maxUses != null && useCount >= maxUses) {
            return InviteUnavailableException.Reason.EXHAUSTED;
        }
        return null;
    }

    @DynamoDbIgnore
    public boolean isRedeemableAt(Instant now) {
        return unavailableReasonAt(now) == null;
    }

    public void deactivate(String deactivatedBy, Instant at) {
        this.active = false;
        this.deactivatedBy = deactivatedBy;
        this.deactivatedAt = at;
        setUpdatedAt(at);
    }

    public String getInviteId() {
        return inviteId;
    }

    public void setInviteId(String inviteId) {
        this.inviteId = inviteId;
    }

    public String getGroupId() {
        return groupId;
    }

    public void setGroupId(String groupId) {
        this.groupId = groupId;
    }

    public String getCode() {
        return code;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(String createdBy) {
        this.createdBy = createdBy;
    }

    @DynamoDbConvertedBy(EpochMillisInstantConverter.class)
    public Instant getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(Instant expiresAt) {
        this.expiresAt = expiresAt;
    }

    public Integer getMaxUses() {
        return maxUses;
    }

    public void setMaxUses(Integer maxUses) {
        this.maxUses = maxUses;
    }

    public int getUseCount() {
        return useCount;
    }

    public void setUseCount(int useCount) {
        this.useCount = useCount;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public String getDeactivatedBy() {
        return deactivatedBy;
    }

    public void setDeactivatedBy(String deactivatedBy) {
        this.deactivatedBy = deactivatedBy;
    }

    @DynamoDbConvertedBy(EpochMillisInstantConverter.class)
    public Instant getDeactivatedAt() {
        return deactivatedAt;
    }

    public void setDeactivatedAt(Instant deactivatedAt) {
        this.deactivatedAt = deactivatedAt;
    }
}
