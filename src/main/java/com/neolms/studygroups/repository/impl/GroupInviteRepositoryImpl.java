package com.neolms.studygroups.repository.impl;

import com.neolms.studygroups.config.StudyGroupsProperties;
import com.neolms.studygroups.exception.AlreadyMemberException;
import com.neolms.studygroups.exception.CapacityExceededException;
import com.neolms.studygroups.exception.InviteUnavailableException;
import com.neolms.studygroups.exception.RepositoryException;
import com.neolms.studygroups.exception.TransactionFailedException;
import com.neolms.studygroups.model.GroupInvite;
import com.neolms.studygroups.model.GroupMember;
import com.neolms.studygroups.repository.GroupInviteRepository;
import com.neolms.studygroups.util.EpochMillisInstantConverter;
import com.neolms.studygroups.util.QueryPerformanceTracker;
import com.neolms.studygroups.util.StudyGroupKeyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.neolms.studygroups.repository.impl.GroupRepositoryImpl.MAX_WRITE_ATTEMPTS;
import static com.neolms.studygroups.repository.impl.GroupRepositoryImpl.conflictedAt;
import static com.neolms.studygroups.repository.impl.GroupRepositoryImpl.failedAt;
import static com.neolms.studygroups.repository.impl.GroupRepositoryImpl.groupKey;
import static com.neolms.studygroups.repository.impl.GroupRepositoryImpl.isAtCapacity;
import static com.neolms.studygroups.repository.impl.GroupRepositoryImpl.n;
import static com.neolms.studygroups.repository.impl.GroupRepositoryImpl.s;

/**
 * DynamoDB implementation of GroupInviteRepository.
 */
@Repository
public class GroupInviteRepositoryImpl implements GroupInviteRepository {

    private static final Logger logger = LoggerFactory.getLogger(GroupInviteRepositoryImpl.class);

    static final String REDEEMABLE_CONDITION = "attribute_exists(pk) AND #active = :true"
        + " AND (attribute_not_exists(maxUses) OR useCount < maxUses)"
        + " AND (attribute_not_exists(expiresAt) OR expiresAt > :now)";

    private final DynamoDbClient dynamoDbClient;
    private final QueryPerformanceTracker queryTracker;
    private final String tableName;
    private final TableSchema<GroupInvite> inviteSchema;
    private final TableSchema<GroupMember> memberSchema;

    @Autowired
    public GroupInviteRepositoryImpl(DynamoDbClient dynamoDbClient, QueryPerformanceTracker queryTracker,
                                     StudyGroupsProperties properties) {
        this.dynamoDbClient = dynamoDbClient;
        this.queryTracker = queryTracker;
        this.tableName = properties.getTableName();
        this.inviteSchema = TableSchema.fromBean(GroupInvite.class);
        this.memberSchema = TableSchema.fromBean(GroupMember.class);
    }

    @Override
    public void save(GroupInvite invite) {
        queryTracker.trackQuery("PutItem", tableName, () -> {
            try {
                dynamoDbClient.putItem(PutItemRequest.builder()
                    .tableName(tableName)
                    .item(inviteSchema.itemToMap(invite, true))
                    .conditionExpression("attribute_not_exists(pk)")
                    .build());
                logger.debug("Saved invite {} for group {}", invite.getInviteId(), invite.getGroupId());
                return null;

            } catch (DynamoDbException e) {
                logger.error("Failed to save invite {}", invite.getInviteId(), e);
                throw new RepositoryException("Failed to save invite", e);
            }
        });
    }

    @Override
    public Optional<GroupInvite> findByCode(String code) {
        return queryTracker.trackQuery("Query", tableName, () -> {
            try {
                QueryResponse response = dynamoDbClient.query(QueryRequest.builder()
                    .tableName(tableName)
                    .indexName(StudyGroupKeyFactory.INVITE_CODE_INDEX)
                    .keyConditionExpression("gsi3pk = :gsi3pk")
                    .expressionAttributeValues(Map.of(
                        ":gsi3pk", s(StudyGroupKeyFactory.getCodeGsi3Pk(code))))
                    .build());

                if (response.items().isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(inviteSchema.mapToItem(response.items().get(0)));

            } catch (DynamoDbException e) {
                logger.error("Failed to find invite by code", e);
                throw new RepositoryException("Failed to find invite by code", e);
            }
        });
    }

    @Override
    public Optional<GroupInvite> findById(String inviteId) {
        return queryTracker.trackQuery("GetItem", tableName, () -> {
            try {
                return loadInvite(inviteId);
            } catch (DynamoDbException e) {
                logger.error("Failed to find invite {}", inviteId, e);
                throw new RepositoryException("Failed to find invite", e);
            }
        });
    }

    @Override
    public List<GroupInvite> findAllByGroupId(String groupId) {
        return queryTracker.trackQuery("Query", tableName, () -> {
            try {
                QueryResponse response = dynamoDbClient.query(QueryRequest.builder()
                    .tableName(tableName)
                    .indexName(StudyGroupKeyFactory.USER_GROUP_INDEX)
                    .keyConditionExpression("gsi1pk = :gsi1pk AND begins_with(gsi1sk, :prefix)")
                    .expressionAttributeValues(Map.of(
                        ":gsi1pk", s(StudyGroupKeyFactory.getGroupGsi1Pk(groupId)),
                        ":prefix", s(StudyGroupKeyFactory.getCreatedSkPrefix())))
                    .scanIndexForward(false)
                    .build());

                List<GroupInvite> invites = new ArrayList<>();
                for (Map<String, AttributeValue> item : response.items()) {
                    invites.add(inviteSchema.mapToItem(item));
                }
                invites.sort(Comparator.comparing(GroupInvite::getCreatedAt).reversed());
                return invites;

            } catch (DynamoDbException e) {
                logger.error("Failed to list invites of group {}", groupId, e);
                throw new RepositoryException("Failed to list invites", e);
            }
        });
    }

    @Override
    public boolean codeExists(String code) {
        return findByCode(code).isPresent();
    }

    @Override
    public void deactivate(String inviteId, String deactivatedBy, Instant at) {
        queryTracker.trackQuery("UpdateItem", tableName, () -> {
            try {
                dynamoDbClient.updateItem(UpdateItemRequest.builder()
                    .tableName(tableName)
                    .key(inviteKey(inviteId))
                    .updateExpression("SET #active = :false, deactivatedBy = :by, deactivatedAt = :at, updatedAt = :at")
                    .conditionExpression("attribute_exists(pk)")
                    .expressionAttributeNames(Map.of("#active", "active"))
                    .expressionAttributeValues(Map.of(
                        ":false", AttributeValue.builder().bool(false).build(),
                        ":by", s(deactivatedBy),
                        ":at", EpochMillisInstantConverter.toAttribute(at)))
                    .build());
                logger.info("Invite {} deactivated by {}", inviteId, deactivatedBy);
                return null;

            } catch (DynamoDbException e) {
                logger.error("Failed to deactivate invite {}", inviteId, e);
                throw new RepositoryException("Failed to deactivate invite", e);
            }
        });
    }

    @Override
    public void redeem(GroupInvite invite, GroupMember member, Instant now) {
        queryTracker.trackQuery("TransactWriteItems", tableName, () -> {
            TransactWriteItemsRequest request = redeemRequest(invite, member, now);

            for (int attempt = 1; ; attempt++) {
                try {
                    dynamoDbClient.transactWriteItems(request);
                    logger.info("User {} joined group {} through invite {}",
                        member.getUserId(), invite.getGroupId(), invite.getInviteId());
                    return null;

                } catch (TransactionCanceledException e) {
                    boolean retryable = attempt < MAX_WRITE_ATTEMPTS;
                    if (conflictedAt(e, 0)) {
                        InviteUnavailableException.Reason reason = resolveUnavailableReason(invite.getInviteId(), now);
                        if (reason == null && retryable) {
                            logger.debug("Redeem of invite {} lost a write race, retrying", invite.getInviteId());
                            continue;
                        }
                        // Still redeemable after the retry: the contended use went to someone else.
                        if (reason == null) {
                            reason = InviteUnavailableException.Reason.EXHAUSTED;
                        }
                        throw new InviteUnavailableException(reason,
                            "Invite " + invite.getInviteId() + " cannot be redeemed: " + reason, e);
                    }
                    if (failedAt(e, 1)) {
                        throw new AlreadyMemberException("User " + member.getUserId()
                            + " is already a member of group " + invite.getGroupId(), e);
                    }
                    if (conflictedAt(e, 2)) {
                        if (isAtCapacity(dynamoDbClient, tableName, invite.getGroupId())) {
                            throw new CapacityExceededException("Group " + invite.getGroupId() + " is full", e);
                        }
                        if (retryable) {
                            logger.debug("Redeem of invite {} lost the capacity race, retrying", invite.getInviteId());
                            continue;
                        }
                    } else if (conflictedAt(e, 1) && retryable) {
                        continue;
                    }
                    logger.error("Redeem transaction cancelled for invite {}: {}", invite.getInviteId(), e.getMessage());
                    throw new TransactionFailedException("Failed to redeem invite", e);
                } catch (DynamoDbException e) {
                    logger.error("Failed to redeem invite {}", invite.getInviteId(), e);
                    throw new RepositoryException("Failed to redeem invite", e);
                }
            }
        });
    }

    private TransactWriteItemsRequest redeemRequest(GroupInvite invite, GroupMember member, Instant now) {
        AttributeValue nowValue = EpochMillisInstantConverter.toAttribute(now);
        return TransactWriteItemsRequest.builder()
            .transactItems(
                TransactWriteItem.builder()
                    .update(Update.builder()
                        .tableName(tableName)
                        .key(inviteKey(invite.getInviteId()))
                        .updateExpression("SET useCount = useCount + :one, updatedAt = :now")
                        .conditionExpression(REDEEMABLE_CONDITION)
                        .expressionAttributeNames(Map.of("#active", "active"))
                        .expressionAttributeValues(Map.of(
                            ":one", n(1),
                            ":true", AttributeValue.builder().bool(true).build(),
                            ":now", nowValue))
                        .build())
                    .build(),
                TransactWriteItem.builder()
                    .put(Put.builder()
                        .tableName(tableName)
                        .item(memberSchema.itemToMap(member, true))
                        .conditionExpression("attribute_not_exists(pk)")
                        .build())
                    .build(),
                TransactWriteItem.builder()
                    .update(Update.builder()
                        .tableName(tableName)
                        .key(groupKey(invite.getGroupId()))
                        .updateExpression("SET memberCount = memberCount + :one, lastActivity = :now, updatedAt = :now")
                        .conditionExpression("attribute_exists(pk) AND memberCount < maxMembers")
                        .expressionAttributeValues(Map.of(
                            ":one", n(1),
                            ":now", nowValue))
                        .build())
                    .build()
            )
            .build();
    }

    /**
     * Consistent re-read of the invite after its increment was rejected or contended.
     *
     * @return why the invite cannot be used at now, or null when it still looks redeemable
     */
    private InviteUnavailableException.Reason resolveUnavailableReason(String inviteId, Instant now) {
        Optional<GroupInvite> current;
        try {
            current = loadInvite(inviteId);
        } catch (DynamoDbException e) {
            logger.error("Failed to re-read invite {}", inviteId, e);
            throw new RepositoryException("Failed to re-read invite", e);
        }
        if (current.isEmpty()) {
            return InviteUnavailableException.Reason.NOT_FOUND;
        }
        return current.get().unavailableReasonAt(now);
    }

    private Optional<GroupInvite> loadInvite(String inviteId) {
        GetItemResponse response = dynamoDbClient.getItem(GetItemRequest.builder()
            .tableName(tableName)
            .key(inviteKey(inviteId))
            .consistentRead(true)
            .build());
        if (!response.hasItem() || response.item().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(inviteSchema.mapToItem(response.item()));
    }

    private static Map<String, AttributeValue> inviteKey(String inviteId) {
        return Map.of(
            "pk", s(StudyGroupKeyFactory.getInvitePk(inviteId)),
            "sk", s(StudyGroupKeyFactory.getMetadataSk()));
    }
}
