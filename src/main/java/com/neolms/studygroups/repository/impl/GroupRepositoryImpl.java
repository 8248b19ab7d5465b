package com.neolms.studygroups.repository.impl;

import com.neolms.studygroups.config.StudyGroupsProperties;
import com.neolms.studygroups.exception.AlreadyMemberException;
import com.neolms.studygroups.exception.CapacityExceededException;
import com.neolms.studygroups.exception.NotMemberException;
import com.neolms.studygroups.exception.RepositoryException;
import com.neolms.studygroups.exception.TransactionFailedException;
import com.neolms.studygroups.model.GroupMember;
import com.neolms.studygroups.model.GroupPin;
import com.neolms.studygroups.model.GroupWithMembers;
import com.neolms.studygroups.model.MemberRole;
import com.neolms.studygroups.model.StudyGroup;
import com.neolms.studygroups.repository.GroupRepository;
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
import java.util.*;

/**
 * DynamoDB implementation of GroupRepository over the single study groups table.
 *
 * Group metadata and member rows share the GROUP#{id} partition, so one Query loads a group
 * with all of its members. Membership changes are TransactWriteItems that pair the member
 * row with the memberCount counter on the metadata item.
 */
@Repository
public class GroupRepositoryImpl implements GroupRepository {

    private static final Logger logger = LoggerFactory.getLogger(GroupRepositoryImpl.class);
    private static final String CONDITIONAL_CHECK_FAILED = "ConditionalCheckFailed";
    private static final String TRANSACTION_CONFLICT = "TransactionConflict";
    static final int MAX_WRITE_ATTEMPTS = 2;

    private final DynamoDbClient dynamoDbClient;
    private final QueryPerformanceTracker queryTracker;
    private final String tableName;
    private final TableSchema<StudyGroup> groupSchema;
    private final TableSchema<GroupMember> memberSchema;
    private final TableSchema<GroupPin> pinSchema;

    @Autowired
    public GroupRepositoryImpl(DynamoDbClient dynamoDbClient, QueryPerformanceTracker queryTracker,
                               StudyGroupsProperties properties) {
        this.dynamoDbClient = dynamoDbClient;
        this.queryTracker = queryTracker;
        this.tableName = properties.getTableName();
        this.groupSchema = TableSchema.fromBean(StudyGroup.class);
        this.memberSchema = TableSchema.fromBean(GroupMember.class);
        this.pinSchema = TableSchema.fromBean(GroupPin.class);
    }

    @Override
    public List<GroupWithMembers> list(String viewerId) {
        return queryTracker.trackQuery("Query", tableName, () -> {
            try {
                List<StudyGroup> directory = new ArrayList<>();
                for (Map<String, AttributeValue> item : queryAll(QueryRequest.builder()
                        .tableName(tableName)
                        .indexName(StudyGroupKeyFactory.DIRECTORY_INDEX)
                        .keyConditionExpression("gsi2pk = :gsi2pk")
                        .expressionAttributeValues(Map.of(
                            ":gsi2pk", s(StudyGroupKeyFactory.DIRECTORY_PK)))
                        .build())) {
                    directory.add(groupSchema.mapToItem(item));
                }

                Set<String> memberOf = new HashSet<>();
                for (GroupMember membership : loadMembershipsByUser(viewerId)) {
                    memberOf.add(membership.getGroupId());
                }
                Set<String> pinned = loadPinnedGroupIds(viewerId);

                List<GroupWithMembers> visible = new ArrayList<>();
                for (StudyGroup group : directory) {
                    if (group.isPrivate() && !memberOf.contains(group.getGroupId())) {
                        continue;
                    }
                    visible.add(new GroupWithMembers(group, loadMembers(group.getGroupId()),
                        pinned.contains(group.getGroupId())));
                }

                logger.debug("Listed {} of {} groups for viewer {}", visible.size(), directory.size(), viewerId);
                return visible;

            } catch (DynamoDbException e) {
                logger.error("Failed to list groups for viewer {}", viewerId, e);
                throw new RepositoryException("Failed to list groups", e);
            }
        });
    }

    @Override
    public Optional<GroupWithMembers> findGroup(String groupId, String viewerId) {
        return queryTracker.trackQuery("Query", tableName, () -> {
            try {
                StudyGroup group = null;
                List<GroupMember> members = new ArrayList<>();
                for (Map<String, AttributeValue> item : queryAll(QueryRequest.builder()
                        .tableName(tableName)
                        .keyConditionExpression("pk = :pk")
                        .expressionAttributeValues(Map.of(
                            ":pk", s(StudyGroupKeyFactory.getGroupPk(groupId))))
                        .build())) {
                    String sk = item.get("sk").s();
                    if (StudyGroupKeyFactory.isGroupMetadata(sk)) {
                        group = groupSchema.mapToItem(item);
                    } else if (StudyGroupKeyFactory.isMemberItem(sk)) {
                        members.add(memberSchema.mapToItem(item));
                    }
                }
                if (group == null) {
                    return Optional.empty();
                }
                return Optional.of(new GroupWithMembers(group, members, isPinned(viewerId, groupId)));

            } catch (DynamoDbException e) {
                logger.error("Failed to find group {}", groupId, e);
                throw new RepositoryException("Failed to retrieve group", e);
            }
        });
    }

    @Override
    public Optional<GroupMember> findMember(String groupId, String userId) {
        return queryTracker.trackQuery("GetItem", tableName, () -> {
            try {
                GetItemResponse response = dynamoDbClient.getItem(GetItemRequest.builder()
                    .tableName(tableName)
                    .key(memberKey(groupId, userId))
                    .build());
                if (!response.hasItem() || response.item().isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(memberSchema.mapToItem(response.item()));

            } catch (DynamoDbException e) {
                logger.error("Failed to find member {} of group {}", userId, groupId, e);
                throw new RepositoryException("Failed to retrieve group member", e);
            }
        });
    }

    @Override
    public List<GroupMember> findMembers(String groupId) {
        return queryTracker.trackQuery("Query", tableName, () -> {
            try {
                return loadMembers(groupId);
            } catch (DynamoDbException e) {
                logger.error("Failed to find members of group {}", groupId, e);
                throw new RepositoryException("Failed to retrieve group members", e);
            }
        });
    }

    @Override
    public List<GroupMember> findMembershipsByUser(String userId) {
        return queryTracker.trackQuery("Query", tableName, () -> {
            try {
                return loadMembershipsByUser(userId);
            } catch (DynamoDbException e) {
                logger.error("Failed to find memberships of user {}", userId, e);
                throw new RepositoryException("Failed to retrieve user memberships", e);
            }
        });
    }

    @Override
    public void insertGroupWithOwner(StudyGroup group, GroupMember owner) {
        queryTracker.trackQuery("TransactWriteItems", tableName, () -> {
            try {
                dynamoDbClient.transactWriteItems(TransactWriteItemsRequest.builder()
                    .transactItems(
                        TransactWriteItem.builder()
                            .put(Put.builder()
                                .tableName(tableName)
                                .item(groupSchema.itemToMap(group, true))
                                .conditionExpression("attribute_not_exists(pk)")
                                .build())
                            .build(),
                        TransactWriteItem.builder()
                            .put(Put.builder()
                                .tableName(tableName)
                                .item(memberSchema.itemToMap(owner, true))
                                .build())
                            .build()
                    )
                    .build());
                logger.info("Created group {} owned by {}", group.getGroupId(), owner.getUserId());

            } catch (TransactionCanceledException e) {
                logger.error("Group creation transaction cancelled for group {}", group.getGroupId(), e);
                throw new TransactionFailedException("Failed to create group", e);
            } catch (DynamoDbException e) {
                logger.error("Failed to create group {} with owner {}", group.getGroupId(), owner.getUserId(), e);
                throw new RepositoryException("Failed to create group with owner", e);
            }
            return null;
        });
    }

    @Override
    public void insertMember(GroupMember member) {
        queryTracker.trackQuery("TransactWriteItems", tableName, () -> {
            AttributeValue now = EpochMillisInstantConverter.toAttribute(member.getCreatedAt());
            TransactWriteItemsRequest request = TransactWriteItemsRequest.builder()
                .transactItems(
                    TransactWriteItem.builder()
                        .put(Put.builder()
                            .tableName(tableName)
                            .item(memberSchema.itemToMap(member, true))
                            .conditionExpression("attribute_not_exists(pk)")
                            .build())
                        .build(),
                    TransactWriteItem.builder()
                        .update(incrementMemberCount(member.getGroupId(), now))
                        .build()
                )
                .build();

            for (int attempt = 1; ; attempt++) {
                try {
                    dynamoDbClient.transactWriteItems(request);
                    logger.info("User {} joined group {}", member.getUserId(), member.getGroupId());
                    return null;

                } catch (TransactionCanceledException e) {
                    boolean retryable = attempt < MAX_WRITE_ATTEMPTS;
                    if (failedAt(e, 0)) {
                        throw new AlreadyMemberException("User " + member.getUserId()
                            + " is already a member of group " + member.getGroupId(), e);
                    }
                    if (conflictedAt(e, 1)) {
                        if (isAtCapacity(dynamoDbClient, tableName, member.getGroupId())) {
                            throw new CapacityExceededException("Group " + member.getGroupId() + " is full", e);
                        }
                        if (retryable) {
                            logger.debug("Join of group {} lost a write race, retrying", member.getGroupId());
                            continue;
                        }
                    } else if (conflictedAt(e, 0) && retryable) {
                        logger.debug("Join of group {} lost a write race, retrying", member.getGroupId());
                        continue;
                    }
                    logger.error("Join transaction cancelled for group {}: {}", member.getGroupId(), e.getMessage());
                    throw new TransactionFailedException("Failed to join group", e);
                } catch (DynamoDbException e) {
                    logger.error("Failed to add member {} to group {}", member.getUserId(), member.getGroupId(), e);
                    throw new RepositoryException("Failed to add group member", e);
                }
            }
        });
    }

    @Override
    public void deleteMember(String groupId, String userId, String successorUserId, Instant at) {
        queryTracker.trackQuery("TransactWriteItems", tableName, () -> {
            AttributeValue now = EpochMillisInstantConverter.toAttribute(at);
            List<TransactWriteItem> items = new ArrayList<>();
            items.add(TransactWriteItem.builder()
                .delete(Delete.builder()
                    .tableName(tableName)
                    .key(memberKey(groupId, userId))
                    .conditionExpression("attribute_exists(pk)")
                    .build())
                .build());
            items.add(TransactWriteItem.builder()
                .update(Update.builder()
                    .tableName(tableName)
                    .key(groupKey(groupId))
                    .updateExpression("SET memberCount = memberCount - :one, updatedAt = :now")
                    .conditionExpression("attribute_exists(pk) AND memberCount > :zero")
                    .expressionAttributeValues(Map.of(
                        ":one", n(1),
                        ":zero", n(0),
                        ":now", now))
                    .build())
                .build());
            if (successorUserId != null) {
                items.add(TransactWriteItem.builder()
                    .update(Update.builder()
                        .tableName(tableName)
                        .key(memberKey(groupId, successorUserId))
                        .updateExpression("SET #role = :owner, updatedAt = :now")
                        .conditionExpression("attribute_exists(pk)")
                        .expressionAttributeNames(Map.of("#role", "role"))
                        .expressionAttributeValues(Map.of(
                            ":owner", s(MemberRole.OWNER.name()),
                            ":now", now))
                        .build())
                    .build());
            }

            try {
                dynamoDbClient.transactWriteItems(TransactWriteItemsRequest.builder()
                    .transactItems(items)
                    .build());
                if (successorUserId != null) {
                    logger.info("User {} left group {}; ownership passed to {}", userId, groupId, successorUserId);
                } else {
                    logger.info("User {} left group {}", userId, groupId);
                }

            } catch (TransactionCanceledException e) {
                if (failedAt(e, 0)) {
                    throw new NotMemberException("User " + userId + " is not a member of group " + groupId, e);
                }
                logger.error("Leave transaction cancelled for group {}: {}", groupId, e.getMessage());
                throw new TransactionFailedException("Failed to leave group", e);
            } catch (DynamoDbException e) {
                logger.error("Failed to remove member {} from group {}", userId, groupId, e);
                throw new RepositoryException("Failed to remove group member", e);
            }
            return null;
        });
    }

    @Override
    public void setPinned(String viewerId, String groupId, boolean pinned) {
        queryTracker.trackQuery(pinned ? "PutItem" : "DeleteItem", tableName, () -> {
            try {
                if (pinned) {
                    dynamoDbClient.putItem(PutItemRequest.builder()
                        .tableName(tableName)
                        .item(pinSchema.itemToMap(new GroupPin(viewerId, groupId), true))
                        .build());
                } else {
                    dynamoDbClient.deleteItem(DeleteItemRequest.builder()
                        .tableName(tableName)
                        .key(pinKey(viewerId, groupId))
                        .build());
                }
                return null;

            } catch (DynamoDbException e) {
                logger.error("Failed to set pin={} on group {} for user {}", pinned, groupId, viewerId, e);
                throw new RepositoryException("Failed to update pin", e);
            }
        });
    }

    @Override
    public boolean updateMemberPresence(String groupId, String userId, boolean online, Instant at) {
        return queryTracker.trackQuery("UpdateItem", tableName, () -> {
            try {
                dynamoDbClient.updateItem(UpdateItemRequest.builder()
                    .tableName(tableName)
                    .key(memberKey(groupId, userId))
                    .updateExpression("SET #online = :online, lastActive = :at")
                    .conditionExpression("attribute_exists(pk)")
                    .expressionAttributeNames(Map.of("#online", "online"))
                    .expressionAttributeValues(Map.of(
                        ":online", AttributeValue.builder().bool(online).build(),
                        ":at", EpochMillisInstantConverter.toAttribute(at)))
                    .build());
                return true;

            } catch (ConditionalCheckFailedException e) {
                logger.debug("Skipped presence update for {} in group {}: no longer a member", userId, groupId);
                return false;
            } catch (DynamoDbException e) {
                logger.error("Failed to update presence of {} in group {}", userId, groupId, e);
                throw new RepositoryException("Failed to update presence", e);
            }
        });
    }

    private Update incrementMemberCount(String groupId, AttributeValue now) {
        return Update.builder()
            .tableName(tableName)
            .key(groupKey(groupId))
            .updateExpression("SET memberCount = memberCount + :one, lastActivity = :now, updatedAt = :now")
            .conditionExpression("attribute_exists(pk) AND memberCount < maxMembers")
            .expressionAttributeValues(Map.of(
                ":one", n(1),
                ":now", now))
            .build();
    }

    private List<GroupMember> loadMembers(String groupId) {
        List<GroupMember> members = new ArrayList<>();
        for (Map<String, AttributeValue> item : queryAll(QueryRequest.builder()
                .tableName(tableName)
                .keyConditionExpression("pk = :pk AND begins_with(sk, :prefix)")
                .expressionAttributeValues(Map.of(
                    ":pk", s(StudyGroupKeyFactory.getGroupPk(groupId)),
                    ":prefix", s(StudyGroupKeyFactory.getUserSkPrefix())))
                .build())) {
            members.add(memberSchema.mapToItem(item));
        }
        return members;
    }

    private List<GroupMember> loadMembershipsByUser(String userId) {
        List<GroupMember> memberships = new ArrayList<>();
        for (Map<String, AttributeValue> item : queryAll(QueryRequest.builder()
                .tableName(tableName)
                .indexName(StudyGroupKeyFactory.USER_GROUP_INDEX)
                .keyConditionExpression("gsi1pk = :gsi1pk AND begins_with(gsi1sk, :prefix)")
                .expressionAttributeValues(Map.of(
                    ":gsi1pk", s(StudyGroupKeyFactory.getUserGsi1Pk(userId)),
                    ":prefix", s(StudyGroupKeyFactory.GROUP_PREFIX + "#")))
                .build())) {
            memberships.add(memberSchema.mapToItem(item));
        }
        return memberships;
    }

    private Set<String> loadPinnedGroupIds(String viewerId) {
        Set<String> pinned = new HashSet<>();
        for (Map<String, AttributeValue> item : queryAll(QueryRequest.builder()
                .tableName(tableName)
                .keyConditionExpression("pk = :pk AND begins_with(sk, :prefix)")
                .expressionAttributeValues(Map.of(
                    ":pk", s(StudyGroupKeyFactory.getUserPk(viewerId)),
                    ":prefix", s(StudyGroupKeyFactory.getPinSkPrefix())))
                .build())) {
            pinned.add(StudyGroupKeyFactory.extractId(item.get("sk").s()));
        }
        return pinned;
    }

    private boolean isPinned(String viewerId, String groupId) {
        GetItemResponse response = dynamoDbClient.getItem(GetItemRequest.builder()
            .tableName(tableName)
            .key(pinKey(viewerId, groupId))
            .build());
        return response.hasItem() && !response.item().isEmpty();
    }

    /**
     * Runs a query to completion, following LastEvaluatedKey.
     */
    private List<Map<String, AttributeValue>> queryAll(QueryRequest request) {
        List<Map<String, AttributeValue>> items = new ArrayList<>();
        Map<String, AttributeValue> lastKey = null;
        do {
            QueryRequest page = lastKey == null ? request : request.toBuilder().exclusiveStartKey(lastKey).build();
            QueryResponse response = dynamoDbClient.query(page);
            items.addAll(response.items());
            lastKey = response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()
                ? response.lastEvaluatedKey() : null;
        } while (lastKey != null);
        return items;
    }

    static boolean failedAt(TransactionCanceledException e, int index) {
        return CONDITIONAL_CHECK_FAILED.equals(reasonCode(e, index));
    }

    /**
     * True when the item at index failed its condition or lost to a concurrent transaction.
     * Both outcomes mean the item's state has to be re-read before it can be reported.
     */
    static boolean conflictedAt(TransactionCanceledException e, int index) {
        String code = reasonCode(e, index);
        return CONDITIONAL_CHECK_FAILED.equals(code) || TRANSACTION_CONFLICT.equals(code);
    }

    private static String reasonCode(TransactionCanceledException e, int index) {
        if (!e.hasCancellationReasons() || e.cancellationReasons().size() <= index) {
            return null;
        }
        return e.cancellationReasons().get(index).code();
    }

    /**
     * Consistent read of the group counter. A missing group counts as full, matching the
     * attribute_exists(pk) AND memberCount < maxMembers condition it stands in for.
     */
    static boolean isAtCapacity(DynamoDbClient client, String tableName, String groupId) {
        try {
            GetItemResponse response = client.getItem(GetItemRequest.builder()
                .tableName(tableName)
                .key(groupKey(groupId))
                .consistentRead(true)
                .projectionExpression("memberCount, maxMembers")
                .build());
            if (!response.hasItem() || response.item().isEmpty()) {
                return true;
            }
            AttributeValue count = response.item().get("memberCount");
            AttributeValue max = response.item().get("maxMembers");
            if (count == null || max == null) {
                return true;
            }
            return Integer.parseInt(count.n()) >= Integer.parseInt(max.n());

        } catch (DynamoDbException e) {
            logger.error("Failed to re-read capacity of group {}", groupId, e);
            throw new RepositoryException("Failed to read group capacity", e);
        }
    }

    static Map<String, AttributeValue> groupKey(String groupId) {
        return Map.of(
            "pk", s(StudyGroupKeyFactory.getGroupPk(groupId)),
            "sk", s(StudyGroupKeyFactory.getMetadataSk()));
    }

    private static Map<String, AttributeValue> memberKey(String groupId, String userId) {
        return Map.of(
            "pk", s(StudyGroupKeyFactory.getGroupPk(groupId)),
            "sk", s(StudyGroupKeyFactory.getUserSk(userId)));
    }

    private static Map<String, AttributeValue> pinKey(String viewerId, String groupId) {
        return Map.of(
            "pk", s(StudyGroupKeyFactory.getUserPk(viewerId)),
            "sk", s(StudyGroupKeyFactory.getPinSk(groupId)));
    }

    static AttributeValue s(String value) {
        return AttributeValue.builder().s(value).build();
    }

    static AttributeValue n(long value) {
        return AttributeValue.builder().n(String.valueOf(value)).build();
    }
}
