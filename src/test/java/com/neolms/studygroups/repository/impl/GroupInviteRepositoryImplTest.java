package com.neolms.studygroups.repository.impl;

import com.neolms.studygroups.config.StudyGroupsProperties;
import com.neolms.studygroups.exception.AlreadyMemberException;
import com.neolms.studygroups.exception.CapacityExceededException;
import com.neolms.studygroups.exception.InviteUnavailableException;
import com.neolms.studygroups.exception.RepositoryException;
import com.neolms.studygroups.model.GroupInvite;
import com.neolms.studygroups.model.GroupMember;
import com.neolms.studygroups.model.MemberRole;
import com.neolms.studygroups.util.QueryPerformanceTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

import static com.neolms.studygroups.testutil.TestConstants.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GroupInviteRepositoryImplTest {

    private static final String CODE = "ABCDEFGHJKLMNPQR";

    @Mock
    private DynamoDbClient dynamoDbClient;

    @Mock
    private QueryPerformanceTracker performanceTracker;

    private GroupInviteRepositoryImpl repository;
    private TableSchema<GroupInvite> inviteSchema;
    private GroupInvite invite;
    private GroupMember member;

    @BeforeEach
    void setUp() {
        lenient().when(performanceTracker.trackQuery(anyString(), anyString(), any())).thenAnswer(invocation -> {
            Supplier<?> supplier = invocation.getArgument(2);
            return supplier.get();
        });

        repository = new GroupInviteRepositoryImpl(dynamoDbClient, performanceTracker, new StudyGroupsProperties());
        inviteSchema = TableSchema.fromBean(GroupInvite.class);
        invite = new GroupInvite(GROUP_ID, CODE, OTHER_USER_ID, NOW.minus(Duration.ofHours(1)));
        invite.setMaxUses(1);
        member = new GroupMember(GROUP_ID, USER_ID, MemberRole.MEMBER);
    }

    private static TransactionCanceledException cancelled(String... codes) {
        CancellationReason[] reasons = new CancellationReason[codes.length];
        for (int i = 0; i < codes.length; i++) {
            reasons[i] = CancellationReason.builder().code(codes[i]).build();
        }
        return TransactionCanceledException.builder()
            .message("Transaction cancelled")
            .cancellationReasons(reasons)
            .build();
    }

    private void givenStoredInvite(GroupInvite stored) {
        when(dynamoDbClient.getItem(any(GetItemRequest.class))).thenReturn(GetItemResponse.builder()
            .item(inviteSchema.itemToMap(stored, true))
            .build());
    }

    private void givenGroupCounter(int memberCount, int maxMembers) {
        when(dynamoDbClient.getItem(any(GetItemRequest.class))).thenReturn(GetItemResponse.builder()
            .item(Map.of(
                "memberCount", AttributeValue.builder().n(String.valueOf(memberCount)).build(),
                "maxMembers", AttributeValue.builder().n(String.valueOf(maxMembers)).build()))
            .build());
    }

    @Test
    void findByCode_QueriesCodeIndex() {
        // Given
        when(dynamoDbClient.query(any(QueryRequest.class))).thenReturn(QueryResponse.builder()
            .items(inviteSchema.itemToMap(invite, true))
            .build());

        // When
        Optional<GroupInvite> found = repository.findByCode(CODE);

        // Then
        assertThat(found).isPresent();
        assertThat(found.get().getInviteId()).isEqualTo(invite.getInviteId());
        assertThat(found.get().getMaxUses()).isEqualTo(1);
        ArgumentCaptor<QueryRequest> query = ArgumentCaptor.forClass(QueryRequest.class);
        verify(dynamoDbClient).query(query.capture());
        assertThat(query.getValue().indexName()).isEqualTo("InviteCodeIndex");
        assertThat(query.getValue().expressionAttributeValues().get(":gsi3pk").s()).isEqualTo("CODE#" + CODE);
    }

    @Test
    void codeExists_NoMatch_ReturnsFalse() {
        when(dynamoDbClient.query(any(QueryRequest.class))).thenReturn(QueryResponse.builder().items(List.of()).build());

        assertThat(repository.codeExists(CODE)).isFalse();
    }

    @Test
    void findAllByGroupId_ReturnsNewestFirst() {
        GroupInvite older = new GroupInvite(GROUP_ID, "ZZZZZZZZZZZZZZZZ", USER_ID, NOW.minus(Duration.ofDays(3)));
        when(dynamoDbClient.query(any(QueryRequest.class))).thenReturn(QueryResponse.builder()
            .items(inviteSchema.itemToMap(older, true), inviteSchema.itemToMap(invite, true))
            .build());

        List<GroupInvite> invites = repository.findAllByGroupId(GROUP_ID);

        assertThat(invites).extracting(GroupInvite::getCode).containsExactly(CODE, "ZZZZZZZZZZZZZZZZ");
    }

    @Test
    void save_IsConditionalOnNewId() {
        repository.save(invite);

        ArgumentCaptor<PutItemRequest> put = ArgumentCaptor.forClass(PutItemRequest.class);
        verify(dynamoDbClient).putItem(put.capture());
        assertThat(put.getValue().conditionExpression()).isEqualTo("attribute_not_exists(pk)");
        assertThat(put.getValue().item().get("gsi3pk").s()).isEqualTo("CODE#" + CODE);
    }

    @Test
    void save_Failure_IsWrapped() {
        when(dynamoDbClient.putItem(any(PutItemRequest.class)))
            .thenThrow(DynamoDbException.builder().message("boom").build());

        assertThatThrownBy(() -> repository.save(invite)).isInstanceOf(RepositoryException.class);
    }

    @Nested
    class Redeem {

        @Test
        void redeem_IncrementsUseAddsMemberAndCountsInOneTransaction() {
            // When
            repository.redeem(invite, member, NOW);

            // Then
            ArgumentCaptor<TransactWriteItemsRequest> request = ArgumentCaptor.forClass(TransactWriteItemsRequest.class);
            verify(dynamoDbClient).transactWriteItems(request.capture());
            List<TransactWriteItem> items = request.getValue().transactItems();
            assertThat(items).hasSize(3);
            assertThat(items.get(0).update().conditionExpression())
                .isEqualTo(GroupInviteRepositoryImpl.REDEEMABLE_CONDITION);
            assertThat(items.get(0).update().expressionAttributeValues().get(":now").n())
                .isEqualTo(String.valueOf(NOW.toEpochMilli()));
            assertThat(items.get(1).put().item().get("sk").s()).isEqualTo("USER#" + USER_ID);
            assertThat(items.get(2).update().conditionExpression()).contains("memberCount < maxMembers");
        }

        @Test
        void redeem_LastUseTakenConcurrently_ReportsExhausted() {
            // Given
            GroupInvite stored = inviteSchema.mapToItem(inviteSchema.itemToMap(invite, true));
            stored.setUseCount(1);
            givenStoredInvite(stored);
            when(dynamoDbClient.transactWriteItems(any(TransactWriteItemsRequest.class)))
                .thenThrow(cancelled("ConditionalCheckFailed", "None", "None"));

            // When / Then
            assertThatThrownBy(() -> repository.redeem(invite, member, NOW))
                .isInstanceOf(InviteUnavailableException.class)
                .satisfies(e -> assertThat(((InviteUnavailableException) e).getReason())
                    .isEqualTo(InviteUnavailableException.Reason.EXHAUSTED));
        }

        @Test
        void redeem_ExpiredAtWriteTime_ReportsExpired() {
            GroupInvite stored = inviteSchema.mapToItem(inviteSchema.itemToMap(invite, true));
            stored.setExpiresAt(NOW.minusSeconds(1));
            givenStoredInvite(stored);
            when(dynamoDbClient.transactWriteItems(any(TransactWriteItemsRequest.class)))
                .thenThrow(cancelled("ConditionalCheckFailed", "None", "None"));

            assertThatThrownBy(() -> repository.redeem(invite, member, NOW))
                .isInstanceOf(InviteUnavailableException.class)
                .satisfies(e -> assertThat(((InviteUnavailableException) e).getReason())
                    .isEqualTo(InviteUnavailableException.Reason.EXPIRED));
        }

        @Test
        void redeem_InviteRowGone_ReportsNotFound() {
            when(dynamoDbClient.getItem(any(GetItemRequest.class))).thenReturn(GetItemResponse.builder().build());
            when(dynamoDbClient.transactWriteItems(any(TransactWriteItemsRequest.class)))
                .thenThrow(cancelled("ConditionalCheckFailed", "None", "None"));

            assertThatThrownBy(() -> repository.redeem(invite, member, NOW))
                .isInstanceOf(InviteUnavailableException.class)
                .satisfies(e -> assertThat(((InviteUnavailableException) e).getReason())
                    .isEqualTo(InviteUnavailableException.Reason.NOT_FOUND));
        }

        @Test
        void redeem_LostConflictOnLastUse_ReportsExhausted() {
            // Given
            GroupInvite stored = inviteSchema.mapToItem(inviteSchema.itemToMap(invite, true));
            stored.setUseCount(1);
            givenStoredInvite(stored);
            when(dynamoDbClient.transactWriteItems(any(TransactWriteItemsRequest.class)))
                .thenThrow(cancelled("TransactionConflict", "None", "None"));

            // When / Then
            assertThatThrownBy(() -> repository.redeem(invite, member, NOW))
                .isInstanceOf(InviteUnavailableException.class)
                .satisfies(e -> assertThat(((InviteUnavailableException) e).getReason())
                    .isEqualTo(InviteUnavailableException.Reason.EXHAUSTED));
            verify(dynamoDbClient, times(1)).transactWriteItems(any(TransactWriteItemsRequest.class));
        }

        @Test
        void redeem_ConflictWhileStillRedeemable_RetriesOnce() {
            // Given
            givenStoredInvite(invite);
            when(dynamoDbClient.transactWriteItems(any(TransactWriteItemsRequest.class)))
                .thenThrow(cancelled("TransactionConflict", "None", "None"))
                .thenReturn(TransactWriteItemsResponse.builder().build());

            // When
            repository.redeem(invite, member, NOW);

            // Then
            verify(dynamoDbClient, times(2)).transactWriteItems(any(TransactWriteItemsRequest.class));
        }

        @Test
        void redeem_PersistentConflict_ReportsExhaustedAfterOneRetry() {
            givenStoredInvite(invite);
            when(dynamoDbClient.transactWriteItems(any(TransactWriteItemsRequest.class)))
                .thenThrow(cancelled("TransactionConflict", "None", "None"));

            assertThatThrownBy(() -> repository.redeem(invite, member, NOW))
                .isInstanceOf(InviteUnavailableException.class)
                .satisfies(e -> assertThat(((InviteUnavailableException) e).getReason())
                    .isEqualTo(InviteUnavailableException.Reason.EXHAUSTED));
            verify(dynamoDbClient, times(2)).transactWriteItems(any(TransactWriteItemsRequest.class));
        }

        @Test
        void redeem_ReReadFailure_IsWrapped() {
            when(dynamoDbClient.transactWriteItems(any(TransactWriteItemsRequest.class)))
                .thenThrow(cancelled("ConditionalCheckFailed", "None", "None"));
            when(dynamoDbClient.getItem(any(GetItemRequest.class)))
                .thenThrow(DynamoDbException.builder().message("throttled").build());

            assertThatThrownBy(() -> repository.redeem(invite, member, NOW))
                .isInstanceOf(RepositoryException.class)
                .hasMessage("Failed to re-read invite");
        }

        @Test
        void redeem_LostCapacityConflict_ThrowsCapacityExceeded() {
            // Given
            givenGroupCounter(5, 5);
            when(dynamoDbClient.transactWriteItems(any(TransactWriteItemsRequest.class)))
                .thenThrow(cancelled("None", "None", "TransactionConflict"));

            // When / Then
            assertThatThrownBy(() -> repository.redeem(invite, member, NOW))
                .isInstanceOf(CapacityExceededException.class);
            ArgumentCaptor<GetItemRequest> read = ArgumentCaptor.forClass(GetItemRequest.class);
            verify(dynamoDbClient).getItem(read.capture());
            assertThat(read.getValue().key().get("pk").s()).isEqualTo("GROUP#" + GROUP_ID);
            assertThat(read.getValue().consistentRead()).isTrue();
        }

        @Test
        void redeem_CapacityConflictWithRoomLeft_Retries() {
            givenGroupCounter(3, 5);
            when(dynamoDbClient.transactWriteItems(any(TransactWriteItemsRequest.class)))
                .thenThrow(cancelled("None", "None", "TransactionConflict"))
                .thenReturn(TransactWriteItemsResponse.builder().build());

            repository.redeem(invite, member, NOW);

            verify(dynamoDbClient, times(2)).transactWriteItems(any(TransactWriteItemsRequest.class));
        }

        @Test
        void redeem_AlreadyMember_DoesNotConsumeUse() {
            when(dynamoDbClient.transactWriteItems(any(TransactWriteItemsRequest.class)))
                .thenThrow(cancelled("None", "ConditionalCheckFailed", "None"));

            assertThatThrownBy(() -> repository.redeem(invite, member, NOW))
                .isInstanceOf(AlreadyMemberException.class);
            verify(dynamoDbClient, never()).getItem(any(GetItemRequest.class));
        }

        @Test
        void redeem_GroupFull_ThrowsCapacityExceeded() {
            givenGroupCounter(5, 5);
            when(dynamoDbClient.transactWriteItems(any(TransactWriteItemsRequest.class)))
                .thenThrow(cancelled("None", "None", "ConditionalCheckFailed"));

            assertThatThrownBy(() -> repository.redeem(invite, member, NOW))
                .isInstanceOf(CapacityExceededException.class);
        }
    }

    @Test
    void deactivate_SetsInactiveWithAuditFields() {
        repository.deactivate(invite.getInviteId(), USER_ID, NOW);

        ArgumentCaptor<UpdateItemRequest> update = ArgumentCaptor.forClass(UpdateItemRequest.class);
        verify(dynamoDbClient).updateItem(update.capture());
        assertThat(update.getValue().key().get("pk").s()).isEqualTo("INVITE#" + invite.getInviteId());
        assertThat(update.getValue().expressionAttributeValues().get(":by").s()).isEqualTo(USER_ID);
        assertThat(update.getValue().expressionAttributeValues().get(":false").bool()).isFalse();
    }
}
