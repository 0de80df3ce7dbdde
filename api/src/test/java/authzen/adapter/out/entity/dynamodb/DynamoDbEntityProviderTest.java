package authzen.adapter.out.entity.dynamodb;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.dynamodb.DynamoDbAsyncClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.BatchGetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.BatchGetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.KeysAndAttributes;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughputExceededException;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;
import software.amazon.awssdk.services.dynamodb.model.ScanResponse;

import authzen.core.exception.EntityResolutionException;
import authzen.core.model.CedarSchema;
import authzen.core.model.EntityUid;
import authzen.core.model.ResolvedEntity;
import authzen.core.service.ParentClosure;

@ExtendWith(MockitoExtension.class)
@DisplayName("DynamoDbEntityProvider")
class DynamoDbEntityProviderTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final String TABLE = "entities";

    @Mock
    private DynamoDbAsyncClient client;

    private final Map<String, Map<String, AttributeValue>> table = Collections.synchronizedMap(new HashMap<>());

    @BeforeEach
    void setUp() {
        store(entity("identity", "alice", EntityUid.of("group", "editors")));
        store(entity("group", "editors", EntityUid.of("group", "viewers")));
        store(entity("group", "viewers"));
        store(entity("document", "doc1"));
    }

    @Nested
    @DisplayName("findEntities()")
    class FindEntities {

        @Test
        @DisplayName("Should resolve the full ancestry with one BatchGetItem per round")
        void shouldResolveFullAncestry() {
            serveFromTable();
            final var provider = provider(ParentClosure.UNLIMITED);

            final var result = provider.findEntities(
                            List.of(EntityUid.of("identity", "alice"), EntityUid.of("document", "doc1")))
                    .await()
                    .atMost(TIMEOUT);

            assertEquals(
                    List.of("identity::\"alice\"", "document::\"doc1\"", "group::\"editors\"", "group::\"viewers\""),
                    result.stream().map(ResolvedEntity::key).toList());
            // round 1 has two types, so two calls; then one call per parent round
            verify(client, times(4)).batchGetItem(any(BatchGetItemRequest.class));
        }

        @Test
        @DisplayName("One hop should stop at direct parents")
        void oneHopShouldStopAtDirectParents() {
            serveFromTable();

            final var result = provider(1).findEntities(List.of(EntityUid.of("identity", "alice")))
                    .await()
                    .atMost(TIMEOUT);

            assertEquals(2, result.size());
        }

        @Test
        @DisplayName("Should split large lookups into chunks of 100 keys")
        void shouldChunkLargeLookups() {
            serveFromTable();
            final List<EntityUid> uids = new ArrayList<>();
            for (int i = 0; i < 250; i++) {
                uids.add(EntityUid.of("document", "missing-" + i));
            }

            final var result = provider(0).findEntities(uids).await().atMost(TIMEOUT);

            assertTrue(result.isEmpty());
            final var captor = ArgumentCaptor.forClass(BatchGetItemRequest.class);
            verify(client, times(3)).batchGetItem(captor.capture());
            assertEquals(
                    List.of(100, 100, 50),
                    captor.getAllValues().stream()
                            .map(r -> r.requestItems().get(TABLE).keys().size())
                            .sorted(Collections.reverseOrder())
                            .toList());
        }

        @Test
        @DisplayName("Should request unprocessed keys again")
        void shouldRetryUnprocessedKeys() {
            final var calls = new AtomicInteger();
            when(client.batchGetItem(any(BatchGetItemRequest.class))).thenAnswer(invocation -> {
                final BatchGetItemRequest request = invocation.getArgument(0);
                final var keys = request.requestItems().get(TABLE).keys();
                if (calls.getAndIncrement() == 0) {
                    return CompletableFuture.completedFuture(BatchGetItemResponse.builder()
                            .responses(Map.of(TABLE, List.of()))
                            .unprocessedKeys(Map.of(TABLE, KeysAndAttributes.builder().keys(keys).build()))
                            .build());
                }
                return CompletableFuture.completedFuture(respond(keys));
            });

            final var result = provider(0).findEntities(List.of(EntityUid.of("document", "doc1")))
                    .await()
                    .atMost(TIMEOUT);

            assertEquals(1, result.size());
            assertEquals(2, calls.get());
        }

        @Test
        @DisplayName("Should fail with EntityResolutionException when DynamoDB fails")
        void shouldFailWhenDynamoDbFails() {
            when(client.batchGetItem(any(BatchGetItemRequest.class)))
                    .thenReturn(CompletableFuture.failedFuture(ProvisionedThroughputExceededException.builder()
                            .message("slow down")
                            .build()));

            final var uni = provider(0).findEntities(List.of(EntityUid.of("document", "doc1")));

            assertThrows(EntityResolutionException.class, () -> uni.await().atMost(TIMEOUT));
        }
    }

    @Nested
    @DisplayName("scanEntities()")
    class ScanEntities {

        @Test
        @DisplayName("Should follow LastEvaluatedKey across scan pages")
        void shouldFollowScanPages() {
            final var lastKey = Map.of("PK", AttributeValue.fromS("document"), "SK", AttributeValue.fromS("doc2"));
            when(client.scan(any(ScanRequest.class))).thenAnswer(invocation -> {
                final ScanRequest request = invocation.getArgument(0);
                assertEquals("PK = :entityType", request.filterExpression());
                assertEquals("document", request.expressionAttributeValues().get(":entityType").s());
                if (!request.hasExclusiveStartKey()) {
                    return CompletableFuture.completedFuture(ScanResponse.builder()
                            .items(List.of(idItem("doc1"), idItem("doc2")))
                            .lastEvaluatedKey(lastKey)
                            .build());
                }
                assertEquals(lastKey, request.exclusiveStartKey());
                return CompletableFuture.completedFuture(
                        ScanResponse.builder().items(List.of(idItem("doc3"))).build());
            });

            final var ids = provider(0).scanEntities("document").await().atMost(TIMEOUT);

            assertEquals(List.of("doc1", "doc2", "doc3"), ids);
            verify(client, times(2)).scan(any(ScanRequest.class));
        }
    }

    @Test
    @DisplayName("Should answer applicable actions from the schema")
    void shouldAnswerActionsFromSchema() {
        final var schema = new CedarSchema(
                "", Map.of("read", new CedarSchema.AppliesTo(Set.of("identity"), Set.of("document"))));
        final var provider = new DynamoDbEntityProvider(client, TABLE, schema, 0);

        assertEquals(List.of("read"), provider.findApplicableActions("identity", "document").await().atMost(TIMEOUT));
    }

    private DynamoDbEntityProvider provider(int hops) {
        return new DynamoDbEntityProvider(client, TABLE, CedarSchema.empty(), hops);
    }

    private void serveFromTable() {
        when(client.batchGetItem(any(BatchGetItemRequest.class))).thenAnswer(invocation -> {
            final BatchGetItemRequest request = invocation.getArgument(0);
            return CompletableFuture.completedFuture(respond(request.requestItems().get(TABLE).keys()));
        });
    }

    private BatchGetItemResponse respond(List<Map<String, AttributeValue>> keys) {
        final List<Map<String, AttributeValue>> items = new ArrayList<>();
        for (final var key : keys) {
            final var item = table.get(key.get("PK").s() + "/" + key.get("SK").s());
            if (item != null) {
                items.add(item);
            }
        }
        return BatchGetItemResponse.builder().responses(Map.of(TABLE, items)).build();
    }

    private void store(ResolvedEntity entity) {
        table.put(entity.uid().type() + "/" + entity.uid().id(), EntityItemMapper.toItem(entity));
    }

    private static Map<String, AttributeValue> idItem(String id) {
        return Map.of("SK", AttributeValue.fromS(id));
    }

    private static ResolvedEntity entity(String type, String id, EntityUid... parents) {
        return new ResolvedEntity(EntityUid.of(type, id), Map.of(), List.of(parents));
    }
}
