package authzen.adapter.out.entity.dynamodb;

import static software.amazon.awssdk.services.dynamodb.model.AttributeValue.fromS;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import software.amazon.awssdk.services.dynamodb.DynamoDbAsyncClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.BatchGetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.BatchGetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.KeysAndAttributes;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;

import authzen.adapter.out.threading.VertxContextHelper;
import authzen.core.exception.EntityResolutionException;
import authzen.core.model.CedarSchema;
import authzen.core.model.EntityUid;
import authzen.core.model.ResolvedEntity;
import authzen.core.port.out.EntityProvider;
import authzen.core.service.ParentClosure;

/**
 * Entity provider backed by a DynamoDB table (see {@link EntityItemMapper} for the item layout).
 *
 * <p>Each resolution round groups its uids by type and issues one {@code BatchGetItem}
 * per chunk of {@value #BATCH_GET_LIMIT} keys, all chunks concurrently. Keys the service
 * returns as unprocessed are requested again until none are left.
 */
public class DynamoDbEntityProvider implements EntityProvider {

    private static final Logger LOG = Logger.getLogger(DynamoDbEntityProvider.class);

    static final int BATCH_GET_LIMIT = 100;
    static final int MAX_UNPROCESSED_ATTEMPTS = 10;

    private final DynamoDbAsyncClient client;
    private final String tableName;
    private final CedarSchema schema;
    private final ParentClosure closure;

    public DynamoDbEntityProvider(DynamoDbAsyncClient client, String tableName, CedarSchema schema, int maxParentHops) {
        this.client = client;
        this.tableName = tableName;
        this.schema = schema;
        this.closure = new ParentClosure(this::batchGetEntities, maxParentHops);
    }

    @Override
    public Uni<List<ResolvedEntity>> findEntities(List<EntityUid> uids) {
        return closure.resolve(uids);
    }

    @Override
    public Uni<List<String>> scanEntities(String entityType) {
        return scanPage(entityType, null, new ArrayList<>());
    }

    @Override
    public Uni<List<String>> findApplicableActions(String principalType, String resourceType) {
        return Uni.createFrom().item(() -> schema.applicableActions(principalType, resourceType));
    }

    Uni<Map<String, ResolvedEntity>> batchGetEntities(List<EntityUid> uids) {
        final Map<String, List<Map<String, AttributeValue>>> keysByType = new LinkedHashMap<>();
        for (final var uid : uids) {
            keysByType.computeIfAbsent(uid.type(), t -> new ArrayList<>()).add(EntityItemMapper.key(uid));
        }

        final List<Uni<List<Map<String, AttributeValue>>>> chunks = new ArrayList<>();
        for (final var keys : keysByType.values()) {
            for (int i = 0; i < keys.size(); i += BATCH_GET_LIMIT) {
                chunks.add(batchGet(keys.subList(i, Math.min(i + BATCH_GET_LIMIT, keys.size())), 1));
            }
        }
        LOG.debugf("Fetching %d entities in %d BatchGetItem call(s)", uids.size(), chunks.size());

        return Uni.combine().all().unis(chunks).with(results -> {
            final Map<String, ResolvedEntity> found = new LinkedHashMap<>();
            for (final var result : results) {
                @SuppressWarnings("unchecked")
                final var items = (List<Map<String, AttributeValue>>) result;
                for (final var item : items) {
                    final var entity = EntityItemMapper.fromItem(item);
                    found.put(entity.key(), entity);
                }
            }
            return found;
        });
    }

    private Uni<List<Map<String, AttributeValue>>> batchGet(List<Map<String, AttributeValue>> keys, int attempt) {
        final var request = BatchGetItemRequest.builder()
                .requestItems(Map.of(tableName, KeysAndAttributes.builder().keys(keys).build()))
                .build();

        return VertxContextHelper.fromFuture(() -> client.batchGetItem(request))
                .onFailure()
                .transform(e -> new EntityResolutionException(
                        "BatchGetItem on " + tableName + " failed: " + e.getMessage(), e))
                .flatMap(response -> {
                    final List<Map<String, AttributeValue>> items =
                            new ArrayList<>(response.responses().getOrDefault(tableName, List.of()));
                    final var unprocessed = unprocessedKeys(response);
                    if (unprocessed.isEmpty()) {
                        return Uni.createFrom().item(items);
                    }
                    if (attempt >= MAX_UNPROCESSED_ATTEMPTS) {
                        return Uni.createFrom()
                                .failure(new EntityResolutionException(unprocessed.size()
                                        + " keys still unprocessed after " + attempt + " BatchGetItem attempts"));
                    }
                    LOG.debugf("Re-requesting %d unprocessed keys (attempt %d)", unprocessed.size(), attempt + 1);
                    return batchGet(unprocessed, attempt + 1).map(more -> {
                        items.addAll(more);
                        return items;
                    });
                });
    }

    private List<Map<String, AttributeValue>> unprocessedKeys(BatchGetItemResponse response) {
        if (!response.hasUnprocessedKeys()) {
            return List.of();
        }
        final var pending = response.unprocessedKeys().get(tableName);
        return pending == null || !pending.hasKeys() ? List.of() : pending.keys();
    }

    private Uni<List<String>> scanPage(
            String entityType, Map<String, AttributeValue> startKey, List<String> ids) {
        final var builder = ScanRequest.builder()
                .tableName(tableName)
                .filterExpression("PK = :entityType")
                .expressionAttributeValues(Map.of(":entityType", fromS(entityType)))
                .projectionExpression(EntityItemMapper.COL_ID);
        if (startKey != null) {
            builder.exclusiveStartKey(startKey);
        }
        final var request = builder.build();

        return VertxContextHelper.fromFuture(() -> client.scan(request))
                .onFailure()
                .transform(e -> new EntityResolutionException(
                        "Scan of " + entityType + " on " + tableName + " failed: " + e.getMessage(), e))
                .flatMap(response -> {
                    for (final var item : response.items()) {
                        final var id = item.get(EntityItemMapper.COL_ID);
                        if (id != null && id.s() != null) {
                            ids.add(id.s());
                        }
                    }
                    if (response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()) {
                        return scanPage(entityType, response.lastEvaluatedKey(), ids);
                    }
                    return Uni.createFrom().item(List.copyOf(ids));
                });
    }
}
