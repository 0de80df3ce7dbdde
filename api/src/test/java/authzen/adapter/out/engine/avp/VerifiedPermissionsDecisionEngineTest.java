package authzen.adapter.out.engine.avp;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.verifiedpermissions.VerifiedPermissionsAsyncClient;
import software.amazon.awssdk.services.verifiedpermissions.model.AccessDeniedException;
import software.amazon.awssdk.services.verifiedpermissions.model.BatchIsAuthorizedOutputItem;
import software.amazon.awssdk.services.verifiedpermissions.model.BatchIsAuthorizedRequest;
import software.amazon.awssdk.services.verifiedpermissions.model.BatchIsAuthorizedResponse;
import software.amazon.awssdk.services.verifiedpermissions.model.Decision;
import software.amazon.awssdk.services.verifiedpermissions.model.DeterminingPolicyItem;
import software.amazon.awssdk.services.verifiedpermissions.model.EvaluationErrorItem;
import software.amazon.awssdk.services.verifiedpermissions.model.IsAuthorizedRequest;
import software.amazon.awssdk.services.verifiedpermissions.model.IsAuthorizedResponse;

import authzen.adapter.out.entity.CedarEntityJson;
import authzen.core.exception.EvaluationFailedException;
import authzen.core.model.AuthorizationQuery;
import authzen.core.model.EntityUid;
import authzen.core.model.ResolvedEntity;

@ExtendWith(MockitoExtension.class)
@DisplayName("VerifiedPermissionsDecisionEngine")
class VerifiedPermissionsDecisionEngineTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final String POLICY_STORE = "ps-123";

    private static final EntityUid ALICE = EntityUid.of("identity", "alice");
    private static final EntityUid DOC = EntityUid.of("document", "doc1");

    @Mock
    private VerifiedPermissionsAsyncClient client;

    private final ObjectMapper mapper = new ObjectMapper();
    private VerifiedPermissionsDecisionEngine engine;

    @BeforeEach
    void setUp() {
        engine = new VerifiedPermissionsDecisionEngine(client, POLICY_STORE, new CedarEntityJson(mapper));
    }

    @Nested
    @DisplayName("evaluate()")
    class Evaluate {

        @Test
        @DisplayName("Should send identifiers and Cedar JSON entities and report determining policies")
        void shouldSendRequestAndReportPolicies() throws Exception {
            when(client.isAuthorized(any(IsAuthorizedRequest.class)))
                    .thenReturn(CompletableFuture.completedFuture(IsAuthorizedResponse.builder()
                            .decision(Decision.ALLOW)
                            .determiningPolicies(DeterminingPolicyItem.builder().policyId("policy-1").build())
                            .errors(List.of())
                            .build()));
            final var entity = new ResolvedEntity(ALICE, Map.of("department", "eng"), List.of());

            final var answer = engine.evaluate(query(ALICE, "read", DOC, Map.of("ip", "10.0.0.1")), List.of(entity))
                    .await()
                    .atMost(TIMEOUT);

            assertTrue(answer.allowed());
            assertEquals(List.of("policy-1"), answer.reasons());

            final var captor = ArgumentCaptor.forClass(IsAuthorizedRequest.class);
            verify(client).isAuthorized(captor.capture());
            final var request = captor.getValue();
            assertEquals(POLICY_STORE, request.policyStoreId());
            assertEquals("identity", request.principal().entityType());
            assertEquals("alice", request.principal().entityId());
            assertEquals("Action", request.action().actionType());
            assertEquals("read", request.action().actionId());
            assertEquals("doc1", request.resource().entityId());
            final var entities = mapper.readTree(request.entities().cedarJson());
            assertEquals("eng", entities.at("/0/attrs/department").asText());
            assertEquals("10.0.0.1", mapper.readTree(request.context().cedarJson()).get("ip").asText());
        }

        @Test
        @DisplayName("Should omit an empty context and report evaluation errors")
        void shouldReportErrors() {
            when(client.isAuthorized(any(IsAuthorizedRequest.class)))
                    .thenReturn(CompletableFuture.completedFuture(IsAuthorizedResponse.builder()
                            .decision(Decision.DENY)
                            .determiningPolicies(List.of())
                            .errors(EvaluationErrorItem.builder().errorDescription("attribute missing").build())
                            .build()));

            final var answer = engine.evaluate(query(ALICE, "read", DOC, Map.of()), List.of())
                    .await()
                    .atMost(TIMEOUT);

            assertFalse(answer.allowed());
            assertEquals(List.of("attribute missing"), answer.errors());
            final var captor = ArgumentCaptor.forClass(IsAuthorizedRequest.class);
            verify(client).isAuthorized(captor.capture());
            assertNull(captor.getValue().context());
        }

        @Test
        @DisplayName("Service failure should surface as EvaluationFailedException")
        void serviceFailureShouldFail() {
            when(client.isAuthorized(any(IsAuthorizedRequest.class)))
                    .thenReturn(CompletableFuture.failedFuture(
                            AccessDeniedException.builder().message("denied").build()));

            final var uni = engine.evaluate(query(ALICE, "read", DOC, Map.of()), List.of());

            assertThrows(EvaluationFailedException.class, () -> uni.await().atMost(TIMEOUT));
        }
    }

    @Nested
    @DisplayName("evaluateBatch()")
    class EvaluateBatch {

        @Test
        @DisplayName("Should split into chunks of 30 and keep request order")
        void shouldChunkAndKeepOrder() {
            when(client.batchIsAuthorized(any(BatchIsAuthorizedRequest.class))).thenAnswer(invocation -> {
                final BatchIsAuthorizedRequest request = invocation.getArgument(0);
                final List<BatchIsAuthorizedOutputItem> results = new ArrayList<>();
                request.requests().forEach(item -> results.add(BatchIsAuthorizedOutputItem.builder()
                        .request(item)
                        .decision(item.resource().entityId().endsWith("0") ? Decision.ALLOW : Decision.DENY)
                        .determiningPolicies(List.of())
                        .errors(List.of())
                        .build()));
                return CompletableFuture.completedFuture(
                        BatchIsAuthorizedResponse.builder().results(results).build());
            });
            final List<AuthorizationQuery> queries = new ArrayList<>();
            for (int i = 0; i < 65; i++) {
                queries.add(query(ALICE, "read", EntityUid.of("document", "doc" + i), Map.of()));
            }

            final var answers = engine.evaluateBatch(queries, List.of()).await().atMost(TIMEOUT);

            assertEquals(65, answers.size());
            for (int i = 0; i < 65; i++) {
                assertEquals(i % 10 == 0, answers.get(i).allowed(), "answer " + i);
            }
            final var captor = ArgumentCaptor.forClass(BatchIsAuthorizedRequest.class);
            verify(client, times(3)).batchIsAuthorized(captor.capture());
            assertEquals(
                    List.of(30, 30, 5),
                    captor.getAllValues().stream()
                            .map(r -> r.requests().size())
                            .sorted((a, b) -> b - a)
                            .toList());
        }

        @Test
        @DisplayName("Result count mismatch should fail the batch")
        void resultCountMismatchShouldFail() {
            when(client.batchIsAuthorized(any(BatchIsAuthorizedRequest.class)))
                    .thenReturn(CompletableFuture.completedFuture(
                            BatchIsAuthorizedResponse.builder().results(List.of()).build()));

            final var uni = engine.evaluateBatch(List.of(query(ALICE, "read", DOC, Map.of())), List.of());

            assertThrows(EvaluationFailedException.class, () -> uni.await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("Empty batch should not call the service")
        void emptyBatchShouldNotCallService() {
            final var answers = engine.evaluateBatch(List.of(), List.of()).await().atMost(TIMEOUT);

            assertTrue(answers.isEmpty());
            verify(client, never()).batchIsAuthorized(any(BatchIsAuthorizedRequest.class));
        }
    }

    private static AuthorizationQuery query(EntityUid principal, String action, EntityUid resource, Map<String, Object> context) {
        return new AuthorizationQuery(principal, EntityUid.of("Action", action), resource, context);
    }
}
