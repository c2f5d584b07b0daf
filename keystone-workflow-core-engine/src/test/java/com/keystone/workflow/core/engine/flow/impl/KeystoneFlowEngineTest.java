package com.keystone.workflow.core.engine.flow.impl;

import com.keystone.workflow.core.engine.config.KeystoneWorkflowEngineConfig;
import com.keystone.workflow.core.exception.flow.HandlerFailureException;
import com.keystone.workflow.core.exception.flow.NodeNotFoundException;
import com.keystone.workflow.core.exception.flow.TraversalLimitExceededException;
import com.keystone.workflow.core.exception.instance.InvalidLifecycleException;
import com.keystone.workflow.integration.enumerations.KeystoneDefinitionKind;
import com.keystone.workflow.integration.enumerations.KeystoneFlowNodeType;
import com.keystone.workflow.integration.enumerations.KeystoneWorkflowStatus;
import com.keystone.workflow.integration.models.definition.flow.KeystoneFlowDefinition;
import com.keystone.workflow.integration.models.definition.flow.KeystoneFlowEdge;
import com.keystone.workflow.integration.models.definition.flow.KeystoneFlowNode;
import com.keystone.workflow.integration.models.flow.KeystoneFlowExecutionResult;
import com.keystone.workflow.integration.models.flow.KeystoneFlowNodeResult;
import com.keystone.workflow.integration.models.instance.KeystoneStateHistoryEntry;
import com.keystone.workflow.integration.models.instance.KeystoneWorkflowInstance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link KeystoneFlowEngine}.
 */
class KeystoneFlowEngineTest {

    private KeystoneFlowEngine engine;

    @BeforeEach
    void setUp() {
        engine = new KeystoneFlowEngine();
    }

    /**
     * start -> check -(amount > 1000)-> manager -> end
     *                \-(default)-----> auto ----/
     */
    private KeystoneFlowDefinition approvalRouting() {
        return KeystoneFlowDefinition.builder()
                .id("expense_routing")
                .name("Expense Routing")
                .node(KeystoneFlowNode.of("start", KeystoneFlowNodeType.START))
                .node(KeystoneFlowNode.of("check", KeystoneFlowNodeType.DECISION))
                .node(KeystoneFlowNode.of("manager", KeystoneFlowNodeType.ASSIGNMENT, Map.of("route", "manager")))
                .node(KeystoneFlowNode.of("auto", KeystoneFlowNodeType.ASSIGNMENT, Map.of("route", "auto")))
                .node(KeystoneFlowNode.of("end", KeystoneFlowNodeType.END))
                .edge(KeystoneFlowEdge.builder().id("e1").source("start").target("check").build())
                .edge(KeystoneFlowEdge.builder().id("e2").source("check").target("manager").condition("amount > 1000").build())
                .edge(KeystoneFlowEdge.builder().id("e3").source("check").target("auto").build())
                .edge(KeystoneFlowEdge.builder().id("e4").source("manager").target("end").build())
                .edge(KeystoneFlowEdge.builder().id("e5").source("auto").target("end").build())
                .build();
    }

    private KeystoneFlowExecutionResult run(KeystoneFlowDefinition flow, Map<String, Object> variables) {
        KeystoneWorkflowInstance instance = engine.createInstance(flow, null, "alice");
        return engine.execute(flow, instance, variables).block();
    }

    // ========================================================================
    // TRAVERSAL TESTS
    // ========================================================================

    @Nested
    @DisplayName("Traversal")
    class TraversalTests {

        @Test
        @DisplayName("should create a pending instance on the start node")
        void shouldCreateInstanceOnStartNode() {
            // When
            KeystoneWorkflowInstance instance = engine.createInstance(approvalRouting(), null, "alice");

            // Then
            assertTrue(instance.getId().startsWith("flow_"));
            assertEquals("expense_routing", instance.getWorkflowId());
            assertEquals("1", instance.getVersion());
            assertEquals(KeystoneDefinitionKind.FLOW, instance.getDefinitionKind());
            assertEquals("start", instance.getCurrentState());
            assertEquals(KeystoneWorkflowStatus.PENDING, instance.getStatus());
        }

        @Test
        @DisplayName("should follow the matching decision edge for a large amount")
        void shouldRouteLargeAmountToManager() {
            // When
            KeystoneFlowExecutionResult result = run(approvalRouting(), Map.of("amount", 1500));

            // Then
            assertTrue(result.isSuccess());
            assertEquals("manager", result.getVariables().get("route"));
            assertEquals(4, result.getNodesVisited());

            KeystoneWorkflowInstance instance = result.getInstance();
            assertEquals(KeystoneWorkflowStatus.COMPLETED, instance.getStatus());
            assertEquals("end", instance.getCurrentState());
            assertNotNull(instance.getCompletedAt());
            assertEquals(List.of("start", "check", "manager"),
                    instance.getHistory().stream().map(KeystoneStateHistoryEntry::getFromState).collect(Collectors.toList()));
            assertEquals(List.of("start→", "decision→", "assignment→"),
                    instance.getHistory().stream().map(KeystoneStateHistoryEntry::getTransition).collect(Collectors.toList()));
            assertEquals("alice", instance.getHistory().get(0).getTriggeredBy());
        }

        @Test
        @DisplayName("should fall back to the unconditional edge for a small amount")
        void shouldRouteSmallAmountToDefault() {
            // When
            KeystoneFlowExecutionResult result = run(approvalRouting(), Map.of("amount", 500));

            // Then
            assertTrue(result.isSuccess());
            assertEquals("auto", result.getVariables().get("route"));
            assertEquals("check", result.getInstance().getHistory().get(1).getFromState());
            assertEquals("auto", result.getInstance().getHistory().get(1).getToState());
        }

        @Test
        @DisplayName("should seed variables only from the initial variables")
        void shouldSeedVariablesFromInitialVariables() {
            // Given
            KeystoneFlowDefinition flow = approvalRouting();
            KeystoneWorkflowInstance instance = engine.createInstance(flow, Map.of("fromData", true), "alice");

            // When
            KeystoneFlowExecutionResult result = engine.execute(flow, instance, Map.of("amount", 10)).block();

            // Then
            assertEquals(10, result.getVariables().get("amount"));
            assertFalse(result.getVariables().containsKey("fromData"));
        }

        @Test
        @DisplayName("should complete at a node without outgoing edges")
        void shouldCompleteAtDeadEnd() {
            // Given
            KeystoneFlowDefinition flow = KeystoneFlowDefinition.builder()
                    .id("dead_end")
                    .name("Dead End")
                    .node(KeystoneFlowNode.of("start", KeystoneFlowNodeType.START))
                    .node(KeystoneFlowNode.of("set", KeystoneFlowNodeType.ASSIGNMENT, Map.of("done", true)))
                    .edge(KeystoneFlowEdge.of("start", "set"))
                    .build();

            // When
            KeystoneFlowExecutionResult result = run(flow, null);

            // Then
            assertTrue(result.isSuccess());
            assertEquals(KeystoneWorkflowStatus.COMPLETED, result.getInstance().getStatus());
            assertEquals("set", result.getInstance().getCurrentState());
            assertEquals(true, result.getVariables().get("done"));
        }

        @Test
        @DisplayName("should prefer the edge named by the handler result")
        void shouldPreferHandlerSelectedEdge() {
            // Given
            engine.registerHandler("router", (node, context) -> Mono.just(KeystoneFlowNodeResult.okWithEdge("skip")));
            KeystoneFlowDefinition flow = KeystoneFlowDefinition.builder()
                    .id("routed")
                    .name("Routed")
                    .node(KeystoneFlowNode.builder().id("route").type(KeystoneFlowNodeType.CUSTOM).rawType("router").build())
                    .node(KeystoneFlowNode.of("work", KeystoneFlowNodeType.ASSIGNMENT, Map.of("worked", true)))
                    .node(KeystoneFlowNode.of("end", KeystoneFlowNodeType.END))
                    .edge(KeystoneFlowEdge.builder().source("route").target("work").label("process").build())
                    .edge(KeystoneFlowEdge.builder().source("route").target("end").label("skip").build())
                    .edge(KeystoneFlowEdge.of("work", "end"))
                    .build();

            // When
            KeystoneFlowExecutionResult result = run(flow, null);

            // Then
            assertTrue(result.isSuccess());
            assertFalse(result.getVariables().containsKey("worked"));
            assertEquals("router→", result.getInstance().getHistory().get(0).getTransition());
        }

        @Test
        @DisplayName("should merge handler output into the variables")
        void shouldMergeHandlerOutput() {
            // Given
            engine.registerHandler(KeystoneFlowNodeType.HTTP_REQUEST, (node, context) ->
                    Mono.just(KeystoneFlowNodeResult.ok(Map.of("statusCode", 200))));
            KeystoneFlowDefinition flow = KeystoneFlowDefinition.builder()
                    .id("fetch")
                    .name("Fetch")
                    .node(KeystoneFlowNode.of("start", KeystoneFlowNodeType.START))
                    .node(KeystoneFlowNode.of("call", KeystoneFlowNodeType.HTTP_REQUEST))
                    .node(KeystoneFlowNode.of("end", KeystoneFlowNodeType.END))
                    .edge(KeystoneFlowEdge.of("start", "call"))
                    .edge(KeystoneFlowEdge.of("call", "end"))
                    .build();

            // When
            KeystoneFlowExecutionResult result = run(flow, Map.of("url", "https://example.org"));

            // Then
            assertEquals(200, result.getVariables().get("statusCode"));
            assertEquals("https://example.org", result.getVariables().get("url"));
        }

        @Test
        @DisplayName("should pass through node types without a handler")
        void shouldPassThroughUnhandledNodes() {
            // Given
            KeystoneFlowDefinition flow = KeystoneFlowDefinition.builder()
                    .id("passthrough")
                    .name("Passthrough")
                    .node(KeystoneFlowNode.of("start", KeystoneFlowNodeType.START))
                    .node(KeystoneFlowNode.of("save", KeystoneFlowNodeType.CREATE_RECORD))
                    .node(KeystoneFlowNode.of("end", KeystoneFlowNodeType.END))
                    .edge(KeystoneFlowEdge.of("start", "save"))
                    .edge(KeystoneFlowEdge.of("save", "end"))
                    .build();

            // When
            KeystoneFlowExecutionResult result = run(flow, null);

            // Then
            assertTrue(result.isSuccess());
            assertEquals(List.of("create_record"), engine.findMissingHandlers(flow));
        }
    }

    // ========================================================================
    // FAILURE TESTS
    // ========================================================================

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        private KeystoneFlowDefinition singleCall() {
            return KeystoneFlowDefinition.builder()
                    .id("call_flow")
                    .name("Call Flow")
                    .node(KeystoneFlowNode.of("start", KeystoneFlowNodeType.START))
                    .node(KeystoneFlowNode.of("call", KeystoneFlowNodeType.HTTP_REQUEST))
                    .node(KeystoneFlowNode.of("end", KeystoneFlowNodeType.END))
                    .edge(KeystoneFlowEdge.of("start", "call"))
                    .edge(KeystoneFlowEdge.of("call", "end"))
                    .build();
        }

        @Test
        @DisplayName("should fail the instance when a handler reports failure")
        void shouldFailOnHandlerFailure() {
            // Given
            engine.registerHandler(KeystoneFlowNodeType.HTTP_REQUEST, (node, context) ->
                    Mono.just(KeystoneFlowNodeResult.failure("Connection refused")));

            // When
            KeystoneFlowExecutionResult result = run(singleCall(), null);

            // Then
            assertFalse(result.isSuccess());
            assertEquals("Connection refused", result.getError());
            assertInstanceOf(HandlerFailureException.class, result.getFailure());

            KeystoneWorkflowInstance instance = result.getInstance();
            assertEquals(KeystoneWorkflowStatus.FAILED, instance.getStatus());
            assertEquals("Connection refused", instance.getError());
            assertEquals("call", instance.getCurrentState());
            assertNotNull(instance.getFailedAt());
            assertEquals(1, instance.getHistory().size());
        }

        @Test
        @DisplayName("should fail the instance when a handler throws")
        void shouldFailOnHandlerException() {
            // Given
            engine.registerHandler(KeystoneFlowNodeType.HTTP_REQUEST, (node, context) -> {
                throw new IllegalStateException("boom");
            });

            // When
            KeystoneFlowExecutionResult result = run(singleCall(), null);

            // Then
            assertFalse(result.isSuccess());
            assertEquals("boom", result.getError());
            assertEquals(KeystoneWorkflowStatus.FAILED, result.getInstance().getStatus());
        }

        @Test
        @DisplayName("should record the error type when a handler fails without a message")
        void shouldRecordErrorTypeForMessagelessFailure() {
            // Given
            engine.registerHandler(KeystoneFlowNodeType.HTTP_REQUEST,
                    (node, context) -> Mono.error(new RuntimeException()));

            // When
            KeystoneFlowExecutionResult result = run(singleCall(), null);

            // Then
            assertFalse(result.isSuccess());
            assertEquals("java.lang.RuntimeException", result.getError());
            assertEquals("java.lang.RuntimeException", result.getInstance().getError());
            assertEquals(KeystoneWorkflowStatus.FAILED, result.getInstance().getStatus());
            assertInstanceOf(HandlerFailureException.class, result.getFailure());
        }

        @Test
        @DisplayName("should fail a node whose type requires a handler")
        void shouldFailOnRequiredHandler() {
            // Given
            engine = new KeystoneFlowEngine(KeystoneWorkflowEngineConfig.builder()
                    .requiredHandlerType("http_request")
                    .build());

            // When
            KeystoneFlowExecutionResult result = run(singleCall(), null);

            // Then
            assertFalse(result.isSuccess());
            assertEquals("No handler registered for node type \"http_request\"", result.getError());
        }

        @Test
        @DisplayName("should fail after the node limit on a cycle")
        void shouldFailOnCycle() {
            // Given
            engine = new KeystoneFlowEngine(KeystoneWorkflowEngineConfig.builder().maxNodes(10).build());
            KeystoneFlowDefinition loop = KeystoneFlowDefinition.builder()
                    .id("loop")
                    .name("Loop")
                    .node(KeystoneFlowNode.of("a", KeystoneFlowNodeType.ASSIGNMENT))
                    .node(KeystoneFlowNode.of("b", KeystoneFlowNodeType.ASSIGNMENT))
                    .edge(KeystoneFlowEdge.of("a", "b"))
                    .edge(KeystoneFlowEdge.of("b", "a"))
                    .build();

            // When
            KeystoneFlowExecutionResult result = run(loop, null);

            // Then
            assertFalse(result.isSuccess());
            assertEquals(10, result.getNodesVisited());
            assertInstanceOf(TraversalLimitExceededException.class, result.getFailure());
            assertEquals("KWF_ERR_0006", ((TraversalLimitExceededException) result.getFailure()).getErrorCode().getErrorCode());
            assertTrue(result.getError().contains("Max node limit (10) exceeded"));
            assertEquals(KeystoneWorkflowStatus.FAILED, result.getInstance().getStatus());
            assertEquals(10, result.getInstance().getHistory().size());
        }

        @Test
        @DisplayName("should fail when an edge leads to a missing node")
        void shouldFailOnMissingNode() {
            // Given
            KeystoneFlowDefinition broken = KeystoneFlowDefinition.builder()
                    .id("broken")
                    .name("Broken")
                    .node(KeystoneFlowNode.of("start", KeystoneFlowNodeType.START))
                    .edge(KeystoneFlowEdge.of("start", "ghost"))
                    .build();

            // When
            KeystoneFlowExecutionResult result = run(broken, null);

            // Then
            assertFalse(result.isSuccess());
            assertInstanceOf(NodeNotFoundException.class, result.getFailure());
            assertEquals("ghost", result.getInstance().getCurrentState());
        }

        @Test
        @DisplayName("should refuse to execute a terminal instance")
        void shouldRefuseTerminalInstance() {
            // Given
            KeystoneFlowDefinition flow = approvalRouting();
            KeystoneWorkflowInstance instance = engine.createInstance(flow, null, "alice");
            engine.execute(flow, instance, Map.of("amount", 1)).block();
            int historySize = instance.getHistory().size();

            // When / Then
            StepVerifier.create(engine.execute(flow, instance, Map.of("amount", 1)))
                    .expectError(InvalidLifecycleException.class)
                    .verify();
            assertEquals(historySize, instance.getHistory().size());
        }
    }

    // ========================================================================
    // EDGE RESOLUTION TESTS
    // ========================================================================

    @Nested
    @DisplayName("Edge Resolution")
    class EdgeResolutionTests {

        @Test
        @DisplayName("should ignore conditions on edges of non-decision nodes")
        void shouldIgnoreConditionsOutsideDecisions() {
            // Given
            KeystoneFlowNode node = KeystoneFlowNode.of("n", KeystoneFlowNodeType.ASSIGNMENT);
            KeystoneFlowDefinition flow = KeystoneFlowDefinition.builder()
                    .id("f")
                    .name("F")
                    .node(node)
                    .edge(KeystoneFlowEdge.builder().source("n").target("conditional").condition("flag").build())
                    .edge(KeystoneFlowEdge.of("n", "plain"))
                    .build();

            // When
            String next = engine.resolveNextNode(flow, node, Map.of("flag", true), null);

            // Then
            assertEquals("plain", next);
        }

        @Test
        @DisplayName("should take the first edge when every edge is conditional and none matches")
        void shouldTakeFirstEdgeWhenNoConditionMatches() {
            // Given
            KeystoneFlowNode node = KeystoneFlowNode.of("d", KeystoneFlowNodeType.DECISION);
            KeystoneFlowDefinition flow = KeystoneFlowDefinition.builder()
                    .id("f")
                    .name("F")
                    .node(node)
                    .edge(KeystoneFlowEdge.builder().source("d").target("high").condition("amount > 100").build())
                    .edge(KeystoneFlowEdge.builder().source("d").target("low").condition("amount < 10").build())
                    .build();

            // When
            String next = engine.resolveNextNode(flow, node, Map.of("amount", 50), null);

            // Then
            assertEquals("high", next);
        }

        @Test
        @DisplayName("should return null at a dead end")
        void shouldReturnNullAtDeadEnd() {
            // Given
            KeystoneFlowNode node = KeystoneFlowNode.of("d", KeystoneFlowNodeType.DECISION);
            KeystoneFlowDefinition flow = KeystoneFlowDefinition.builder().id("f").name("F").node(node).build();

            // When / Then
            assertNull(engine.resolveNextNode(flow, node, Map.of(), null));
        }
    }
}
